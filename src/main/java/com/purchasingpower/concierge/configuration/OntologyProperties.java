package com.purchasingpower.concierge.configuration;

import jakarta.validation.constraints.NotBlank;
import lombok.Data;

@Data
public class OntologyProperties {

    @NotBlank
    private String allergenGroupsLocation = "classpath:ontology/allergen-groups.yaml";

    @NotBlank
    private String interactionsLocation = "classpath:ontology/ingredient-interactions.yaml";

    @NotBlank
    private String safetyIndexLocation = "classpath:ontology/safety-index.yaml";
}
