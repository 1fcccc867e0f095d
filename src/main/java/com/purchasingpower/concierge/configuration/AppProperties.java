package com.purchasingpower.concierge.configuration;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.NestedConfigurationProperty;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

@Data
@Validated
@Configuration
@ConfigurationProperties(prefix = "app")
public class AppProperties {

    @Valid
    @NotNull
    @NestedConfigurationProperty
    private SafetyProperties safety = new SafetyProperties();

    @Valid
    @NotNull
    @NestedConfigurationProperty
    private MemoryProperties memory = new MemoryProperties();

    @Valid
    @NotNull
    @NestedConfigurationProperty
    private OntologyProperties ontology = new OntologyProperties();

    @Valid
    @NotNull
    @NestedConfigurationProperty
    private DiscoveryProperties discovery = new DiscoveryProperties();
}
