package com.purchasingpower.concierge.ontology;

import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.dataformat.yaml.YAMLMapper;
import com.purchasingpower.concierge.configuration.AppProperties;
import com.purchasingpower.concierge.configuration.OntologyProperties;
import com.purchasingpower.concierge.exception.OntologyLoadException;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;

import java.io.InputStream;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;

/**
 * Loads the versioned ontology data (allergen groups, interaction table,
 * safety index) from YAML and exposes each as a read-only bean.
 *
 * A malformed or missing document stops the application from starting.
 */
@Slf4j
@Configuration
public class OntologyConfiguration {

    static final YAMLMapper YAML = YAMLMapper.builder()
            .enable(MapperFeature.ACCEPT_CASE_INSENSITIVE_ENUMS)
            .build();

    private final ResourceLoader resourceLoader;
    private final OntologyProperties properties;

    public OntologyConfiguration(ResourceLoader resourceLoader, AppProperties appProperties) {
        this.resourceLoader = resourceLoader;
        this.properties = appProperties.getOntology();
    }

    @Bean
    public AllergenOntology allergenOntology() {
        String location = properties.getAllergenGroupsLocation();
        AllergenGroupsDocument document = read(location, AllergenGroupsDocument.class);

        List<AllergenGroup> groups = new ArrayList<>();
        document.getGroups().forEach((name, members) -> groups.add(new AllergenGroup(name, members)));

        AllergenOntology ontology = build(location, () -> new AllergenOntology(document.getVersion(), groups));
        log.info("✅ Allergen ontology {} loaded: {} groups", ontology.getVersion(), groups.size());
        return ontology;
    }

    @Bean
    public InteractionTable interactionTable() {
        String location = properties.getInteractionsLocation();
        InteractionsDocument document = read(location, InteractionsDocument.class);

        List<InteractionRule> rules = document.getInteractions().stream()
                .map(entry -> new InteractionRule(entry.getGroupA(), entry.getGroupB(),
                        entry.getSeverity(), entry.getLabel(), entry.getConcern()))
                .toList();

        InteractionTable table = build(location, () -> new InteractionTable(document.getVersion(), rules));
        log.info("✅ Interaction table {} loaded: {} rules", table.getVersion(), rules.size());

        for (InteractionRule rule : table.missingReverseEntries()) {
            log.info("   Interaction '{}' is directional: no entry for {} → {}",
                    rule.label(), rule.groupB(), rule.groupA());
        }
        return table;
    }

    @Bean
    public SafetyIndex safetyIndex() {
        String location = properties.getSafetyIndexLocation();
        SafetyIndexDocument document = read(location, SafetyIndexDocument.class);

        Map<String, SafetyIndex.Irritant> irritants = new LinkedHashMap<>();
        document.getIrritants().forEach((name, entry) ->
                irritants.put(IngredientParser.normalize(name), new SafetyIndex.Irritant(entry.getRisk(), entry.getConcern())));

        Map<String, Integer> comedogenic = new LinkedHashMap<>();
        document.getComedogenic().forEach((name, rating) -> comedogenic.put(IngredientParser.normalize(name), rating));

        SafetyIndex index = build(location, () -> new SafetyIndex(document.getVersion(), irritants, comedogenic));
        log.info("✅ Safety index {} loaded: {} irritants, {} comedogenic ratings",
                index.getVersion(), irritants.size(), comedogenic.size());
        return index;
    }

    private <T> T read(String location, Class<T> type) {
        Resource resource = resourceLoader.getResource(location);
        if (!resource.exists()) {
            throw new OntologyLoadException(location, "Ontology resource not found", null);
        }
        try (InputStream in = resource.getInputStream()) {
            return YAML.readValue(in, type);
        } catch (Exception e) {
            throw new OntologyLoadException(location, "Failed to parse ontology resource: " + e.getMessage(), e);
        }
    }

    private static <T> T build(String location, Supplier<T> factory) {
        try {
            return factory.get();
        } catch (IllegalArgumentException | NullPointerException e) {
            throw new OntologyLoadException(location, "Invalid ontology data: " + e.getMessage(), e);
        }
    }

    @Data
    public static class AllergenGroupsDocument {
        private String version;
        private Map<String, List<String>> groups = new LinkedHashMap<>();
    }

    @Data
    public static class InteractionsDocument {
        private String version;
        private List<InteractionEntry> interactions = new ArrayList<>();
    }

    @Data
    public static class InteractionEntry {
        private List<String> groupA = new ArrayList<>();
        private List<String> groupB = new ArrayList<>();
        private Severity severity;
        private String label;
        private String concern;
    }

    @Data
    public static class SafetyIndexDocument {
        private String version;
        private Map<String, IrritantEntry> irritants = new LinkedHashMap<>();
        private Map<String, Integer> comedogenic = new LinkedHashMap<>();
    }

    @Data
    public static class IrritantEntry {
        private Severity risk;
        private String concern;
    }
}
