package com.purchasingpower.concierge.ontology;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable allergen synonym ontology with a reverse index member → group.
 *
 * Every member resolves to exactly one group; a group name also resolves to itself.
 * Construction fails when a token is claimed by two groups.
 */
public class AllergenOntology {

    private final String version;
    private final Map<String, AllergenGroup> groups;
    private final Map<String, String> reverseIndex;

    public AllergenOntology(String version, List<AllergenGroup> groupList) {
        this.version = version;

        Map<String, AllergenGroup> byName = new LinkedHashMap<>();
        Map<String, String> reverse = new LinkedHashMap<>();

        for (AllergenGroup raw : groupList) {
            String name = IngredientParser.normalize(raw.name());
            List<String> members = raw.members().stream().map(IngredientParser::normalize).distinct().toList();
            if (byName.containsKey(name)) {
                throw new IllegalArgumentException("Duplicate allergen group: " + name);
            }
            byName.put(name, new AllergenGroup(name, members));
            claim(reverse, name, name);
            for (String member : members) {
                claim(reverse, member, name);
            }
        }

        this.groups = Collections.unmodifiableMap(byName);
        this.reverseIndex = Collections.unmodifiableMap(reverse);
    }

    private static void claim(Map<String, String> reverse, String token, String group) {
        String existing = reverse.putIfAbsent(token, group);
        if (existing != null && !existing.equals(group)) {
            throw new IllegalArgumentException(
                    "Ingredient '" + token + "' belongs to both '" + existing + "' and '" + group + "'");
        }
    }

    public String getVersion() {
        return version;
    }

    public Optional<AllergenGroup> group(String name) {
        return Optional.ofNullable(groups.get(name));
    }

    /**
     * Group a normalized token belongs to (a group name maps to itself).
     */
    public Optional<String> groupOf(String normalized) {
        return Optional.ofNullable(reverseIndex.get(normalized));
    }

    public Collection<AllergenGroup> groups() {
        return groups.values();
    }
}
