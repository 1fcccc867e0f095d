package com.purchasingpower.concierge.ontology;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Versioned, ordered table of ingredient interaction rules.
 */
public class InteractionTable {

    private final String version;
    private final List<InteractionRule> rules;

    public InteractionTable(String version, List<InteractionRule> rules) {
        this.version = version;
        this.rules = List.copyOf(rules);

        Set<String> labels = new LinkedHashSet<>();
        for (InteractionRule rule : this.rules) {
            if (!labels.add(rule.label())) {
                throw new IllegalArgumentException("Duplicate interaction label: " + rule.label());
            }
        }
    }

    public String getVersion() {
        return version;
    }

    public List<InteractionRule> rules() {
        return rules;
    }

    /**
     * Rules whose reverse direction (some member of B as first group and some
     * member of A as second group) has no entry of its own.
     */
    public List<InteractionRule> missingReverseEntries() {
        List<InteractionRule> missing = new ArrayList<>();
        for (InteractionRule rule : rules) {
            boolean reversed = rules.stream()
                    .filter(other -> other != rule)
                    .anyMatch(other -> !Collections.disjoint(other.groupA(), rule.groupB())
                            && !Collections.disjoint(other.groupB(), rule.groupA()));
            if (!reversed) {
                missing.add(rule);
            }
        }
        return missing;
    }
}
