package com.purchasingpower.concierge.ontology;

import java.util.List;

/**
 * Named set of chemically related ingredient synonyms treated as one allergen.
 *
 * @param name Canonical group name, normalized
 * @param members Member ingredient tokens, normalized; may include the group name itself
 */
public record AllergenGroup(String name, List<String> members) {

    public AllergenGroup {
        members = List.copyOf(members);
    }
}
