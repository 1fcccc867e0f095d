package com.purchasingpower.concierge.ontology;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Closure expansion and match detection over the {@link AllergenOntology}.
 */
@Component
@RequiredArgsConstructor
public class AllergenMatcher {

    private final AllergenOntology ontology;

    public String normalize(String value) {
        return IngredientParser.normalize(value);
    }

    /**
     * Expand declared allergens into every token that must be avoided.
     *
     * <ul>
     *   <li>group name → the name and all members</li>
     *   <li>group member → the group name and all members of that group</li>
     *   <li>plural of a group name or member → as the singular</li>
     *   <li>anything else → itself</li>
     * </ul>
     * Groups are flat, so one hop is the full closure.
     */
    public Set<String> expand(Collection<String> allergens) {
        Set<String> expanded = new LinkedHashSet<>();
        if (allergens == null) {
            return expanded;
        }

        for (String allergen : allergens) {
            String normalized = normalize(allergen);
            if (normalized.isEmpty()) {
                continue;
            }
            expanded.add(normalized);
            declaredGroup(normalized)
                    .flatMap(ontology::group)
                    .ifPresent(group -> {
                        expanded.add(group.name());
                        expanded.addAll(group.members());
                    });
        }
        return expanded;
    }

    /**
     * Find the ingredients that hit any declared allergen.
     *
     * A direct match wins over a group match for the same ingredient; each
     * ingredient is reported at most once. Ingredients with no match are not reported.
     */
    public List<AllergenMatch> findAllergenMatches(List<String> ingredients, Collection<String> allergens) {
        List<AllergenMatch> matches = new ArrayList<>();
        if (ingredients == null || ingredients.isEmpty() || allergens == null || allergens.isEmpty()) {
            return matches;
        }

        Set<String> allergenGroups = new LinkedHashSet<>();
        for (String allergen : allergens) {
            String normalized = normalize(allergen);
            allergenGroups.add(declaredGroup(normalized).orElse(normalized));
        }

        for (String ingredient : ingredients) {
            String normalized = normalize(ingredient);
            if (normalized.isEmpty()) {
                continue;
            }

            Optional<String> direct = allergens.stream()
                    .filter(allergen -> normalize(allergen).equals(normalized))
                    .findFirst();
            if (direct.isPresent()) {
                matches.add(new AllergenMatch(ingredient, direct.get(), MatchType.DIRECT));
                continue;
            }

            ontology.groupOf(normalized)
                    .filter(allergenGroups::contains)
                    .ifPresent(group -> matches.add(new AllergenMatch(ingredient, group, MatchType.GROUP)));
        }
        return matches;
    }

    // declared allergens may be plural: "parabens", "sulfates"
    private Optional<String> declaredGroup(String normalized) {
        Optional<String> group = ontology.groupOf(normalized);
        if (group.isEmpty() && normalized.length() > 1 && normalized.endsWith("s")) {
            group = ontology.groupOf(normalized.substring(0, normalized.length() - 1));
        }
        return group;
    }
}
