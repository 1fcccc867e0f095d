package com.purchasingpower.concierge.ontology;

import com.purchasingpower.concierge.TestFixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Allergen Matcher Tests")
class AllergenMatcherTest {

    private AllergenOntology ontology;
    private AllergenMatcher matcher;

    @BeforeEach
    void setUp() {
        ontology = TestFixtures.ontology().allergenOntology();
        matcher = new AllergenMatcher(ontology);
    }

    @Test
    @DisplayName("Declared group should match a member ingredient as a group match")
    void testFindAllergenMatches_GroupMember() {
        // Given: a paraben allergy and a product with methylparaben
        List<String> ingredients = List.of("water", "methylparaben", "glycerin");

        // When
        List<AllergenMatch> matches = matcher.findAllergenMatches(ingredients, List.of("paraben"));

        // Then: exactly one group match
        assertEquals(1, matches.size());
        AllergenMatch match = matches.get(0);
        assertEquals("methylparaben", match.ingredient());
        assertEquals("paraben", match.allergen());
        assertEquals(MatchType.GROUP, match.matchType());
    }

    @Test
    @DisplayName("Literal equality should win as a direct match")
    void testFindAllergenMatches_Direct() {
        List<AllergenMatch> matches = matcher.findAllergenMatches(List.of("Water", "Fragrance"), List.of("fragrance"));

        assertEquals(1, matches.size());
        assertEquals("Fragrance", matches.get(0).ingredient());
        assertEquals("fragrance", matches.get(0).allergen());
        assertEquals(MatchType.DIRECT, matches.get(0).matchType());
    }

    @Test
    @DisplayName("Declaring one member should catch its siblings")
    void testFindAllergenMatches_SiblingMember() {
        List<AllergenMatch> matches = matcher.findAllergenMatches(List.of("methylparaben"), List.of("propylparaben"));

        assertEquals(1, matches.size());
        assertEquals("paraben", matches.get(0).allergen());
        assertEquals(MatchType.GROUP, matches.get(0).matchType());
    }

    @Test
    @DisplayName("Each ingredient should be reported at most once")
    void testFindAllergenMatches_OnePerIngredient() {
        List<AllergenMatch> matches = matcher.findAllergenMatches(
                List.of("methylparaben", "propylparaben", "water"),
                List.of("paraben", "methylparaben"));

        assertEquals(2, matches.size());
        assertEquals(MatchType.DIRECT, matches.get(0).matchType());
        assertEquals(MatchType.GROUP, matches.get(1).matchType());
    }

    @Test
    @DisplayName("Unrelated ingredients and empty inputs should produce no matches")
    void testFindAllergenMatches_NoMatch() {
        assertTrue(matcher.findAllergenMatches(List.of("water", "glycerin"), List.of("paraben")).isEmpty());
        assertTrue(matcher.findAllergenMatches(List.of(), List.of("paraben")).isEmpty());
        assertTrue(matcher.findAllergenMatches(List.of("methylparaben"), List.of()).isEmpty());
    }

    @Test
    @DisplayName("Expanding a group name should include every member")
    void testExpand_GroupName() {
        Set<String> expanded = matcher.expand(List.of("Paraben"));

        assertTrue(expanded.contains("paraben"));
        assertTrue(expanded.containsAll(ontology.group("paraben").orElseThrow().members()));
    }

    @Test
    @DisplayName("Expanding a member should include its group and siblings")
    void testExpand_Member() {
        Set<String> expanded = matcher.expand(List.of("linalool"));

        assertTrue(expanded.contains("fragrance"));
        assertTrue(expanded.contains("parfum"));
        assertTrue(expanded.contains("limonene"));
    }

    @Test
    @DisplayName("Plural declaration should resolve to its group")
    void testFindAllergenMatches_PluralDeclaration() {
        List<AllergenMatch> matches = matcher.findAllergenMatches(List.of("water", "propylparaben"), List.of("Parabens"));

        assertEquals(1, matches.size());
        assertEquals("paraben", matches.get(0).allergen());
        assertTrue(matcher.expand(List.of("sulfates")).contains("sodium lauryl sulfate"));
    }

    @Test
    @DisplayName("Token ending in s that is not a plural should stay unresolved")
    void testFindAllergenMatches_NonPluralEndingInS() {
        // Given: "citrus" is no group name or member, nor is "citru"
        List<AllergenMatch> matches = matcher.findAllergenMatches(
                List.of("water", "limonene", "citrus"), List.of("citrus"));

        // Then: only the direct ingredient matches; limonene's fragrance group is untouched
        assertEquals(1, matches.size());
        assertEquals("citrus", matches.get(0).ingredient());
        assertEquals(MatchType.DIRECT, matches.get(0).matchType());
        assertEquals(Set.of("citrus"), matcher.expand(List.of("citrus")));

        // And: a member that already ends in s resolves as itself
        assertTrue(matcher.expand(List.of("sls")).contains("sodium lauryl sulfate"));
    }

    @Test
    @DisplayName("Expanding an unknown token should keep it as-is")
    void testExpand_Unknown() {
        assertEquals(Set.of("shea butter"), matcher.expand(List.of(" Shea Butter ")));
        assertTrue(matcher.expand(null).isEmpty());
    }

    @Test
    @DisplayName("Every declared allergen's members should be excluded by its expansion")
    void testExpand_CoversEveryMatch() {
        for (AllergenGroup group : ontology.groups()) {
            Set<String> expanded = matcher.expand(List.of(group.name()));
            for (String member : group.members()) {
                assertTrue(expanded.contains(member), group.name() + " expansion misses " + member);
                assertFalse(matcher.findAllergenMatches(List.of(member), List.of(group.name())).isEmpty());
            }
        }
    }

    @Test
    @DisplayName("Every member should resolve to exactly its own group")
    void testOntology_ReverseIndex() {
        for (AllergenGroup group : ontology.groups()) {
            assertEquals(group.name(), ontology.groupOf(group.name()).orElseThrow());
            for (String member : group.members()) {
                assertEquals(group.name(), ontology.groupOf(member).orElseThrow());
            }
        }
    }

    @Test
    @DisplayName("A token claimed by two groups should be rejected")
    void testOntology_RejectsSharedMember() {
        List<AllergenGroup> groups = List.of(
                new AllergenGroup("alpha", List.of("shared", "one")),
                new AllergenGroup("beta", List.of("Shared", "two")));

        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> new AllergenOntology("test", groups));
        assertTrue(e.getMessage().contains("shared"));
    }
}
