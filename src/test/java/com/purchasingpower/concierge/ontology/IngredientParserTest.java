package com.purchasingpower.concierge.ontology;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Ingredient Parser Tests")
class IngredientParserTest {

    @Test
    @DisplayName("Should split on commas, lower-case and drop concentration markers")
    void testParse_InciList() {
        List<String> parsed = IngredientParser.parse("Water, Glycerin (and) Lecithin, [1-5%] Niacinamide");

        assertEquals(List.of("water", "glycerin (and) lecithin", "niacinamide"), parsed);
    }

    @Test
    @DisplayName("Should keep commas inside parentheses")
    void testParse_CommaInsideParentheses() {
        List<String> parsed = IngredientParser.parse("Tocopherol (Vitamin E, natural), Water");

        assertEquals(List.of("tocopherol (vitamin e, natural)", "water"), parsed);
    }

    @Test
    @DisplayName("Should strip list numbering and trailing dots")
    void testParse_NumberingAndDots() {
        List<String> parsed = IngredientParser.parse("1. Water, 2) Alcohol Denat.");

        assertEquals(List.of("water", "alcohol denat"), parsed);
    }

    @Test
    @DisplayName("Should drop single-character tokens")
    void testParse_DropsSingleCharacters() {
        assertEquals(List.of("water"), IngredientParser.parse("Water, a, ,"));
    }

    @Test
    @DisplayName("Should return an empty list for blank or missing text")
    void testParse_Blank() {
        assertTrue(IngredientParser.parse(null).isEmpty());
        assertTrue(IngredientParser.parse("   ").isEmpty());
    }

    @Test
    @DisplayName("Should normalize by trimming and lower-casing")
    void testNormalize() {
        assertEquals("methylparaben", IngredientParser.normalize("  MethylParaben "));
        assertEquals("", IngredientParser.normalize(null));
    }
}
