package com.purchasingpower.concierge.ontology;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Turns free-text INCI ingredient lists into normalized tokens.
 */
public final class IngredientParser {

    // comma not inside parentheses
    private static final Pattern SPLIT = Pattern.compile(",(?![^(]*\\))");
    private static final Pattern CONCENTRATION = Pattern.compile("\\[.*?]");
    private static final Pattern LEADING_NUMBER = Pattern.compile("^\\d+[.)]\\s*");

    private IngredientParser() {
    }

    /**
     * Trim and lower-case.
     */
    public static String normalize(String name) {
        return name == null ? "" : name.strip().toLowerCase(Locale.ROOT);
    }

    /**
     * Split a raw ingredient string, e.g. {@code "Water, Glycerin (and) Lecithin, [1-5%] Niacinamide"}.
     * Tokens of a single character are dropped.
     */
    public static List<String> parse(String ingredientsText) {
        List<String> ingredients = new ArrayList<>();
        if (ingredientsText == null || ingredientsText.isBlank()) {
            return ingredients;
        }

        for (String item : SPLIT.split(ingredientsText)) {
            String cleaned = item.strip().toLowerCase(Locale.ROOT);
            cleaned = CONCENTRATION.matcher(cleaned).replaceAll("");
            cleaned = LEADING_NUMBER.matcher(cleaned).replaceFirst("");
            cleaned = stripSpacesAndDots(cleaned);
            if (cleaned.length() > 1) {
                ingredients.add(cleaned);
            }
        }
        return ingredients;
    }

    private static String stripSpacesAndDots(String value) {
        int start = 0;
        int end = value.length();
        while (start < end && (value.charAt(start) == ' ' || value.charAt(start) == '.')) {
            start++;
        }
        while (end > start && (value.charAt(end - 1) == ' ' || value.charAt(end - 1) == '.')) {
            end--;
        }
        return value.substring(start, end);
    }
}
