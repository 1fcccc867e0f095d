package com.purchasingpower.concierge.catalog;

import com.purchasingpower.concierge.ontology.IngredientParser;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

/**
 * Product candidate returned by discovery.
 *
 * Catalog records carry either a parsed ingredient list or the raw INCI text
 * printed on the package; {@link #ingredientList()} resolves both.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Candidate implements Serializable {

    private String id;

    private String name;

    private String brand;

    private String category;

    private BigDecimal price;

    @Builder.Default
    private List<String> ingredients = new ArrayList<>();

    /**
     * Unparsed ingredient text, used when {@link #ingredients} is empty.
     */
    private String rawIngredients;

    public List<String> ingredientList() {
        if (ingredients != null && !ingredients.isEmpty()) {
            return ingredients;
        }
        return IngredientParser.parse(rawIngredients);
    }
}
