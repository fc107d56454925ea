package org.javai.springai.pantry.adaptation;

import java.util.Objects;
import org.javai.springai.pantry.model.RecipeIngredient;

/**
 * @param ingredient the ingredient as it should be used
 * @param source pantry, to buy, or substituted
 * @param substitutedFor the original ingredient name when substituted, otherwise null
 * @param inPantry whether the ingredient (after substitution) is on hand
 */
public record AdaptedIngredient(
		RecipeIngredient ingredient,
		IngredientSource source,
		String substitutedFor,
		boolean inPantry
) {

	public AdaptedIngredient {
		Objects.requireNonNull(ingredient, "ingredient must not be null");
		Objects.requireNonNull(source, "source must not be null");
		if (source == IngredientSource.SUBSTITUTED && substitutedFor == null) {
			throw new IllegalArgumentException("a substituted ingredient must name what it replaces");
		}
	}

	public String name() {
		return ingredient.name();
	}
}
