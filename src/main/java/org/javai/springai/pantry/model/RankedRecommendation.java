package org.javai.springai.pantry.model;

import java.util.List;
import java.util.Objects;

/**
 * A candidate that survived the hard filters, with its composite score and the facts that
 * produced it.
 *
 * @param recipe the recommended recipe
 * @param compositeScore score in [0,100]
 * @param coverageFraction fraction of the recipe's ingredients found in the pantry
 * @param missingIngredients ingredients not in the pantry, sorted
 * @param usesExpiring whether any used pantry item expires within the urgency window
 * @param expiringIngredientsUsed the expiring pantry items the recipe uses, sorted
 * @param dietUnverified true when a dietary restriction could not be confirmed from the recipe data
 */
public record RankedRecommendation(
		CandidateRecipe recipe,
		double compositeScore,
		double coverageFraction,
		List<String> missingIngredients,
		boolean usesExpiring,
		List<String> expiringIngredientsUsed,
		boolean dietUnverified
) {

	public RankedRecommendation {
		Objects.requireNonNull(recipe, "recipe must not be null");
		if (compositeScore < 0.0 || compositeScore > 100.0) {
			throw new IllegalArgumentException("compositeScore must be within [0,100]: " + compositeScore);
		}
		missingIngredients = missingIngredients != null ? List.copyOf(missingIngredients) : List.of();
		expiringIngredientsUsed = expiringIngredientsUsed != null ? List.copyOf(expiringIngredientsUsed) : List.of();
	}

	public String recipeId() {
		return recipe.id();
	}

	public int missingCount() {
		return missingIngredients.size();
	}
}
