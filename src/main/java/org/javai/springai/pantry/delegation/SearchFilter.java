package org.javai.springai.pantry.delegation;

import java.util.Set;

/**
 * Metadata filter applied by a search collaborator before scoring.
 *
 * @param excludedIngredients recipes containing any of these (word-level) are skipped
 * @param requiredTags when non-empty, a recipe must carry at least one of these tags
 */
public record SearchFilter(Set<String> excludedIngredients, Set<String> requiredTags) {

	public SearchFilter {
		excludedIngredients = excludedIngredients != null ? Set.copyOf(excludedIngredients) : Set.of();
		requiredTags = requiredTags != null ? Set.copyOf(requiredTags) : Set.of();
	}

	public static SearchFilter none() {
		return new SearchFilter(Set.of(), Set.of());
	}

	public static SearchFilter excluding(Set<String> ingredients) {
		return new SearchFilter(ingredients, Set.of());
	}
}
