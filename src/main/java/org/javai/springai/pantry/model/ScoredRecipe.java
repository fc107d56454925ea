package org.javai.springai.pantry.model;

import java.util.Objects;

/**
 * A recipe paired with the semantic similarity its search collaborator assigned.
 *
 * @param recipe the candidate
 * @param similarity similarity in [0,1]
 */
public record ScoredRecipe(CandidateRecipe recipe, double similarity) {

	public ScoredRecipe {
		Objects.requireNonNull(recipe, "recipe must not be null");
		if (Double.isNaN(similarity)) {
			throw new IllegalArgumentException("similarity must be a number");
		}
		similarity = Math.max(0.0, Math.min(1.0, similarity));
	}
}
