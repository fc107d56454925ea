package org.javai.springai.pantry.delegation;

import java.util.List;
import org.javai.springai.pantry.model.ScoredRecipe;

/**
 * Vector search over recipes.
 */
public interface SemanticSearchIndex {

	float[] embed(String text);

	List<ScoredRecipe> query(float[] vector, int topK, SearchFilter filter);
}
