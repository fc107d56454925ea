package org.javai.springai.pantry.delegation;

import java.util.List;
import org.javai.springai.pantry.model.ScoredRecipe;

/**
 * Keyword matching over recipes, used when semantic search is unavailable.
 */
public interface KeywordRecipeIndex {

	List<ScoredRecipe> match(List<String> terms, int topK);
}
