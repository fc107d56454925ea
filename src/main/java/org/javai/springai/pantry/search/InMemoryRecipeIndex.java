package org.javai.springai.pantry.search;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import org.javai.springai.pantry.delegation.KeywordRecipeIndex;
import org.javai.springai.pantry.delegation.SearchFilter;
import org.javai.springai.pantry.delegation.SemanticSearchIndex;
import org.javai.springai.pantry.model.CandidateRecipe;
import org.javai.springai.pantry.model.IngredientNames;
import org.javai.springai.pantry.model.RecipeIngredient;
import org.javai.springai.pantry.model.ScoredRecipe;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.embedding.EmbeddingModel;

/**
 * Recipe index held in memory, serving both semantic and keyword search.
 *
 * <p>Semantic search embeds each recipe's document text with a Spring AI {@link EmbeddingModel}
 * and scores by cosine similarity. Keyword search scores by the fraction of query terms that
 * occur as whole words in the recipe's title, ingredients or tags. Both break score ties by
 * recipe id.</p>
 */
public class InMemoryRecipeIndex implements SemanticSearchIndex, KeywordRecipeIndex {

	private static final Logger logger = LoggerFactory.getLogger(InMemoryRecipeIndex.class);

	private final EmbeddingModel embeddingModel;
	private final Map<String, CandidateRecipe> recipes = new LinkedHashMap<>();
	private final Map<String, float[]> vectors = new ConcurrentHashMap<>();

	/**
	 * @param embeddingModel model used for semantic search; null gives a keyword-only index whose
	 * {@link #embed} fails
	 */
	public InMemoryRecipeIndex(EmbeddingModel embeddingModel) {
		this.embeddingModel = embeddingModel;
	}

	public synchronized void add(CandidateRecipe recipe) {
		Objects.requireNonNull(recipe, "recipe must not be null");
		recipes.put(recipe.id(), recipe);
		vectors.remove(recipe.id());
	}

	public void addAll(List<CandidateRecipe> toAdd) {
		toAdd.forEach(this::add);
	}

	public synchronized int size() {
		return recipes.size();
	}

	@Override
	public float[] embed(String text) {
		if (embeddingModel == null) {
			throw new IllegalStateException("No embedding model configured");
		}
		return embeddingModel.embed(text);
	}

	@Override
	public List<ScoredRecipe> query(float[] vector, int topK, SearchFilter filter) {
		SearchFilter effective = filter != null ? filter : SearchFilter.none();
		List<ScoredRecipe> scored = new ArrayList<>();
		for (CandidateRecipe recipe : snapshot()) {
			if (!accepts(recipe, effective)) {
				continue;
			}
			float[] recipeVector = vectors.computeIfAbsent(recipe.id(), id -> embed(documentText(recipe)));
			double similarity = Math.max(0.0, Math.min(1.0, cosine(vector, recipeVector)));
			scored.add(new ScoredRecipe(recipe.withSourceScore(similarity), similarity));
		}
		List<ScoredRecipe> top = top(scored, topK);
		logger.debug("Semantic query matched {} of {} recipe(s)", top.size(), scored.size());
		return top;
	}

	@Override
	public List<ScoredRecipe> match(List<String> terms, int topK) {
		Set<String> normalizedTerms = new LinkedHashSet<>();
		if (terms != null) {
			for (String term : terms) {
				String normalized = IngredientNames.normalize(term);
				if (!normalized.isEmpty()) {
					normalizedTerms.add(normalized);
				}
			}
		}
		if (normalizedTerms.isEmpty()) {
			return List.of();
		}
		List<ScoredRecipe> scored = new ArrayList<>();
		for (CandidateRecipe recipe : snapshot()) {
			String text = IngredientNames.normalizeText(documentText(recipe));
			long hits = normalizedTerms.stream().filter(term -> IngredientNames.containsWord(text, term)).count();
			if (hits > 0) {
				double score = (double) hits / normalizedTerms.size();
				scored.add(new ScoredRecipe(recipe.withSourceScore(score), score));
			}
		}
		return top(scored, topK);
	}

	static String documentText(CandidateRecipe recipe) {
		StringBuilder text = new StringBuilder(recipe.title());
		for (RecipeIngredient ingredient : recipe.ingredients()) {
			text.append(' ').append(ingredient.name());
		}
		for (String tag : recipe.tags()) {
			text.append(' ').append(tag);
		}
		return text.toString();
	}

	static double cosine(float[] a, float[] b) {
		if (a == null || b == null || a.length != b.length || a.length == 0) {
			return 0.0;
		}
		double dot = 0;
		double normA = 0;
		double normB = 0;
		for (int i = 0; i < a.length; i++) {
			dot += a[i] * b[i];
			normA += a[i] * a[i];
			normB += b[i] * b[i];
		}
		if (normA == 0 || normB == 0) {
			return 0.0;
		}
		return dot / Math.sqrt(normA * normB);
	}

	private static boolean accepts(CandidateRecipe recipe, SearchFilter filter) {
		for (String excluded : filter.excludedIngredients()) {
			String normalized = IngredientNames.normalize(excluded);
			for (String ingredient : recipe.ingredientSet()) {
				if (IngredientNames.containsWord(ingredient, normalized)) {
					return false;
				}
			}
		}
		if (!filter.requiredTags().isEmpty()) {
			return filter.requiredTags().stream().anyMatch(recipe::hasTag);
		}
		return true;
	}

	private static List<ScoredRecipe> top(List<ScoredRecipe> scored, int topK) {
		return scored.stream()
				.sorted(Comparator.comparingDouble(ScoredRecipe::similarity).reversed()
						.thenComparing(s -> s.recipe().id()))
				.limit(Math.max(0, topK))
				.toList();
	}

	private synchronized List<CandidateRecipe> snapshot() {
		return List.copyOf(recipes.values());
	}
}
