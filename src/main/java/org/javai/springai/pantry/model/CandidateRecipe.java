package org.javai.springai.pantry.model;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;

/**
 * A recipe returned by a search collaborator.
 *
 * @param id stable recipe identifier, used for de-duplication and tie-breaking
 * @param title display title
 * @param ingredients ingredient lines
 * @param instructions ordered instruction steps
 * @param tags free-form tags ("vegan", "italian", "quick", ...), lower-cased
 * @param servings servings the quantities are written for (at least 1)
 * @param sourceScore the collaborator's own relevance score in [0,1]
 */
public record CandidateRecipe(
		String id,
		String title,
		List<RecipeIngredient> ingredients,
		List<String> instructions,
		Set<String> tags,
		int servings,
		double sourceScore
) {

	public CandidateRecipe {
		Objects.requireNonNull(id, "id must not be null");
		if (id.isBlank()) {
			throw new IllegalArgumentException("id must not be blank");
		}
		title = title != null ? title : id;
		ingredients = ingredients != null ? List.copyOf(ingredients) : List.of();
		instructions = instructions != null ? List.copyOf(instructions) : List.of();
		Set<String> lowerTags = new TreeSet<>();
		if (tags != null) {
			tags.stream().filter(Objects::nonNull)
					.map(t -> t.trim().toLowerCase(Locale.ROOT))
					.filter(t -> !t.isEmpty())
					.forEach(lowerTags::add);
		}
		tags = Set.copyOf(lowerTags);
		if (servings < 1) {
			throw new IllegalArgumentException("servings must be >= 1");
		}
		if (sourceScore < 0.0 || sourceScore > 1.0 || Double.isNaN(sourceScore)) {
			throw new IllegalArgumentException("sourceScore must be within [0,1]: " + sourceScore);
		}
	}

	/**
	 * The normalized ingredient names, in recipe order.
	 */
	public Set<String> ingredientSet() {
		Set<String> names = new LinkedHashSet<>();
		for (RecipeIngredient ingredient : ingredients) {
			names.add(ingredient.name());
		}
		return names;
	}

	public boolean hasTag(String tag) {
		return tags.contains(tag);
	}

	public CandidateRecipe withSourceScore(double score) {
		return new CandidateRecipe(id, title, ingredients, instructions, tags, servings, score);
	}
}
