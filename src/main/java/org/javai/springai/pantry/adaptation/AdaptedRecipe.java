package org.javai.springai.pantry.adaptation;

import java.util.List;
import java.util.Objects;
import org.javai.springai.pantry.model.CandidateRecipe;

/**
 * A recipe fitted to the household's pantry and constraints.
 *
 * @param original the recipe that was adapted
 * @param title title with substitutions applied
 * @param ingredients every ingredient with its source
 * @param instructions instructions rewritten to name substitutes
 * @param servings servings the quantities are scaled to
 * @param shoppingList ingredients to buy, sorted
 * @param notes human-readable adaptation notes
 */
public record AdaptedRecipe(
		CandidateRecipe original,
		String title,
		List<AdaptedIngredient> ingredients,
		List<String> instructions,
		int servings,
		List<String> shoppingList,
		List<String> notes
) {

	public AdaptedRecipe {
		Objects.requireNonNull(original, "original must not be null");
		title = title != null ? title : original.title();
		ingredients = List.copyOf(ingredients);
		instructions = List.copyOf(instructions);
		shoppingList = shoppingList != null ? List.copyOf(shoppingList) : List.of();
		notes = notes != null ? List.copyOf(notes) : List.of();
	}

	public List<AdaptedIngredient> substitutions() {
		return ingredients.stream().filter(i -> i.source() == IngredientSource.SUBSTITUTED).toList();
	}

	/**
	 * The adapted recipe as a plain candidate, for re-validation or re-adaptation.
	 */
	public CandidateRecipe asCandidate() {
		return new CandidateRecipe(original.id(), title,
				ingredients.stream().map(AdaptedIngredient::ingredient).toList(),
				instructions, original.tags(), servings, original.sourceScore());
	}
}
