package org.javai.springai.pantry.model;

/**
 * An ingredient line of a recipe.
 *
 * @param name normalized ingredient name
 * @param quantity amount required, or null when the recipe does not say ("salt to taste")
 * @param unit optional unit
 */
public record RecipeIngredient(String name, Double quantity, String unit) {

	public RecipeIngredient {
		name = IngredientNames.normalize(name);
		if (name.isEmpty()) {
			throw new IllegalArgumentException("ingredient name must not be blank");
		}
		if (quantity != null && quantity < 0) {
			throw new IllegalArgumentException("quantity must be >= 0 for " + name);
		}
		unit = unit == null || unit.isBlank() ? null : unit.trim();
	}

	public static RecipeIngredient of(String name) {
		return new RecipeIngredient(name, null, null);
	}

	public static RecipeIngredient of(String name, double quantity, String unit) {
		return new RecipeIngredient(name, quantity, unit);
	}

	public RecipeIngredient scaled(double factor) {
		return quantity == null ? this : new RecipeIngredient(name, quantity * factor, unit);
	}

	public RecipeIngredient renamed(String newName) {
		return new RecipeIngredient(newName, quantity, unit);
	}

	@Override
	public String toString() {
		if (quantity == null) {
			return name;
		}
		return Quantities.format(quantity) + (unit != null ? " " + unit : "") + " " + name;
	}
}
