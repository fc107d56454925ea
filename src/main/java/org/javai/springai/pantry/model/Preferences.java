package org.javai.springai.pantry.model;

import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Set;
import java.util.TreeSet;

/**
 * The household's constraints for one conversation.
 *
 * <p>Allergies are the strictest filter. {@link #merge(PreferenceDelta)} only ever adds to them;
 * an allergy disappears only when a delta names it in {@link PreferenceDelta#allergiesRemoved()}.</p>
 *
 * @param dietaryRestrictions canonical restriction labels, e.g. {@code vegan}, {@code gluten-free}
 * @param allergies normalized allergen names
 * @param cuisinePreferences lower-cased cuisine names
 * @param skillLevel cooking skill
 */
public record Preferences(
		Set<String> dietaryRestrictions,
		Set<String> allergies,
		Set<String> cuisinePreferences,
		SkillLevel skillLevel
) {

	public Preferences {
		dietaryRestrictions = canonicalDiets(dietaryRestrictions);
		allergies = Set.copyOf(IngredientNames.normalizeAll(allergies));
		cuisinePreferences = lowerCased(cuisinePreferences);
		skillLevel = skillLevel != null ? skillLevel : SkillLevel.INTERMEDIATE;
	}

	public static Preferences none() {
		return new Preferences(Set.of(), Set.of(), Set.of(), SkillLevel.INTERMEDIATE);
	}

	/**
	 * Applies a delta. Fields absent from the delta keep their current value.
	 */
	public Preferences merge(PreferenceDelta delta) {
		if (delta == null || delta.isEmpty()) {
			return this;
		}
		Set<String> mergedAllergies = new LinkedHashSet<>(allergies);
		mergedAllergies.addAll(IngredientNames.normalizeAll(delta.allergiesAdded()));
		mergedAllergies.removeAll(IngredientNames.normalizeAll(delta.allergiesRemoved()));
		return new Preferences(
				delta.dietaryRestrictions() != null ? delta.dietaryRestrictions() : dietaryRestrictions,
				mergedAllergies,
				delta.cuisinePreferences() != null ? delta.cuisinePreferences() : cuisinePreferences,
				delta.skillLevel() != null ? delta.skillLevel() : skillLevel);
	}

	/**
	 * Number of constraints that narrow the candidate set (dietary + allergy + cuisine).
	 */
	public int activeConstraintCount() {
		return dietaryRestrictions.size() + allergies.size() + cuisinePreferences.size();
	}

	public boolean hasAllergy(String ingredient) {
		String normalized = IngredientNames.normalize(ingredient);
		return allergies.stream().anyMatch(a -> IngredientNames.containsWord(normalized, a));
	}

	private static Set<String> canonicalDiets(Set<String> raw) {
		Set<String> result = new TreeSet<>();
		if (raw != null) {
			for (String diet : raw) {
				String canonical = DietaryRestrictions.canonical(diet);
				if (!canonical.isEmpty()) {
					result.add(canonical);
				}
			}
		}
		return Set.copyOf(result);
	}

	private static Set<String> lowerCased(Set<String> raw) {
		Set<String> result = new TreeSet<>();
		if (raw != null) {
			for (String value : raw) {
				if (value != null && !value.isBlank()) {
					result.add(value.toLowerCase(Locale.ROOT).trim());
				}
			}
		}
		return Set.copyOf(result);
	}
}
