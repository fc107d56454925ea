package org.javai.springai.pantry.model;

import java.util.LinkedHashSet;
import java.util.Set;

/**
 * A partial preference update extracted from one message.
 *
 * <p>A {@code null} field is absent and leaves the current value untouched. Allergies are never
 * replaced: {@code allergiesAdded} is unioned in and only {@code allergiesRemoved} takes one away.</p>
 *
 * @param dietaryRestrictions replacement restriction set, or null when absent
 * @param allergiesAdded allergens to add (never null)
 * @param allergiesRemoved allergens explicitly withdrawn (never null)
 * @param cuisinePreferences replacement cuisine set, or null when absent
 * @param skillLevel replacement skill level, or null when absent
 */
public record PreferenceDelta(
		Set<String> dietaryRestrictions,
		Set<String> allergiesAdded,
		Set<String> allergiesRemoved,
		Set<String> cuisinePreferences,
		SkillLevel skillLevel
) {

	public PreferenceDelta {
		dietaryRestrictions = dietaryRestrictions != null ? Set.copyOf(dietaryRestrictions) : null;
		allergiesAdded = allergiesAdded != null ? Set.copyOf(allergiesAdded) : Set.of();
		allergiesRemoved = allergiesRemoved != null ? Set.copyOf(allergiesRemoved) : Set.of();
		cuisinePreferences = cuisinePreferences != null ? Set.copyOf(cuisinePreferences) : null;
	}

	public static PreferenceDelta empty() {
		return new PreferenceDelta(null, Set.of(), Set.of(), null, null);
	}

	/**
	 * Treats a full preference set supplied by the caller as a delta: every field is present,
	 * and its allergies are added rather than replacing what the session already knows.
	 */
	public static PreferenceDelta of(Preferences known) {
		if (known == null) {
			return empty();
		}
		return new PreferenceDelta(known.dietaryRestrictions(), known.allergies(), Set.of(),
				known.cuisinePreferences(), known.skillLevel());
	}

	public boolean isEmpty() {
		return dietaryRestrictions == null && allergiesAdded.isEmpty() && allergiesRemoved.isEmpty()
				&& cuisinePreferences == null && skillLevel == null;
	}

	/**
	 * Combines two deltas; fields present in {@code later} win, allergy changes accumulate.
	 */
	public PreferenceDelta andThen(PreferenceDelta later) {
		if (later == null || later.isEmpty()) {
			return this;
		}
		Set<String> added = new LinkedHashSet<>(allergiesAdded);
		added.removeAll(later.allergiesRemoved());
		added.addAll(later.allergiesAdded());
		Set<String> removed = new LinkedHashSet<>(allergiesRemoved);
		removed.removeAll(later.allergiesAdded());
		removed.addAll(later.allergiesRemoved());
		return new PreferenceDelta(
				later.dietaryRestrictions() != null ? later.dietaryRestrictions() : dietaryRestrictions,
				added,
				removed,
				later.cuisinePreferences() != null ? later.cuisinePreferences() : cuisinePreferences,
				later.skillLevel() != null ? later.skillLevel() : skillLevel);
	}

	public static Builder builder() {
		return new Builder();
	}

	public static final class Builder {
		private Set<String> dietaryRestrictions;
		private final Set<String> allergiesAdded = new LinkedHashSet<>();
		private final Set<String> allergiesRemoved = new LinkedHashSet<>();
		private Set<String> cuisinePreferences;
		private SkillLevel skillLevel;

		private Builder() {
		}

		public Builder dietaryRestrictions(Set<String> restrictions) {
			this.dietaryRestrictions = restrictions;
			return this;
		}

		public Builder addAllergy(String allergen) {
			this.allergiesAdded.add(allergen);
			return this;
		}

		public Builder removeAllergy(String allergen) {
			this.allergiesRemoved.add(allergen);
			return this;
		}

		public Builder cuisinePreferences(Set<String> cuisines) {
			this.cuisinePreferences = cuisines;
			return this;
		}

		public Builder skillLevel(SkillLevel skillLevel) {
			this.skillLevel = skillLevel;
			return this;
		}

		public PreferenceDelta build() {
			return new PreferenceDelta(dietaryRestrictions, allergiesAdded, allergiesRemoved,
					cuisinePreferences, skillLevel);
		}
	}
}
