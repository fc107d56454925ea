package org.javai.springai.pantry.model;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.Set;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("Preferences")
class PreferencesTest {

	@Test
	@DisplayName("canonicalizes restrictions, allergens and cuisines on construction")
	void canonicalizesOnConstruction() {
		Preferences preferences = new Preferences(Set.of("Gluten Free"), Set.of("Peanuts"), Set.of(" Thai "), null);

		assertThat(preferences.dietaryRestrictions()).containsExactly("gluten-free");
		assertThat(preferences.allergies()).containsExactly("peanut");
		assertThat(preferences.cuisinePreferences()).containsExactly("thai");
		assertThat(preferences.skillLevel()).isEqualTo(SkillLevel.INTERMEDIATE);
		assertThat(preferences.activeConstraintCount()).isEqualTo(3);
	}

	@Nested
	@DisplayName("merge")
	class Merge {

		@Test
		@DisplayName("adds allergies and never drops existing ones")
		void addsAllergies() {
			Preferences start = new Preferences(Set.of(), Set.of("shellfish"), Set.of(), null);

			Preferences merged = start.merge(PreferenceDelta.builder().addAllergy("peanut").build());

			assertThat(merged.allergies()).containsExactlyInAnyOrder("shellfish", "peanut");
		}

		@Test
		@DisplayName("removes an allergy only when explicitly withdrawn")
		void removesWithdrawnAllergy() {
			Preferences start = new Preferences(Set.of(), Set.of("shrimp", "peanut"), Set.of(), null);

			Preferences merged = start.merge(PreferenceDelta.builder().removeAllergy("shrimp").build());

			assertThat(merged.allergies()).containsExactly("peanut");
		}

		@Test
		@DisplayName("keeps fields the delta leaves absent")
		void keepsAbsentFields() {
			Preferences start = new Preferences(Set.of("vegan"), Set.of(), Set.of("italian"), SkillLevel.BEGINNER);

			Preferences merged = start.merge(PreferenceDelta.builder().skillLevel(SkillLevel.ADVANCED).build());

			assertThat(merged.dietaryRestrictions()).containsExactly("vegan");
			assertThat(merged.cuisinePreferences()).containsExactly("italian");
			assertThat(merged.skillLevel()).isEqualTo(SkillLevel.ADVANCED);
		}

		@Test
		@DisplayName("treats caller-supplied preferences as additive for allergies")
		void callerPreferencesAreAdditive() {
			Preferences session = new Preferences(Set.of(), Set.of("egg"), Set.of(), null);
			Preferences known = new Preferences(Set.of("vegetarian"), Set.of("soy"), Set.of(), null);

			Preferences merged = session.merge(PreferenceDelta.of(known));

			assertThat(merged.allergies()).containsExactlyInAnyOrder("egg", "soy");
			assertThat(merged.dietaryRestrictions()).containsExactly("vegetarian");
		}
	}

	@Test
	@DisplayName("later deltas win while allergy changes accumulate")
	void deltasCombine() {
		PreferenceDelta first = PreferenceDelta.builder().addAllergy("peanut").skillLevel(SkillLevel.BEGINNER).build();
		PreferenceDelta second = PreferenceDelta.builder().addAllergy("sesame").removeAllergy("peanut")
				.skillLevel(SkillLevel.ADVANCED).build();

		PreferenceDelta combined = first.andThen(second);

		assertThat(combined.allergiesAdded()).containsExactly("sesame");
		assertThat(combined.allergiesRemoved()).containsExactly("peanut");
		assertThat(combined.skillLevel()).isEqualTo(SkillLevel.ADVANCED);
	}

	@Test
	@DisplayName("hasAllergy matches allergens inside longer ingredient names")
	void hasAllergyMatchesWords() {
		Preferences preferences = new Preferences(Set.of(), Set.of("peanut"), Set.of(), null);

		assertThat(preferences.hasAllergy("Peanut Butter")).isTrue();
		assertThat(preferences.hasAllergy("butter")).isFalse();
	}
}
