package org.javai.springai.pantry.safety;

import static org.assertj.core.api.Assertions.assertThat;
import static org.javai.springai.pantry.testsupport.PantryFixtures.recipe;
import static org.javai.springai.pantry.testsupport.PantryFixtures.recommendation;

import java.util.List;
import java.util.Set;
import org.apache.logging.log4j.Level;
import org.javai.springai.pantry.model.CandidateRecipe;
import org.javai.springai.pantry.model.Preferences;
import org.javai.springai.pantry.model.RecipeIngredient;
import org.javai.springai.pantry.testsupport.LogCaptorAppender;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("QualityGate")
class QualityGateTest {

	private final QualityGate gate = new QualityGate();

	@Nested
	@DisplayName("inspect")
	class Inspect {

		@Test
		@DisplayName("passes a recipe with no conflicting ingredient or step")
		void passesCleanRecipe() {
			Preferences prefs = new Preferences(Set.of(), Set.of("peanut"), Set.of(), null);

			GateVerdict verdict = gate.inspect(recipe("rice", "rice", "garlic"), prefs);

			assertThat(verdict.passed()).isTrue();
			assertThat(verdict.violations()).isEmpty();
		}

		@Test
		@DisplayName("finds allergens mentioned only in an instruction step")
		void findsAllergenInInstructions() {
			CandidateRecipe recipe = new CandidateRecipe("rice", "Garlic rice",
					List.of(RecipeIngredient.of("rice"), RecipeIngredient.of("garlic")),
					List.of("Cook the rice.", "Serve with a drizzle of cream."), Set.of(), 2, 0.5);
			Preferences prefs = new Preferences(Set.of(), Set.of("dairy"), Set.of(), null);

			try (LogCaptorAppender logs = LogCaptorAppender.capture(QualityGate.class, Level.WARN)) {
				GateVerdict verdict = gate.inspect(recipe, prefs);

				assertThat(verdict.passed()).isFalse();
				assertThat(verdict.violations()).singleElement()
						.extracting(ConstraintViolation::detail).isEqualTo("instruction 2");
				assertThat(logs.anyContains("Quality gate rejected recipe rice")).isTrue();
			}
		}
	}

	@Nested
	@DisplayName("inspectRecommendations")
	class InspectRecommendations {

		@Test
		@DisplayName("withholds violating recommendations and keeps the order of the rest")
		void withholdsViolations() {
			var omelette = recommendation(recipe("omelette", "egg", "spinach"), 80);
			var stew = recommendation(recipe("stew", "beef", "carrot"), 70);
			var salad = recommendation(recipe("salad", "lettuce", "tomato"), 60);
			Preferences prefs = new Preferences(Set.of("vegetarian"), Set.of("egg"), Set.of(), null);

			RecommendationScreen screen = gate.inspectRecommendations(List.of(omelette, stew, salad), prefs);

			assertThat(screen.approved()).containsExactly(salad);
			assertThat(screen.withheld()).containsOnlyKeys("omelette", "stew");
			assertThat(screen.anyWithheld()).isTrue();
			assertThat(screen.allViolations())
					.extracting(ConstraintViolation::constraint)
					.containsExactly("egg", "vegetarian");
		}

		@Test
		@DisplayName("withholds a recipe whose tags contradict a restriction")
		void withholdsOnContradictingTag() {
			var bacon = recommendation(recipe("toast", "Toast", Set.of("bacon"), "bread"), 50);
			Preferences prefs = new Preferences(Set.of("vegetarian"), Set.of(), Set.of(), null);

			RecommendationScreen screen = gate.inspectRecommendations(List.of(bacon), prefs);

			assertThat(screen.approved()).isEmpty();
			assertThat(screen.withheld().get("toast")).singleElement()
					.extracting(ConstraintViolation::detail).isEqualTo("tags");
		}
	}
}
