package org.javai.springai.pantry.adaptation;

import static org.assertj.core.api.Assertions.assertThat;
import static org.javai.springai.pantry.testsupport.PantryFixtures.item;
import static org.javai.springai.pantry.testsupport.PantryFixtures.recipe;

import java.util.List;
import java.util.Map;
import java.util.Set;
import org.javai.springai.pantry.model.CandidateRecipe;
import org.javai.springai.pantry.model.PantryItem;
import org.javai.springai.pantry.model.Preferences;
import org.javai.springai.pantry.model.RecipeIngredient;
import org.javai.springai.pantry.model.SkillLevel;
import org.javai.springai.pantry.safety.QualityGate;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("RecipeAdapter")
class RecipeAdapterTest {

	private static final CandidateRecipe BUTTERED_PASTA = new CandidateRecipe("buttered-pasta", "Buttered pasta",
			List.of(RecipeIngredient.of("pasta", 200, "g"), RecipeIngredient.of("butter", 2, "tbsp"),
					RecipeIngredient.of("parmesan", 30, "g")),
			List.of("Boil the pasta.", "Toss with butter and parmesan."), Set.of("italian"), 2, 0.7);

	private static final List<PantryItem> PANTRY = List.of(item("pasta", 500), item("olive oil", 1));

	private static final Preferences DAIRY_FREE = new Preferences(Set.of(), Set.of("dairy"), Set.of(), null);

	private static final AlternativeSource ALTERNATIVES = ingredient -> Map.of(
			"butter", List.of("olive oil", "coconut oil"),
			"parmesan", List.of("nutritional yeast"),
			"lime", List.of("lemon")).getOrDefault(ingredient, List.of());

	private final RecipeAdapter adapter = new RecipeAdapter();

	@Nested
	@DisplayName("constraint violations")
	class Violations {

		@Test
		@DisplayName("are replaced by a safe alternative, preferring one in the pantry")
		void replacedPreferringPantry() {
			AdaptedRecipe adapted = adapter.adapt(BUTTERED_PASTA, PANTRY, DAIRY_FREE, null, ALTERNATIVES);

			assertThat(adapted.ingredients()).extracting(AdaptedIngredient::name)
					.containsExactly("pasta", "olive oil", "nutritional yeast");
			assertThat(adapted.substitutions()).extracting(AdaptedIngredient::substitutedFor)
					.containsExactly("butter", "parmesan");
			assertThat(adapted.ingredients().get(1).inPantry()).isTrue();
			assertThat(adapted.shoppingList()).containsExactly("nutritional yeast");
			assertThat(adapted.notes()).anyMatch(note -> note.startsWith("Replaced butter with olive oil"));
		}

		@Test
		@DisplayName("are renamed in the instructions but not inside other words")
		void instructionsRewritten() {
			AdaptedRecipe adapted = adapter.adapt(BUTTERED_PASTA, PANTRY, DAIRY_FREE, null, ALTERNATIVES);

			assertThat(adapted.instructions()).containsExactly("Boil the pasta.",
					"Toss with olive oil and nutritional yeast.");
			assertThat(adapted.title()).isEqualTo("Buttered pasta");
		}

		@Test
		@DisplayName("produce a recipe that passes the quality gate")
		void passesGate() {
			AdaptedRecipe adapted = adapter.adapt(BUTTERED_PASTA, PANTRY, DAIRY_FREE, null, ALTERNATIVES);

			assertThat(new QualityGate().inspect(adapted.asCandidate(), DAIRY_FREE).passed()).isTrue();
		}

		@Test
		@DisplayName("are renamed where the steps shorten the ingredient's name")
		void shortenedMentionsRewritten() {
			CandidateRecipe rice = new CandidateRecipe("chicken-rice", "Rice bowl",
					List.of(RecipeIngredient.of("chicken breast", 2, null), RecipeIngredient.of("rice", 200, "g")),
					List.of("Slice the chicken thinly.", "Fry the chicken breasts and serve over rice."),
					Set.of(), 2, 0.8);
			Preferences vegetarian = new Preferences(Set.of("vegetarian"), Set.of(), Set.of(), null);
			AlternativeSource tofu = ingredient -> "chicken breast".equals(ingredient) ? List.of("tofu") : List.of();

			AdaptedRecipe adapted = adapter.adapt(rice, List.of(item("tofu", 1), item("rice", 500)), vegetarian, null,
					tofu);

			assertThat(adapted.ingredients()).extracting(AdaptedIngredient::name).containsExactly("tofu", "rice");
			assertThat(adapted.instructions()).containsExactly("Slice the tofu thinly.",
					"Fry the tofu and serve over rice.");
			assertThat(new QualityGate().inspect(adapted.asCandidate(), vegetarian).passed()).isTrue();
		}

		@Test
		@DisplayName("stay in place with a note when no safe alternative exists")
		void noAlternative() {
			AdaptedRecipe adapted = adapter.adapt(BUTTERED_PASTA, PANTRY, DAIRY_FREE, null, AlternativeSource.NONE);

			assertThat(adapted.substitutions()).isEmpty();
			assertThat(adapted.notes()).contains("No safe substitute found for butter.");
			assertThat(new QualityGate().inspect(adapted.asCandidate(), DAIRY_FREE).passed()).isFalse();
		}
	}

	@Test
	@DisplayName("changes no ingredient when adapting an adapted recipe again")
	void fixedPoint() {
		AdaptedRecipe once = adapter.adapt(BUTTERED_PASTA, PANTRY, DAIRY_FREE, null, ALTERNATIVES);
		AdaptedRecipe twice = adapter.adapt(once.asCandidate(), PANTRY, DAIRY_FREE, null, ALTERNATIVES);

		assertThat(twice.ingredients()).extracting(AdaptedIngredient::name)
				.containsExactlyElementsOf(once.ingredients().stream().map(AdaptedIngredient::name).toList());
		assertThat(twice.substitutions()).isEmpty();
	}

	@Test
	@DisplayName("scales quantities to the requested servings")
	void scales() {
		AdaptedRecipe adapted = adapter.adapt(BUTTERED_PASTA, PANTRY, DAIRY_FREE, 4, ALTERNATIVES);

		assertThat(adapted.servings()).isEqualTo(4);
		assertThat(adapted.ingredients().get(0).ingredient().quantity()).isEqualTo(400.0);
		assertThat(adapted.notes()).contains("Scaled from 2 to 4 servings.");
	}

	@Test
	@DisplayName("covers a missing ingredient with a safe alternative on hand")
	void missingCoveredFromPantry() {
		CandidateRecipe salsa = recipe("salsa", "tomato", "onion", "lime");

		AdaptedRecipe adapted = adapter.adapt(salsa, List.of(item("tomato", 3), item("onion", 1), item("lemon", 1)),
				Preferences.none(), null, ALTERNATIVES);

		assertThat(adapted.ingredients().get(2).source()).isEqualTo(IngredientSource.SUBSTITUTED);
		assertThat(adapted.ingredients().get(2).name()).isEqualTo("lemon");
		assertThat(adapted.notes()).contains("Using lemon from your pantry instead of lime.");
		assertThat(adapted.shoppingList()).isEmpty();
	}

	@Test
	@DisplayName("puts missing ingredients without an on-hand alternative on the shopping list")
	void missingToBuy() {
		CandidateRecipe salsa = recipe("salsa", "tomato", "onion", "lime");

		AdaptedRecipe adapted = adapter.adapt(salsa, List.of(item("tomato", 3)), Preferences.none(), null, ALTERNATIVES);

		assertThat(adapted.shoppingList()).containsExactly("lime", "onion");
		assertThat(adapted.ingredients()).extracting(AdaptedIngredient::source)
				.containsExactly(IngredientSource.PANTRY, IngredientSource.TO_BUY, IngredientSource.TO_BUY);
	}

	@Test
	@DisplayName("warns a beginner about a long method")
	void beginnerLongMethod() {
		CandidateRecipe longMethod = new CandidateRecipe("stew", "Stew", List.of(RecipeIngredient.of("pasta")),
				List.of("One.", "Two.", "Three.", "Four.", "Five.", "Six.", "Seven."), Set.of(), 2, 0.5);
		Preferences beginner = new Preferences(Set.of(), Set.of(), Set.of(), SkillLevel.BEGINNER);

		assertThat(adapter.adapt(longMethod, PANTRY, beginner, null, ALTERNATIVES).notes())
				.contains("This one has 7 steps; read them all before you start.");
		assertThat(adapter.adapt(longMethod, PANTRY, Preferences.none(), null, ALTERNATIVES).notes()).isEmpty();
	}

	@Test
	@DisplayName("rewrites plural mentions of a renamed ingredient")
	void pluralRewrite() {
		assertThat(RecipeAdapter.rewrite("Crack the eggs into a bowl.", Map.of("egg", "flax egg")))
				.isEqualTo("Crack the flax egg into a bowl.");
	}
}
