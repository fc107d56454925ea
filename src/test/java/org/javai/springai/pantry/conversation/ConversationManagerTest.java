package org.javai.springai.pantry.conversation;

import static org.assertj.core.api.Assertions.assertThat;
import static org.javai.springai.pantry.testsupport.PantryFixtures.item;
import static org.javai.springai.pantry.testsupport.PantryFixtures.recipe;
import static org.javai.springai.pantry.testsupport.PantryFixtures.scored;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.fasterxml.jackson.databind.ObjectMapper;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import org.apache.logging.log4j.Level;
import org.javai.springai.pantry.adaptation.AdaptedIngredient;
import org.javai.springai.pantry.delegation.Collaborators;
import org.javai.springai.pantry.delegation.DelegationRouter;
import org.javai.springai.pantry.delegation.KeywordRecipeIndex;
import org.javai.springai.pantry.delegation.SemanticSearchIndex;
import org.javai.springai.pantry.delegation.TextGenerationCapability;
import org.javai.springai.pantry.intent.DefaultIntentClassifier;
import org.javai.springai.pantry.inventory.InMemoryInventoryStore;
import org.javai.springai.pantry.model.CandidateRecipe;
import org.javai.springai.pantry.model.PantryItem;
import org.javai.springai.pantry.model.Preferences;
import org.javai.springai.pantry.model.RankedRecommendation;
import org.javai.springai.pantry.model.RecipeIngredient;
import org.javai.springai.pantry.ranking.HybridRanker;
import org.javai.springai.pantry.ranking.RankingPolicy;
import org.javai.springai.pantry.substitution.InMemorySubstitutionCatalog;
import org.javai.springai.pantry.testsupport.LogCaptorAppender;
import org.javai.springai.pantry.testsupport.PantryFixtures;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

/**
 * End-to-end turns against in-memory collaborators and mocked search indexes.
 */
class ConversationManagerTest {

	private static final String SESSION = "s1";

	private static final CandidateRecipe GARLIC_RICE = recipe("garlic-rice", "Garlic rice", Set.of(), "rice", "garlic");
	private static final CandidateRecipe PEANUT_NOODLES = recipe("peanut-noodles", "Peanut noodles", Set.of(),
			"noodles", "peanut butter", "garlic");
	private static final CandidateRecipe BUTTERED_PASTA = new CandidateRecipe("buttered-pasta", "Buttered pasta",
			List.of(RecipeIngredient.of("pasta", 200, "g"), RecipeIngredient.of("butter", 2, "tbsp"),
					RecipeIngredient.of("parmesan", 30, "g")),
			List.of("Boil the pasta.", "Toss with butter and parmesan."), Set.of("italian"), 2, 0.7);

	private static final Preferences DAIRY_ALLERGY = new Preferences(Set.of(), Set.of("dairy"), Set.of(), null);

	private FlakyStore inventory;
	private SemanticSearchIndex search;
	private KeywordRecipeIndex keyword;
	private TextGenerationCapability generation;
	private InMemoryConversationStateStore stateStore;
	private DelegationRouter router;

	@BeforeEach
	void setUp() {
		inventory = new FlakyStore();
		inventory.put(SESSION, List.of(item("pasta", 500), item("olive oil", 1), item("rice", 1), item("garlic", 3)));
		search = mock(SemanticSearchIndex.class);
		when(search.embed(anyString())).thenReturn(new float[] {1f});
		when(search.query(any(), anyInt(), any())).thenReturn(List.of(
				scored(GARLIC_RICE, 0.8), scored(PEANUT_NOODLES, 0.9), scored(BUTTERED_PASTA, 0.7)));
		keyword = mock(KeywordRecipeIndex.class);
		generation = mock(TextGenerationCapability.class);
		stateStore = new InMemoryConversationStateStore(PantryFixtures.fixedClock(), Duration.ofMinutes(30));
	}

	@AfterEach
	void closeRouter() {
		if (router != null) {
			router.close();
		}
	}

	private ConversationManager manager(Map<String, List<String>> substitutions, boolean withKeyword,
			boolean withGeneration) {
		Collaborators collaborators = Collaborators.builder(inventory)
				.searchIndex(search)
				.keywordIndex(withKeyword ? keyword : null)
				.textGeneration(withGeneration ? generation : null)
				.substitutionCatalog(new InMemorySubstitutionCatalog(substitutions))
				.build();
		router = new DelegationRouter(collaborators, Duration.ofSeconds(2), Map.of());
		return ConversationManager.builder(router)
				.stateStore(stateStore)
				.ranker(new HybridRanker(RankingPolicy.defaults(), PantryFixtures.fixedClock()))
				.clock(PantryFixtures.fixedClock())
				.build();
	}

	private ConversationManager manager() {
		return manager(Map.of("butter", List.of("olive oil"), "parmesan", List.of("nutritional yeast")), true, false);
	}

	private static ConversationResponse say(ConversationManager manager, String message) {
		return manager.converse(new ConversationRequest(SESSION, message));
	}

	private static List<String> ids(List<RankedRecommendation> recommendations) {
		return recommendations.stream().map(RankedRecommendation::recipeId).toList();
	}

	@Nested
	@DisplayName("recipe search")
	class Search {

		@Test
		@DisplayName("presents ranked options and waits for a selection")
		void presentsOptions() {
			ConversationResponse response = say(manager(), "What can I make for dinner?");

			assertThat(response.outcome()).isEqualTo(TurnOutcome.OK);
			assertThat(response.stage()).isEqualTo(ConversationStage.AWAITING_SELECTION);
			assertThat(ids(response.payload().recommendations()))
					.containsExactly("garlic-rice", "peanut-noodles", "buttered-pasta");
			assertThat(response.explanationText()).isNotBlank();
			assertThat(stateStore.load(SESSION)).hasValueSatisfying(state ->
					assertThat(state.pendingCandidates()).hasSize(3));
		}

		@Test
		@DisplayName("never presents a recipe containing a stated allergen")
		void excludesAllergens() {
			ConversationResponse response = say(manager(), "I'm allergic to peanuts. What can I make for dinner?");

			assertThat(ids(response.payload().recommendations())).containsExactly("garlic-rice", "buttered-pasta");
			assertThat(response.updatedPreferences().allergies()).containsExactly("peanut");
		}

		@Test
		@DisplayName("applies a pantry change before searching with the updated pantry")
		void mutationThenSearch() {
			ConversationResponse response = say(manager(), "I just bought 2 eggs, what can I make?");

			assertThat(response.outcome()).isEqualTo(TurnOutcome.OK);
			assertThat(response.payload().notices()).contains("Updated your pantry: egg:+2.");
			assertThat(inventory.getInventory(SESSION)).extracting(PantryItem::name).contains("egg");
			assertThat(response.payload().recommendations()).isNotEmpty();
		}

		@Test
		@DisplayName("falls back to keyword matching when semantic search fails")
		void keywordFallback() {
			when(search.embed(anyString())).thenThrow(new IllegalStateException("embedding service down"));
			when(keyword.match(anyList(), anyInt())).thenReturn(List.of(scored(GARLIC_RICE, 0.5)));

			ConversationResponse response = say(manager(), "What can I make for dinner?");

			assertThat(response.outcome()).isEqualTo(TurnOutcome.OK);
			assertThat(ids(response.payload().recommendations())).containsExactly("garlic-rice");
			assertThat(response.payload().notices()).anyMatch(n -> n.contains("keyword matching"));
		}

		@Test
		@DisplayName("degrades when no search is available at all")
		void degradesWithoutSearch() {
			when(search.embed(anyString())).thenThrow(new IllegalStateException("embedding service down"));
			ConversationManager manager = manager(Map.of(), false, false);

			ConversationResponse response = say(manager, "What can I make for dinner?");

			assertThat(response.outcome()).isEqualTo(TurnOutcome.DEGRADED);
			assertThat(response.stage()).isEqualTo(ConversationStage.COLLECTING_PREFS);
			assertThat(response.payload().notices())
					.contains("Recipe search is unavailable right now; please try again shortly.");
			assertThat(response.payload().recommendations()).isEmpty();
		}

		@Test
		@DisplayName("uses the cached pantry when the store fails on a later turn")
		void cachedInventory() {
			ConversationManager manager = manager();
			say(manager, "What can I make for dinner?");
			inventory.down = true;

			ConversationResponse response = say(manager, "Any other dinner ideas?");

			assertThat(response.outcome()).isEqualTo(TurnOutcome.OK);
			assertThat(response.payload().notices()).contains(
					"Your pantry could not be read (the service failed), so I used the copy from 0 minute(s) ago.");
			assertThat(ids(response.payload().recommendations())).startsWith("garlic-rice");
		}

		@Test
		@DisplayName("logs the plan audit with every criterion met")
		void auditLog() {
			ConversationManager manager = manager();
			try (LogCaptorAppender captor = LogCaptorAppender.capture(ConversationManager.class, Level.INFO)) {
				say(manager, "What can I make for dinner?");

				assertThat(captor.messagesAt(Level.INFO)).anyMatch(m -> m.contains("finished OK")
						&& m.contains("SEARCHING -> PRESENTING_OPTIONS -> AWAITING_SELECTION")
						&& m.endsWith("unmet criteria: none"));
			}
		}
	}

	@Nested
	@DisplayName("acceptance scenarios")
	class Scenarios {

		@Test
		@DisplayName("A: the top pasta recommendation uses what the pantry holds")
		void topRecommendationUsesPantry() {
			inventory.put(SESSION, List.of(item("tomato", 5), new PantryItem("pasta", 1, "kg"),
					new PantryItem("garlic", 8, "cloves")));
			CandidateRecipe tomatoPasta = recipe("tomato-pasta", "Tomato pasta", Set.of(), "tomato", "pasta", "garlic");
			CandidateRecipe risotto = recipe("risotto", "Mushroom risotto", Set.of(), "arborio rice", "mushroom", "parmesan");
			when(search.query(any(), anyInt(), any())).thenReturn(List.of(scored(risotto, 0.7), scored(tomatoPasta, 0.6)));

			ConversationResponse response = say(manager(), "pasta dinner");

			RankedRecommendation top = response.payload().recommendations().get(0);
			assertThat(top.recipe().ingredientSet()).containsAnyOf("tomato", "pasta", "garlic");
			assertThat(top.recipe().ingredientSet().stream().filter(Set.of("tomato", "pasta", "garlic")::contains))
					.hasSizeGreaterThanOrEqualTo(2);
		}

		@Test
		@DisplayName("B: a peanut recipe never reaches the payload or the pending options")
		void peanutRecipeNeverPending() {
			ConversationManager manager = manager();
			manager.converse(new ConversationRequest(SESSION, "What can I make for dinner?",
					new Preferences(Set.of(), Set.of("peanut"), Set.of(), null), null));

			assertThat(stateStore.load(SESSION)).hasValueSatisfying(state ->
					assertThat(ids(state.pendingCandidates())).doesNotContain("peanut-noodles"));
		}

		@Test
		@DisplayName("C: with equal similarity the recipe using an expiring item ranks first")
		void expiringIngredientWins() {
			inventory.put(SESSION, List.of(item("egg", 6), PantryFixtures.expiring("spinach", 1, 1), item("zucchini", 2)));
			CandidateRecipe frittata = recipe("frittata", "Frittata", Set.of(), "egg", "zucchini");
			CandidateRecipe omelette = recipe("omelette", "Spinach omelette", Set.of(), "egg", "spinach");
			when(search.query(any(), anyInt(), any())).thenReturn(List.of(scored(frittata, 0.5), scored(omelette, 0.5)));

			ConversationResponse response = say(manager(), "What can I make for breakfast?");

			assertThat(ids(response.payload().recommendations())).containsExactly("omelette", "frittata");
			assertThat(response.payload().recommendations().get(0).usesExpiring()).isTrue();
		}

		@Test
		@DisplayName("D: nothing within reach after relaxation yields a shopping list, not silence")
		void noSafeMatchOffersShoppingList() {
			CandidateRecipe bouillabaisse = recipe("bouillabaisse", "Bouillabaisse", Set.of(),
					"fish", "fennel", "saffron", "leek", "tomato");
			when(search.query(any(), anyInt(), any())).thenReturn(List.of(scored(bouillabaisse, 0.9)));

			ConversationResponse response = say(manager(), "What can I make for dinner?");

			assertThat(response.outcome()).isEqualTo(TurnOutcome.NO_SAFE_MATCH);
			assertThat(response.payload().recommendations()).isEmpty();
			assertThat(response.payload().shoppingList()).containsExactly("fennel", "fish", "leek", "saffron", "tomato");
			assertThat(response.payload().textAnswer()).isEqualTo("Closest safe options: Bouillabaisse.");
			assertThat(response.stage()).isEqualTo(ConversationStage.COLLECTING_PREFS);
		}

		@Test
		@DisplayName("E: a purchase is applied before the search that follows it")
		void purchaseAppliedBeforeSearch() {
			CandidateRecipe chickenRice = recipe("chicken-rice", "Chicken rice", Set.of(), "chicken breast", "rice");
			when(search.query(any(), anyInt(), any())).thenReturn(List.of(scored(chickenRice, 0.5)));
			ArgumentCaptor<String> queryText = ArgumentCaptor.forClass(String.class);

			ConversationResponse response = say(manager(), "I bought 2 chicken breasts, what can I make?");

			verify(search).embed(queryText.capture());
			assertThat(queryText.getValue()).contains("chicken breast");
			assertThat(inventory.getInventory(SESSION)).contains(new PantryItem("chicken breast", 2));
			assertThat(response.payload().recommendations()).singleElement()
					.satisfies(r -> assertThat(r.missingIngredients()).isEmpty());
		}
	}

	@Nested
	@DisplayName("selection and adaptation")
	class Selection {

		@Test
		@DisplayName("adapts the chosen recipe to a new allergy and returns it")
		void adaptsChosenRecipe() {
			ConversationManager manager = manager();
			say(manager, "What can I make for dinner?");

			ConversationResponse response = manager.converse(new ConversationRequest(SESSION, "3", DAIRY_ALLERGY, null));

			assertThat(response.outcome()).isEqualTo(TurnOutcome.OK);
			assertThat(response.stage()).isEqualTo(ConversationStage.COLLECTING_PREFS);
			assertThat(response.payload().adaptedRecipe()).isNotNull();
			assertThat(response.payload().adaptedRecipe().substitutions()).extracting(AdaptedIngredient::name)
					.containsExactly("olive oil", "nutritional yeast");
			assertThat(response.payload().adaptedRecipe().instructions())
					.containsExactly("Boil the pasta.", "Toss with olive oil and nutritional yeast.");
			assertThat(response.payload().shoppingList()).containsExactly("nutritional yeast");
			assertThat(stateStore.load(SESSION)).hasValueSatisfying(state ->
					assertThat(state.pendingCandidates()).isEmpty());
		}

		@Test
		@DisplayName("withholds an adapted recipe that still violates a constraint")
		void withholdsUnsafeAdaptation() {
			ConversationManager manager = manager(Map.of(), true, false);
			say(manager, "What can I make for dinner?");

			ConversationResponse response = manager.converse(new ConversationRequest(SESSION, "3", DAIRY_ALLERGY, null));

			assertThat(response.outcome()).isEqualTo(TurnOutcome.CONSTRAINT_VIOLATION);
			assertThat(response.stage()).isEqualTo(ConversationStage.AWAITING_SELECTION);
			assertThat(response.payload().adaptedRecipe()).isNull();
			assertThat(response.payload().violations()).isNotEmpty();
			assertThat(stateStore.load(SESSION)).hasValueSatisfying(state ->
					assertThat(state.pendingCandidates()).hasSize(3));
		}

		@Test
		@DisplayName("asks again for an out-of-range choice without losing the options")
		void outOfRange() {
			ConversationManager manager = manager();
			say(manager, "What can I make for dinner?");

			ConversationResponse response = say(manager, "7");

			assertThat(response.outcome()).isEqualTo(TurnOutcome.CLARIFICATION_NEEDED);
			assertThat(response.payload().textAnswer()).isEqualTo("Please pick a number between 1 and 3.");
			assertThat(response.stage()).isEqualTo(ConversationStage.AWAITING_SELECTION);
		}

		@Test
		@DisplayName("withdraws pending options that conflict with a newly stated allergy")
		void rescreensPendingOnNewAllergy() {
			ConversationManager manager = manager();
			say(manager, "What can I make for dinner?");

			ConversationResponse response = say(manager, "I'm allergic to peanuts");

			assertThat(response.stage()).isEqualTo(ConversationStage.AWAITING_SELECTION);
			assertThat(response.payload().violations()).isNotEmpty();
			assertThat(ids(response.payload().recommendations())).containsExactly("garlic-rice", "buttered-pasta");
			assertThat(stateStore.load(SESSION)).hasValueSatisfying(state ->
					assertThat(ids(state.pendingCandidates())).containsExactly("garlic-rice", "buttered-pasta"));
		}
	}

	@Nested
	@DisplayName("pantry changes")
	class PantryChanges {

		@Test
		void appliesChange() {
			ConversationResponse response = say(manager(), "I bought 2 chicken breasts and 500g pasta");

			assertThat(response.outcome()).isEqualTo(TurnOutcome.OK);
			assertThat(response.payload().pantrySummary()).isNotNull();
			assertThat(inventory.getInventory(SESSION)).filteredOn(i -> i.name().equals("pasta"))
					.extracting(PantryItem::quantity).containsExactly(1000.0);
		}

		@Test
		void rejectedChangeIsExplained() {
			ConversationResponse response = say(manager(), "I used 3 eggs");

			assertThat(response.outcome()).isEqualTo(TurnOutcome.CLARIFICATION_NEEDED);
			assertThat(response.payload().textAnswer())
					.isEqualTo("I couldn't update your pantry: Cannot remove 3 egg: none in the pantry. Nothing was changed.");
			assertThat(inventory.getInventory(SESSION)).hasSize(4);
		}

		@Test
		void asksForMissingQuantity() {
			ConversationResponse response = say(manager(), "I bought eggs");

			assertThat(response.outcome()).isEqualTo(TurnOutcome.CLARIFICATION_NEEDED);
			assertThat(response.payload().textAnswer()).startsWith("How much egg was that?");
		}
	}

	@Nested
	@DisplayName("general messages")
	class General {

		@Test
		void answersCookingQuestionWithModel() throws Exception {
			when(generation.complete(anyString(), any()))
					.thenReturn(new ObjectMapper().readTree("{\"answer\": \"About 7 minutes.\"}"));
			ConversationManager manager = manager(Map.of(), true, true);

			ConversationResponse response = say(manager, "How long should I boil an egg?");

			assertThat(response.outcome()).isEqualTo(TurnOutcome.OK);
			assertThat(response.payload().textAnswer()).isEqualTo("About 7 minutes.");
		}

		@Test
		void degradesWithoutModel() {
			ConversationResponse response = say(manager(), "How long should I boil an egg?");

			assertThat(response.outcome()).isEqualTo(TurnOutcome.DEGRADED);
			assertThat(response.payload().notices()).anyMatch(n -> n.startsWith("I can't answer general cooking questions"));
		}

		@Test
		void answersPantryQuestionFromInventory() {
			ConversationResponse response = say(manager(), "What's in my pantry?");

			assertThat(response.outcome()).isEqualTo(TurnOutcome.OK);
			assertThat(response.payload().pantrySummary()).isNotNull();
			verify(generation, never()).complete(anyString(), any());
		}

		@Test
		void acknowledgesPreferences() {
			ConversationResponse response = say(manager(), "I'm vegan");

			assertThat(response.payload().textAnswer()).isEqualTo("Noted. diet: vegan; skill: intermediate.");
			assertThat(response.updatedPreferences().dietaryRestrictions()).containsExactly("vegan");
			assertThat(stateStore.load(SESSION)).hasValueSatisfying(state ->
					assertThat(state.preferences().dietaryRestrictions()).containsExactly("vegan"));
		}

		@Test
		@DisplayName("records a stated allergy without touching the pantry")
		void allergyLeavesPantryAlone() {
			ConversationResponse response = say(manager(), "I have a peanut allergy");

			assertThat(response.outcome()).isEqualTo(TurnOutcome.OK);
			assertThat(response.payload().textAnswer()).startsWith("Noted.").doesNotContain("Updated your pantry");
			assertThat(response.updatedPreferences().allergies()).contains("peanut");
			assertThat(inventory.getInventory(SESSION)).extracting(PantryItem::name)
					.containsExactly("pasta", "olive oil", "rice", "garlic");
		}

		@Test
		void asksForClarification() {
			ConversationResponse response = say(manager(), "hello there");

			assertThat(response.outcome()).isEqualTo(TurnOutcome.CLARIFICATION_NEEDED);
			assertThat(response.stage()).isEqualTo(ConversationStage.COLLECTING_PREFS);
			assertThat(response.payload().textAnswer()).startsWith("I can update your pantry");
		}
	}

	@Nested
	@DisplayName("session handling")
	class Sessions {

		@Test
		@DisplayName("resets a corrupt session but keeps its preferences")
		void resetsCorruptSession() {
			Preferences peanut = new Preferences(Set.of(), Set.of("peanut"), Set.of(), null);
			stateStore.save(new ConversationState(SESSION, ConversationStage.SEARCHING, peanut, null, List.of(), null));

			ConversationResponse response = say(manager(), "hello there");

			assertThat(response.payload().notices()).contains(ConversationManager.RESET_NOTICE);
			assertThat(response.updatedPreferences().allergies()).containsExactly("peanut");
			assertThat(response.stage()).isEqualTo(ConversationStage.COLLECTING_PREFS);
		}

		@Test
		@DisplayName("commits nothing when a turn fails unexpectedly")
		void unexpectedFailure() {
			DefaultIntentClassifier broken = mock(DefaultIntentClassifier.class);
			when(broken.resolve(any())).thenThrow(new IllegalStateException("classifier exploded"));
			router = new DelegationRouter(Collaborators.builder(inventory).build());
			ConversationManager manager = ConversationManager.builder(router)
					.stateStore(stateStore)
					.classifier(broken)
					.build();

			ConversationResponse response = say(manager, "What can I make for dinner?");

			assertThat(response.outcome()).isEqualTo(TurnOutcome.ERROR);
			assertThat(response.isCommitted()).isFalse();
			assertThat(stateStore.load(SESSION)).isEmpty();
		}

		@Test
		void endSessionDropsState() {
			ConversationManager manager = manager();
			say(manager, "I'm vegan");

			assertThat(manager.endSession(SESSION)).isTrue();
			assertThat(stateStore.load(SESSION)).isEmpty();
			assertThat(manager.endSession(SESSION)).isFalse();
		}

		@Test
		@DisplayName("a newer message supersedes a turn still waiting on a collaborator")
		void newerMessageSupersedes() throws Exception {
			inventory.blockFirstRead = true;
			ConversationManager manager = manager();
			ExecutorService caller = Executors.newSingleThreadExecutor();
			try {
				Future<ConversationResponse> first = caller.submit(() -> say(manager, "What can I make for dinner?"));
				assertThat(inventory.entered.await(2, TimeUnit.SECONDS)).isTrue();

				ConversationResponse second = say(manager, "What can I make for dinner?");
				inventory.release.countDown();

				assertThat(first.get(5, TimeUnit.SECONDS).outcome()).isEqualTo(TurnOutcome.SUPERSEDED);
				assertThat(second.outcome()).isEqualTo(TurnOutcome.OK);
				assertThat(stateStore.load(SESSION)).hasValueSatisfying(state ->
						assertThat(state.stage()).isEqualTo(ConversationStage.AWAITING_SELECTION));
			}
			finally {
				inventory.release.countDown();
				caller.shutdownNow();
			}
		}
	}

	/**
	 * In-memory store that can be switched off, or made to hold its first read until released.
	 */
	static class FlakyStore extends InMemoryInventoryStore {
		volatile boolean down;
		volatile boolean blockFirstRead;
		final CountDownLatch entered = new CountDownLatch(1);
		final CountDownLatch release = new CountDownLatch(1);
		private final AtomicBoolean firstRead = new AtomicBoolean(true);

		@Override
		public List<PantryItem> getInventory(String sessionId) {
			if (down) {
				throw new IllegalStateException("store offline");
			}
			if (blockFirstRead && firstRead.compareAndSet(true, false)) {
				entered.countDown();
				try {
					release.await(5, TimeUnit.SECONDS);
				}
				catch (InterruptedException e) {
					Thread.currentThread().interrupt();
				}
			}
			return super.getInventory(sessionId);
		}
	}
}
