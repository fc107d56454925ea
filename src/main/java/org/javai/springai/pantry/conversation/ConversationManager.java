package org.javai.springai.pantry.conversation;

import com.fasterxml.jackson.databind.JsonNode;
import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Pattern;
import org.javai.springai.pantry.adaptation.AdaptedRecipe;
import org.javai.springai.pantry.adaptation.DelegatedAlternativeSource;
import org.javai.springai.pantry.adaptation.RecipeAdapter;
import org.javai.springai.pantry.delegation.DelegationRecord;
import org.javai.springai.pantry.delegation.DelegationRequest;
import org.javai.springai.pantry.delegation.DelegationResult;
import org.javai.springai.pantry.delegation.DelegationRouter;
import org.javai.springai.pantry.delegation.ExpectedSchema;
import org.javai.springai.pantry.delegation.ExpectedSchema.FieldType;
import org.javai.springai.pantry.delegation.FailureKind;
import org.javai.springai.pantry.delegation.PendingDelegation;
import org.javai.springai.pantry.delegation.SearchFilter;
import org.javai.springai.pantry.intent.ClassificationContext;
import org.javai.springai.pantry.intent.DefaultIntentClassifier;
import org.javai.springai.pantry.intent.Intent;
import org.javai.springai.pantry.intent.IntentClassification;
import org.javai.springai.pantry.model.InventoryDelta;
import org.javai.springai.pantry.model.PantryItem;
import org.javai.springai.pantry.model.PreferenceDelta;
import org.javai.springai.pantry.model.Preferences;
import org.javai.springai.pantry.model.RankedRecommendation;
import org.javai.springai.pantry.model.ScoredRecipe;
import org.javai.springai.pantry.planning.ComplexityPlanner;
import org.javai.springai.pantry.planning.SuccessCriterion;
import org.javai.springai.pantry.planning.TaskPlan;
import org.javai.springai.pantry.planning.TurnEvidence;
import org.javai.springai.pantry.ranking.HybridRanker;
import org.javai.springai.pantry.ranking.RankingResult;
import org.javai.springai.pantry.safety.GateVerdict;
import org.javai.springai.pantry.safety.QualityGate;
import org.javai.springai.pantry.safety.RecommendationScreen;
import org.javai.springai.pantry.synthesis.PantrySummary;
import org.javai.springai.pantry.synthesis.ResponseSynthesizer;
import org.javai.springai.pantry.synthesis.StructuredPayload;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs one conversation turn per message.
 *
 * <p>A turn loads the session, classifies the message, plans, dispatches to collaborators through
 * the {@link DelegationRouter}, ranks or adapts, passes everything recipe-bearing through the
 * {@link QualityGate} and synthesizes the response. The new state is committed only if no newer
 * message for the same session arrived meanwhile.</p>
 *
 * <h2>Usage</h2>
 * <pre>{@code
 * ConversationManager manager = ConversationManager.builder(router).build();
 * ConversationResponse response = manager.converse(new ConversationRequest("s-1", "what can I make?"));
 * }</pre>
 */
public class ConversationManager {

	private static final Logger logger = LoggerFactory.getLogger(ConversationManager.class);

	public static final int DEFAULT_SEARCH_TOP_K = 10;

	static final ExpectedSchema ANSWER_SCHEMA = ExpectedSchema.named("answer")
			.required("answer", FieldType.STRING);

	private static final Pattern PANTRY_QUESTION = Pattern.compile(
			"\\b(pantry|inventory|do i have|have i got|what'?s in my|expir\\w*)\\b", Pattern.CASE_INSENSITIVE);

	static final String RESET_NOTICE = "Your conversation had to be restarted; your preferences were kept.";

	private final ConversationStateStore stateStore;
	private final DelegationRouter router;
	private final DefaultIntentClassifier classifier;
	private final ComplexityPlanner planner;
	private final HybridRanker ranker;
	private final RecipeAdapter adapter;
	private final QualityGate gate;
	private final ResponseSynthesizer synthesizer;
	private final TurnRegistry turns;
	private final Clock clock;
	private final int searchTopK;

	private ConversationManager(Builder builder) {
		this.router = Objects.requireNonNull(builder.router, "router must not be null");
		this.stateStore = builder.stateStore != null ? builder.stateStore : new InMemoryConversationStateStore();
		this.classifier = builder.classifier != null ? builder.classifier : new DefaultIntentClassifier();
		this.planner = builder.planner != null ? builder.planner : new ComplexityPlanner();
		this.ranker = builder.ranker != null ? builder.ranker : new HybridRanker();
		this.adapter = builder.adapter != null ? builder.adapter : new RecipeAdapter();
		this.gate = builder.gate != null ? builder.gate : new QualityGate();
		this.synthesizer = builder.synthesizer != null ? builder.synthesizer : new ResponseSynthesizer();
		this.turns = builder.turns != null ? builder.turns : new TurnRegistry();
		this.clock = builder.clock != null ? builder.clock : Clock.systemDefaultZone();
		this.searchTopK = builder.searchTopK;
	}

	public static Builder builder(DelegationRouter router) {
		return new Builder(router);
	}

	/**
	 * Processes one message. Never throws for collaborator failures; an unexpected failure yields
	 * {@link TurnOutcome#ERROR} with nothing committed.
	 */
	public ConversationResponse converse(ConversationRequest request) {
		Objects.requireNonNull(request, "request must not be null");
		String sessionId = request.sessionId();
		TurnTicket ticket = turns.begin(sessionId);

		ConversationState loaded;
		try {
			loaded = stateStore.load(sessionId).orElseGet(() -> ConversationState.initial(sessionId));
		}
		catch (RuntimeException e) {
			logger.error("Could not load session {}", sessionId, e);
			turns.finish(ticket);
			return failed(ConversationState.initial(sessionId));
		}
		boolean reset = false;
		try {
			ConversationStateValidator.validate(loaded);
		}
		catch (SessionStateCorruptException e) {
			logger.warn("Session {} state is corrupt ({}); resetting with preferences kept", sessionId, e.getMessage());
			loaded = loaded.resetToReady();
			reset = true;
		}

		try {
			TurnResult result = runTurn(request, loaded, ticket, reset);
			ConversationState next = result.state();
			ConversationStateValidator.validate(next);
			String explanation = synthesizer.explain(result.payload(), next.preferences(), router, ticket);
			auditTurn(ticket, result);
			if (!turns.commitIfCurrent(ticket, () -> stateStore.save(next))) {
				return superseded(ticket, loaded);
			}
			return new ConversationResponse(next.stage(), result.payload(), explanation, next.preferences(),
					result.outcome());
		}
		catch (SessionStateCorruptException e) {
			logger.warn("Turn {} hit an inconsistent session state: {}", ticket, e.getMessage());
			ConversationState ready = loaded.resetToReady();
			StructuredPayload payload = StructuredPayload.builder().notice(RESET_NOTICE).build();
			if (!turns.commitIfCurrent(ticket, () -> stateStore.save(ready))) {
				return superseded(ticket, loaded);
			}
			return new ConversationResponse(ready.stage(), payload, synthesizer.explain(payload, ready.preferences()),
					ready.preferences(), TurnOutcome.SESSION_RESET);
		}
		catch (RuntimeException e) {
			logger.error("Turn {} failed", ticket, e);
			turns.finish(ticket);
			return failed(loaded);
		}
	}

	private ConversationResponse failed(ConversationState unchanged) {
		StructuredPayload payload = StructuredPayload.builder()
				.notice("Something went wrong handling that message. Nothing was changed; please try again.")
				.build();
		return new ConversationResponse(unchanged.stage(), payload, synthesizer.explain(payload, unchanged.preferences()),
				unchanged.preferences(), TurnOutcome.ERROR);
	}

	/**
	 * Drops a session explicitly.
	 */
	public boolean endSession(String sessionId) {
		return stateStore.evict(sessionId);
	}

	private TurnResult runTurn(ConversationRequest request, ConversationState state, TurnTicket ticket, boolean reset) {
		StageMachine machine = new StageMachine(state.sessionId(), state.stage());
		if (machine.current() == ConversationStage.INITIAL) {
			machine.advance(ConversationStage.COLLECTING_PREFS);
		}

		Preferences preferences = state.preferences();
		if (request.knownPreferences() != null) {
			preferences = preferences.merge(PreferenceDelta.of(request.knownPreferences()));
		}
		ClassificationContext context = new ClassificationContext(machine.current(), request.message(), preferences,
				state.pendingCandidates().size(), ticket);
		IntentClassification classification = classifier.resolve(context);
		preferences = preferences.merge(classification.preferenceDelta());
		TaskPlan plan = planner.plan(classification, preferences, context.selectionPending());

		Turn turn = new Turn(request, state, preferences, machine, ticket, plan);
		if (reset) {
			turn.payload.notice(RESET_NOTICE);
		}
		boolean preferencesChanged = !preferences.equals(state.preferences());
		Intent primary = classification.primary();

		if (primary instanceof Intent.Ambiguous ambiguous) {
			rescreenPending(turn, preferencesChanged);
			return clarify(turn, ambiguous.clarifyingQuestion());
		}
		if (primary instanceof Intent.MutatePantry mutation) {
			return mutate(turn, mutation, classification.find(Intent.SearchRecipes.class).orElse(null));
		}
		if (primary instanceof Intent.SearchRecipes search) {
			machine.advance(ConversationStage.SEARCHING);
			return search(turn, search.query(), null);
		}
		if (primary instanceof Intent.SelectRecommendation selection) {
			return select(turn, selection.index());
		}
		Intent.GeneralQuery query = (Intent.GeneralQuery) primary;
		rescreenPending(turn, preferencesChanged);
		return query.preferencesOnly() ? acknowledgePreferences(turn) : answer(turn, query.question());
	}

	private TurnResult clarify(Turn turn, String question) {
		turn.machine.advance(turn.machine.current());
		turn.payload.textAnswer(question);
		turn.evidence = turn.evidence.withAnswerProduced();
		return turn.finish(TurnOutcome.CLARIFICATION_NEEDED);
	}

	private TurnResult mutate(Turn turn, Intent.MutatePantry mutation, Intent.SearchRecipes followUp) {
		turn.machine.advance(ConversationStage.PANTRY_OP);
		turn.pending = List.of();
		List<InventoryDelta> deltas = mutation.deltas();
		DelegationResult<List<PantryItem>> applied = router.call(
				new DelegationRequest.ApplyInventoryDeltas(turn.sessionId(), deltas), turn.ticket);
		if (applied instanceof DelegationResult.Failure<List<PantryItem>> failure) {
			turn.machine.advance(ConversationStage.DONE);
			if (failure.kind() == FailureKind.REJECTED) {
				turn.payload.textAnswer("I couldn't update your pantry: " + failure.detail() + ". Nothing was changed.");
				turn.evidence = turn.evidence.withAnswerProduced();
				return turn.finish(TurnOutcome.CLARIFICATION_NEEDED);
			}
			turn.payload.notice("Your pantry could not be updated right now (" + describe(failure.kind())
					+ "). Nothing was changed; please try again.");
			return turn.finish(TurnOutcome.DEGRADED);
		}
		List<PantryItem> pantry = applied.orElse(List.of());
		turn.snapshot = new PantrySnapshot(pantry, clock.instant());
		turn.evidence = turn.evidence.withMutationApplied();
		String changes = String.join(", ", deltas.stream().map(InventoryDelta::toString).toList());
		if (followUp != null) {
			turn.payload.notice("Updated your pantry: " + changes + ".");
			turn.machine.advance(ConversationStage.SEARCHING);
			return search(turn, followUp.query(), pantry);
		}
		turn.machine.advance(ConversationStage.DONE);
		turn.payload.textAnswer("Updated your pantry: " + changes + ".");
		turn.payload.pantrySummary(summarize(pantry));
		turn.evidence = turn.evidence.withAnswerProduced();
		return turn.finish(TurnOutcome.OK);
	}

	/**
	 * @param knownPantry the pantry a mutation in this turn produced, or null to fetch it
	 */
	private TurnResult search(Turn turn, String query, List<PantryItem> knownPantry) {
		turn.pending = List.of();
		Preferences preferences = turn.preferences;
		List<PantryItem> pantryHint = knownPantry != null ? knownPantry
				: turn.state.pantrySnapshot() != null ? turn.state.pantrySnapshot().items() : List.of();
		String queryText = queryText(query, pantryHint, preferences);

		PendingDelegation<List<PantryItem>> inventoryCall = knownPantry == null
				? router.submit(new DelegationRequest.FetchInventory(turn.sessionId()), turn.ticket)
				: null;
		PendingDelegation<List<ScoredRecipe>> searchCall = router.submit(
				new DelegationRequest.QueryRecipes(queryText, searchTopK, SearchFilter.excluding(preferences.allergies())),
				turn.ticket);

		List<PantryItem> pantry = knownPantry;
		if (inventoryCall != null) {
			pantry = resolveInventory(turn, router.await(inventoryCall));
			if (pantry == null) {
				searchCall.cancel();
				turn.machine.advance(ConversationStage.DONE);
				return turn.finish(TurnOutcome.DEGRADED);
			}
		}

		DelegationResult<List<ScoredRecipe>> semantic = router.await(searchCall);
		List<ScoredRecipe> candidates;
		if (semantic instanceof DelegationResult.Success<List<ScoredRecipe>> success) {
			candidates = success.value();
		}
		else {
			candidates = keywordFallback(turn, query, pantry);
			if (candidates == null) {
				turn.machine.advance(ConversationStage.DONE);
				turn.payload.pantrySummary(summarize(pantry));
				turn.payload.notice("Recipe search is unavailable right now; please try again shortly.");
				return turn.finish(TurnOutcome.DEGRADED);
			}
		}

		RankingResult ranking = ranker.rank(candidates, pantry, preferences);
		RecommendationScreen screen = gate.inspectRecommendations(ranking.recommendations(), preferences);
		if (screen.anyWithheld()) {
			turn.payload.violations(screen.allViolations());
		}
		List<RankedRecommendation> approved = screen.approved();
		if (approved.isEmpty()) {
			turn.machine.advance(ConversationStage.DONE);
			List<String> shopping = ranking.shoppingList();
			turn.payload.shoppingList(shopping);
			turn.payload.pantrySummary(summarize(pantry));
			if (!ranking.closestCandidates().isEmpty()) {
				turn.payload.textAnswer("Closest safe options: " + String.join(", ",
						ranking.closestCandidates().stream().map(c -> c.title()).toList()) + ".");
			}
			else {
				turn.payload.textAnswer("I found no recipe that fits your constraints.");
			}
			turn.evidence = turn.evidence.withAnswerProduced();
			return turn.finish(TurnOutcome.NO_SAFE_MATCH);
		}

		turn.machine.advance(ConversationStage.PRESENTING_OPTIONS);
		turn.machine.advance(ConversationStage.AWAITING_SELECTION);
		turn.pending = approved;
		turn.payload.recommendations(approved);
		if (ranking.relaxed()) {
			turn.payload.notice("Some suggestions need a few more ingredients than usual; see what is missing.");
		}
		for (RankedRecommendation recommendation : approved) {
			if (recommendation.dietUnverified()) {
				turn.payload.notice(recommendation.recipe().title() + " is not labeled "
						+ String.join("/", preferences.dietaryRestrictions().stream().sorted().toList())
						+ "; please double-check its ingredients.");
			}
		}
		Set<String> ids = new HashSet<>();
		boolean distinct = approved.stream().allMatch(r -> ids.add(r.recipeId()));
		turn.evidence = turn.evidence.withCandidates(approved.size(), distinct);
		return turn.finish(TurnOutcome.OK);
	}

	private List<ScoredRecipe> keywordFallback(Turn turn, String query, List<PantryItem> pantry) {
		if (!turn.plan.fallbackStrategy().keywordSearchOnSemanticFailure()) {
			return null;
		}
		Set<String> terms = new LinkedHashSet<>();
		if (query != null) {
			for (String word : query.toLowerCase(Locale.ROOT).split("[^\\p{L}]+")) {
				if (word.length() > 2) {
					terms.add(word);
				}
			}
		}
		pantry.stream().filter(PantryItem::isAvailable).map(PantryItem::name).forEach(terms::add);
		if (terms.isEmpty()) {
			return null;
		}
		DelegationResult<List<ScoredRecipe>> keyword = router.call(
				new DelegationRequest.KeywordRecipes(List.copyOf(terms), searchTopK), turn.ticket);
		if (keyword.isSuccess()) {
			turn.payload.notice("Semantic search was unavailable, so these results come from keyword matching.");
			return keyword.orElse(List.of());
		}
		return null;
	}

	private TurnResult select(Turn turn, int index) {
		List<RankedRecommendation> pending = turn.state.pendingCandidates();
		if (turn.machine.current() != ConversationStage.AWAITING_SELECTION || index > pending.size()) {
			return clarify(turn, pending.isEmpty()
					? "There is nothing to choose from yet. Ask me for recipe ideas first."
					: "Please pick a number between 1 and " + pending.size() + ".");
		}
		turn.machine.advance(ConversationStage.ADAPTING);
		RankedRecommendation chosen = pending.get(index - 1);

		DelegationResult<List<PantryItem>> fetched = router.call(
				new DelegationRequest.FetchInventory(turn.sessionId()), turn.ticket);
		List<PantryItem> pantry = resolveInventory(turn, fetched);
		if (pantry == null) {
			turn.machine.advance(ConversationStage.AWAITING_SELECTION);
			return turn.finish(TurnOutcome.DEGRADED);
		}

		AdaptedRecipe adapted = adapter.adapt(chosen.recipe(), pantry, turn.preferences, turn.request.targetServings(),
				new DelegatedAlternativeSource(router, turn.ticket, turn.preferences));
		GateVerdict verdict = gate.inspect(adapted.asCandidate(), turn.preferences);
		if (!verdict.passed()) {
			turn.machine.advance(ConversationStage.AWAITING_SELECTION);
			turn.payload.violations(verdict.violations());
			turn.payload.recommendations(pending);
			turn.payload.textAnswer("I couldn't make " + chosen.recipe().title()
					+ " safe for you, so I won't show it. Pick another option, or pick it again to retry.");
			return turn.finish(TurnOutcome.CONSTRAINT_VIOLATION);
		}
		turn.machine.advance(ConversationStage.DONE);
		turn.pending = List.of();
		turn.payload.adaptedRecipe(adapted);
		turn.payload.shoppingList(adapted.shoppingList());
		turn.payload.pantrySummary(summarize(pantry));
		turn.evidence = turn.evidence.withAdaptedRecipePassed();
		return turn.finish(TurnOutcome.OK);
	}

	private TurnResult acknowledgePreferences(Turn turn) {
		Preferences preferences = turn.preferences;
		List<String> facts = new ArrayList<>();
		if (!preferences.dietaryRestrictions().isEmpty()) {
			facts.add("diet: " + String.join(", ", preferences.dietaryRestrictions().stream().sorted().toList()));
		}
		if (!preferences.allergies().isEmpty()) {
			facts.add("allergies: " + String.join(", ", preferences.allergies().stream().sorted().toList()));
		}
		if (!preferences.cuisinePreferences().isEmpty()) {
			facts.add("cuisines: " + String.join(", ", preferences.cuisinePreferences().stream().sorted().toList()));
		}
		facts.add("skill: " + preferences.skillLevel().name().toLowerCase(Locale.ROOT));
		turn.payload.textAnswer("Noted. " + String.join("; ", facts) + ".");
		turn.evidence = turn.evidence.withAnswerProduced();
		if (!turn.pending.isEmpty()) {
			turn.machine.advance(ConversationStage.AWAITING_SELECTION);
			turn.payload.recommendations(turn.pending);
			return turn.finish(TurnOutcome.OK);
		}
		turn.machine.advance(ConversationStage.GENERAL);
		turn.machine.advance(ConversationStage.DONE);
		return turn.finish(TurnOutcome.OK);
	}

	private TurnResult answer(Turn turn, String question) {
		turn.machine.advance(ConversationStage.GENERAL);
		TurnOutcome outcome = TurnOutcome.OK;
		if (PANTRY_QUESTION.matcher(question).find()) {
			DelegationResult<List<PantryItem>> fetched = router.call(
					new DelegationRequest.FetchInventory(turn.sessionId()), turn.ticket);
			List<PantryItem> pantry = resolveInventory(turn, fetched);
			if (pantry != null) {
				turn.payload.pantrySummary(summarize(pantry));
				turn.evidence = turn.evidence.withAnswerProduced();
			}
			else {
				outcome = TurnOutcome.DEGRADED;
			}
		}
		else {
			DelegationResult<JsonNode> result = router.call(
					new DelegationRequest.CompleteText(answerPrompt(question, turn.preferences), ANSWER_SCHEMA), turn.ticket);
			String text = result.optional().map(node -> node.get("answer").asText("").trim()).orElse("");
			if (text.isEmpty()) {
				turn.payload.notice("I can't answer general cooking questions right now, but I can still manage "
						+ "your pantry and suggest recipes.");
				outcome = TurnOutcome.DEGRADED;
			}
			else {
				turn.payload.textAnswer(text);
				turn.evidence = turn.evidence.withAnswerProduced();
			}
		}
		if (!turn.pending.isEmpty()) {
			turn.machine.advance(ConversationStage.AWAITING_SELECTION);
		}
		else {
			turn.machine.advance(ConversationStage.DONE);
		}
		return turn.finish(outcome);
	}

	/**
	 * Screens the pending candidates again after a preference change; withheld ones are reported.
	 */
	private void rescreenPending(Turn turn, boolean preferencesChanged) {
		if (!preferencesChanged || turn.pending.isEmpty()) {
			return;
		}
		RecommendationScreen screen = gate.inspectRecommendations(turn.pending, turn.preferences);
		if (screen.anyWithheld()) {
			turn.payload.violations(screen.allViolations());
			turn.pending = screen.approved();
			logger.info("Withdrew {} pending candidate(s) after a preference change", screen.withheld().size());
		}
	}

	/**
	 * The fetched pantry, or the session's cached snapshot when the store failed and the plan allows it.
	 *
	 * @return null when no pantry could be obtained; a degradation notice has been added
	 */
	private List<PantryItem> resolveInventory(Turn turn, DelegationResult<List<PantryItem>> fetched) {
		if (fetched instanceof DelegationResult.Success<List<PantryItem>> success) {
			turn.snapshot = new PantrySnapshot(success.value(), clock.instant());
			return success.value();
		}
		FailureKind kind = fetched.failureKind().orElse(FailureKind.COLLABORATOR_ERROR);
		PantrySnapshot cached = turn.state.pantrySnapshot();
		if (cached != null && turn.plan.fallbackStrategy().cachedInventoryOnStoreFailure()) {
			turn.payload.notice("Your pantry could not be read (" + describe(kind)
					+ "), so I used the copy from " + cached.age(clock.instant()).toMinutes() + " minute(s) ago.");
			return cached.items();
		}
		turn.payload.notice("Your pantry could not be read right now (" + describe(kind) + ").");
		return null;
	}

	private PantrySummary summarize(List<PantryItem> pantry) {
		return PantrySummary.of(pantry, LocalDate.now(clock), ranker.policy().urgencyWindowDays());
	}

	private static String queryText(String query, List<PantryItem> pantryHint, Preferences preferences) {
		List<String> parts = new ArrayList<>();
		if (query != null && !query.isBlank()) {
			parts.add(query);
		}
		pantryHint.stream().filter(PantryItem::isAvailable).map(PantryItem::name).forEach(parts::add);
		preferences.cuisinePreferences().stream().sorted().forEach(parts::add);
		preferences.dietaryRestrictions().stream().sorted().forEach(parts::add);
		return parts.isEmpty() ? "easy home cooking" : String.join(" ", parts);
	}

	private static String answerPrompt(String question, Preferences preferences) {
		return """
				Answer this home-cooking question in at most three sentences.
				The household avoids: %s. Dietary restrictions: %s.
				Question: %s
				Reply with JSON only: %s
				""".formatted(
				preferences.allergies().isEmpty() ? "nothing" : String.join(", ", preferences.allergies()),
				preferences.dietaryRestrictions().isEmpty() ? "none" : String.join(", ", preferences.dietaryRestrictions()),
				question, ANSWER_SCHEMA.describe());
	}

	private static String describe(FailureKind kind) {
		return switch (kind) {
			case TIMEOUT -> "it took too long";
			case UNAVAILABLE -> "the service is not configured";
			case CANCELLED -> "the request was cancelled";
			case SCHEMA_INVALID -> "the answer was malformed";
			case REJECTED -> "the change was rejected";
			case COLLABORATOR_ERROR -> "the service failed";
		};
	}

	private ConversationResponse superseded(TurnTicket ticket, ConversationState loaded) {
		logger.debug("Turn {} superseded; nothing committed", ticket);
		return new ConversationResponse(loaded.stage(), StructuredPayload.empty(), "", loaded.preferences(),
				TurnOutcome.SUPERSEDED);
	}

	private void auditTurn(TurnTicket ticket, TurnResult result) {
		TaskPlan plan = result.state().lastPlan();
		List<SuccessCriterion> unmet = plan.unmetCriteria(result.evidence());
		logger.info("Turn {} finished {} via {}; unmet criteria: {}", ticket, result.outcome(), result.stages(),
				unmet.isEmpty() ? "none" : unmet.stream().map(SuccessCriterion::description).toList());
		for (DelegationRecord record : ticket.records()) {
			logger.debug("Turn {} delegation: {}", ticket, record);
		}
	}

	/**
	 * Mutable working data of one turn. Confined to the turn's thread.
	 */
	private final class Turn {
		final ConversationRequest request;
		final ConversationState state;
		final Preferences preferences;
		final StageMachine machine;
		final TurnTicket ticket;
		final TaskPlan plan;
		final StructuredPayload.Builder payload = StructuredPayload.builder();
		List<RankedRecommendation> pending;
		PantrySnapshot snapshot;
		TurnEvidence evidence = TurnEvidence.none();

		Turn(ConversationRequest request, ConversationState state, Preferences preferences, StageMachine machine,
				TurnTicket ticket, TaskPlan plan) {
			this.request = request;
			this.state = state;
			this.preferences = preferences;
			this.machine = machine;
			this.ticket = ticket;
			this.plan = plan;
			this.pending = state.pendingCandidates();
			this.snapshot = state.pantrySnapshot();
		}

		String sessionId() {
			return state.sessionId();
		}

		TurnResult finish(TurnOutcome outcome) {
			if (machine.current() == ConversationStage.AWAITING_SELECTION && pending.isEmpty()) {
				machine.advance(ConversationStage.COLLECTING_PREFS);
			}
			String stages = machine.toString();
			ConversationStage resting = machine.settle();
			List<RankedRecommendation> keep = resting == ConversationStage.AWAITING_SELECTION ? pending : List.of();
			ConversationState next = new ConversationState(state.sessionId(), resting, preferences, snapshot, keep, plan);
			return new TurnResult(next, payload.build(), outcome, evidence, stages);
		}
	}

	private record TurnResult(
			ConversationState state,
			StructuredPayload payload,
			TurnOutcome outcome,
			TurnEvidence evidence,
			String stages
	) {
	}

	public static final class Builder {
		private final DelegationRouter router;
		private ConversationStateStore stateStore;
		private DefaultIntentClassifier classifier;
		private ComplexityPlanner planner;
		private HybridRanker ranker;
		private RecipeAdapter adapter;
		private QualityGate gate;
		private ResponseSynthesizer synthesizer;
		private TurnRegistry turns;
		private Clock clock;
		private int searchTopK = DEFAULT_SEARCH_TOP_K;

		private Builder(DelegationRouter router) {
			this.router = router;
		}

		public Builder stateStore(ConversationStateStore stateStore) {
			this.stateStore = stateStore;
			return this;
		}

		public Builder classifier(DefaultIntentClassifier classifier) {
			this.classifier = classifier;
			return this;
		}

		public Builder planner(ComplexityPlanner planner) {
			this.planner = planner;
			return this;
		}

		public Builder ranker(HybridRanker ranker) {
			this.ranker = ranker;
			return this;
		}

		public Builder adapter(RecipeAdapter adapter) {
			this.adapter = adapter;
			return this;
		}

		public Builder gate(QualityGate gate) {
			this.gate = gate;
			return this;
		}

		public Builder synthesizer(ResponseSynthesizer synthesizer) {
			this.synthesizer = synthesizer;
			return this;
		}

		public Builder turns(TurnRegistry turns) {
			this.turns = turns;
			return this;
		}

		public Builder clock(Clock clock) {
			this.clock = clock;
			return this;
		}

		public Builder searchTopK(int searchTopK) {
			if (searchTopK < 1) {
				throw new IllegalArgumentException("searchTopK must be >= 1");
			}
			this.searchTopK = searchTopK;
			return this;
		}

		public ConversationManager build() {
			return new ConversationManager(this);
		}
	}
}
