package org.javai.springai.pantry.planning;

import java.util.ArrayList;
import java.util.List;
import org.javai.springai.pantry.intent.Intent;
import org.javai.springai.pantry.intent.IntentClassification;
import org.javai.springai.pantry.model.Preferences;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Decides how much explicit planning a turn receives.
 *
 * <ul>
 *   <li>SIMPLE: pure mutation, general question or clarification; one step.</li>
 *   <li>MEDIUM: recipe search or adaptation.</li>
 *   <li>COMPLEX: recipe-bearing with three or more constraints, or with any constraint while a
 *   selection is pending, or a split mutation and search with any constraint.</li>
 * </ul>
 */
public class ComplexityPlanner {

	private static final Logger logger = LoggerFactory.getLogger(ComplexityPlanner.class);

	static final int COMPLEX_CONSTRAINT_THRESHOLD = 3;

	public TaskPlan plan(IntentClassification classification, Preferences preferences, boolean selectionPending) {
		List<Intent> intents = classification.intents();
		boolean mutation = classification.has(Intent.MutatePantry.class);
		boolean search = classification.has(Intent.SearchRecipes.class);
		boolean selection = classification.has(Intent.SelectRecommendation.class);
		int constraints = preferences.activeConstraintCount();

		TaskPlan plan;
		if (!search && !selection) {
			plan = simplePlan(intents.get(0));
		}
		else {
			boolean split = mutation && search;
			Complexity complexity = constraints >= COMPLEX_CONSTRAINT_THRESHOLD
					|| (selectionPending && constraints >= 1)
					|| (split && constraints >= 1)
					? Complexity.COMPLEX
					: Complexity.MEDIUM;
			plan = selection ? adaptationPlan(complexity, constraints) : searchPlan(complexity, mutation, constraints);
		}
		logger.info("Turn plan: {}", plan.summary());
		return plan;
	}

	private static TaskPlan simplePlan(Intent intent) {
		if (intent instanceof Intent.MutatePantry mutate) {
			return new TaskPlan(Complexity.SIMPLE,
					List.of(new PlanStep(PlanActor.INVENTORY_STORE, "apply " + mutate.deltas().size() + " inventory delta(s)")),
					List.of(SuccessCriterion.MUTATION_APPLIED), FallbackStrategy.none());
		}
		if (intent instanceof Intent.GeneralQuery query && !query.preferencesOnly()) {
			return new TaskPlan(Complexity.SIMPLE,
					List.of(new PlanStep(PlanActor.TEXT_GENERATION, "answer general question")),
					List.of(SuccessCriterion.ANSWER_PRODUCED), FallbackStrategy.none());
		}
		String action = intent instanceof Intent.Ambiguous ? "ask clarifying question" : "acknowledge preferences";
		return new TaskPlan(Complexity.SIMPLE, List.of(new PlanStep(PlanActor.SYNTHESIZER, action)),
				List.of(SuccessCriterion.ANSWER_PRODUCED), FallbackStrategy.none());
	}

	private static TaskPlan searchPlan(Complexity complexity, boolean mutation, int constraints) {
		List<PlanStep> steps = new ArrayList<>();
		List<SuccessCriterion> criteria = new ArrayList<>();
		if (mutation) {
			steps.add(new PlanStep(PlanActor.INVENTORY_STORE, "apply inventory deltas, use resulting pantry"));
			criteria.add(SuccessCriterion.MUTATION_APPLIED);
		}
		else {
			steps.add(new PlanStep(PlanActor.INVENTORY_STORE, "fetch inventory"));
		}
		steps.add(new PlanStep(PlanActor.SEARCH_INDEX, "query search index"));
		if (complexity == Complexity.COMPLEX) {
			steps.add(new PlanStep(PlanActor.HYBRID_RANKER, "apply hard filters for " + constraints + " constraint(s)"));
		}
		steps.add(new PlanStep(PlanActor.HYBRID_RANKER, "rank candidates"));
		steps.add(new PlanStep(PlanActor.QUALITY_GATE, "screen recommendations"));
		steps.add(new PlanStep(PlanActor.SYNTHESIZER, "present top recommendations"));
		criteria.add(SuccessCriterion.AT_LEAST_ONE_SAFE_CANDIDATE);
		criteria.add(SuccessCriterion.TOP_THREE_DISTINCT);
		return new TaskPlan(complexity, steps, criteria, FallbackStrategy.forSearch());
	}

	private static TaskPlan adaptationPlan(Complexity complexity, int constraints) {
		List<PlanStep> steps = new ArrayList<>();
		steps.add(new PlanStep(PlanActor.INVENTORY_STORE, "fetch inventory"));
		steps.add(new PlanStep(PlanActor.RECIPE_ADAPTER, "adapt selected recipe"));
		steps.add(new PlanStep(PlanActor.SUBSTITUTION_CATALOG, "lookup substitutions"));
		if (complexity == Complexity.COMPLEX) {
			steps.add(new PlanStep(PlanActor.QUALITY_GATE, "re-validate against " + constraints + " constraint(s)"));
		}
		else {
			steps.add(new PlanStep(PlanActor.QUALITY_GATE, "re-validate adapted recipe"));
		}
		steps.add(new PlanStep(PlanActor.SYNTHESIZER, "present adapted recipe"));
		return new TaskPlan(complexity, steps, List.of(SuccessCriterion.ADAPTED_RECIPE_PASSES_GATE),
				FallbackStrategy.forAdaptation());
	}
}
