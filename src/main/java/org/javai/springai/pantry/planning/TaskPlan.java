package org.javai.springai.pantry.planning;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * The plan for one turn. It does no work itself; it is logged, kept as the session's last plan
 * and evaluated against the turn's evidence afterwards.
 *
 * @param complexity tier that shaped the plan
 * @param steps ordered steps
 * @param successCriteria what the turn should achieve
 * @param fallbackStrategy relaxations allowed when a step fails
 */
public record TaskPlan(
		Complexity complexity,
		List<PlanStep> steps,
		List<SuccessCriterion> successCriteria,
		FallbackStrategy fallbackStrategy
) {

	public TaskPlan {
		Objects.requireNonNull(complexity, "complexity must not be null");
		steps = steps != null ? List.copyOf(steps) : List.of();
		if (steps.isEmpty()) {
			throw new IllegalArgumentException("a plan needs at least one step");
		}
		successCriteria = successCriteria != null ? List.copyOf(successCriteria) : List.of();
		fallbackStrategy = fallbackStrategy != null ? fallbackStrategy : FallbackStrategy.none();
	}

	/**
	 * @return the criteria the evidence does not meet, in plan order
	 */
	public List<SuccessCriterion> unmetCriteria(TurnEvidence evidence) {
		return successCriteria.stream().filter(c -> !c.isMetBy(evidence)).toList();
	}

	public boolean involves(PlanActor actor) {
		return steps.stream().anyMatch(step -> step.actor() == actor);
	}

	public String summary() {
		return complexity + " [" + steps.stream().map(PlanStep::toString).collect(Collectors.joining(" | "))
				+ "] criteria=" + successCriteria + " fallback=" + fallbackStrategy.describe();
	}
}
