package org.javai.springai.pantry.planning;

import java.util.function.Predicate;

/**
 * A condition a plan expects the turn to meet.
 */
public enum SuccessCriterion {
	MUTATION_APPLIED("inventory mutation applied", TurnEvidence::mutationApplied),
	ANSWER_PRODUCED("answer produced", TurnEvidence::answerProduced),
	AT_LEAST_ONE_SAFE_CANDIDATE("at least one candidate satisfies all hard filters", e -> e.safeCandidates() > 0),
	TOP_THREE_DISTINCT("at most three recommendations with distinct ids",
			e -> e.candidatesDistinct() && e.safeCandidates() <= 3),
	ADAPTED_RECIPE_PASSES_GATE("adapted recipe passes the quality gate", TurnEvidence::adaptedRecipePassed);

	private final String description;
	private final Predicate<TurnEvidence> check;

	SuccessCriterion(String description, Predicate<TurnEvidence> check) {
		this.description = description;
		this.check = check;
	}

	public String description() {
		return description;
	}

	public boolean isMetBy(TurnEvidence evidence) {
		return check.test(evidence);
	}
}
