package org.javai.springai.pantry.planning;

/**
 * What a turn actually achieved, collected by the orchestrator for evaluating the plan.
 *
 * @param mutationApplied the pantry change was committed by the inventory store
 * @param answerProduced a text answer or acknowledgement was produced
 * @param safeCandidates recommendations that passed every hard filter and the quality gate
 * @param candidatesDistinct the presented recommendations have distinct recipe ids
 * @param adaptedRecipePassed an adapted recipe passed the quality gate
 */
public record TurnEvidence(
		boolean mutationApplied,
		boolean answerProduced,
		int safeCandidates,
		boolean candidatesDistinct,
		boolean adaptedRecipePassed
) {

	public static TurnEvidence none() {
		return new TurnEvidence(false, false, 0, true, false);
	}

	public TurnEvidence withMutationApplied() {
		return new TurnEvidence(true, answerProduced, safeCandidates, candidatesDistinct, adaptedRecipePassed);
	}

	public TurnEvidence withAnswerProduced() {
		return new TurnEvidence(mutationApplied, true, safeCandidates, candidatesDistinct, adaptedRecipePassed);
	}

	public TurnEvidence withCandidates(int count, boolean distinct) {
		return new TurnEvidence(mutationApplied, answerProduced, count, distinct, adaptedRecipePassed);
	}

	public TurnEvidence withAdaptedRecipePassed() {
		return new TurnEvidence(mutationApplied, answerProduced, safeCandidates, candidatesDistinct, true);
	}
}
