package org.javai.springai.pantry.conversation;

import java.util.HashSet;
import java.util.Set;
import org.javai.springai.pantry.model.RankedRecommendation;

/**
 * Consistency checks applied to a state loaded from the store.
 */
public final class ConversationStateValidator {

	private ConversationStateValidator() {
	}

	/**
	 * @throws SessionStateCorruptException describing the first inconsistency found
	 */
	public static void validate(ConversationState state) {
		String sessionId = state.sessionId();
		if (!state.stage().isResting()) {
			throw new SessionStateCorruptException(sessionId, "Session persisted mid-turn in stage " + state.stage());
		}
		int pending = state.pendingCandidates().size();
		if (pending > ConversationState.MAX_PENDING) {
			throw new SessionStateCorruptException(sessionId, pending + " pending candidates exceed the maximum");
		}
		if (state.stage() == ConversationStage.AWAITING_SELECTION && pending == 0) {
			throw new SessionStateCorruptException(sessionId, "Awaiting a selection with no pending candidates");
		}
		if (state.stage() != ConversationStage.AWAITING_SELECTION && pending > 0) {
			throw new SessionStateCorruptException(sessionId, "Pending candidates outside AWAITING_SELECTION");
		}
		Set<String> ids = new HashSet<>();
		for (RankedRecommendation candidate : state.pendingCandidates()) {
			if (!ids.add(candidate.recipeId())) {
				throw new SessionStateCorruptException(sessionId, "Duplicate pending candidate " + candidate.recipeId());
			}
		}
	}
}
