package org.javai.springai.pantry.conversation;

import java.util.List;
import java.util.Objects;
import org.javai.springai.pantry.model.Preferences;
import org.javai.springai.pantry.model.RankedRecommendation;
import org.javai.springai.pantry.planning.TaskPlan;

/**
 * Immutable state of one session. Only the {@link ConversationManager} produces new instances;
 * each committed turn replaces the stored state as a whole.
 *
 * @param sessionId the session
 * @param stage resting stage
 * @param preferences accumulated preferences
 * @param pantrySnapshot last pantry seen, or null before the first read
 * @param pendingCandidates recommendations awaiting selection (at most three)
 * @param lastPlan plan of the last committed turn, for audit
 */
public record ConversationState(
		String sessionId,
		ConversationStage stage,
		Preferences preferences,
		PantrySnapshot pantrySnapshot,
		List<RankedRecommendation> pendingCandidates,
		TaskPlan lastPlan
) {

	public static final int MAX_PENDING = 3;

	public ConversationState {
		Objects.requireNonNull(sessionId, "sessionId must not be null");
		stage = stage != null ? stage : ConversationStage.INITIAL;
		preferences = preferences != null ? preferences : Preferences.none();
		pendingCandidates = pendingCandidates != null ? List.copyOf(pendingCandidates) : List.of();
	}

	public static ConversationState initial(String sessionId) {
		return new ConversationState(sessionId, ConversationStage.INITIAL, Preferences.none(), null, List.of(), null);
	}

	public boolean hasPendingCandidates() {
		return !pendingCandidates.isEmpty();
	}

	public ConversationState withStage(ConversationStage newStage) {
		return new ConversationState(sessionId, newStage, preferences, pantrySnapshot, pendingCandidates, lastPlan);
	}

	public ConversationState withPreferences(Preferences newPreferences) {
		return new ConversationState(sessionId, stage, newPreferences, pantrySnapshot, pendingCandidates, lastPlan);
	}

	public ConversationState withPantrySnapshot(PantrySnapshot snapshot) {
		return new ConversationState(sessionId, stage, preferences, snapshot, pendingCandidates, lastPlan);
	}

	public ConversationState withPendingCandidates(List<RankedRecommendation> candidates) {
		return new ConversationState(sessionId, stage, preferences, pantrySnapshot, candidates, lastPlan);
	}

	public ConversationState withLastPlan(TaskPlan plan) {
		return new ConversationState(sessionId, stage, preferences, pantrySnapshot, pendingCandidates, plan);
	}

	/**
	 * Ready to collect preferences again, with nothing pending. Preferences and the pantry
	 * snapshot are kept.
	 */
	public ConversationState resetToReady() {
		return new ConversationState(sessionId, ConversationStage.COLLECTING_PREFS, preferences, pantrySnapshot,
				List.of(), lastPlan);
	}
}
