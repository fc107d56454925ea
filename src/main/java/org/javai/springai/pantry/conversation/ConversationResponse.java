package org.javai.springai.pantry.conversation;

import java.util.Objects;
import org.javai.springai.pantry.model.Preferences;
import org.javai.springai.pantry.synthesis.StructuredPayload;

/**
 * Result of one turn. The payload is the contract; the explanation text is derived from it.
 *
 * @param stage the session's stage after the turn
 * @param payload structured result
 * @param explanationText human-readable explanation
 * @param updatedPreferences the session's preferences after the turn
 * @param outcome how the turn ended
 */
public record ConversationResponse(
		ConversationStage stage,
		StructuredPayload payload,
		String explanationText,
		Preferences updatedPreferences,
		TurnOutcome outcome
) {

	public ConversationResponse {
		Objects.requireNonNull(stage, "stage must not be null");
		payload = payload != null ? payload : StructuredPayload.empty();
		explanationText = explanationText != null ? explanationText : "";
		updatedPreferences = updatedPreferences != null ? updatedPreferences : Preferences.none();
		Objects.requireNonNull(outcome, "outcome must not be null");
	}

	public boolean isCommitted() {
		return outcome != TurnOutcome.SUPERSEDED && outcome != TurnOutcome.ERROR;
	}
}
