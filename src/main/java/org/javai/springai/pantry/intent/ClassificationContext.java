package org.javai.springai.pantry.intent;

import java.util.Objects;
import org.javai.springai.pantry.conversation.ConversationStage;
import org.javai.springai.pantry.delegation.DispatchScope;
import org.javai.springai.pantry.model.Preferences;

/**
 * Everything a classifier may look at.
 *
 * @param stage persisted stage of the session
 * @param message the raw message
 * @param preferences preferences known before this message
 * @param pendingCount number of recommendations awaiting selection
 * @param scope the turn that model calls made while classifying belong to
 */
public record ClassificationContext(
		ConversationStage stage,
		String message,
		Preferences preferences,
		int pendingCount,
		DispatchScope scope
) {

	public ClassificationContext(ConversationStage stage, String message, Preferences preferences, int pendingCount) {
		this(stage, message, preferences, pendingCount, DispatchScope.NONE);
	}

	public ClassificationContext {
		Objects.requireNonNull(stage, "stage must not be null");
		message = message != null ? message : "";
		preferences = preferences != null ? preferences : Preferences.none();
		scope = scope != null ? scope : DispatchScope.NONE;
		if (pendingCount < 0) {
			throw new IllegalArgumentException("pendingCount must be >= 0");
		}
	}

	public boolean selectionPending() {
		return stage == ConversationStage.AWAITING_SELECTION && pendingCount > 0;
	}
}
