package org.javai.springai.pantry.conversation;

import java.util.Objects;
import org.javai.springai.pantry.model.Preferences;

/**
 * One incoming message.
 *
 * @param sessionId conversation id
 * @param message the household's message
 * @param knownPreferences preferences the caller already knows, merged before classification (may be null)
 * @param targetServings servings to scale an adapted recipe to (may be null)
 */
public record ConversationRequest(
		String sessionId,
		String message,
		Preferences knownPreferences,
		Integer targetServings
) {

	public ConversationRequest {
		Objects.requireNonNull(sessionId, "sessionId must not be null");
		if (sessionId.isBlank()) {
			throw new IllegalArgumentException("sessionId must not be blank");
		}
		message = message != null ? message : "";
		if (targetServings != null && targetServings < 1) {
			throw new IllegalArgumentException("targetServings must be >= 1");
		}
	}

	public ConversationRequest(String sessionId, String message) {
		this(sessionId, message, null, null);
	}
}
