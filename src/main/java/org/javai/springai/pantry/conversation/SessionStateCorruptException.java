package org.javai.springai.pantry.conversation;

/**
 * Raised when a session's state is inconsistent or a turn attempts a transition the stage
 * machine does not allow. The session is reset to {@link ConversationStage#COLLECTING_PREFS}
 * with its preferences kept.
 */
public class SessionStateCorruptException extends RuntimeException {

	private final String sessionId;

	public SessionStateCorruptException(String sessionId, String message) {
		super(message);
		this.sessionId = sessionId;
	}

	public String sessionId() {
		return sessionId;
	}
}
