package org.javai.springai.pantry.conversation;

/**
 * Stages of a conversation turn.
 *
 * <p>{@link #INITIAL} and {@link #DONE} bracket a turn. Between turns a session rests in
 * {@link #COLLECTING_PREFS} or {@link #AWAITING_SELECTION}.</p>
 */
public enum ConversationStage {
	INITIAL,
	COLLECTING_PREFS,
	PANTRY_OP,
	SEARCHING,
	GENERAL,
	PRESENTING_OPTIONS,
	AWAITING_SELECTION,
	ADAPTING,
	DONE,
	ERROR;

	/**
	 * Whether a session may be persisted in this stage.
	 */
	public boolean isResting() {
		return this == INITIAL || this == COLLECTING_PREFS || this == AWAITING_SELECTION;
	}
}
