package org.javai.springai.pantry.conversation;

import java.util.Optional;

/**
 * Persistence contract for conversation state, keyed by session id.
 */
public interface ConversationStateStore {

	Optional<ConversationState> load(String sessionId);

	void save(ConversationState state);

	/**
	 * Removes a session explicitly.
	 *
	 * @return true when the session existed
	 */
	boolean evict(String sessionId);
}
