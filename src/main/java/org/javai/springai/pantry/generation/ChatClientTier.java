package org.javai.springai.pantry.generation;

import org.springframework.ai.chat.client.ChatClient;

/**
 * One step of the model fallback chain: a chat client and how many times to try it.
 *
 * <p>{@link SpringAiTextGeneration} makes up to {@code maxAttempts} calls to this client before
 * moving on to the next tier.</p>
 *
 * @param chatClient the Spring AI ChatClient
 * @param maxAttempts attempts before falling through to the next tier (at least 1)
 * @param modelId optional label for logs and metrics, e.g. "gpt-4.1-mini"
 */
public record ChatClientTier(
		ChatClient chatClient,
		int maxAttempts,
		String modelId
) {

	public ChatClientTier {
		if (chatClient == null) {
			throw new IllegalArgumentException("chatClient must not be null");
		}
		if (maxAttempts < 1) {
			throw new IllegalArgumentException("maxAttempts must be >= 1");
		}
	}

	public ChatClientTier(ChatClient chatClient, String modelId) {
		this(chatClient, 1, modelId);
	}
}
