package org.javai.springai.pantry.generation;

import java.util.List;

/**
 * Telemetry for one {@link SpringAiTextGeneration#complete} call across all tiers.
 *
 * @param schemaName schema the caller asked for
 * @param successfulModelId model that produced the accepted answer, null when every attempt failed
 * @param attempts every attempt, in order
 */
public record GenerationMetrics(
		String schemaName,
		String successfulModelId,
		List<GenerationAttempt> attempts
) {

	public GenerationMetrics {
		attempts = attempts != null ? List.copyOf(attempts) : List.of();
	}

	public int totalAttempts() {
		return attempts.size();
	}

	public boolean succeeded() {
		return attempts.stream().anyMatch(GenerationAttempt::isSuccess);
	}

	public int tiersAttempted() {
		return (int) attempts.stream()
				.mapToInt(GenerationAttempt::tierIndex)
				.distinct()
				.count();
	}

	public GenerationAttempt finalAttempt() {
		return attempts.isEmpty() ? null : attempts.get(attempts.size() - 1);
	}
}
