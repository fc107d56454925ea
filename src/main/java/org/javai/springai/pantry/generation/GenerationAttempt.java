package org.javai.springai.pantry.generation;

/**
 * Record of one model call, kept for observability.
 *
 * @param modelId label of the tier's model (may be null)
 * @param tierIndex 0-based tier index
 * @param attemptWithinTier 1-based attempt number within the tier
 * @param outcome how the call ended
 * @param durationMillis wall time of the call
 * @param errorDetails failure description, null on success
 */
public record GenerationAttempt(
		String modelId,
		int tierIndex,
		int attemptWithinTier,
		AttemptOutcome outcome,
		long durationMillis,
		String errorDetails
) {

	public GenerationAttempt {
		if (tierIndex < 0) {
			throw new IllegalArgumentException("tierIndex must be >= 0");
		}
		if (attemptWithinTier < 1) {
			throw new IllegalArgumentException("attemptWithinTier must be >= 1");
		}
		if (outcome == null) {
			throw new IllegalArgumentException("outcome must not be null");
		}
		if (durationMillis < 0) {
			throw new IllegalArgumentException("durationMillis must be >= 0");
		}
	}

	public boolean isSuccess() {
		return outcome == AttemptOutcome.SUCCESS;
	}
}
