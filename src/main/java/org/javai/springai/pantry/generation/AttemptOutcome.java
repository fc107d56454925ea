package org.javai.springai.pantry.generation;

/**
 * How a single model call ended.
 */
public enum AttemptOutcome {
	/** JSON was extracted and matched the expected schema. */
	SUCCESS,

	/** JSON was extracted but did not match the expected schema. */
	SCHEMA_MISMATCH,

	/** No JSON object could be extracted from the response. */
	PARSE_FAILED,

	/** The call itself failed (network, quota, provider error). */
	CALL_FAILED
}
