package org.javai.springai.pantry.delegation;

/**
 * Why a delegated call produced no value.
 */
public enum FailureKind {
	/** The call exceeded its collaborator's timeout. */
	TIMEOUT,
	/** The collaborator threw. */
	COLLABORATOR_ERROR,
	/** Model output did not match the expected schema. */
	SCHEMA_INVALID,
	/** The collaborator refused the request, e.g. an inventory delta below zero. */
	REJECTED,
	/** No collaborator of this kind is configured. */
	UNAVAILABLE,
	/** The turn was superseded or interrupted. */
	CANCELLED;

	/**
	 * Whether the orchestrator should treat this like an unavailable collaborator and fall back.
	 */
	public boolean isUnavailability() {
		return this != REJECTED && this != CANCELLED;
	}
}
