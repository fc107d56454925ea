package org.javai.springai.pantry.delegation;

import java.util.Objects;

/**
 * Audit entry for one dispatch.
 *
 * @param collaborator who was called
 * @param request short description of the request
 * @param failureKind null on success
 * @param durationMillis wall time from submission to completion
 * @param detail failure detail, empty on success
 */
public record DelegationRecord(
		Collaborator collaborator,
		String request,
		FailureKind failureKind,
		long durationMillis,
		String detail
) {

	public DelegationRecord {
		Objects.requireNonNull(collaborator, "collaborator must not be null");
		if (durationMillis < 0) {
			throw new IllegalArgumentException("durationMillis must be >= 0");
		}
		detail = detail != null ? detail : "";
	}

	public boolean isSuccess() {
		return failureKind == null;
	}
}
