package org.javai.springai.pantry.safety;

import java.util.List;

/**
 * Result of re-validating one recipe before it is shown.
 *
 * @param passed true when no violation was found
 * @param violations itemized violations, empty when passed
 */
public record GateVerdict(boolean passed, List<ConstraintViolation> violations) {

	public GateVerdict {
		violations = violations != null ? List.copyOf(violations) : List.of();
		if (passed && !violations.isEmpty()) {
			throw new IllegalArgumentException("a passing verdict cannot carry violations");
		}
	}

	public static GateVerdict of(List<ConstraintViolation> violations) {
		return new GateVerdict(violations == null || violations.isEmpty(), violations);
	}
}
