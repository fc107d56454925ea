package org.javai.springai.pantry.planning;

/**
 * How much explicit planning a turn receives.
 */
public enum Complexity {
	SIMPLE,
	MEDIUM,
	COMPLEX
}
