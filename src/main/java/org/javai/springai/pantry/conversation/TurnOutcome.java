package org.javai.springai.pantry.conversation;

/**
 * How a turn ended.
 */
public enum TurnOutcome {
	/** The turn did what was asked. */
	OK,
	/** The message was ambiguous or named an invalid selection; a clarifying question was asked. */
	CLARIFICATION_NEEDED,
	/** Nothing safe qualified even after relaxation; a shopping list is offered. */
	NO_SAFE_MATCH,
	/** The adapted recipe failed the quality gate and was not returned. */
	CONSTRAINT_VIOLATION,
	/** A collaborator failed and no fallback covered it. */
	DEGRADED,
	/** A newer message for the same session replaced this turn; nothing was committed. */
	SUPERSEDED,
	/** The session state was inconsistent and was reset, keeping preferences. */
	SESSION_RESET,
	/** Unexpected failure; nothing was committed. */
	ERROR
}
