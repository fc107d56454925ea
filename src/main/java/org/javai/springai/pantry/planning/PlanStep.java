package org.javai.springai.pantry.planning;

import java.util.Objects;

/**
 * @param actor who performs the step
 * @param action what the step does, in words
 */
public record PlanStep(PlanActor actor, String action) {

	public PlanStep {
		Objects.requireNonNull(actor, "actor must not be null");
		Objects.requireNonNull(action, "action must not be null");
	}

	@Override
	public String toString() {
		return actor + ": " + action;
	}
}
