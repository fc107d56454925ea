package org.javai.springai.pantry.safety;

/**
 * Whether a recipe satisfies a dietary restriction.
 */
public enum DietCompliance {
	/** Recipe data asserts compliance and no ingredient contradicts it. */
	COMPLIES,
	/** Nothing contradicts the restriction, but nothing confirms it either. */
	UNVERIFIED,
	/** An ingredient or tag contradicts the restriction. */
	VIOLATES;

	public DietCompliance worse(DietCompliance other) {
		return other.ordinal() > ordinal() ? other : this;
	}
}
