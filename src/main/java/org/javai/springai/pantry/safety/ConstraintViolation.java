package org.javai.springai.pantry.safety;

import java.util.Objects;

/**
 * One itemized reason a recipe may not be shown.
 *
 * @param kind allergen or dietary restriction
 * @param ingredient the offending ingredient name or text fragment
 * @param constraint the allergen or restriction that was violated
 * @param detail where the violation was found
 */
public record ConstraintViolation(Kind kind, String ingredient, String constraint, String detail) {

	public enum Kind {
		ALLERGEN,
		DIET
	}

	public ConstraintViolation {
		Objects.requireNonNull(kind, "kind must not be null");
		Objects.requireNonNull(ingredient, "ingredient must not be null");
		Objects.requireNonNull(constraint, "constraint must not be null");
		detail = detail != null ? detail : "";
	}

	public String describe() {
		String what = kind == Kind.ALLERGEN ? "allergen '" + constraint + "'" : "'" + constraint + "' diet";
		return ingredient + " conflicts with " + what + (detail.isEmpty() ? "" : " (" + detail + ")");
	}
}
