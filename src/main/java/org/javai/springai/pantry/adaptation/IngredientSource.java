package org.javai.springai.pantry.adaptation;

/**
 * Where an adapted recipe's ingredient comes from.
 */
public enum IngredientSource {
	PANTRY,
	TO_BUY,
	SUBSTITUTED
}
