package org.javai.springai.pantry.model;

/**
 * Raised when an inventory delta cannot be applied: the quantity would go below zero, or the
 * delta's unit disagrees with the stored item.
 */
public class InventoryDeltaException extends RuntimeException {

	private final String ingredient;

	public InventoryDeltaException(String ingredient, String message) {
		super(message);
		this.ingredient = ingredient;
	}

	public String ingredient() {
		return ingredient;
	}
}
