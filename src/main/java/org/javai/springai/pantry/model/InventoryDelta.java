package org.javai.springai.pantry.model;

import java.util.Locale;

/**
 * A signed quantity change for one pantry ingredient, e.g. {@code chicken breast +2} or
 * {@code egg -1}.
 *
 * @param name normalized ingredient name
 * @param amount signed change (never zero)
 * @param unit optional unit; must agree with the stored item's unit when both are present
 */
public record InventoryDelta(String name, double amount, String unit) {

	public InventoryDelta {
		name = IngredientNames.normalize(name);
		if (name.isEmpty()) {
			throw new IllegalArgumentException("name must not be blank");
		}
		if (amount == 0 || Double.isNaN(amount)) {
			throw new IllegalArgumentException("amount must be non-zero for " + name);
		}
		unit = unit == null || unit.isBlank() ? null : unit.trim().toLowerCase(Locale.ROOT);
	}

	public InventoryDelta(String name, double amount) {
		this(name, amount, null);
	}

	public boolean isAddition() {
		return amount > 0;
	}

	@Override
	public String toString() {
		String signed = (amount > 0 ? "+" : "") + Quantities.format(amount);
		return name + ":" + signed + (unit != null ? " " + unit : "");
	}
}
