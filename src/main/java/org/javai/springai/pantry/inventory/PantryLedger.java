package org.javai.springai.pantry.inventory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.javai.springai.pantry.model.InventoryDelta;
import org.javai.springai.pantry.model.InventoryDeltaException;
import org.javai.springai.pantry.model.PantryItem;
import org.javai.springai.pantry.model.Quantities;

/**
 * Applies signed deltas to a pantry. Shared by the store implementations.
 *
 * <p>Deltas are applied to a working copy; the first delta that cannot be applied raises
 * {@link InventoryDeltaException} and the input is left untouched. An item whose quantity
 * reaches exactly zero is removed.</p>
 */
public final class PantryLedger {

	private PantryLedger() {
	}

	/**
	 * @param current the pantry before the change
	 * @param deltas changes, applied in order
	 * @return the pantry after every delta, in name order of first appearance
	 * @throws InventoryDeltaException when a quantity would go below zero, an item to remove is
	 * unknown, or units disagree
	 */
	public static List<PantryItem> apply(List<PantryItem> current, List<InventoryDelta> deltas) {
		Objects.requireNonNull(current, "current must not be null");
		Map<String, PantryItem> working = new LinkedHashMap<>();
		for (PantryItem item : current) {
			working.put(item.name(), item);
		}
		if (deltas != null) {
			for (InventoryDelta delta : deltas) {
				applyOne(working, delta);
			}
		}
		return new ArrayList<>(working.values());
	}

	private static void applyOne(Map<String, PantryItem> working, InventoryDelta delta) {
		PantryItem existing = working.get(delta.name());
		if (existing == null) {
			if (!delta.isAddition()) {
				throw new InventoryDeltaException(delta.name(),
						"Cannot remove " + Quantities.format(-delta.amount()) + " " + delta.name() + ": none in the pantry");
			}
			working.put(delta.name(), new PantryItem(delta.name(), delta.amount(), delta.unit()));
			return;
		}
		if (delta.unit() != null && existing.unit() != null && !delta.unit().equals(existing.unit())) {
			throw new InventoryDeltaException(delta.name(),
					"Unit mismatch for " + delta.name() + ": pantry uses " + existing.unit() + ", change uses " + delta.unit());
		}
		double updated = existing.quantity() + delta.amount();
		if (updated < 0) {
			throw new InventoryDeltaException(delta.name(),
					"Cannot remove " + Quantities.format(-delta.amount()) + " " + delta.name() + ": only "
							+ Quantities.format(existing.quantity()) + " in the pantry");
		}
		if (updated == 0) {
			working.remove(delta.name());
			return;
		}
		String unit = existing.unit() != null ? existing.unit() : delta.unit();
		working.put(delta.name(), new PantryItem(existing.name(), updated, unit, existing.expirationDate()));
	}
}
