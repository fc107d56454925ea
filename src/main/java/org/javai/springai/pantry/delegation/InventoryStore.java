package org.javai.springai.pantry.delegation;

import java.util.List;
import org.javai.springai.pantry.model.InventoryDelta;
import org.javai.springai.pantry.model.InventoryDeltaException;
import org.javai.springai.pantry.model.PantryItem;

/**
 * Storage for a session's pantry.
 */
public interface InventoryStore {

	List<PantryItem> getInventory(String sessionId);

	/**
	 * Applies all deltas or none.
	 *
	 * @return the pantry after the change
	 * @throws InventoryDeltaException when a delta would take a quantity below zero or uses the wrong unit
	 */
	List<PantryItem> applyDeltas(String sessionId, List<InventoryDelta> deltas);
}
