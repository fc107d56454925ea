package org.javai.springai.pantry.inventory;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import org.javai.springai.pantry.delegation.InventoryStore;
import org.javai.springai.pantry.model.InventoryDelta;
import org.javai.springai.pantry.model.PantryItem;

/**
 * Simple in-memory inventory, intended for tests and local use.
 */
public class InMemoryInventoryStore implements InventoryStore {

	private final Map<String, List<PantryItem>> pantries = new ConcurrentHashMap<>();

	@Override
	public List<PantryItem> getInventory(String sessionId) {
		return pantries.getOrDefault(sessionId, List.of());
	}

	@Override
	public List<PantryItem> applyDeltas(String sessionId, List<InventoryDelta> deltas) {
		return pantries.compute(sessionId, (id, current) ->
				List.copyOf(PantryLedger.apply(current != null ? current : List.of(), deltas)));
	}

	/**
	 * Replaces a session's pantry, e.g. to seed a test.
	 */
	public void put(String sessionId, List<PantryItem> items) {
		pantries.put(sessionId, List.copyOf(items));
	}
}
