package org.javai.springai.pantry.inventory;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.javai.springai.pantry.delegation.InventoryStore;
import org.javai.springai.pantry.model.InventoryDelta;
import org.javai.springai.pantry.model.PantryItem;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Inventory kept in a single JSON file, one array of items per session id.
 *
 * <pre>{@code
 * {
 *   "session-1": [
 *     { "name": "egg", "quantity": 6, "unit": null, "expirationDate": "2026-10-20" }
 *   ]
 * }
 * }</pre>
 *
 * <p>The whole file is rewritten on every change (written to a temporary file, then moved into
 * place). Access is serialized on the store instance.</p>
 */
public class JsonFileInventoryStore implements InventoryStore {

	private static final Logger logger = LoggerFactory.getLogger(JsonFileInventoryStore.class);

	private final Path file;
	private final ObjectMapper mapper;

	public JsonFileInventoryStore(Path file) {
		this.file = file;
		this.mapper = new ObjectMapper()
				.registerModule(new JavaTimeModule())
				.configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false)
				.enable(SerializationFeature.INDENT_OUTPUT);
	}

	@Override
	public synchronized List<PantryItem> getInventory(String sessionId) {
		return readAll().getOrDefault(sessionId, List.of());
	}

	@Override
	public synchronized List<PantryItem> applyDeltas(String sessionId, List<InventoryDelta> deltas) {
		Map<String, List<PantryItem>> all = readAll();
		List<PantryItem> updated = PantryLedger.apply(all.getOrDefault(sessionId, List.of()), deltas);
		all.put(sessionId, updated);
		writeAll(all);
		return List.copyOf(updated);
	}

	private Map<String, List<PantryItem>> readAll() {
		Map<String, List<PantryItem>> result = new LinkedHashMap<>();
		if (!Files.exists(file)) {
			return result;
		}
		try {
			JsonNode root = mapper.readTree(file.toFile());
			if (root == null || !root.isObject()) {
				return result;
			}
			Iterator<Map.Entry<String, JsonNode>> sessions = root.fields();
			while (sessions.hasNext()) {
				Map.Entry<String, JsonNode> session = sessions.next();
				List<PantryItem> items = new ArrayList<>();
				for (JsonNode itemNode : session.getValue()) {
					items.add(itemFromJson(itemNode));
				}
				result.put(session.getKey(), items);
			}
			return result;
		}
		catch (IOException e) {
			throw new UncheckedIOException("Failed to read inventory file " + file, e);
		}
	}

	private void writeAll(Map<String, List<PantryItem>> all) {
		ObjectNode root = mapper.createObjectNode();
		all.forEach((sessionId, items) -> {
			ArrayNode array = root.putArray(sessionId);
			items.forEach(item -> array.add(itemToJson(item)));
		});
		try {
			Path parent = file.toAbsolutePath().getParent();
			if (parent != null) {
				Files.createDirectories(parent);
			}
			Path temp = Files.createTempFile(parent, "inventory", ".json");
			mapper.writeValue(temp.toFile(), root);
			Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING);
			logger.debug("Wrote inventory for {} session(s) to {}", all.size(), file);
		}
		catch (IOException e) {
			throw new UncheckedIOException("Failed to write inventory file " + file, e);
		}
	}

	private ObjectNode itemToJson(PantryItem item) {
		ObjectNode node = mapper.createObjectNode();
		node.put("name", item.name());
		node.put("quantity", item.quantity());
		node.put("unit", item.unit());
		node.set("expirationDate", mapper.valueToTree(item.expirationDate()));
		return node;
	}

	private PantryItem itemFromJson(JsonNode node) {
		JsonNode unit = node.get("unit");
		JsonNode expiration = node.get("expirationDate");
		LocalDate expirationDate = expiration == null || expiration.isNull()
				? null
				: mapper.convertValue(expiration, LocalDate.class);
		return new PantryItem(
				node.path("name").asText(),
				node.path("quantity").asDouble(),
				unit == null || unit.isNull() ? null : unit.asText(),
				expirationDate);
	}
}
