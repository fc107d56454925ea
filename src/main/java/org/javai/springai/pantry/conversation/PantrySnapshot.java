package org.javai.springai.pantry.conversation;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import org.javai.springai.pantry.model.PantryItem;

/**
 * The pantry as last seen by the session, used when the inventory store cannot be reached.
 *
 * @param items pantry items
 * @param fetchedAt when the items were read from or written to the store
 */
public record PantrySnapshot(List<PantryItem> items, Instant fetchedAt) {

	public PantrySnapshot {
		items = items != null ? List.copyOf(items) : List.of();
		Objects.requireNonNull(fetchedAt, "fetchedAt must not be null");
	}

	public Duration age(Instant now) {
		return Duration.between(fetchedAt, now);
	}
}
