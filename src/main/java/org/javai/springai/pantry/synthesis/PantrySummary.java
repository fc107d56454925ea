package org.javai.springai.pantry.synthesis;

import java.time.LocalDate;
import java.util.Comparator;
import java.util.List;
import org.javai.springai.pantry.model.PantryItem;

/**
 * The pantry as shown to the household.
 *
 * @param items every item, sorted by name
 * @param expiringSoon items expiring within the urgency window, soonest first
 * @param expired items past their expiration date
 */
public record PantrySummary(List<PantryItem> items, List<PantryItem> expiringSoon, List<PantryItem> expired) {

	public PantrySummary {
		items = items != null ? List.copyOf(items) : List.of();
		expiringSoon = expiringSoon != null ? List.copyOf(expiringSoon) : List.of();
		expired = expired != null ? List.copyOf(expired) : List.of();
	}

	public static PantrySummary of(List<PantryItem> pantry, LocalDate today, int urgencyWindowDays) {
		List<PantryItem> sorted = pantry.stream().sorted(Comparator.comparing(PantryItem::name)).toList();
		Comparator<PantryItem> soonestFirst = Comparator.comparing(PantryItem::expirationDate)
				.thenComparing(PantryItem::name);
		List<PantryItem> expiring = sorted.stream()
				.filter(PantryItem::isAvailable)
				.filter(item -> item.daysUntilExpiry(today).map(d -> d >= 0 && d <= urgencyWindowDays).orElse(false))
				.sorted(soonestFirst)
				.toList();
		List<PantryItem> expired = sorted.stream()
				.filter(item -> item.daysUntilExpiry(today).map(d -> d < 0).orElse(false))
				.sorted(soonestFirst)
				.toList();
		return new PantrySummary(sorted, expiring, expired);
	}
}
