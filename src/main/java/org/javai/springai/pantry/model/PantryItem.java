package org.javai.springai.pantry.model;

import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.Locale;
import java.util.Optional;

/**
 * One ingredient the household has on hand.
 *
 * @param name normalized ingredient name, unique within a session's pantry
 * @param quantity amount on hand (never negative)
 * @param unit optional unit ("g", "cloves", ...), null when the quantity is a count
 * @param expirationDate optional expiration date
 */
public record PantryItem(
		String name,
		double quantity,
		String unit,
		LocalDate expirationDate
) {

	public PantryItem {
		name = IngredientNames.normalize(name);
		if (name.isEmpty()) {
			throw new IllegalArgumentException("name must not be blank");
		}
		if (quantity < 0 || Double.isNaN(quantity)) {
			throw new IllegalArgumentException("quantity must be >= 0 for " + name);
		}
		unit = unit == null || unit.isBlank() ? null : unit.trim().toLowerCase(Locale.ROOT);
	}

	public PantryItem(String name, double quantity) {
		this(name, quantity, null, null);
	}

	public PantryItem(String name, double quantity, String unit) {
		this(name, quantity, unit, null);
	}

	public boolean isAvailable() {
		return quantity > 0;
	}

	/**
	 * Days until expiration relative to {@code today}; negative once expired, empty when
	 * no expiration date is known.
	 */
	public Optional<Long> daysUntilExpiry(LocalDate today) {
		if (expirationDate == null) {
			return Optional.empty();
		}
		return Optional.of(ChronoUnit.DAYS.between(today, expirationDate));
	}

	public PantryItem withQuantity(double newQuantity) {
		return new PantryItem(name, newQuantity, unit, expirationDate);
	}
}
