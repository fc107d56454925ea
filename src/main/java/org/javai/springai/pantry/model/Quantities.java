package org.javai.springai.pantry.model;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Formatting for quantities shown to the household.
 */
public final class Quantities {

	private Quantities() {
	}

	/**
	 * Renders whole numbers without a fractional part and everything else with at most two
	 * decimals: {@code 2.0 -> "2"}, {@code 0.333 -> "0.33"}.
	 */
	public static String format(double value) {
		if (value == Math.rint(value) && !Double.isInfinite(value)) {
			return Long.toString((long) value);
		}
		return BigDecimal.valueOf(value).setScale(2, RoundingMode.HALF_UP)
				.stripTrailingZeros().toPlainString();
	}
}
