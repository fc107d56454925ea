package org.javai.springai.pantry.model;

import java.util.Locale;

/**
 * Canonical spelling for dietary restriction labels ("Gluten Free" becomes {@code gluten-free}).
 */
public final class DietaryRestrictions {

	private DietaryRestrictions() {
	}

	public static String canonical(String raw) {
		if (raw == null) {
			return "";
		}
		return raw.toLowerCase(Locale.ROOT).trim().replaceAll("[\\s_]+", "-");
	}
}
