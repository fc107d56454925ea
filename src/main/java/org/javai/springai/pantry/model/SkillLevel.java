package org.javai.springai.pantry.model;

import java.util.Locale;
import java.util.Optional;

/**
 * Cooking skill of the household, used to pitch adapted instructions.
 */
public enum SkillLevel {
	BEGINNER,
	INTERMEDIATE,
	ADVANCED;

	/**
	 * Lenient parse for model or user supplied text ("Beginner", "advanced cook").
	 */
	public static Optional<SkillLevel> parse(String text) {
		if (text == null || text.isBlank()) {
			return Optional.empty();
		}
		String lower = text.toLowerCase(Locale.ROOT);
		for (SkillLevel level : values()) {
			if (lower.contains(level.name().toLowerCase(Locale.ROOT))) {
				return Optional.of(level);
			}
		}
		if (lower.contains("novice") || lower.contains("new to cooking")) {
			return Optional.of(BEGINNER);
		}
		if (lower.contains("experienced") || lower.contains("expert")) {
			return Optional.of(ADVANCED);
		}
		return Optional.empty();
	}
}
