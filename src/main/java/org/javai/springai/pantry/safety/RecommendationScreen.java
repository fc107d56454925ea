package org.javai.springai.pantry.safety;

import java.util.List;
import java.util.Map;
import org.javai.springai.pantry.model.RankedRecommendation;

/**
 * Outcome of screening a ranked list: what may be shown, and what was withheld and why.
 *
 * @param approved recommendations safe to show, in their original order
 * @param withheld recipe ids that were withheld, mapped to their violations
 */
public record RecommendationScreen(
		List<RankedRecommendation> approved,
		Map<String, List<ConstraintViolation>> withheld
) {

	public RecommendationScreen {
		approved = approved != null ? List.copyOf(approved) : List.of();
		withheld = withheld != null ? Map.copyOf(withheld) : Map.of();
	}

	public List<ConstraintViolation> allViolations() {
		return withheld.keySet().stream()
				.sorted()
				.flatMap(id -> withheld.get(id).stream())
				.toList();
	}

	public boolean anyWithheld() {
		return !withheld.isEmpty();
	}
}
