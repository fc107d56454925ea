package org.javai.springai.pantry.planning;

import java.util.ArrayList;
import java.util.List;

/**
 * The relaxations a turn may apply when a step fails, in the order they are tried.
 * Allergies are never relaxed.
 *
 * @param allowMissingRelaxation widen the missing-ingredient allowance once when too few candidates pass
 * @param keywordSearchOnSemanticFailure fall back to keyword matching when semantic search fails
 * @param cachedInventoryOnStoreFailure use the session's cached pantry snapshot when the store fails
 */
public record FallbackStrategy(
		boolean allowMissingRelaxation,
		boolean keywordSearchOnSemanticFailure,
		boolean cachedInventoryOnStoreFailure
) {

	public static FallbackStrategy none() {
		return new FallbackStrategy(false, false, false);
	}

	public static FallbackStrategy forSearch() {
		return new FallbackStrategy(true, true, true);
	}

	public static FallbackStrategy forAdaptation() {
		return new FallbackStrategy(false, false, true);
	}

	public String describe() {
		List<String> parts = new ArrayList<>();
		if (allowMissingRelaxation) {
			parts.add("relax allow-missing once");
		}
		if (keywordSearchOnSemanticFailure) {
			parts.add("keyword-only search");
		}
		if (cachedInventoryOnStoreFailure) {
			parts.add("cached inventory");
		}
		if (parts.isEmpty()) {
			return "none; allergies never relaxed";
		}
		return String.join(" -> ", parts) + "; allergies never relaxed";
	}
}
