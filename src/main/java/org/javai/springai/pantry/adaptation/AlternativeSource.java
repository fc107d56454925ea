package org.javai.springai.pantry.adaptation;

import java.util.List;

/**
 * Supplies substitution candidates for an ingredient, best first. Results are not yet checked
 * against the household's constraints.
 */
@FunctionalInterface
public interface AlternativeSource {

	AlternativeSource NONE = ingredient -> List.of();

	List<String> alternativesFor(String ingredient);
}
