package org.javai.springai.pantry.adaptation;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.javai.springai.pantry.delegation.DelegationRequest;
import org.javai.springai.pantry.delegation.DelegationResult;
import org.javai.springai.pantry.delegation.DelegationRouter;
import org.javai.springai.pantry.delegation.DispatchScope;
import org.javai.springai.pantry.delegation.ExpectedSchema;
import org.javai.springai.pantry.delegation.ExpectedSchema.FieldType;
import org.javai.springai.pantry.model.IngredientNames;
import org.javai.springai.pantry.model.Preferences;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Looks alternatives up in the substitution catalog, asks the text-generation capability when the
 * catalog has nothing, and answers with no alternatives when neither helps. Answers are memoized
 * for the lifetime of the instance, which is one turn.
 */
public class DelegatedAlternativeSource implements AlternativeSource {

	private static final Logger logger = LoggerFactory.getLogger(DelegatedAlternativeSource.class);

	static final ExpectedSchema SCHEMA = ExpectedSchema.named("substitutions")
			.required("alternatives", FieldType.ARRAY);

	private static final int MAX_SUGGESTIONS = 3;

	private final DelegationRouter router;
	private final DispatchScope scope;
	private final Preferences preferences;
	private final Map<String, List<String>> memo = new HashMap<>();

	public DelegatedAlternativeSource(DelegationRouter router, DispatchScope scope, Preferences preferences) {
		this.router = router;
		this.scope = scope;
		this.preferences = preferences;
	}

	@Override
	public List<String> alternativesFor(String ingredient) {
		return memo.computeIfAbsent(IngredientNames.normalize(ingredient), this::lookup);
	}

	private List<String> lookup(String ingredient) {
		DelegationResult<List<String>> catalog = router.call(new DelegationRequest.LookupSubstitutes(ingredient), scope);
		List<String> fromCatalog = catalog.orElse(List.of());
		if (!fromCatalog.isEmpty()) {
			return fromCatalog;
		}
		DelegationResult<JsonNode> suggested = router.call(
				new DelegationRequest.CompleteText(prompt(ingredient), SCHEMA), scope);
		List<String> result = new ArrayList<>();
		suggested.optional().ifPresent(answer -> {
			for (JsonNode alternative : answer.get("alternatives")) {
				if (alternative.isTextual() && !alternative.asText().isBlank() && result.size() < MAX_SUGGESTIONS) {
					result.add(alternative.asText());
				}
			}
		});
		if (result.isEmpty()) {
			logger.debug("No alternatives known for {}", ingredient);
		}
		return List.copyOf(result);
	}

	private String prompt(String ingredient) {
		return """
				Suggest up to %d common cooking substitutes for "%s".
				Never suggest anything containing: %s. Dietary restrictions: %s.
				Reply with JSON only: %s
				""".formatted(MAX_SUGGESTIONS, ingredient,
				preferences.allergies().isEmpty() ? "none" : String.join(", ", preferences.allergies()),
				preferences.dietaryRestrictions().isEmpty() ? "none" : String.join(", ", preferences.dietaryRestrictions()),
				SCHEMA.describe());
	}
}
