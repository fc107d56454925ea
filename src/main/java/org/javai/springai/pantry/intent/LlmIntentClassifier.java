package org.javai.springai.pantry.intent;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import org.javai.springai.pantry.delegation.DelegationRequest;
import org.javai.springai.pantry.delegation.DelegationResult;
import org.javai.springai.pantry.delegation.DelegationRouter;
import org.javai.springai.pantry.delegation.ExpectedSchema;
import org.javai.springai.pantry.delegation.ExpectedSchema.FieldType;
import org.javai.springai.pantry.intent.IntentClassification.Source;
import org.javai.springai.pantry.model.InventoryDelta;
import org.javai.springai.pantry.model.PreferenceDelta;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Classifies a message with the text-generation capability.
 *
 * <p>The model answers with JSON; an answer that fails the schema, names an unknown intent or
 * reports a confidence below the threshold yields no classification. Preference extraction stays
 * rule-based so that allergies never depend on a model.</p>
 */
public class LlmIntentClassifier implements IntentClassifier {

	private static final Logger logger = LoggerFactory.getLogger(LlmIntentClassifier.class);

	public static final double DEFAULT_CONFIDENCE_THRESHOLD = 0.55;

	static final ExpectedSchema SCHEMA = ExpectedSchema.named("intent_classification")
			.required("intent", FieldType.STRING)
			.required("confidence", FieldType.NUMBER)
			.optional("deltas", FieldType.ARRAY)
			.optional("also_search", FieldType.BOOLEAN)
			.optional("query", FieldType.STRING)
			.optional("index", FieldType.INTEGER)
			.optional("clarifying_question", FieldType.STRING);

	private final DelegationRouter router;
	private final PreferenceExtractor preferenceExtractor;
	private final double confidenceThreshold;

	public LlmIntentClassifier(DelegationRouter router) {
		this(router, new PreferenceExtractor(), DEFAULT_CONFIDENCE_THRESHOLD);
	}

	public LlmIntentClassifier(DelegationRouter router, PreferenceExtractor preferenceExtractor,
			double confidenceThreshold) {
		this.router = router;
		this.preferenceExtractor = preferenceExtractor;
		this.confidenceThreshold = confidenceThreshold;
	}

	@Override
	public Optional<IntentClassification> classify(ClassificationContext context) {
		DelegationResult<JsonNode> result = router.call(new DelegationRequest.CompleteText(prompt(context), SCHEMA),
				context.scope());
		if (!(result instanceof DelegationResult.Success<JsonNode> success)) {
			logger.debug("Model classification unavailable: {}", result);
			return Optional.empty();
		}
		JsonNode answer = success.value();
		double confidence = answer.get("confidence").asDouble();
		if (confidence < confidenceThreshold || confidence > 1.0) {
			logger.debug("Model classification below threshold: {} < {}", confidence, confidenceThreshold);
			return Optional.empty();
		}
		PreferenceDelta delta = preferenceExtractor.extract(context.message(), context.preferences());
		try {
			List<Intent> intents = toIntents(answer, context);
			if (intents.isEmpty()) {
				return Optional.empty();
			}
			return Optional.of(new IntentClassification(intents, delta, confidence, Source.MODEL));
		}
		catch (IllegalArgumentException e) {
			logger.warn("Discarding model classification: {}", e.getMessage());
			return Optional.empty();
		}
	}

	private static List<Intent> toIntents(JsonNode answer, ClassificationContext context) {
		String intent = answer.get("intent").asText().toLowerCase(Locale.ROOT);
		List<Intent> intents = new ArrayList<>();
		switch (intent) {
			case "mutate_pantry" -> {
				intents.add(new Intent.MutatePantry(deltas(answer.get("deltas"))));
				if (answer.path("also_search").asBoolean(false)) {
					intents.add(new Intent.SearchRecipes(answer.path("query").asText(context.message())));
				}
			}
			case "search_recipes" -> intents.add(new Intent.SearchRecipes(answer.path("query").asText(context.message())));
			case "select_recommendation" -> intents.add(
					RuleBasedIntentClassifier.validateSelection(answer.path("index").asInt(0), context));
			case "general_query" -> intents.add(new Intent.GeneralQuery(context.message(), false));
			case "ambiguous" -> intents.add(new Intent.Ambiguous("model could not decide",
					answer.path("clarifying_question").asText("Could you say a little more about what you need?")));
			default -> logger.warn("Model returned unknown intent '{}'", intent);
		}
		return intents;
	}

	private static List<InventoryDelta> deltas(JsonNode node) {
		List<InventoryDelta> deltas = new ArrayList<>();
		if (node == null || !node.isArray()) {
			return deltas;
		}
		for (JsonNode entry : node) {
			String name = entry.path("name").asText("");
			double amount = entry.path("amount").asDouble(0);
			String unit = entry.hasNonNull("unit") ? entry.get("unit").asText() : null;
			deltas.add(new InventoryDelta(name, amount, unit));
		}
		return deltas;
	}

	private static String prompt(ClassificationContext context) {
		return """
				You classify messages sent to a kitchen pantry assistant.
				Intents: mutate_pantry (the user added or used ingredients; give signed deltas),
				search_recipes (the user wants recipe ideas), select_recommendation (the user picks one of
				%d pending options by 1-based index), general_query (any other cooking question), ambiguous.
				If a message both changes the pantry and asks for recipes, answer mutate_pantry with also_search true.
				Conversation stage: %s
				Message: %s
				Reply with JSON only: %s
				Each delta is {"name": string, "amount": number, "unit": string or null}.
				""".formatted(context.pendingCount(), context.stage(), context.message(), SCHEMA.describe());
	}
}
