package org.javai.springai.pantry.synthesis;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.ArrayList;
import java.util.List;
import org.javai.springai.pantry.adaptation.AdaptedIngredient;
import org.javai.springai.pantry.adaptation.AdaptedRecipe;
import org.javai.springai.pantry.adaptation.IngredientSource;
import org.javai.springai.pantry.delegation.Collaborator;
import org.javai.springai.pantry.delegation.DelegationRequest;
import org.javai.springai.pantry.delegation.DelegationResult;
import org.javai.springai.pantry.delegation.DelegationRouter;
import org.javai.springai.pantry.delegation.DispatchScope;
import org.javai.springai.pantry.delegation.ExpectedSchema;
import org.javai.springai.pantry.delegation.ExpectedSchema.FieldType;
import org.javai.springai.pantry.model.PantryItem;
import org.javai.springai.pantry.model.Preferences;
import org.javai.springai.pantry.model.Quantities;
import org.javai.springai.pantry.model.RankedRecommendation;
import org.javai.springai.pantry.safety.ConstraintViolation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Turns a structured payload into explanation text.
 *
 * <p>The templated explanation is deterministic and always available. When model explanations
 * are enabled, the text-generation capability may rewrite it; that version is advisory and
 * replaces only the text, never the structured fields.</p>
 */
public class ResponseSynthesizer {

	private static final Logger logger = LoggerFactory.getLogger(ResponseSynthesizer.class);

	static final ExpectedSchema SCHEMA = ExpectedSchema.named("explanation")
			.required("explanation", FieldType.STRING);

	private final boolean modelExplanations;

	public ResponseSynthesizer() {
		this(false);
	}

	public ResponseSynthesizer(boolean modelExplanations) {
		this.modelExplanations = modelExplanations;
	}

	/**
	 * Explanation for the payload, using the model only for recipe-bearing payloads and only when
	 * enabled and available.
	 */
	public String explain(StructuredPayload payload, Preferences preferences, DelegationRouter router,
			DispatchScope scope) {
		String templated = explain(payload, preferences);
		if (!modelExplanations || router == null || !payload.isRecipeBearing()
				|| !router.isAvailable(Collaborator.TEXT_GENERATION)) {
			return templated;
		}
		DelegationResult<JsonNode> result = router.call(new DelegationRequest.CompleteText(prompt(templated), SCHEMA), scope);
		String advisory = result.optional().map(node -> node.get("explanation").asText("").trim()).orElse("");
		if (advisory.isEmpty()) {
			logger.debug("Using templated explanation");
			return templated;
		}
		return advisory;
	}

	/**
	 * The deterministic explanation.
	 */
	public String explain(StructuredPayload payload, Preferences preferences) {
		List<String> parts = new ArrayList<>();
		if (payload.textAnswer() != null && !payload.textAnswer().isBlank()) {
			parts.add(payload.textAnswer());
		}
		if (!payload.recommendations().isEmpty()) {
			parts.add(describeRecommendations(payload.recommendations(), preferences));
		}
		if (payload.adaptedRecipe() != null) {
			parts.add(describeAdaptation(payload.adaptedRecipe()));
		}
		else if (!payload.shoppingList().isEmpty()) {
			parts.add("No recipe fits your pantry and constraints right now. Buying "
					+ String.join(", ", payload.shoppingList()) + " would let you make the closest safe options.");
		}
		if (!payload.violations().isEmpty()) {
			List<String> reasons = payload.violations().stream().map(ConstraintViolation::describe).distinct().toList();
			parts.add("I held back a recipe that conflicts with your constraints: " + String.join("; ", reasons) + ".");
		}
		if (payload.pantrySummary() != null && payload.recommendations().isEmpty() && payload.adaptedRecipe() == null) {
			parts.add(describePantry(payload.pantrySummary()));
		}
		parts.addAll(payload.notices());
		return String.join("\n\n", parts);
	}

	private static String describeRecommendations(List<RankedRecommendation> recommendations, Preferences preferences) {
		StringBuilder text = new StringBuilder("Here ")
				.append(recommendations.size() == 1 ? "is 1 recipe" : "are " + recommendations.size() + " recipes")
				.append(" ranked by how well they use your pantry:");
		for (int i = 0; i < recommendations.size(); i++) {
			RankedRecommendation r = recommendations.get(i);
			int total = r.recipe().ingredientSet().size();
			int have = total - r.missingCount();
			text.append("\n").append(i + 1).append(". ").append(r.recipe().title())
					.append(" (score ").append(Quantities.format(r.compositeScore()))
					.append("; you have ").append(have).append(" of ").append(total).append(" ingredients");
			if (!r.missingIngredients().isEmpty()) {
				text.append("; missing ").append(String.join(", ", r.missingIngredients()));
			}
			if (r.usesExpiring()) {
				text.append("; uses soon-to-expire ").append(String.join(", ", r.expiringIngredientsUsed()));
			}
			text.append(")");
		}
		List<String> constraints = new ArrayList<>();
		if (!preferences.allergies().isEmpty()) {
			constraints.add("avoid " + String.join(", ", preferences.allergies().stream().sorted().toList()));
		}
		if (!preferences.dietaryRestrictions().isEmpty()) {
			constraints.add("fit " + String.join(", ", preferences.dietaryRestrictions().stream().sorted().toList()));
		}
		if (!constraints.isEmpty()) {
			text.append("\nAll of them ").append(String.join(" and ", constraints)).append(".");
		}
		text.append("\nReply with a number to pick one.");
		return text.toString();
	}

	private static String describeAdaptation(AdaptedRecipe recipe) {
		StringBuilder text = new StringBuilder(recipe.title())
				.append(" for ").append(recipe.servings()).append(recipe.servings() == 1 ? " serving." : " servings.");
		List<AdaptedIngredient> substitutions = recipe.substitutions();
		if (!substitutions.isEmpty()) {
			text.append(" Substitutions: ");
			text.append(String.join(", ", substitutions.stream()
					.map(s -> s.name() + " instead of " + s.substitutedFor())
					.toList()));
			text.append(".");
		}
		long fromPantry = recipe.ingredients().stream().filter(i -> i.source() == IngredientSource.PANTRY).count();
		text.append(" ").append(fromPantry).append(" ingredient(s) come from your pantry.");
		if (!recipe.shoppingList().isEmpty()) {
			text.append(" To buy: ").append(String.join(", ", recipe.shoppingList())).append(".");
		}
		for (String note : recipe.notes()) {
			text.append("\n- ").append(note);
		}
		return text.toString();
	}

	private static String describePantry(PantrySummary summary) {
		if (summary.items().isEmpty()) {
			return "Your pantry is empty.";
		}
		StringBuilder text = new StringBuilder("Your pantry: ");
		text.append(String.join(", ", summary.items().stream().map(ResponseSynthesizer::describeItem).toList()))
				.append(".");
		if (!summary.expiringSoon().isEmpty()) {
			text.append(" Use soon: ")
					.append(String.join(", ", summary.expiringSoon().stream().map(PantryItem::name).toList()))
					.append(".");
		}
		if (!summary.expired().isEmpty()) {
			text.append(" Expired: ")
					.append(String.join(", ", summary.expired().stream().map(PantryItem::name).toList()))
					.append(".");
		}
		return text.toString();
	}

	private static String describeItem(PantryItem item) {
		return item.name() + " " + Quantities.format(item.quantity()) + (item.unit() != null ? " " + item.unit() : "");
	}

	private static String prompt(String templated) {
		return """
				Rewrite this explanation for a home cook in a warm, concise tone. Keep every recipe name,
				number, ingredient and warning exactly as given; add no new recipes or ingredients.
				Explanation:
				%s
				Reply with JSON only: %s
				""".formatted(templated, SCHEMA.describe());
	}
}
