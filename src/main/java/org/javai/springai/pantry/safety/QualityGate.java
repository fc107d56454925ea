package org.javai.springai.pantry.safety;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.javai.springai.pantry.model.CandidateRecipe;
import org.javai.springai.pantry.model.Preferences;
import org.javai.springai.pantry.model.RankedRecommendation;
import org.javai.springai.pantry.model.RecipeIngredient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Final constraint check for everything recipe-bearing that leaves the assistant.
 *
 * <p>Nothing is shown unless it passed here. A failing recipe is reported with itemized
 * violations; it is never returned with a warning attached.</p>
 */
public class QualityGate {

	private static final Logger logger = LoggerFactory.getLogger(QualityGate.class);

	/**
	 * Checks every ingredient name and every instruction step of a recipe.
	 */
	public GateVerdict inspect(CandidateRecipe recipe, Preferences preferences) {
		List<ConstraintViolation> violations = new ArrayList<>();
		for (RecipeIngredient ingredient : recipe.ingredients()) {
			violations.addAll(SafetyRules.violations(ingredient.name(), preferences));
		}
		List<String> steps = recipe.instructions();
		for (int i = 0; i < steps.size(); i++) {
			violations.addAll(SafetyRules.textViolations(steps.get(i), preferences, "instruction " + (i + 1)));
		}
		GateVerdict verdict = GateVerdict.of(violations);
		if (!verdict.passed()) {
			logger.warn("Quality gate rejected recipe {}: {} violation(s)", recipe.id(), violations.size());
			logger.debug("Violations for {}: {}", recipe.id(), violations);
		}
		return verdict;
	}

	/**
	 * Screens a ranked list. Recommendations whose ingredients violate a constraint are withheld
	 * and reported; the approved list keeps the original order.
	 */
	public RecommendationScreen inspectRecommendations(List<RankedRecommendation> recommendations,
			Preferences preferences) {
		List<RankedRecommendation> approved = new ArrayList<>();
		Map<String, List<ConstraintViolation>> withheld = new LinkedHashMap<>();
		for (RankedRecommendation recommendation : recommendations) {
			CandidateRecipe recipe = recommendation.recipe();
			List<ConstraintViolation> violations = new ArrayList<>();
			for (RecipeIngredient ingredient : recipe.ingredients()) {
				violations.addAll(SafetyRules.violations(ingredient.name(), preferences));
			}
			if (violations.isEmpty()
					&& SafetyRules.dietCompliance(recipe, preferences.dietaryRestrictions()) == DietCompliance.VIOLATES) {
				violations.add(new ConstraintViolation(ConstraintViolation.Kind.DIET, recipe.title(),
						String.join(",", preferences.dietaryRestrictions()), "tags"));
			}
			if (violations.isEmpty()) {
				approved.add(recommendation);
			}
			else {
				logger.warn("Withholding recommendation {} with {} violation(s)", recipe.id(), violations.size());
				withheld.put(recipe.id(), List.copyOf(violations));
			}
		}
		return new RecommendationScreen(approved, withheld);
	}
}
