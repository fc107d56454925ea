package org.javai.springai.pantry.adaptation;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.javai.springai.pantry.model.CandidateRecipe;
import org.javai.springai.pantry.model.IngredientNames;
import org.javai.springai.pantry.model.PantryItem;
import org.javai.springai.pantry.model.Preferences;
import org.javai.springai.pantry.model.RecipeIngredient;
import org.javai.springai.pantry.model.SkillLevel;
import org.javai.springai.pantry.safety.ConstraintViolation;
import org.javai.springai.pantry.safety.SafetyRules;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Fits a chosen recipe to the pantry and the household's constraints.
 *
 * <p>Per ingredient: one that violates a constraint is replaced by a safe alternative, preferring
 * one already in the pantry; one that is on hand is used from the pantry; one that is missing is
 * replaced only by a safe alternative that is on hand, and otherwise goes on the shopping list.
 * Adapting the result again with the same pantry and preferences changes no ingredient.</p>
 */
public class RecipeAdapter {

	private static final Logger logger = LoggerFactory.getLogger(RecipeAdapter.class);

	static final int BEGINNER_STEP_HINT_THRESHOLD = 6;

	private static final Set<String> DESCRIPTIVE_WORDS = Set.of("fresh", "dried", "ground", "whole", "green", "red",
			"white", "black", "brown", "yellow", "sweet", "sour", "smoked", "salted", "unsalted", "plain", "light",
			"heavy", "extra", "virgin", "large", "small", "baby", "hot", "cold", "low", "fat", "free", "powder",
			"frozen", "canned", "raw", "cooked", "chopped", "sliced", "minced", "grated");

	/**
	 * @param targetServings servings to scale to, or null to keep the recipe's own
	 */
	public AdaptedRecipe adapt(CandidateRecipe recipe, List<PantryItem> pantry, Preferences preferences,
			Integer targetServings, AlternativeSource alternatives) {
		int servings = targetServings != null && targetServings > 0 ? targetServings : recipe.servings();
		double factor = (double) servings / recipe.servings();
		List<PantryItem> available = pantry.stream().filter(PantryItem::isAvailable).toList();

		List<AdaptedIngredient> adapted = new ArrayList<>();
		Set<String> shopping = new TreeSet<>();
		List<String> notes = new ArrayList<>();
		Map<String, String> renames = new LinkedHashMap<>();

		if (factor != 1.0) {
			notes.add("Scaled from " + recipe.servings() + " to " + servings + " servings.");
		}
		for (RecipeIngredient original : recipe.ingredients()) {
			RecipeIngredient scaled = original.scaled(factor);
			String name = scaled.name();
			boolean onHand = inPantry(name, available);
			List<ConstraintViolation> violations = SafetyRules.violations(name, preferences);

			if (!violations.isEmpty()) {
				Optional<String> replacement = safeReplacement(name, available, preferences, alternatives);
				if (replacement.isPresent()) {
					String substitute = replacement.get();
					boolean substituteOnHand = inPantry(substitute, available);
					adapted.add(new AdaptedIngredient(scaled.renamed(substitute), IngredientSource.SUBSTITUTED, name,
							substituteOnHand));
					renames.put(name, IngredientNames.normalize(substitute));
					if (!substituteOnHand) {
						shopping.add(IngredientNames.normalize(substitute));
					}
					notes.add("Replaced " + name + " with " + IngredientNames.normalize(substitute)
							+ " (" + violations.get(0).describe() + ").");
				}
				else {
					logger.warn("No safe substitute for {} in recipe {}", name, recipe.id());
					adapted.add(new AdaptedIngredient(scaled, onHand ? IngredientSource.PANTRY : IngredientSource.TO_BUY,
							null, onHand));
					notes.add("No safe substitute found for " + name + ".");
				}
			}
			else if (onHand) {
				adapted.add(new AdaptedIngredient(scaled, IngredientSource.PANTRY, null, true));
			}
			else {
				Optional<String> onHandAlternative = safeAlternatives(name, preferences, alternatives).stream()
						.filter(alternative -> inPantry(alternative, available))
						.findFirst();
				if (onHandAlternative.isPresent()) {
					String substitute = IngredientNames.normalize(onHandAlternative.get());
					adapted.add(new AdaptedIngredient(scaled.renamed(substitute), IngredientSource.SUBSTITUTED, name, true));
					renames.put(name, substitute);
					notes.add("Using " + substitute + " from your pantry instead of " + name + ".");
				}
				else {
					adapted.add(new AdaptedIngredient(scaled, IngredientSource.TO_BUY, null, false));
					shopping.add(name);
				}
			}
		}

		Set<String> keptWords = new HashSet<>();
		for (AdaptedIngredient ingredient : adapted) {
			keptWords.addAll(Arrays.asList(IngredientNames.normalize(ingredient.name()).split(" ")));
		}
		String title = rewrite(recipe.title(), renames, keptWords);
		List<String> instructions = recipe.instructions().stream()
				.map(step -> rewrite(step, renames, keptWords))
				.toList();
		if (preferences.skillLevel() == SkillLevel.BEGINNER && instructions.size() > BEGINNER_STEP_HINT_THRESHOLD) {
			notes.add("This one has " + instructions.size() + " steps; read them all before you start.");
		}
		AdaptedRecipe result = new AdaptedRecipe(recipe, title, adapted, instructions, servings,
				List.copyOf(shopping), notes);
		logger.debug("Adapted {}: {} substitution(s), {} to buy", recipe.id(), result.substitutions().size(),
				shopping.size());
		return result;
	}

	/**
	 * A safe alternative for a violating ingredient: one on hand if possible; otherwise the first
	 * safe one, unless that one can itself be covered by a safe alternative on hand.
	 */
	private static Optional<String> safeReplacement(String name, List<PantryItem> available, Preferences preferences,
			AlternativeSource alternatives) {
		List<String> safe = safeAlternatives(name, preferences, alternatives);
		for (String alternative : safe) {
			if (inPantry(alternative, available)) {
				return Optional.of(alternative);
			}
		}
		if (safe.isEmpty()) {
			return Optional.empty();
		}
		String first = safe.get(0);
		return Optional.of(safeAlternatives(first, preferences, alternatives).stream()
				.filter(second -> inPantry(second, available))
				.findFirst()
				.orElse(first));
	}

	private static List<String> safeAlternatives(String name, Preferences preferences, AlternativeSource alternatives) {
		List<String> result = new ArrayList<>();
		for (String alternative : alternatives.alternativesFor(name)) {
			String normalized = IngredientNames.normalize(alternative);
			if (!normalized.isEmpty() && !IngredientNames.sameIngredient(normalized, name)
					&& SafetyRules.isSafe(normalized, preferences) && !result.contains(normalized)) {
				result.add(normalized);
			}
		}
		return result;
	}

	private static boolean inPantry(String name, List<PantryItem> available) {
		String normalized = IngredientNames.normalize(name);
		return available.stream().anyMatch(item -> IngredientNames.covers(item.name(), normalized));
	}

	static String rewrite(String text, Map<String, String> renames) {
		return rewrite(text, renames, Set.of());
	}

	/**
	 * Replaces whole-word mentions of renamed ingredients, longest names first, keeping plural
	 * mentions recognizable ("eggs" becomes the substitute too).
	 *
	 * <p>Steps often shorten a multi-word ingredient ("Slice the chicken" for chicken breast), so
	 * the first and last word of a renamed name are replaced as well. A short form is left alone
	 * when it is a descriptive word, when another renamed ingredient shares it, or when it is part
	 * of an ingredient the adapted recipe still uses.</p>
	 *
	 * @param keptWords words of the ingredient names in the adapted recipe
	 */
	static String rewrite(String text, Map<String, String> renames, Set<String> keptWords) {
		if (text == null || renames.isEmpty()) {
			return text;
		}
		List<Map.Entry<String, String>> ordered = new ArrayList<>(renames.entrySet());
		ordered.sort(Comparator.comparingInt((Map.Entry<String, String> e) -> e.getKey().length()).reversed()
				.thenComparing(Map.Entry::getKey));
		String result = text;
		for (Map.Entry<String, String> rename : ordered) {
			result = replaceWords(result, rename.getKey().split(" "), rename.getValue());
		}
		for (Map.Entry<String, String> rename : ordered) {
			for (String shortForm : shortForms(rename.getKey(), renames.keySet(), keptWords)) {
				result = replaceWords(result, new String[] {shortForm}, rename.getValue());
			}
		}
		return result;
	}

	private static List<String> shortForms(String name, Set<String> renamed, Set<String> keptWords) {
		String[] words = name.split(" ");
		if (words.length < 2) {
			return List.of();
		}
		List<String> forms = new ArrayList<>();
		for (String word : List.of(words[words.length - 1], words[0])) {
			if (forms.contains(word) || DESCRIPTIVE_WORDS.contains(word) || keptWords.contains(word)) {
				continue;
			}
			long sharing = renamed.stream()
					.filter(other -> Arrays.asList(other.split(" ")).contains(word))
					.count();
			if (sharing == 1) {
				forms.add(word);
			}
		}
		return forms;
	}

	private static String replaceWords(String text, String[] words, String replacement) {
		StringBuilder regex = new StringBuilder("(?i)\\b");
		for (int i = 0; i < words.length; i++) {
			if (i > 0) {
				regex.append("\\s+");
			}
			regex.append(Pattern.quote(words[i]));
		}
		regex.append("(?:e?s)?\\b");
		return Pattern.compile(regex.toString()).matcher(text).replaceAll(Matcher.quoteReplacement(replacement));
	}
}
