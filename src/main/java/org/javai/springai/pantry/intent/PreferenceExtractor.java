package org.javai.springai.pantry.intent;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.javai.springai.pantry.model.DietaryRestrictions;
import org.javai.springai.pantry.model.IngredientNames;
import org.javai.springai.pantry.model.PreferenceDelta;
import org.javai.springai.pantry.model.Preferences;
import org.javai.springai.pantry.model.SkillLevel;

/**
 * Pulls stated preferences out of a message.
 *
 * <p>Only first-person statements count: "I'm vegan" is a restriction, "show me vegan recipes"
 * is not. Restrictions and cuisines accumulate onto what is already known; allergies are only
 * ever added, unless the message explicitly withdraws one ("I'm no longer allergic to shrimp").</p>
 */
public class PreferenceExtractor {

	private static final String DIETS = "vegan|vegetarian|pescatarian|gluten[- ]free|dairy[- ]free|keto|paleo|halal|kosher|low[- ]carb";
	private static final String CUISINES = "italian|mexican|indian|chinese|japanese|thai|french|greek|mediterranean"
			+ "|korean|vietnamese|spanish|american|middle eastern|moroccan|turkish|lebanese|caribbean";
	private static final String SELF = "(?:i'm|i am|im|we're|we are|i've become|we've become|i have become|i eat|we eat|i follow|we follow|i keep|we keep)";

	private static final Pattern ALLERGY_WITHDRAWN = Pattern.compile(
			"(?:no longer|not|n't|never was|wasn't) allergic to ([a-z][a-z ,-]*?)(?: anymore| any more)?(?=[.!?;]|$| but | so )");
	private static final Pattern ALLERGY_STATED = Pattern.compile(
			"allergic to ([a-z][a-z ,-]*?)(?=[.!?;]|$| but | so | and i| and we| what| can| could)");
	private static final Pattern ALLERGY_NOUN = Pattern.compile(
			"\\b(?:i|we) (?:have|has) (?:an? |a severe |severe )?([a-z][a-z -]*?) allerg(?:y|ies)\\b");
	private static final Pattern DIET_WITHDRAWN = Pattern.compile(
			SELF + "?\\s*(?:no longer|not) (?:a |an )?(" + DIETS + ")(?: anymore| any more)?\\b");
	private static final Pattern DIET_STATED = Pattern.compile(
			"\\b" + SELF + "\\s+(?:now\\s+|strictly\\s+|a\\s+|an\\s+|mostly\\s+)*(" + DIETS + ")\\b"
					+ "|\\b(?:i|we) (?:only )?eat (" + DIETS + ")\\b"
					+ "|\\b(?:my|our|i'm on a|i am on a|we're on a|on a) (" + DIETS + ") diet\\b");
	private static final Pattern CUISINE_STATED = Pattern.compile(
			"\\b(?:i|we) (?:really )?(?:like|love|prefer|enjoy|am into|'m into) (" + CUISINES + ")\\b");
	private static final Pattern SKILL_STATED = Pattern.compile(
			"\\b(?:i'm|i am|im) (?:a |an |pretty |very |fairly |quite )*(beginner|novice|intermediate|advanced|experienced|expert)\\b"
					+ "|\\b(new to cooking)\\b"
					+ "|\\b(beginner|novice|intermediate|advanced|experienced|expert) (?:cook|chef|level)\\b");
	private static final Pattern LIST_SEPARATOR = Pattern.compile("\\s*,\\s*(?:and\\s+|or\\s+)?|\\s+and\\s+|\\s+or\\s+");

	/**
	 * @param known preferences before this message, used to accumulate restrictions and cuisines
	 * @return the delta, empty when the message states nothing
	 */
	public PreferenceDelta extract(String message, Preferences known) {
		if (message == null || message.isBlank()) {
			return PreferenceDelta.empty();
		}
		Preferences current = known != null ? known : Preferences.none();
		String text = message.toLowerCase(Locale.ROOT).replace('’', '\'');
		PreferenceDelta.Builder delta = PreferenceDelta.builder();

		Matcher withdrawn = ALLERGY_WITHDRAWN.matcher(text);
		while (withdrawn.find()) {
			splitList(withdrawn.group(1)).forEach(delta::removeAllergy);
		}
		String remaining = ALLERGY_WITHDRAWN.matcher(text).replaceAll(" ");
		Matcher stated = ALLERGY_STATED.matcher(remaining);
		while (stated.find()) {
			splitList(stated.group(1)).forEach(delta::addAllergy);
		}
		Matcher noun = ALLERGY_NOUN.matcher(remaining);
		while (noun.find()) {
			splitList(noun.group(1)).forEach(delta::addAllergy);
		}

		Set<String> diets = new LinkedHashSet<>(current.dietaryRestrictions());
		boolean dietsMentioned = false;
		Matcher dietOut = DIET_WITHDRAWN.matcher(text);
		while (dietOut.find()) {
			diets.remove(DietaryRestrictions.canonical(dietOut.group(1)));
			dietsMentioned = true;
		}
		String dietText = DIET_WITHDRAWN.matcher(text).replaceAll(" ");
		Matcher dietIn = DIET_STATED.matcher(dietText);
		while (dietIn.find()) {
			String diet = firstNonNull(dietIn.group(1), dietIn.group(2), dietIn.group(3));
			diets.add(DietaryRestrictions.canonical(diet));
			dietsMentioned = true;
		}
		if (dietsMentioned) {
			delta.dietaryRestrictions(diets);
		}

		Set<String> cuisines = new LinkedHashSet<>(current.cuisinePreferences());
		boolean cuisinesMentioned = false;
		Matcher cuisine = CUISINE_STATED.matcher(text);
		while (cuisine.find()) {
			cuisines.add(cuisine.group(1));
			cuisinesMentioned = true;
		}
		if (cuisinesMentioned) {
			delta.cuisinePreferences(cuisines);
		}

		Matcher skill = SKILL_STATED.matcher(text);
		if (skill.find()) {
			SkillLevel.parse(firstNonNull(skill.group(1), skill.group(2), skill.group(3)))
					.ifPresent(delta::skillLevel);
		}
		return delta.build();
	}

	private static List<String> splitList(String raw) {
		return LIST_SEPARATOR.splitAsStream(raw.trim())
				.map(s -> s.replaceFirst("^(?:the|all|any)\\s+", ""))
				.map(IngredientNames::normalize)
				.filter(s -> !s.isEmpty())
				.toList();
	}

	private static String firstNonNull(String... values) {
		for (String value : values) {
			if (value != null) {
				return value;
			}
		}
		return "";
	}
}
