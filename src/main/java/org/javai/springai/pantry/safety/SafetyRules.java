package org.javai.springai.pantry.safety;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import org.javai.springai.pantry.model.CandidateRecipe;
import org.javai.springai.pantry.model.DietaryRestrictions;
import org.javai.springai.pantry.model.IngredientNames;
import org.javai.springai.pantry.model.Preferences;
import org.javai.springai.pantry.model.RecipeIngredient;
import org.javai.springai.pantry.safety.ConstraintViolation.Kind;

/**
 * Keyword rules for allergens and dietary restrictions.
 *
 * <p>All matching is word-level on normalized names: the allergen {@code peanut} matches
 * {@code peanut butter} and {@code peanuts}, but {@code egg} does not match {@code eggplant}.
 * Allergen family names ("dairy", "shellfish", "tree nut", ...) expand to their members.</p>
 */
public final class SafetyRules {

	private static final Set<String> MEAT = Set.of("chicken", "beef", "pork", "bacon", "ham", "lamb",
			"turkey", "sausage", "meat", "veal", "duck", "prosciutto", "salami", "pepperoni", "chorizo",
			"steak", "mince", "gelatin", "lard");
	private static final Set<String> FISH = Set.of("fish", "salmon", "tuna", "cod", "anchovy", "tilapia",
			"sardine", "trout", "halibut", "mackerel");
	private static final Set<String> SHELLFISH = Set.of("shrimp", "prawn", "crab", "lobster", "scallop",
			"clam", "mussel", "oyster", "shellfish");
	private static final Set<String> DAIRY = Set.of("milk", "cheese", "butter", "cream", "yogurt", "ghee",
			"whey", "parmesan", "mozzarella", "cheddar", "feta", "ricotta", "dairy", "buttermilk");
	private static final Set<String> EGG = Set.of("egg", "mayonnaise");
	private static final Set<String> GLUTEN = Set.of("wheat", "flour", "bread", "pasta", "spaghetti",
			"noodle", "barley", "rye", "couscous", "breadcrumb", "gluten", "tortilla", "penne", "macaroni");
	private static final Set<String> TREE_NUTS = Set.of("almond", "walnut", "cashew", "pecan", "pistachio",
			"hazelnut", "macadamia");

	private static final List<String> DAIRY_FREE_PHRASES = List.of("peanut butter", "almond butter",
			"cashew butter", "apple butter", "cocoa butter", "almond milk", "oat milk", "soy milk",
			"coconut milk", "rice milk", "coconut cream", "vegan cheese", "dairy-free", "butternut squash",
			"butter bean");
	private static final List<String> GLUTEN_FREE_PHRASES = List.of("gluten-free", "rice noodle",
			"rice flour", "almond flour", "coconut flour", "chickpea flour", "corn tortilla", "buckwheat");
	private static final List<String> MEAT_FREE_PHRASES = List.of("vegetable broth", "vegetable stock",
			"vegan sausage", "veggie sausage", "plant-based");

	private static final Map<String, Set<String>> ALLERGEN_FAMILIES = Map.of(
			"dairy", DAIRY,
			"shellfish", SHELLFISH,
			"fish", FISH,
			"tree nut", TREE_NUTS,
			"nut", union(TREE_NUTS, Set.of("peanut")),
			"gluten", GLUTEN,
			"wheat", GLUTEN,
			"egg", EGG,
			"soy", Set.of("soy", "tofu", "tempeh", "edamame", "miso", "soy sauce"),
			"sesame", Set.of("sesame", "tahini"));

	private static final Map<String, DietRule> DIET_RULES = Map.of(
			"vegan", new DietRule(union(MEAT, FISH, SHELLFISH, DAIRY, EGG, Set.of("honey")),
					concat(DAIRY_FREE_PHRASES, MEAT_FREE_PHRASES)),
			"vegetarian", new DietRule(union(MEAT, FISH, SHELLFISH), MEAT_FREE_PHRASES),
			"pescatarian", new DietRule(MEAT, MEAT_FREE_PHRASES),
			"dairy-free", new DietRule(DAIRY, DAIRY_FREE_PHRASES),
			"gluten-free", new DietRule(GLUTEN, GLUTEN_FREE_PHRASES));

	/** Tags that assert compliance with a restriction, beyond the restriction's own name. */
	private static final Map<String, Set<String>> IMPLIED_BY_TAG = Map.of(
			"vegan", Set.of("vegan", "vegetarian", "pescatarian", "dairy-free"),
			"vegetarian", Set.of("vegetarian", "pescatarian"));

	private SafetyRules() {
	}

	/**
	 * Returns the allergen from {@code allergies} that the ingredient contains, if any.
	 */
	public static Optional<String> matchingAllergen(String ingredient, Collection<String> allergies) {
		String name = IngredientNames.normalize(ingredient);
		for (String allergen : allergies) {
			if (!allergenTerm(name, allergen).isEmpty()) {
				return Optional.of(allergen);
			}
		}
		return Optional.empty();
	}

	/**
	 * Returns the word that makes the ingredient unacceptable under {@code diet}, if any.
	 * Unknown restrictions never forbid anything by keyword.
	 */
	public static Optional<String> forbiddenTerm(String ingredient, String diet) {
		DietRule rule = DIET_RULES.get(DietaryRestrictions.canonical(diet));
		if (rule == null) {
			return Optional.empty();
		}
		return rule.offendingTerm(IngredientNames.normalize(ingredient));
	}

	public static boolean hasKeywordRules(String diet) {
		return DIET_RULES.containsKey(DietaryRestrictions.canonical(diet));
	}

	public static boolean isSafe(String ingredient, Preferences preferences) {
		return violations(ingredient, preferences).isEmpty();
	}

	/**
	 * All violations a single ingredient name causes.
	 */
	public static List<ConstraintViolation> violations(String ingredient, Preferences preferences) {
		String name = IngredientNames.normalize(ingredient);
		List<ConstraintViolation> result = new ArrayList<>();
		for (String allergen : sorted(preferences.allergies())) {
			String term = allergenTerm(name, allergen);
			if (!term.isEmpty()) {
				result.add(new ConstraintViolation(Kind.ALLERGEN, name, allergen, "ingredient"));
			}
		}
		for (String diet : sorted(preferences.dietaryRestrictions())) {
			forbiddenTerm(name, diet).ifPresent(term ->
					result.add(new ConstraintViolation(Kind.DIET, name, diet, "ingredient")));
		}
		return result;
	}

	/**
	 * Violations found anywhere in free text such as instructions or a title.
	 *
	 * @param location label used in the violation's detail, e.g. "instruction 2"
	 */
	public static List<ConstraintViolation> textViolations(String text, Preferences preferences, String location) {
		String normalized = IngredientNames.normalizeText(text);
		List<ConstraintViolation> result = new ArrayList<>();
		if (normalized.isEmpty()) {
			return result;
		}
		for (String allergen : sorted(preferences.allergies())) {
			String term = allergenTerm(normalized, allergen);
			if (!term.isEmpty()) {
				result.add(new ConstraintViolation(Kind.ALLERGEN, term, allergen, location));
			}
		}
		for (String diet : sorted(preferences.dietaryRestrictions())) {
			DietRule rule = DIET_RULES.get(diet);
			if (rule != null) {
				rule.offendingTerm(normalized).ifPresent(term ->
						result.add(new ConstraintViolation(Kind.DIET, term, diet, location)));
			}
		}
		return result;
	}

	/**
	 * Compliance of a whole recipe with one restriction.
	 */
	public static DietCompliance dietCompliance(CandidateRecipe recipe, String diet) {
		String canonical = DietaryRestrictions.canonical(diet);
		DietRule rule = DIET_RULES.get(canonical);
		if (rule != null) {
			for (RecipeIngredient ingredient : recipe.ingredients()) {
				if (rule.offendingTerm(ingredient.name()).isPresent()) {
					return DietCompliance.VIOLATES;
				}
			}
			for (String tag : recipe.tags()) {
				if (rule.offendingTerm(IngredientNames.normalizeText(tag)).isPresent()) {
					return DietCompliance.VIOLATES;
				}
			}
		}
		if (recipe.hasTag(canonical) || assertedByTags(recipe, canonical)) {
			return DietCompliance.COMPLIES;
		}
		return DietCompliance.UNVERIFIED;
	}

	/**
	 * Worst compliance across every restriction; {@code COMPLIES} when there are none.
	 */
	public static DietCompliance dietCompliance(CandidateRecipe recipe, Set<String> diets) {
		DietCompliance result = DietCompliance.COMPLIES;
		for (String diet : diets) {
			result = result.worse(dietCompliance(recipe, diet));
		}
		return result;
	}

	/**
	 * First allergen the recipe contains, looking at every ingredient.
	 */
	public static Optional<String> recipeAllergen(CandidateRecipe recipe, Collection<String> allergies) {
		for (RecipeIngredient ingredient : recipe.ingredients()) {
			Optional<String> match = matchingAllergen(ingredient.name(), allergies);
			if (match.isPresent()) {
				return match;
			}
		}
		return Optional.empty();
	}

	private static boolean assertedByTags(CandidateRecipe recipe, String diet) {
		for (Map.Entry<String, Set<String>> implied : IMPLIED_BY_TAG.entrySet()) {
			if (recipe.hasTag(implied.getKey()) && implied.getValue().contains(diet)) {
				return true;
			}
		}
		return false;
	}

	/**
	 * Returns the term of {@code allergen} found in {@code normalized}, or an empty string.
	 */
	private static String allergenTerm(String normalized, String allergen) {
		String key = IngredientNames.normalize(allergen);
		if (key.isEmpty()) {
			return "";
		}
		Set<String> family = ALLERGEN_FAMILIES.getOrDefault(key, Set.of());
		String haystack = DAIRY.contains(key) ? strip(normalized, DAIRY_FREE_PHRASES) : normalized;
		if (IngredientNames.containsWord(haystack, key)) {
			return key;
		}
		for (String member : sorted(family)) {
			if (IngredientNames.containsWord(haystack, member)) {
				return member;
			}
		}
		return "";
	}

	private static String strip(String normalized, List<String> safePhrases) {
		String padded = " " + normalized + " ";
		for (String phrase : safePhrases) {
			padded = padded.replace(" " + phrase + " ", " _ ");
		}
		return padded.trim();
	}

	private static List<String> sorted(Collection<String> values) {
		return values.stream().sorted().toList();
	}

	@SafeVarargs
	private static Set<String> union(Set<String>... sets) {
		Set<String> result = new LinkedHashSet<>();
		for (Set<String> set : sets) {
			result.addAll(set);
		}
		return Set.copyOf(result);
	}

	private static List<String> concat(List<String> a, List<String> b) {
		List<String> result = new ArrayList<>(a);
		result.addAll(b);
		return List.copyOf(result);
	}

	private record DietRule(Set<String> forbidden, List<String> safePhrases) {

		Optional<String> offendingTerm(String normalized) {
			String haystack = strip(normalized, safePhrases);
			return forbidden.stream()
					.sorted()
					.filter(term -> IngredientNames.containsWord(haystack, term))
					.findFirst();
		}
	}
}
