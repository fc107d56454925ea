package org.javai.springai.pantry.model;

import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Normalization and word-level matching for ingredient names.
 *
 * <p>Every name that is used as a key (pantry items, recipe ingredients, allergens) passes
 * through {@link #normalize(String)} so that "2 Chicken Breasts" and "chicken breast" refer
 * to the same thing.</p>
 */
public final class IngredientNames {

	private static final Pattern LEADING_QUANTITY = Pattern.compile(
			"^\\s*[+-]?\\d+(?:[./]\\d+)?\\s*"
					+ "(?:cups?|tbsps?|tbs|tsps?|grams?|g|kg|oz|ounces?|lbs?|pounds?|ml|l|liters?|litres?|cloves?|pinch(?:es)?|cans?|slices?)?\\b",
			Pattern.CASE_INSENSITIVE);
	private static final Pattern NON_WORD = Pattern.compile("[^\\p{L}\\p{N}\\s-]");
	private static final Pattern WHITESPACE = Pattern.compile("\\s+");

	private IngredientNames() {
	}

	/**
	 * Lower-case, strip a leading quantity/unit, drop punctuation, collapse whitespace and
	 * singularize the last word.
	 *
	 * @param raw the raw name (may be null)
	 * @return the normalized name, or an empty string when nothing usable remains
	 */
	public static String normalize(String raw) {
		if (raw == null) {
			return "";
		}
		String s = raw.toLowerCase(Locale.ROOT).trim();
		s = LEADING_QUANTITY.matcher(s).replaceFirst("");
		s = NON_WORD.matcher(s).replaceAll(" ");
		s = WHITESPACE.matcher(s).replaceAll(" ").trim();
		if (s.isEmpty()) {
			return s;
		}
		int lastSpace = s.lastIndexOf(' ');
		String head = lastSpace < 0 ? "" : s.substring(0, lastSpace + 1);
		String last = lastSpace < 0 ? s : s.substring(lastSpace + 1);
		return head + singularize(last);
	}

	public static Set<String> normalizeAll(Collection<String> raw) {
		Set<String> result = new LinkedHashSet<>();
		if (raw == null) {
			return result;
		}
		for (String name : raw) {
			String normalized = normalize(name);
			if (!normalized.isEmpty()) {
				result.add(normalized);
			}
		}
		return result;
	}

	/**
	 * Normalizes free text word by word (every word singularized), so that instruction text can be
	 * searched with {@link #containsWord(String, String)}.
	 */
	public static String normalizeText(String text) {
		if (text == null) {
			return "";
		}
		String s = NON_WORD.matcher(text.toLowerCase(Locale.ROOT)).replaceAll(" ");
		s = WHITESPACE.matcher(s).replaceAll(" ").trim();
		if (s.isEmpty()) {
			return s;
		}
		StringBuilder out = new StringBuilder();
		for (String word : s.split(" ")) {
			if (out.length() > 0) {
				out.append(' ');
			}
			out.append(singularize(word));
		}
		return out.toString();
	}

	/**
	 * True when {@code needle} occurs in {@code haystack} as a whole word or word sequence.
	 * Both arguments are expected to be normalized.
	 */
	public static boolean containsWord(String haystack, String needle) {
		if (haystack == null || needle == null || needle.isBlank()) {
			return false;
		}
		return (" " + haystack + " ").contains(" " + needle + " ");
	}

	/**
	 * Two normalized names refer to the same ingredient when one contains the other as whole words,
	 * e.g. {@code chicken} and {@code chicken breast}.
	 */
	public static boolean sameIngredient(String a, String b) {
		if (a == null || b == null || a.isEmpty() || b.isEmpty()) {
			return false;
		}
		return a.equals(b) || containsWord(a, b) || containsWord(b, a);
	}

	/**
	 * True when a pantry item can stand in for a recipe ingredient: the names are equal, or the
	 * pantry name is the more specific one ({@code chicken breast} covers {@code chicken}). A
	 * generic pantry name never covers a more specific ingredient, so {@code butter} does not
	 * cover {@code peanut butter}. Both arguments are expected to be normalized.
	 */
	public static boolean covers(String pantryName, String recipeName) {
		if (pantryName == null || recipeName == null || pantryName.isEmpty() || recipeName.isEmpty()) {
			return false;
		}
		return pantryName.equals(recipeName) || containsWord(pantryName, recipeName);
	}

	static String singularize(String word) {
		int n = word.length();
		if (n > 4 && word.endsWith("ies")) {
			return word.substring(0, n - 3) + "y";
		}
		if (n > 4 && (word.endsWith("oes") || word.endsWith("ches") || word.endsWith("shes")
				|| word.endsWith("sses") || word.endsWith("xes"))) {
			return word.substring(0, n - 2);
		}
		if (n > 3 && word.endsWith("s") && !word.endsWith("ss") && !word.endsWith("us")) {
			return word.substring(0, n - 1);
		}
		return word;
	}
}
