package org.javai.springai.pantry.intent;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.javai.springai.pantry.model.IngredientNames;
import org.javai.springai.pantry.model.InventoryDelta;

/**
 * Finds pantry mutations in free text.
 *
 * <p>Recognizes verb phrases ("I bought 2 chicken breasts and 500g pasta", "used 3 eggs") and
 * signed deltas ("+2 tomatoes, -1 onion"). An item named without a quantity is not guessed:
 * it is reported in {@link Result#missingQuantity()} so the caller can ask. A plain statement of
 * possession ("I have 3 onions") only counts when it carries a real count, so "I have a peanut
 * allergy" never touches the pantry.</p>
 */
public class PantryDeltaParser {

	private static final String UNITS = "kg|g|grams?|mg|oz|ounces?|lbs?|pounds?|ml|l|liters?|litres?|cups?|tbsps?|tsps?"
			+ "|cans?|cloves?|bunch(?:es)?|bags?|bottles?|boxes|box|jars?|packs?|packets?|slices?|heads?|loaf|loaves|sticks?|pieces?";

	private static final Pattern SENTENCE_BREAK = Pattern.compile("[!?;]+|\\.(?!\\d)");
	private static final Pattern ITEM_SEPARATOR = Pattern.compile("\\s*,\\s*|\\s+and\\s+|\\s*&\\s*");
	private static final Pattern VERB = Pattern.compile(
			"\\b(?:(bought|purchased|picked up|added|add|grabbed|restocked|stocked up on)"
					+ "|(used up|used|ate|eaten|finished|removed|remove|threw out|threw away|tossed|took out|cooked with))\\s+");
	private static final Pattern WEAK_ADD = Pattern.compile(
			"\\b(?:i|we)\\s*(?:'ve got|have got|now have|'ve|have|got)\\s+(.+)$");
	private static final Pattern SIGNED_ITEM = Pattern.compile(
			"^([+-])\\s*(\\d+(?:\\.\\d+)?)\\s*(?:(" + UNITS + ")\\b)?\\s*(?:of\\s+)?([a-z][a-z\\s-]*)$");
	private static final Pattern QUANTIFIED_ITEM = Pattern.compile(
			"^(\\d+(?:\\.\\d+)?|(?:a dozen|half a|an|a|one|two|three|four|five|six|seven|eight|nine|ten|eleven|twelve|dozen|half)(?=\\s))"
					+ "\\s*(?:(" + UNITS + ")\\b)?\\s*(?:of\\s+)?([a-z][a-z\\s-]*)$");
	private static final Pattern BARE_ITEM = Pattern.compile("^(?:some\\s+|more\\s+|the\\s+)?([a-z][a-z\\s-]*)$");
	private static final Pattern FILLER_PREFIX = Pattern.compile("^(?:the|some|more|fresh|a few|few)\\s+");
	private static final Pattern FILLER_SUFFIX = Pattern.compile(
			"\\s+(?:today|yesterday|tonight|too|as well|already|to (?:my|the) (?:pantry|inventory|fridge|list)"
					+ "|from (?:my|the) (?:pantry|inventory|fridge))$");

	private static final Set<String> CLAUSE_STARTERS = Set.of("what", "how", "can", "could", "any", "anything",
			"suggest", "recommend", "give", "show", "find", "which", "is", "do", "does", "should", "so", "then",
			"but", "please", "i", "we", "recipe", "recipes", "let's", "lets", "also", "to", "it", "this", "that",
			"them", "with", "for", "in", "on");

	private static final Map<String, Double> NUMBER_WORDS = Map.ofEntries(
			Map.entry("a", 1.0), Map.entry("an", 1.0), Map.entry("one", 1.0), Map.entry("two", 2.0),
			Map.entry("three", 3.0), Map.entry("four", 4.0), Map.entry("five", 5.0), Map.entry("six", 6.0),
			Map.entry("seven", 7.0), Map.entry("eight", 8.0), Map.entry("nine", 9.0), Map.entry("ten", 10.0),
			Map.entry("eleven", 11.0), Map.entry("twelve", 12.0), Map.entry("a dozen", 12.0),
			Map.entry("dozen", 12.0), Map.entry("half a", 0.5), Map.entry("half", 0.5));

	private static final Set<String> SINGLE_ARTICLES = Set.of("a", "an");

	private static final Set<String> NON_INGREDIENT_WORDS = Set.of("allergy", "allergies", "intolerance",
			"sensitivity", "question", "questions", "idea", "ideas", "problem", "issue", "doubt", "request",
			"craving", "preference", "diet", "restriction", "condition", "minute", "minutes", "hour", "hours",
			"kid", "kids", "child", "children", "guest", "guests", "friend", "friends", "family", "recipe",
			"recipes", "meal", "meals", "plan", "kitchen", "oven", "stove", "microwave", "time");

	private static final Pattern TRAILING_CONJUNCTION = Pattern.compile("\\s+(?:and|then)$");

	private static final int MAX_NAME_WORDS = 4;

	private record VerbSpan(int start, int end, int sign) {
	}

	/**
	 * @param deltas deltas with a known quantity, in message order
	 * @param missingQuantity item names mentioned with a strong add/remove verb but no quantity
	 */
	public record Result(List<InventoryDelta> deltas, List<String> missingQuantity) {

		public Result {
			deltas = List.copyOf(deltas);
			missingQuantity = List.copyOf(missingQuantity);
		}

		public boolean mentionsMutation() {
			return !deltas.isEmpty() || !missingQuantity.isEmpty();
		}
	}

	public Result parse(String message) {
		List<InventoryDelta> deltas = new ArrayList<>();
		List<String> missing = new ArrayList<>();
		if (message == null || message.isBlank()) {
			return new Result(deltas, missing);
		}
		String lower = message.toLowerCase(Locale.ROOT).replace('’', '\'');
		for (String sentence : SENTENCE_BREAK.split(lower)) {
			String trimmed = sentence.trim();
			if (trimmed.isEmpty()) {
				continue;
			}
			if (parseSigned(trimmed, deltas)) {
				continue;
			}
			if (!parseVerbPhrases(trimmed, deltas, missing)) {
				Matcher weakAdd = WEAK_ADD.matcher(trimmed);
				if (weakAdd.find()) {
					parseItems(weakAdd.group(1), 1, false, deltas, missing);
				}
			}
		}
		return new Result(deltas, missing);
	}

	/**
	 * Each add or remove verb governs the text up to the next verb, so "bought 2 eggs and used
	 * 1 onion" yields both deltas.
	 */
	private boolean parseVerbPhrases(String sentence, List<InventoryDelta> deltas, List<String> missing) {
		Matcher verb = VERB.matcher(sentence);
		List<VerbSpan> spans = new ArrayList<>();
		while (verb.find()) {
			spans.add(new VerbSpan(verb.start(), verb.end(), verb.group(1) != null ? 1 : -1));
		}
		for (int i = 0; i < spans.size(); i++) {
			int to = i + 1 < spans.size() ? spans.get(i + 1).start() : sentence.length();
			String phrase = sentence.substring(spans.get(i).end(), to).trim();
			phrase = TRAILING_CONJUNCTION.matcher(phrase).replaceFirst("");
			parseItems(phrase, spans.get(i).sign(), true, deltas, missing);
		}
		return !spans.isEmpty();
	}

	private boolean parseSigned(String sentence, List<InventoryDelta> deltas) {
		if (!sentence.startsWith("+") && !sentence.startsWith("-")) {
			return false;
		}
		boolean any = false;
		for (String part : ITEM_SEPARATOR.split(sentence)) {
			Matcher m = SIGNED_ITEM.matcher(part.trim());
			if (!m.matches()) {
				continue;
			}
			String name = cleanName(m.group(4));
			if (name.isEmpty()) {
				continue;
			}
			double amount = Double.parseDouble(m.group(2));
			if (amount == 0) {
				continue;
			}
			deltas.add(new InventoryDelta(name, "-".equals(m.group(1)) ? -amount : amount, m.group(3)));
			any = true;
		}
		return any;
	}

	private void parseItems(String phrase, int sign, boolean strongVerb, List<InventoryDelta> deltas,
			List<String> missing) {
		for (String part : ITEM_SEPARATOR.split(phrase)) {
			String item = part.trim();
			if (item.isEmpty()) {
				continue;
			}
			String firstWord = item.split("\\s+")[0];
			if (CLAUSE_STARTERS.contains(firstWord)) {
				break;
			}
			Matcher quantified = QUANTIFIED_ITEM.matcher(item);
			if (quantified.matches()) {
				String name = cleanName(quantified.group(3));
				if (!strongVerb && SINGLE_ARTICLES.contains(quantified.group(1))) {
					continue;
				}
				if (!name.isEmpty()) {
					double amount = quantity(quantified.group(1));
					deltas.add(new InventoryDelta(name, sign * amount, quantified.group(2)));
				}
				continue;
			}
			Matcher bare = BARE_ITEM.matcher(item);
			if (strongVerb && bare.matches()) {
				String name = cleanName(bare.group(1));
				if (!name.isEmpty()) {
					missing.add(name);
				}
			}
		}
	}

	private static double quantity(String token) {
		Double word = NUMBER_WORDS.get(token);
		return word != null ? word : Double.parseDouble(token);
	}

	private static String cleanName(String raw) {
		String name = raw.trim();
		name = FILLER_PREFIX.matcher(name).replaceFirst("");
		name = FILLER_SUFFIX.matcher(name).replaceFirst("");
		name = IngredientNames.normalize(name);
		if (name.isEmpty() || name.split(" ").length > MAX_NAME_WORDS) {
			return "";
		}
		for (String word : name.split(" ")) {
			if (NON_INGREDIENT_WORDS.contains(word)) {
				return "";
			}
		}
		return name;
	}
}
