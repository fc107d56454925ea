package org.javai.springai.pantry.intent;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.javai.springai.pantry.intent.IntentClassification.Source;
import org.javai.springai.pantry.model.PreferenceDelta;

/**
 * Deterministic classifier built from phrase patterns.
 *
 * <p>Returns empty when no pattern applies, so a model-backed classifier can be consulted.</p>
 */
public class RuleBasedIntentClassifier implements IntentClassifier {

	static final double RULE_CONFIDENCE = 0.9;

	private static final Pattern SEARCH = Pattern.compile(
			"\\b(?:recipes?|dish(?:es)?|meals?|dinner|lunch|breakfast|supper|brunch|snacks?|dessert)\\b"
					+ "|\\bwhat (?:can|could|should|shall) (?:i|we) (?:make|cook|eat|prepare|have for)\\b"
					+ "|\\b(?:suggest|recommend|ideas?)\\b"
					+ "|\\bsomething to (?:make|cook|eat)\\b"
					+ "|\\bcook (?:something|tonight)\\b"
					+ "|\\bhungry\\b");
	private static final Pattern BARE_SELECTION = Pattern.compile(
			"^\\s*(?:#|no\\.?\\s*|number\\s+|option\\s+|recipe\\s+)?(\\d{1,3})\\s*[.!]?\\s*$");
	private static final String CHOICE = "(\\d{1,3}|first|second|third|last|one|two|three|1st|2nd|3rd)";
	private static final Pattern PHRASE_SELECTION = Pattern.compile(
			"\\b(?:i'll take|i will take|i'll have|i want|i'd like|let's do|let's go with|let's make|lets make"
					+ "|go with|choose|pick|select|take|make|try)\\s+(?:the\\s+|number\\s+|option\\s+|recipe\\s+|#)*"
					+ CHOICE + "(?:\\s+(?:one|option|recipe))?\\s*(?:[.!,]|please|$)");
	private static final Pattern ORDINAL_SELECTION = Pattern.compile(
			"^\\s*(?:the\\s+)?(first|second|third|last|1st|2nd|3rd)(?:\\s+(?:one|option|recipe))?(?:\\s+please)?\\s*[.!]?\\s*$");
	private static final Pattern QUESTION_START = Pattern.compile(
			"^(?:what|how|why|when|where|which|who|can|could|is|are|do|does|should|would|tell me|explain)\\b");

	private static final Map<String, Integer> ORDINALS = Map.of(
			"first", 1, "1st", 1, "one", 1,
			"second", 2, "2nd", 2, "two", 2,
			"third", 3, "3rd", 3, "three", 3);

	private final PantryDeltaParser deltaParser;
	private final PreferenceExtractor preferenceExtractor;

	public RuleBasedIntentClassifier() {
		this(new PantryDeltaParser(), new PreferenceExtractor());
	}

	public RuleBasedIntentClassifier(PantryDeltaParser deltaParser, PreferenceExtractor preferenceExtractor) {
		this.deltaParser = deltaParser;
		this.preferenceExtractor = preferenceExtractor;
	}

	@Override
	public Optional<IntentClassification> classify(ClassificationContext context) {
		String text = context.message().toLowerCase(Locale.ROOT).replace('’', '\'').trim();
		PreferenceDelta delta = preferenceExtractor.extract(context.message(), context.preferences());
		PantryDeltaParser.Result mutation = deltaParser.parse(context.message());

		if (!mutation.missingQuantity().isEmpty()) {
			String items = String.join(", ", mutation.missingQuantity());
			return Optional.of(new IntentClassification(
					List.of(new Intent.Ambiguous("missing quantity for " + items,
							"How much " + items + " was that? For example \"2 " + mutation.missingQuantity().get(0) + "\".")),
					delta, RULE_CONFIDENCE, Source.RULES));
		}

		List<Intent> intents = new ArrayList<>();
		if (!mutation.deltas().isEmpty()) {
			intents.add(new Intent.MutatePantry(mutation.deltas()));
		}

		OptionalInt selection = intents.isEmpty() ? selectionIndex(text, context.pendingCount()) : OptionalInt.empty();
		if (selection.isPresent()) {
			return Optional.of(new IntentClassification(List.of(validateSelection(selection.getAsInt(), context)),
					delta, RULE_CONFIDENCE, Source.RULES));
		}

		if (SEARCH.matcher(text).find()) {
			intents.add(new Intent.SearchRecipes(context.message()));
		}

		if (intents.isEmpty()) {
			if (isQuestion(text)) {
				intents.add(new Intent.GeneralQuery(context.message(), false));
			}
			else if (!delta.isEmpty()) {
				intents.add(new Intent.GeneralQuery(context.message(), true));
			}
			else {
				return Optional.empty();
			}
		}
		return Optional.of(new IntentClassification(intents, delta, RULE_CONFIDENCE, Source.RULES));
	}

	/**
	 * A selection is only valid while options are pending and within range; anything else is a
	 * clarification, never an error.
	 */
	static Intent validateSelection(int index, ClassificationContext context) {
		if (!context.selectionPending()) {
			return new Intent.Ambiguous("invalid selection: no pending recommendations",
					"There are no recipe options to choose from yet. Would you like me to suggest some recipes?");
		}
		if (index < 1 || index > context.pendingCount()) {
			return new Intent.Ambiguous("invalid selection: " + index,
					"Please pick a number between 1 and " + context.pendingCount() + ".");
		}
		return new Intent.SelectRecommendation(index);
	}

	private static OptionalInt selectionIndex(String text, int pendingCount) {
		Matcher bare = BARE_SELECTION.matcher(text);
		if (bare.matches()) {
			return OptionalInt.of(Integer.parseInt(bare.group(1)));
		}
		Matcher ordinal = ORDINAL_SELECTION.matcher(text);
		if (ordinal.matches()) {
			return OptionalInt.of(choice(ordinal.group(1), pendingCount));
		}
		Matcher phrase = PHRASE_SELECTION.matcher(text);
		if (phrase.find()) {
			return OptionalInt.of(choice(phrase.group(1), pendingCount));
		}
		return OptionalInt.empty();
	}

	private static int choice(String token, int pendingCount) {
		if ("last".equals(token)) {
			return pendingCount;
		}
		Integer ordinal = ORDINALS.get(token);
		return ordinal != null ? ordinal : Integer.parseInt(token);
	}

	private static boolean isQuestion(String text) {
		return text.endsWith("?") || QUESTION_START.matcher(text).find();
	}
}
