package org.javai.springai.pantry.intent;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import org.javai.springai.pantry.model.PreferenceDelta;

/**
 * Classifier output for one message.
 *
 * <p>Intents are always ordered so that a {@link Intent.MutatePantry} precedes a
 * {@link Intent.SearchRecipes}: the search must see the pantry the mutation produced. The
 * constructor enforces the order whatever order the intents were supplied in.</p>
 *
 * @param intents the intents, mutation first
 * @param preferenceDelta preference changes stated in the message (never null)
 * @param confidence confidence in [0,1]
 * @param source which classifier produced this
 */
public record IntentClassification(
		List<Intent> intents,
		PreferenceDelta preferenceDelta,
		double confidence,
		Source source
) {

	public enum Source {
		RULES,
		MODEL,
		FALLBACK
	}

	public IntentClassification {
		List<Intent> ordered = new ArrayList<>(intents != null ? intents : List.of());
		if (ordered.isEmpty()) {
			throw new IllegalArgumentException("a classification needs at least one intent");
		}
		ordered.sort(Comparator.comparingInt(IntentClassification::executionOrder));
		intents = List.copyOf(ordered);
		preferenceDelta = preferenceDelta != null ? preferenceDelta : PreferenceDelta.empty();
		if (confidence < 0.0 || confidence > 1.0) {
			throw new IllegalArgumentException("confidence must be within [0,1]");
		}
		if (source == null) {
			source = Source.RULES;
		}
	}

	public static IntentClassification ambiguous(String reason, String question, PreferenceDelta delta) {
		return new IntentClassification(List.of(new Intent.Ambiguous(reason, question)), delta, 0.0, Source.FALLBACK);
	}

	public Intent primary() {
		return intents.get(0);
	}

	public boolean isAmbiguous() {
		return intents.stream().anyMatch(Intent.Ambiguous.class::isInstance);
	}

	public <T extends Intent> Optional<T> find(Class<T> type) {
		return intents.stream().filter(type::isInstance).map(type::cast).findFirst();
	}

	public boolean has(Class<? extends Intent> type) {
		return intents.stream().anyMatch(type::isInstance);
	}

	/**
	 * Stable sort keys: mutations run first, then searches, then everything else.
	 */
	private static int executionOrder(Intent intent) {
		if (intent instanceof Intent.MutatePantry) {
			return 0;
		}
		if (intent instanceof Intent.SearchRecipes) {
			return 1;
		}
		return 2;
	}
}
