package org.javai.springai.pantry.intent;

import java.util.List;
import java.util.Objects;
import org.javai.springai.pantry.model.InventoryDelta;

/**
 * What the household asked for in one message. A message may carry more than one intent;
 * see {@link IntentClassification} for the ordering contract.
 */
public sealed interface Intent {

	/**
	 * Short stable name used in logs and plans.
	 */
	String kind();

	/** Add to or take from the pantry. */
	record MutatePantry(List<InventoryDelta> deltas) implements Intent {
		public MutatePantry {
			deltas = deltas != null ? List.copyOf(deltas) : List.of();
			if (deltas.isEmpty()) {
				throw new IllegalArgumentException("a pantry mutation needs at least one delta");
			}
		}

		@Override
		public String kind() {
			return "mutate_pantry";
		}
	}

	/** Find recipes for what is in the pantry, optionally steered by a free-text query. */
	record SearchRecipes(String query) implements Intent {
		public SearchRecipes {
			query = query != null ? query.trim() : "";
		}

		@Override
		public String kind() {
			return "search_recipes";
		}
	}

	/** Pick one of the pending recommendations (1-based). */
	record SelectRecommendation(int index) implements Intent {
		public SelectRecommendation {
			if (index < 1) {
				throw new IllegalArgumentException("selection index is 1-based");
			}
		}

		@Override
		public String kind() {
			return "select_recommendation";
		}
	}

	/**
	 * A question that needs no recipe, or a message that only states preferences.
	 */
	record GeneralQuery(String question, boolean preferencesOnly) implements Intent {
		public GeneralQuery {
			question = question != null ? question.trim() : "";
		}

		@Override
		public String kind() {
			return preferencesOnly ? "state_preferences" : "general_query";
		}
	}

	/** The message could not be acted on; the household is asked to clarify. */
	record Ambiguous(String reason, String clarifyingQuestion) implements Intent {
		public Ambiguous {
			Objects.requireNonNull(reason, "reason must not be null");
			Objects.requireNonNull(clarifyingQuestion, "clarifyingQuestion must not be null");
		}

		@Override
		public String kind() {
			return "ambiguous";
		}
	}
}
