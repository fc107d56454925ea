package org.javai.springai.pantry.synthesis;

import java.util.ArrayList;
import java.util.List;
import org.javai.springai.pantry.adaptation.AdaptedRecipe;
import org.javai.springai.pantry.model.RankedRecommendation;
import org.javai.springai.pantry.safety.ConstraintViolation;

/**
 * The contract of a response. Explanation text is derived from it; nothing in the explanation
 * may contradict it.
 *
 * @param pantrySummary the pantry, when the turn read or changed it
 * @param recommendations recommendations awaiting selection, best first
 * @param adaptedRecipe the adapted recipe, only after it passed the quality gate
 * @param textAnswer answer to a general question or a clarifying question
 * @param shoppingList what to buy, for an adapted recipe or a no-safe-match result
 * @param violations reasons content was withheld
 * @param notices disclosures such as degraded service or unverified diet compliance
 */
public record StructuredPayload(
		PantrySummary pantrySummary,
		List<RankedRecommendation> recommendations,
		AdaptedRecipe adaptedRecipe,
		String textAnswer,
		List<String> shoppingList,
		List<ConstraintViolation> violations,
		List<String> notices
) {

	public StructuredPayload {
		recommendations = recommendations != null ? List.copyOf(recommendations) : List.of();
		shoppingList = shoppingList != null ? List.copyOf(shoppingList) : List.of();
		violations = violations != null ? List.copyOf(violations) : List.of();
		notices = notices != null ? List.copyOf(notices) : List.of();
	}

	public static StructuredPayload empty() {
		return new StructuredPayload(null, List.of(), null, null, List.of(), List.of(), List.of());
	}

	public static Builder builder() {
		return new Builder();
	}

	public boolean isRecipeBearing() {
		return !recommendations.isEmpty() || adaptedRecipe != null;
	}

	public static final class Builder {
		private PantrySummary pantrySummary;
		private List<RankedRecommendation> recommendations = List.of();
		private AdaptedRecipe adaptedRecipe;
		private String textAnswer;
		private List<String> shoppingList = List.of();
		private final List<ConstraintViolation> violations = new ArrayList<>();
		private final List<String> notices = new ArrayList<>();

		private Builder() {
		}

		public Builder pantrySummary(PantrySummary pantrySummary) {
			this.pantrySummary = pantrySummary;
			return this;
		}

		public Builder recommendations(List<RankedRecommendation> recommendations) {
			this.recommendations = recommendations;
			return this;
		}

		public Builder adaptedRecipe(AdaptedRecipe adaptedRecipe) {
			this.adaptedRecipe = adaptedRecipe;
			return this;
		}

		public Builder textAnswer(String textAnswer) {
			this.textAnswer = textAnswer;
			return this;
		}

		public Builder shoppingList(List<String> shoppingList) {
			this.shoppingList = shoppingList;
			return this;
		}

		public Builder violations(List<ConstraintViolation> violations) {
			this.violations.addAll(violations);
			return this;
		}

		public Builder notice(String notice) {
			if (!notices.contains(notice)) {
				this.notices.add(notice);
			}
			return this;
		}

		public StructuredPayload build() {
			return new StructuredPayload(pantrySummary, recommendations, adaptedRecipe, textAnswer, shoppingList,
					violations, notices);
		}
	}
}
