package org.javai.springai.pantry.conversation;

import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.javai.springai.pantry.testsupport.PantryFixtures.recipe;
import static org.javai.springai.pantry.testsupport.PantryFixtures.recommendation;

import java.util.List;
import org.javai.springai.pantry.model.Preferences;
import org.javai.springai.pantry.model.RankedRecommendation;
import org.junit.jupiter.api.Test;

class ConversationStateValidatorTest {

	private final RankedRecommendation rice = recommendation(recipe("rice", "rice", "garlic"), 90);
	private final RankedRecommendation soup = recommendation(recipe("soup", "carrot", "onion"), 80);

	private ConversationState state(ConversationStage stage, List<RankedRecommendation> pending) {
		return new ConversationState("s1", stage, Preferences.none(), null, pending, null);
	}

	@Test
	void acceptsRestingStates() {
		assertThatCode(() -> ConversationStateValidator.validate(ConversationState.initial("s1"))).doesNotThrowAnyException();
		assertThatCode(() -> ConversationStateValidator.validate(
				state(ConversationStage.AWAITING_SELECTION, List.of(rice, soup)))).doesNotThrowAnyException();
	}

	@Test
	void rejectsMidTurnStage() {
		assertThatThrownBy(() -> ConversationStateValidator.validate(state(ConversationStage.SEARCHING, List.of())))
				.isInstanceOf(SessionStateCorruptException.class)
				.hasMessage("Session persisted mid-turn in stage SEARCHING");
	}

	@Test
	void rejectsAwaitingSelectionWithNothingPending() {
		assertThatThrownBy(() -> ConversationStateValidator.validate(state(ConversationStage.AWAITING_SELECTION, List.of())))
				.isInstanceOf(SessionStateCorruptException.class)
				.hasMessage("Awaiting a selection with no pending candidates");
	}

	@Test
	void rejectsPendingOutsideSelection() {
		assertThatThrownBy(() -> ConversationStateValidator.validate(state(ConversationStage.COLLECTING_PREFS, List.of(rice))))
				.isInstanceOf(SessionStateCorruptException.class)
				.hasMessage("Pending candidates outside AWAITING_SELECTION");
	}

	@Test
	void rejectsTooManyOrDuplicateCandidates() {
		RankedRecommendation stew = recommendation(recipe("stew", "beef"), 70);
		RankedRecommendation salad = recommendation(recipe("salad", "lettuce"), 60);

		assertThatThrownBy(() -> ConversationStateValidator.validate(
				state(ConversationStage.AWAITING_SELECTION, List.of(rice, soup, stew, salad))))
				.hasMessage("4 pending candidates exceed the maximum");
		assertThatThrownBy(() -> ConversationStateValidator.validate(
				state(ConversationStage.AWAITING_SELECTION, List.of(rice, rice))))
				.hasMessage("Duplicate pending candidate rice")
				.extracting(e -> ((SessionStateCorruptException) e).sessionId())
				.isEqualTo("s1");
	}
}
