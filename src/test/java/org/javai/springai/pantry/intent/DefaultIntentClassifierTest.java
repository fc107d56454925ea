package org.javai.springai.pantry.intent;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;
import org.javai.springai.pantry.conversation.ConversationStage;
import org.javai.springai.pantry.intent.IntentClassification.Source;
import org.javai.springai.pantry.model.PreferenceDelta;
import org.javai.springai.pantry.model.Preferences;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("DefaultIntentClassifier")
class DefaultIntentClassifierTest {

	private static ClassificationContext context(String message) {
		return new ClassificationContext(ConversationStage.COLLECTING_PREFS, message, Preferences.none(), 0);
	}

	@Test
	@DisplayName("does not consult the model when the rules decide")
	void rulesFirst() {
		AtomicInteger modelCalls = new AtomicInteger();
		IntentClassifier model = context -> {
			modelCalls.incrementAndGet();
			return Optional.empty();
		};
		DefaultIntentClassifier classifier = new DefaultIntentClassifier(new RuleBasedIntentClassifier(), model);

		IntentClassification result = classifier.resolve(context("What can I make for dinner?"));

		assertThat(result.source()).isEqualTo(Source.RULES);
		assertThat(modelCalls).hasValue(0);
	}

	@Test
	@DisplayName("uses the model when the rules decline")
	void modelSecond() {
		IntentClassification fromModel = new IntentClassification(List.of(new Intent.SearchRecipes("something warm")),
				PreferenceDelta.empty(), 0.8, Source.MODEL);
		DefaultIntentClassifier classifier = new DefaultIntentClassifier(new RuleBasedIntentClassifier(),
				context -> Optional.of(fromModel));

		assertThat(classifier.resolve(context("hmm, something warm"))).isSameAs(fromModel);
	}

	@Test
	@DisplayName("asks for clarification when nothing recognizes the message")
	void clarification() {
		DefaultIntentClassifier classifier = new DefaultIntentClassifier();

		IntentClassification result = classifier.resolve(context("hello there"));

		assertThat(result.source()).isEqualTo(Source.FALLBACK);
		assertThat(result.primary()).isInstanceOfSatisfying(Intent.Ambiguous.class, ambiguous ->
				assertThat(ambiguous.clarifyingQuestion()).isEqualTo(DefaultIntentClassifier.CLARIFY));
	}
}
