package org.javai.springai.pantry.intent;

import java.util.Optional;
import org.javai.springai.pantry.model.PreferenceDelta;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Rules first, then the model (when configured), then a clarifying question.
 */
public class DefaultIntentClassifier implements IntentClassifier {

	private static final Logger logger = LoggerFactory.getLogger(DefaultIntentClassifier.class);

	static final String CLARIFY = "I can update your pantry, suggest recipes from it, or answer a cooking question. "
			+ "Which would you like?";

	private final IntentClassifier rules;
	private final IntentClassifier model;
	private final PreferenceExtractor preferenceExtractor;

	public DefaultIntentClassifier(IntentClassifier rules, IntentClassifier model) {
		this.rules = rules;
		this.model = model;
		this.preferenceExtractor = new PreferenceExtractor();
	}

	public DefaultIntentClassifier() {
		this(new RuleBasedIntentClassifier(), null);
	}

	@Override
	public Optional<IntentClassification> classify(ClassificationContext context) {
		return Optional.of(resolve(context));
	}

	/**
	 * Always produces a classification.
	 */
	public IntentClassification resolve(ClassificationContext context) {
		Optional<IntentClassification> byRules = rules.classify(context);
		if (byRules.isPresent()) {
			logger.debug("Classified by rules: {}", byRules.get().intents());
			return byRules.get();
		}
		if (model != null) {
			Optional<IntentClassification> byModel = model.classify(context);
			if (byModel.isPresent()) {
				logger.debug("Classified by model: {}", byModel.get().intents());
				return byModel.get();
			}
		}
		PreferenceDelta delta = preferenceExtractor.extract(context.message(), context.preferences());
		logger.debug("No classifier matched; asking for clarification");
		return IntentClassification.ambiguous("no intent recognized", CLARIFY, delta);
	}
}
