package org.javai.springai.pantry.intent;

import java.util.Optional;

/**
 * Turns a message into intents and a preference delta.
 */
public interface IntentClassifier {

	/**
	 * @return the classification, or empty when this classifier cannot decide
	 */
	Optional<IntentClassification> classify(ClassificationContext context);
}
