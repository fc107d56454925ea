package org.javai.springai.pantry.delegation;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * A language model that answers with JSON.
 *
 * <p>The answer is not trusted: callers validate it against the {@link ExpectedSchema} they asked
 * for and treat a mismatch as the collaborator being unavailable.</p>
 */
public interface TextGenerationCapability {

	/**
	 * @throws TextGenerationException when no usable JSON could be obtained
	 */
	JsonNode complete(String prompt, ExpectedSchema schema);
}
