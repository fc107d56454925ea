package org.javai.springai.pantry.delegation;

import java.util.List;

/**
 * Model output parsed as JSON but did not have the expected shape.
 */
public class SchemaViolationException extends TextGenerationException {

	private final List<String> problems;

	public SchemaViolationException(String schemaName, List<String> problems) {
		super("Response does not match schema '" + schemaName + "': " + String.join("; ", problems));
		this.problems = List.copyOf(problems);
	}

	public List<String> problems() {
		return problems;
	}
}
