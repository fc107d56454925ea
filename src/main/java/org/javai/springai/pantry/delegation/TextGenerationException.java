package org.javai.springai.pantry.delegation;

/**
 * The text-generation capability could not produce a usable answer.
 */
public class TextGenerationException extends RuntimeException {

	public TextGenerationException(String message) {
		super(message);
	}

	public TextGenerationException(String message, Throwable cause) {
		super(message, cause);
	}
}
