package org.javai.springai.pantry.delegation;

import java.util.Locale;

/**
 * No collaborator is configured for a request.
 */
public class CollaboratorUnavailableException extends RuntimeException {

	public CollaboratorUnavailableException(Collaborator collaborator) {
		super("No " + collaborator.name().toLowerCase(Locale.ROOT) + " collaborator configured");
	}
}
