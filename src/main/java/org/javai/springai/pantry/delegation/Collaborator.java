package org.javai.springai.pantry.delegation;

/**
 * The external subsystems a turn may delegate to. Timeouts are configured per collaborator.
 */
public enum Collaborator {
	INVENTORY_STORE,
	SEARCH_INDEX,
	KEYWORD_INDEX,
	TEXT_GENERATION,
	SUBSTITUTION_CATALOG
}
