package org.javai.springai.pantry.delegation;

import java.util.List;

/**
 * Known ingredient alternatives, best first.
 */
public interface SubstitutionCatalog {

	/**
	 * @return alternatives for the ingredient, or an empty list when none are known
	 */
	List<String> lookup(String ingredient);
}
