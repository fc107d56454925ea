package org.javai.springai.pantry.planning;

/**
 * Who performs a plan step.
 */
public enum PlanActor {
	INVENTORY_STORE,
	SEARCH_INDEX,
	TEXT_GENERATION,
	SUBSTITUTION_CATALOG,
	HYBRID_RANKER,
	RECIPE_ADAPTER,
	QUALITY_GATE,
	SYNTHESIZER
}
