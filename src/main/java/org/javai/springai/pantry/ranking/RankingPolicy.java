package org.javai.springai.pantry.ranking;

/**
 * Weights and limits for {@link HybridRanker}.
 *
 * @param semanticWeight weight of semantic similarity
 * @param coverageWeight weight of pantry coverage
 * @param allowMissing maximum missing ingredients in the primary pass
 * @param relaxationIncrement added to {@code allowMissing} for the single relaxation pass
 * @param urgencyWindowDays items expiring within this many days earn a bonus
 * @param expiryBonusScale bonus for an ingredient is {@code scale / (daysRemaining + 1)}
 * @param expiryBonusPerIngredientCap maximum bonus from one ingredient
 * @param expiryBonusTotalCap maximum bonus for a recipe
 * @param maxRecommendations number of recommendations returned
 */
public record RankingPolicy(
		double semanticWeight,
		double coverageWeight,
		int allowMissing,
		int relaxationIncrement,
		int urgencyWindowDays,
		double expiryBonusScale,
		double expiryBonusPerIngredientCap,
		double expiryBonusTotalCap,
		int maxRecommendations
) {

	public RankingPolicy {
		if (semanticWeight < 0 || coverageWeight < 0 || semanticWeight + coverageWeight <= 0) {
			throw new IllegalArgumentException("weights must be non-negative and not both zero");
		}
		if (allowMissing < 0 || relaxationIncrement < 0) {
			throw new IllegalArgumentException("allowMissing and relaxationIncrement must be >= 0");
		}
		if (urgencyWindowDays < 0) {
			throw new IllegalArgumentException("urgencyWindowDays must be >= 0");
		}
		if (expiryBonusScale < 0 || expiryBonusPerIngredientCap < 0 || expiryBonusTotalCap < 0) {
			throw new IllegalArgumentException("expiry bonus settings must be >= 0");
		}
		if (maxRecommendations < 1) {
			throw new IllegalArgumentException("maxRecommendations must be >= 1");
		}
	}

	public static RankingPolicy defaults() {
		return new RankingPolicy(0.35, 0.65, 2, 2, 3, 10.0, 10.0, 15.0, 3);
	}

	public RankingPolicy withAllowMissing(int value) {
		return new RankingPolicy(semanticWeight, coverageWeight, value, relaxationIncrement, urgencyWindowDays,
				expiryBonusScale, expiryBonusPerIngredientCap, expiryBonusTotalCap, maxRecommendations);
	}

	public RankingPolicy withWeights(double semantic, double coverage) {
		return new RankingPolicy(semantic, coverage, allowMissing, relaxationIncrement, urgencyWindowDays,
				expiryBonusScale, expiryBonusPerIngredientCap, expiryBonusTotalCap, maxRecommendations);
	}
}
