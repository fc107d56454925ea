package org.javai.springai.pantry.ranking;

import java.util.List;
import org.javai.springai.pantry.model.CandidateRecipe;
import org.javai.springai.pantry.model.RankedRecommendation;

/**
 * Output of one ranking.
 *
 * @param recommendations top recommendations, best first; empty when nothing safe qualified
 * @param relaxed whether the single allow-missing relaxation contributed recommendations
 * @param shoppingList for a no-safe-match result, what to buy to cook the closest safe candidates
 * @param closestCandidates for a no-safe-match result, the allergy- and diet-safe recipes that came closest
 * @param excludedByAllergy candidates dropped by the allergy filter
 * @param excludedByDiet candidates dropped by the diet filter
 */
public record RankingResult(
		List<RankedRecommendation> recommendations,
		boolean relaxed,
		List<String> shoppingList,
		List<CandidateRecipe> closestCandidates,
		int excludedByAllergy,
		int excludedByDiet
) {

	public RankingResult {
		recommendations = recommendations != null ? List.copyOf(recommendations) : List.of();
		shoppingList = shoppingList != null ? List.copyOf(shoppingList) : List.of();
		closestCandidates = closestCandidates != null ? List.copyOf(closestCandidates) : List.of();
	}

	public static RankingResult noSafeMatch(List<String> shoppingList, List<CandidateRecipe> closest,
			int excludedByAllergy, int excludedByDiet) {
		return new RankingResult(List.of(), true, shoppingList, closest, excludedByAllergy, excludedByDiet);
	}

	public boolean isNoSafeMatch() {
		return recommendations.isEmpty();
	}
}
