package org.javai.springai.pantry.ranking;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import org.javai.springai.pantry.model.CandidateRecipe;
import org.javai.springai.pantry.model.IngredientNames;
import org.javai.springai.pantry.model.PantryItem;
import org.javai.springai.pantry.model.Preferences;
import org.javai.springai.pantry.model.RankedRecommendation;
import org.javai.springai.pantry.model.ScoredRecipe;
import org.javai.springai.pantry.safety.DietCompliance;
import org.javai.springai.pantry.safety.SafetyRules;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Combines semantic similarity, pantry coverage and expiration urgency into one score.
 *
 * <p>Allergies and dietary violations are hard filters applied before any scoring and are never
 * relaxed. The missing-ingredient allowance is also a hard filter, widened exactly once when
 * fewer than the requested number of recommendations qualify. Identical inputs always produce
 * identical output.</p>
 */
public class HybridRanker {

	private static final Logger logger = LoggerFactory.getLogger(HybridRanker.class);

	private static final Comparator<Evaluation> ORDER = Comparator
			.comparingDouble(Evaluation::composite).reversed()
			.thenComparingInt(e -> e.missing().size())
			.thenComparing(Comparator.comparingInt((Evaluation e) -> e.expiringUsed().size()).reversed())
			.thenComparing(e -> e.recipe().id());

	private final RankingPolicy policy;
	private final Clock clock;

	public HybridRanker() {
		this(RankingPolicy.defaults(), Clock.systemDefaultZone());
	}

	public HybridRanker(RankingPolicy policy, Clock clock) {
		this.policy = policy;
		this.clock = clock;
	}

	public RankingPolicy policy() {
		return policy;
	}

	public RankingResult rank(List<ScoredRecipe> candidates, List<PantryItem> pantry, Preferences preferences) {
		return rank(candidates, pantry, preferences, policy.allowMissing());
	}

	/**
	 * @param allowMissing missing-ingredient allowance for the primary pass
	 */
	public RankingResult rank(List<ScoredRecipe> candidates, List<PantryItem> pantry, Preferences preferences,
			int allowMissing) {
		LocalDate today = LocalDate.now(clock);
		List<PantryItem> available = pantry.stream().filter(PantryItem::isAvailable).toList();

		int excludedByAllergy = 0;
		int excludedByDiet = 0;
		List<Evaluation> safe = new ArrayList<>();
		for (ScoredRecipe candidate : distinctById(candidates)) {
			CandidateRecipe recipe = candidate.recipe();
			Optional<String> allergen = SafetyRules.recipeAllergen(recipe, preferences.allergies());
			if (allergen.isPresent()) {
				logger.debug("Excluding {}: contains allergen {}", recipe.id(), allergen.get());
				excludedByAllergy++;
				continue;
			}
			DietCompliance compliance = SafetyRules.dietCompliance(recipe, preferences.dietaryRestrictions());
			if (compliance == DietCompliance.VIOLATES) {
				logger.debug("Excluding {}: violates {}", recipe.id(), preferences.dietaryRestrictions());
				excludedByDiet++;
				continue;
			}
			safe.add(evaluate(candidate, available, today, compliance == DietCompliance.UNVERIFIED));
		}
		safe.sort(ORDER);

		List<Evaluation> selected = new ArrayList<>();
		for (Evaluation evaluation : safe) {
			if (selected.size() < policy.maxRecommendations() && evaluation.missing().size() <= allowMissing) {
				selected.add(evaluation);
			}
		}
		boolean relaxed = false;
		if (selected.size() < policy.maxRecommendations() && policy.relaxationIncrement() > 0) {
			int relaxedAllowance = allowMissing + policy.relaxationIncrement();
			for (Evaluation evaluation : safe) {
				if (selected.size() >= policy.maxRecommendations()) {
					break;
				}
				if (!selected.contains(evaluation) && evaluation.missing().size() <= relaxedAllowance) {
					selected.add(evaluation);
					relaxed = true;
				}
			}
			if (relaxed) {
				selected.sort(ORDER);
				logger.debug("Relaxed allow-missing from {} to {}", allowMissing, relaxedAllowance);
			}
		}

		if (selected.isEmpty()) {
			return noSafeMatch(safe, excludedByAllergy, excludedByDiet);
		}
		List<RankedRecommendation> recommendations = selected.stream().map(Evaluation::toRecommendation).toList();
		logger.debug("Ranked {} of {} candidate(s); top: {}", recommendations.size(), candidates.size(),
				recommendations.get(0).recipeId());
		return new RankingResult(recommendations, relaxed, List.of(), List.of(), excludedByAllergy, excludedByDiet);
	}

	private RankingResult noSafeMatch(List<Evaluation> safe, int excludedByAllergy, int excludedByDiet) {
		List<Evaluation> closest = new ArrayList<>(safe);
		closest.sort(Comparator.comparingInt((Evaluation e) -> e.missing().size()).thenComparing(ORDER));
		List<Evaluation> top = closest.subList(0, Math.min(policy.maxRecommendations(), closest.size()));
		Set<String> shopping = new TreeSet<>();
		top.forEach(e -> shopping.addAll(e.missing()));
		logger.info("No safe match; {} safe candidate(s) considered, shopping list of {}", safe.size(), shopping.size());
		return RankingResult.noSafeMatch(List.copyOf(shopping), top.stream().map(Evaluation::recipe).toList(),
				excludedByAllergy, excludedByDiet);
	}

	private Evaluation evaluate(ScoredRecipe candidate, List<PantryItem> available, LocalDate today,
			boolean dietUnverified) {
		CandidateRecipe recipe = candidate.recipe();
		Set<String> ingredients = recipe.ingredientSet();
		Set<String> missing = new TreeSet<>();
		Set<String> expiringUsed = new TreeSet<>();
		double bonus = 0.0;
		int covered = 0;
		for (String ingredient : ingredients) {
			List<PantryItem> matches = available.stream()
					.filter(item -> IngredientNames.covers(item.name(), ingredient))
					.toList();
			if (matches.isEmpty()) {
				missing.add(ingredient);
				continue;
			}
			covered++;
			Optional<PantryItem> soonest = matches.stream()
					.filter(item -> item.daysUntilExpiry(today).map(d -> d >= 0 && d <= policy.urgencyWindowDays()).orElse(false))
					.min(Comparator.comparing(PantryItem::expirationDate).thenComparing(PantryItem::name));
			if (soonest.isPresent()) {
				long days = soonest.get().daysUntilExpiry(today).orElseThrow();
				bonus += Math.min(policy.expiryBonusScale() / (days + 1), policy.expiryBonusPerIngredientCap());
				expiringUsed.add(soonest.get().name());
			}
		}
		double coverage = ingredients.isEmpty() ? 0.0 : (double) covered / ingredients.size();
		bonus = Math.min(bonus, policy.expiryBonusTotalCap());
		double composite = policy.semanticWeight() * candidate.similarity() * 100
				+ policy.coverageWeight() * coverage * 100
				+ bonus;
		composite = round(Math.max(0.0, Math.min(100.0, composite)));
		return new Evaluation(candidate, composite, round(coverage), List.copyOf(missing), List.copyOf(expiringUsed),
				dietUnverified);
	}

	private static List<ScoredRecipe> distinctById(List<ScoredRecipe> candidates) {
		Map<String, ScoredRecipe> best = new LinkedHashMap<>();
		for (ScoredRecipe candidate : candidates) {
			best.merge(candidate.recipe().id(), candidate,
					(a, b) -> b.similarity() > a.similarity() ? b : a);
		}
		return new ArrayList<>(best.values());
	}

	private static double round(double value) {
		return BigDecimal.valueOf(value).setScale(4, RoundingMode.HALF_UP).doubleValue();
	}

	private record Evaluation(
			ScoredRecipe scored,
			double composite,
			double coverage,
			List<String> missing,
			List<String> expiringUsed,
			boolean dietUnverified
	) {

		CandidateRecipe recipe() {
			return scored.recipe();
		}

		RankedRecommendation toRecommendation() {
			return new RankedRecommendation(scored.recipe(), composite, coverage, missing,
					!expiringUsed.isEmpty(), expiringUsed, dietUnverified);
		}
	}
}
