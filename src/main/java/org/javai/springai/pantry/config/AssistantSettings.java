package org.javai.springai.pantry.config;

import java.time.Duration;
import java.util.EnumMap;
import java.util.Map;
import org.javai.springai.pantry.delegation.Collaborator;
import org.javai.springai.pantry.delegation.DelegationRouter;
import org.javai.springai.pantry.intent.LlmIntentClassifier;
import org.javai.springai.pantry.ranking.RankingPolicy;

/**
 * Tunable settings of the assistant.
 *
 * <h2>Usage</h2>
 * <pre>{@code
 * // Use defaults
 * AssistantSettings settings = AssistantSettings.defaults();
 *
 * // Custom settings
 * AssistantSettings settings = AssistantSettings.builder()
 *         .sessionIdleTimeout(Duration.ofMinutes(10))
 *         .collaboratorTimeout(Collaborator.TEXT_GENERATION, Duration.ofSeconds(8))
 *         .build();
 * }</pre>
 *
 * @param sessionIdleTimeout sessions untouched for longer are evicted
 * @param defaultCollaboratorTimeout timeout for collaborators without an override
 * @param collaboratorTimeouts per-collaborator timeout overrides
 * @param ranking ranking weights and limits
 * @param modelClassification consult the model when the rules recognize no intent
 * @param classifierConfidenceThreshold model classifications below this confidence are ignored
 * @param modelExplanations let the model rewrite explanations of recipe-bearing responses
 * @param searchTopK candidates requested from the search index per query
 * @param substitutionsResource classpath resource seeding the substitution catalog
 */
public record AssistantSettings(
		Duration sessionIdleTimeout,
		Duration defaultCollaboratorTimeout,
		Map<Collaborator, Duration> collaboratorTimeouts,
		RankingPolicy ranking,
		boolean modelClassification,
		double classifierConfidenceThreshold,
		boolean modelExplanations,
		int searchTopK,
		String substitutionsResource
) {

	public static final Duration DEFAULT_SESSION_IDLE_TIMEOUT = Duration.ofMinutes(30);
	public static final int DEFAULT_SEARCH_TOP_K = 10;
	public static final String DEFAULT_SUBSTITUTIONS_RESOURCE = "substitutions.yml";

	public AssistantSettings {
		if (sessionIdleTimeout == null || sessionIdleTimeout.isNegative() || sessionIdleTimeout.isZero()) {
			throw new IllegalArgumentException("sessionIdleTimeout must be positive");
		}
		if (defaultCollaboratorTimeout == null || defaultCollaboratorTimeout.isNegative()
				|| defaultCollaboratorTimeout.isZero()) {
			throw new IllegalArgumentException("defaultCollaboratorTimeout must be positive");
		}
		collaboratorTimeouts = collaboratorTimeouts != null ? Map.copyOf(collaboratorTimeouts) : Map.of();
		ranking = ranking != null ? ranking : RankingPolicy.defaults();
		if (classifierConfidenceThreshold < 0.0 || classifierConfidenceThreshold > 1.0) {
			throw new IllegalArgumentException("classifierConfidenceThreshold must be within [0,1]");
		}
		if (searchTopK < 1) {
			throw new IllegalArgumentException("searchTopK must be >= 1");
		}
		substitutionsResource = substitutionsResource != null ? substitutionsResource : DEFAULT_SUBSTITUTIONS_RESOURCE;
	}

	public static AssistantSettings defaults() {
		return builder().build();
	}

	public static Builder builder() {
		return new Builder();
	}

	public Duration timeoutFor(Collaborator collaborator) {
		return collaboratorTimeouts.getOrDefault(collaborator, defaultCollaboratorTimeout);
	}

	/**
	 * Builder for {@link AssistantSettings}.
	 */
	public static class Builder {
		private Duration sessionIdleTimeout = DEFAULT_SESSION_IDLE_TIMEOUT;
		private Duration defaultCollaboratorTimeout = DelegationRouter.DEFAULT_TIMEOUT;
		private final Map<Collaborator, Duration> collaboratorTimeouts = new EnumMap<>(Collaborator.class);
		private RankingPolicy ranking = RankingPolicy.defaults();
		private boolean modelClassification = true;
		private double classifierConfidenceThreshold = LlmIntentClassifier.DEFAULT_CONFIDENCE_THRESHOLD;
		private boolean modelExplanations = false;
		private int searchTopK = DEFAULT_SEARCH_TOP_K;
		private String substitutionsResource = DEFAULT_SUBSTITUTIONS_RESOURCE;

		private Builder() {
		}

		public Builder sessionIdleTimeout(Duration timeout) {
			this.sessionIdleTimeout = timeout;
			return this;
		}

		public Builder defaultCollaboratorTimeout(Duration timeout) {
			this.defaultCollaboratorTimeout = timeout;
			return this;
		}

		public Builder collaboratorTimeout(Collaborator collaborator, Duration timeout) {
			this.collaboratorTimeouts.put(collaborator, timeout);
			return this;
		}

		public Builder ranking(RankingPolicy ranking) {
			this.ranking = ranking;
			return this;
		}

		public Builder modelClassification(boolean enabled) {
			this.modelClassification = enabled;
			return this;
		}

		public Builder classifierConfidenceThreshold(double threshold) {
			this.classifierConfidenceThreshold = threshold;
			return this;
		}

		public Builder modelExplanations(boolean enabled) {
			this.modelExplanations = enabled;
			return this;
		}

		public Builder searchTopK(int topK) {
			this.searchTopK = topK;
			return this;
		}

		public Builder substitutionsResource(String resource) {
			this.substitutionsResource = resource;
			return this;
		}

		public AssistantSettings build() {
			return new AssistantSettings(sessionIdleTimeout, defaultCollaboratorTimeout, collaboratorTimeouts, ranking,
					modelClassification, classifierConfidenceThreshold, modelExplanations, searchTopK,
					substitutionsResource);
		}
	}
}
