package org.javai.springai.pantry.config;

import java.io.InputStream;
import java.io.Reader;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Locale;
import java.util.Map;
import org.javai.springai.pantry.delegation.Collaborator;
import org.javai.springai.pantry.ranking.RankingPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.Yaml;

/**
 * Reads {@link AssistantSettings} from YAML. Every key is optional; a missing key keeps its default.
 *
 * <pre>{@code
 * pantry:
 *   assistant:
 *     session:
 *       idle-timeout-minutes: 30
 *     delegation:
 *       default-timeout-ms: 3000
 *       timeouts-ms:
 *         text_generation: 8000
 *     ranking:
 *       semantic-weight: 0.35
 *       coverage-weight: 0.65
 *       allow-missing: 2
 *     classifier:
 *       model-fallback: true
 *       confidence-threshold: 0.55
 * }</pre>
 */
public class AssistantSettingsLoader {

	private static final Logger logger = LoggerFactory.getLogger(AssistantSettingsLoader.class);

	public static final String DEFAULT_RESOURCE = "pantry-assistant.yml";

	private final Yaml yaml = new Yaml();

	/**
	 * Loads a classpath resource; a missing resource yields the defaults.
	 */
	public AssistantSettings loadResource(String resource) {
		try (InputStream in = AssistantSettingsLoader.class.getClassLoader().getResourceAsStream(resource)) {
			if (in == null) {
				logger.info("No {} on the classpath; using default settings", resource);
				return AssistantSettings.defaults();
			}
			return fromData(yaml.load(in));
		}
		catch (SettingsException e) {
			throw e;
		}
		catch (Exception e) {
			throw new SettingsException("Failed to load settings from resource " + resource, e);
		}
	}

	public AssistantSettings load(Path path) {
		try (Reader reader = Files.newBufferedReader(path)) {
			return fromData(yaml.load(reader));
		}
		catch (SettingsException e) {
			throw e;
		}
		catch (Exception e) {
			throw new SettingsException("Failed to load settings from path: " + path, e);
		}
	}

	public AssistantSettings parseString(String yamlContent) {
		try {
			return fromData(yaml.load(yamlContent));
		}
		catch (SettingsException e) {
			throw e;
		}
		catch (Exception e) {
			throw new SettingsException("Failed to parse settings", e);
		}
	}

	private AssistantSettings fromData(Object data) {
		Map<String, Object> root = section(section(asMap(data), "pantry"), "assistant");
		AssistantSettings.Builder builder = AssistantSettings.builder();

		Map<String, Object> session = section(root, "session");
		Long idleMinutes = longValue(session, "idle-timeout-minutes");
		if (idleMinutes != null) {
			builder.sessionIdleTimeout(Duration.ofMinutes(idleMinutes));
		}

		Map<String, Object> delegation = section(root, "delegation");
		Long defaultTimeout = longValue(delegation, "default-timeout-ms");
		if (defaultTimeout != null) {
			builder.defaultCollaboratorTimeout(Duration.ofMillis(defaultTimeout));
		}
		section(delegation, "timeouts-ms").forEach((name, value) -> {
			Collaborator collaborator = collaborator(name);
			builder.collaboratorTimeout(collaborator, Duration.ofMillis(toLong(value, "timeouts-ms." + name)));
		});

		builder.ranking(ranking(section(root, "ranking")));

		Map<String, Object> classifier = section(root, "classifier");
		Boolean modelFallback = booleanValue(classifier, "model-fallback");
		if (modelFallback != null) {
			builder.modelClassification(modelFallback);
		}
		Double threshold = doubleValue(classifier, "confidence-threshold");
		if (threshold != null) {
			builder.classifierConfidenceThreshold(threshold);
		}

		Boolean explanations = booleanValue(section(root, "synthesis"), "model-explanations");
		if (explanations != null) {
			builder.modelExplanations(explanations);
		}
		Long topK = longValue(section(root, "search"), "top-k");
		if (topK != null) {
			builder.searchTopK(topK.intValue());
		}
		Object resource = section(root, "substitutions").get("resource");
		if (resource != null) {
			builder.substitutionsResource(resource.toString());
		}

		try {
			return builder.build();
		}
		catch (IllegalArgumentException e) {
			throw new SettingsException("Invalid settings: " + e.getMessage(), e);
		}
	}

	private static RankingPolicy ranking(Map<String, Object> data) {
		RankingPolicy defaults = RankingPolicy.defaults();
		try {
			return new RankingPolicy(
					orDefault(doubleValue(data, "semantic-weight"), defaults.semanticWeight()),
					orDefault(doubleValue(data, "coverage-weight"), defaults.coverageWeight()),
					orDefault(longValue(data, "allow-missing"), defaults.allowMissing()),
					orDefault(longValue(data, "relaxation-increment"), defaults.relaxationIncrement()),
					orDefault(longValue(data, "urgency-window-days"), defaults.urgencyWindowDays()),
					orDefault(doubleValue(data, "expiry-bonus-scale"), defaults.expiryBonusScale()),
					orDefault(doubleValue(data, "expiry-bonus-per-ingredient-cap"), defaults.expiryBonusPerIngredientCap()),
					orDefault(doubleValue(data, "expiry-bonus-total-cap"), defaults.expiryBonusTotalCap()),
					orDefault(longValue(data, "max-recommendations"), defaults.maxRecommendations()));
		}
		catch (IllegalArgumentException e) {
			throw new SettingsException("Invalid ranking settings: " + e.getMessage(), e);
		}
	}

	private static Collaborator collaborator(String name) {
		try {
			return Collaborator.valueOf(name.trim().toUpperCase(Locale.ROOT).replace('-', '_'));
		}
		catch (IllegalArgumentException e) {
			throw new SettingsException("Unknown collaborator in timeouts-ms: " + name, e);
		}
	}

	@SuppressWarnings("unchecked")
	private static Map<String, Object> asMap(Object value) {
		return value instanceof Map<?, ?> ? (Map<String, Object>) value : Map.of();
	}

	private static Map<String, Object> section(Map<String, Object> parent, String key) {
		return asMap(parent.get(key));
	}

	private static Long longValue(Map<String, Object> data, String key) {
		Object value = data.get(key);
		return value == null ? null : toLong(value, key);
	}

	private static long toLong(Object value, String key) {
		if (value instanceof Number number) {
			return number.longValue();
		}
		try {
			return Long.parseLong(value.toString().trim());
		}
		catch (NumberFormatException e) {
			throw new SettingsException("Setting '" + key + "' must be a whole number: " + value, e);
		}
	}

	private static Double doubleValue(Map<String, Object> data, String key) {
		Object value = data.get(key);
		if (value == null) {
			return null;
		}
		if (value instanceof Number number) {
			return number.doubleValue();
		}
		try {
			return Double.parseDouble(value.toString().trim());
		}
		catch (NumberFormatException e) {
			throw new SettingsException("Setting '" + key + "' must be a number: " + value, e);
		}
	}

	private static Boolean booleanValue(Map<String, Object> data, String key) {
		Object value = data.get(key);
		if (value == null) {
			return null;
		}
		return value instanceof Boolean b ? b : Boolean.parseBoolean(value.toString().trim());
	}

	private static double orDefault(Double value, double fallback) {
		return value != null ? value : fallback;
	}

	private static int orDefault(Long value, int fallback) {
		return value != null ? value.intValue() : fallback;
	}

	/**
	 * Raised when the settings document cannot be read or holds invalid values.
	 */
	public static class SettingsException extends RuntimeException {
		public SettingsException(String message, Throwable cause) {
			super(message, cause);
		}
	}
}
