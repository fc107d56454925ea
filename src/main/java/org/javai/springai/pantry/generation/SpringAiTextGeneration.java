package org.javai.springai.pantry.generation;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Consumer;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.javai.springai.pantry.delegation.ExpectedSchema;
import org.javai.springai.pantry.delegation.TextGenerationCapability;
import org.javai.springai.pantry.delegation.TextGenerationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.client.ChatClient;

/**
 * Text generation backed by Spring AI chat clients.
 *
 * <p>Tries each {@link ChatClientTier} in order, up to its attempt limit, until a response yields
 * a JSON object matching the expected schema. Responses may wrap the JSON in a markdown code
 * block. When every attempt fails a {@link TextGenerationException} is thrown.</p>
 */
public class SpringAiTextGeneration implements TextGenerationCapability {

	private static final Logger logger = LoggerFactory.getLogger(SpringAiTextGeneration.class);

	private static final Pattern JSON_BLOCK_PATTERN = Pattern.compile("```(?:json)?\\s*\\n?(\\{.*?\\})\\s*```", Pattern.DOTALL);

	static final String SYSTEM_PROMPT = """
			You are the reasoning component of a kitchen pantry assistant.
			Answer with a single JSON object and nothing else.
			Never suggest an ingredient the user is allergic to.""";

	private final List<ChatClientTier> tiers;
	private final ObjectMapper mapper;
	private final Consumer<GenerationMetrics> metricsListener;

	public SpringAiTextGeneration(ChatClient chatClient) {
		this(List.of(new ChatClientTier(chatClient, 1, null)), null);
	}

	/**
	 * @param tiers ordered fallback chain, at least one
	 * @param metricsListener receives metrics after every call (may be null)
	 */
	public SpringAiTextGeneration(List<ChatClientTier> tiers, Consumer<GenerationMetrics> metricsListener) {
		Objects.requireNonNull(tiers, "tiers must not be null");
		if (tiers.isEmpty()) {
			throw new IllegalArgumentException("at least one ChatClientTier is required");
		}
		this.tiers = List.copyOf(tiers);
		this.mapper = new ObjectMapper();
		this.metricsListener = metricsListener;
	}

	@Override
	public JsonNode complete(String prompt, ExpectedSchema schema) {
		List<GenerationAttempt> attempts = new ArrayList<>();
		String lastError = "no attempts made";
		for (int tierIndex = 0; tierIndex < tiers.size(); tierIndex++) {
			ChatClientTier tier = tiers.get(tierIndex);
			for (int attempt = 1; attempt <= tier.maxAttempts(); attempt++) {
				long start = System.currentTimeMillis();
				AttemptOutcome outcome;
				String error = null;
				JsonNode accepted = null;
				try {
					String content = invokeModel(tier.chatClient(), prompt);
					Optional<JsonNode> json = parse(content);
					if (json.isEmpty()) {
						outcome = AttemptOutcome.PARSE_FAILED;
						error = "response contained no JSON object";
					}
					else {
						List<String> problems = schema.validate(json.get());
						if (problems.isEmpty()) {
							outcome = AttemptOutcome.SUCCESS;
							accepted = json.get();
						}
						else {
							outcome = AttemptOutcome.SCHEMA_MISMATCH;
							error = String.join("; ", problems);
						}
					}
				}
				catch (RuntimeException e) {
					outcome = AttemptOutcome.CALL_FAILED;
					error = e.getClass().getSimpleName() + ": " + e.getMessage();
				}
				long duration = Math.max(0, System.currentTimeMillis() - start);
				attempts.add(new GenerationAttempt(tier.modelId(), tierIndex, attempt, outcome, duration, error));
				if (accepted != null) {
					publish(new GenerationMetrics(schema.name(), tier.modelId(), attempts));
					return accepted;
				}
				lastError = error;
				logger.warn("Model attempt {}/{} on tier {} ({}) failed: {} {}", attempt, tier.maxAttempts(), tierIndex,
						tier.modelId(), outcome, error);
			}
		}
		publish(new GenerationMetrics(schema.name(), null, attempts));
		throw new TextGenerationException("All " + attempts.size() + " model attempt(s) failed for schema '"
				+ schema.name() + "': " + lastError);
	}

	private String invokeModel(ChatClient chatClient, String prompt) {
		ChatClient.ChatClientRequestSpec request = chatClient.prompt();
		request.system(SYSTEM_PROMPT);
		request.user(prompt);
		String content = request.call().content();
		logger.debug("Model response:\n{}", content);
		return content;
	}

	private Optional<JsonNode> parse(String response) {
		if (response == null || response.isBlank()) {
			return Optional.empty();
		}
		String trimmed = response.trim();
		String candidate = null;
		Matcher matcher = JSON_BLOCK_PATTERN.matcher(trimmed);
		if (matcher.find()) {
			candidate = matcher.group(1).trim();
		}
		else if (trimmed.startsWith("{") && trimmed.endsWith("}")) {
			candidate = trimmed;
		}
		if (candidate == null) {
			return Optional.empty();
		}
		try {
			JsonNode node = mapper.readTree(candidate);
			return node != null && node.isObject() ? Optional.of(node) : Optional.empty();
		}
		catch (JsonProcessingException e) {
			logger.debug("Unparseable model JSON: {}", e.getOriginalMessage());
			return Optional.empty();
		}
	}

	private void publish(GenerationMetrics metrics) {
		logger.debug("Generation metrics for {}: {} attempt(s), succeeded={}", metrics.schemaName(),
				metrics.totalAttempts(), metrics.succeeded());
		if (metricsListener != null) {
			metricsListener.accept(metrics);
		}
	}
}
