package org.javai.springai.pantry.config;

import java.time.Clock;
import org.javai.springai.pantry.conversation.ConversationManager;
import org.javai.springai.pantry.conversation.ConversationStateStore;
import org.javai.springai.pantry.conversation.InMemoryConversationStateStore;
import org.javai.springai.pantry.delegation.Collaborator;
import org.javai.springai.pantry.delegation.Collaborators;
import org.javai.springai.pantry.delegation.DelegationRouter;
import org.javai.springai.pantry.delegation.InventoryStore;
import org.javai.springai.pantry.delegation.KeywordRecipeIndex;
import org.javai.springai.pantry.delegation.SemanticSearchIndex;
import org.javai.springai.pantry.delegation.SubstitutionCatalog;
import org.javai.springai.pantry.delegation.TextGenerationCapability;
import org.javai.springai.pantry.generation.SpringAiTextGeneration;
import org.javai.springai.pantry.intent.DefaultIntentClassifier;
import org.javai.springai.pantry.intent.LlmIntentClassifier;
import org.javai.springai.pantry.intent.PreferenceExtractor;
import org.javai.springai.pantry.intent.RuleBasedIntentClassifier;
import org.javai.springai.pantry.inventory.InMemoryInventoryStore;
import org.javai.springai.pantry.ranking.HybridRanker;
import org.javai.springai.pantry.substitution.InMemorySubstitutionCatalog;
import org.javai.springai.pantry.synthesis.ResponseSynthesizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Wires the assistant as Spring beans.
 *
 * <p>Collaborators are picked up from the context when present: an {@link InventoryStore}, a
 * {@link SemanticSearchIndex} and {@link KeywordRecipeIndex}, a {@link SubstitutionCatalog}, and
 * either a {@link TextGenerationCapability} or a Spring AI {@link ChatClient.Builder}. Without an
 * inventory store an in-memory one is used; without a catalog the one seeded from the configured
 * YAML resource is used. Set {@code pantry.assistant.enabled=false} to switch the whole
 * configuration off.</p>
 */
@Configuration
@ConditionalOnProperty(name = "pantry.assistant.enabled", havingValue = "true", matchIfMissing = true)
public class PantryAssistantConfiguration {

	private static final Logger logger = LoggerFactory.getLogger(PantryAssistantConfiguration.class);

	@Bean
	public AssistantSettings assistantSettings() {
		return new AssistantSettingsLoader().loadResource(AssistantSettingsLoader.DEFAULT_RESOURCE);
	}

	@Bean
	public Collaborators pantryCollaborators(
			AssistantSettings settings,
			ObjectProvider<InventoryStore> inventoryStore,
			ObjectProvider<SemanticSearchIndex> searchIndex,
			ObjectProvider<KeywordRecipeIndex> keywordIndex,
			ObjectProvider<SubstitutionCatalog> substitutionCatalog,
			ObjectProvider<TextGenerationCapability> textGeneration,
			ObjectProvider<ChatClient.Builder> chatClientBuilder) {
		TextGenerationCapability generation = textGeneration.getIfAvailable(() -> {
			ChatClient.Builder builder = chatClientBuilder.getIfAvailable();
			return builder != null ? new SpringAiTextGeneration(builder.build()) : null;
		});
		Collaborators collaborators = Collaborators.builder(inventoryStore.getIfAvailable(InMemoryInventoryStore::new))
				.searchIndex(searchIndex.getIfAvailable())
				.keywordIndex(keywordIndex.getIfAvailable())
				.substitutionCatalog(substitutionCatalog.getIfAvailable(
						() -> InMemorySubstitutionCatalog.fromClasspath(settings.substitutionsResource())))
				.textGeneration(generation)
				.build();
		for (Collaborator collaborator : Collaborator.values()) {
			if (!collaborators.has(collaborator)) {
				logger.info("No {} configured; requests to it will fail as unavailable", collaborator);
			}
		}
		return collaborators;
	}

	@Bean(destroyMethod = "close")
	public DelegationRouter delegationRouter(Collaborators collaborators, AssistantSettings settings) {
		return new DelegationRouter(collaborators, settings.defaultCollaboratorTimeout(),
				settings.collaboratorTimeouts());
	}

	@Bean
	public ConversationStateStore conversationStateStore(AssistantSettings settings) {
		return new InMemoryConversationStateStore(Clock.systemUTC(), settings.sessionIdleTimeout());
	}

	@Bean
	public DefaultIntentClassifier intentClassifier(DelegationRouter router, AssistantSettings settings) {
		LlmIntentClassifier model = settings.modelClassification() && router.isAvailable(Collaborator.TEXT_GENERATION)
				? new LlmIntentClassifier(router, new PreferenceExtractor(), settings.classifierConfidenceThreshold())
				: null;
		return new DefaultIntentClassifier(new RuleBasedIntentClassifier(), model);
	}

	@Bean
	public ConversationManager conversationManager(
			DelegationRouter router,
			ConversationStateStore stateStore,
			DefaultIntentClassifier intentClassifier,
			AssistantSettings settings) {
		return ConversationManager.builder(router)
				.stateStore(stateStore)
				.classifier(intentClassifier)
				.ranker(new HybridRanker(settings.ranking(), Clock.systemDefaultZone()))
				.synthesizer(new ResponseSynthesizer(settings.modelExplanations()))
				.searchTopK(settings.searchTopK())
				.build();
	}
}
