package org.javai.springai.pantry.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import org.javai.springai.pantry.config.AssistantSettingsLoader.SettingsException;
import org.javai.springai.pantry.delegation.Collaborator;
import org.javai.springai.pantry.ranking.RankingPolicy;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class AssistantSettingsLoaderTest {

	private final AssistantSettingsLoader loader = new AssistantSettingsLoader();

	@Test
	@DisplayName("the bundled resource matches the built-in defaults")
	void bundledResourceMatchesDefaults() {
		AssistantSettings settings = loader.loadResource(AssistantSettingsLoader.DEFAULT_RESOURCE);

		assertThat(settings.sessionIdleTimeout()).isEqualTo(Duration.ofMinutes(30));
		assertThat(settings.defaultCollaboratorTimeout()).isEqualTo(Duration.ofSeconds(3));
		assertThat(settings.timeoutFor(Collaborator.TEXT_GENERATION)).isEqualTo(Duration.ofSeconds(8));
		assertThat(settings.timeoutFor(Collaborator.SEARCH_INDEX)).isEqualTo(Duration.ofSeconds(3));
		assertThat(settings.ranking()).isEqualTo(RankingPolicy.defaults());
		assertThat(settings.classifierConfidenceThreshold()).isEqualTo(0.55);
		assertThat(settings.searchTopK()).isEqualTo(10);
		assertThat(settings.substitutionsResource()).isEqualTo("substitutions.yml");
	}

	@Test
	@DisplayName("a missing resource yields the defaults")
	void missingResourceYieldsDefaults() {
		assertThat(loader.loadResource("no-such-settings.yml")).isEqualTo(AssistantSettings.defaults());
	}

	@Nested
	@DisplayName("parseString")
	class ParseString {

		@Test
		void keepsDefaultsForMissingKeys() {
			AssistantSettings settings = loader.parseString("""
					pantry:
					  assistant:
					    ranking:
					      allow-missing: 4
					""");

			assertThat(settings.ranking().allowMissing()).isEqualTo(4);
			assertThat(settings.ranking().semanticWeight()).isEqualTo(0.35);
			assertThat(settings.modelClassification()).isTrue();
			assertThat(settings.modelExplanations()).isFalse();
		}

		@Test
		void readsEverySection() {
			AssistantSettings settings = loader.parseString("""
					pantry:
					  assistant:
					    session:
					      idle-timeout-minutes: 5
					    delegation:
					      default-timeout-ms: 1500
					      timeouts-ms:
					        search-index: 400
					    classifier:
					      model-fallback: false
					      confidence-threshold: 0.8
					    synthesis:
					      model-explanations: "true"
					    search:
					      top-k: 20
					    substitutions:
					      resource: kitchen-swaps.yml
					""");

			assertThat(settings.sessionIdleTimeout()).isEqualTo(Duration.ofMinutes(5));
			assertThat(settings.defaultCollaboratorTimeout()).isEqualTo(Duration.ofMillis(1500));
			assertThat(settings.timeoutFor(Collaborator.SEARCH_INDEX)).isEqualTo(Duration.ofMillis(400));
			assertThat(settings.modelClassification()).isFalse();
			assertThat(settings.classifierConfidenceThreshold()).isEqualTo(0.8);
			assertThat(settings.modelExplanations()).isTrue();
			assertThat(settings.searchTopK()).isEqualTo(20);
			assertThat(settings.substitutionsResource()).isEqualTo("kitchen-swaps.yml");
		}

		@Test
		void emptyDocumentYieldsDefaults() {
			assertThat(loader.parseString("")).isEqualTo(AssistantSettings.defaults());
		}
	}

	@Nested
	@DisplayName("invalid settings")
	class Invalid {

		@Test
		void rejectsUnknownCollaborator() {
			assertThatThrownBy(() -> loader.parseString("""
					pantry:
					  assistant:
					    delegation:
					      timeouts-ms:
					        oracle: 100
					"""))
					.isInstanceOf(SettingsException.class)
					.hasMessage("Unknown collaborator in timeouts-ms: oracle");
		}

		@Test
		void rejectsNonNumericValue() {
			assertThatThrownBy(() -> loader.parseString("""
					pantry:
					  assistant:
					    search:
					      top-k: lots
					"""))
					.isInstanceOf(SettingsException.class)
					.hasMessage("Setting 'top-k' must be a whole number: lots");
		}

		@Test
		void rejectsOutOfRangeThreshold() {
			assertThatThrownBy(() -> loader.parseString("""
					pantry:
					  assistant:
					    classifier:
					      confidence-threshold: 1.5
					"""))
					.isInstanceOf(SettingsException.class)
					.hasMessageStartingWith("Invalid settings:");
		}

		@Test
		void rejectsInvalidRankingWeights() {
			assertThatThrownBy(() -> loader.parseString("""
					pantry:
					  assistant:
					    ranking:
					      semantic-weight: -1
					"""))
					.isInstanceOf(SettingsException.class)
					.hasMessageStartingWith("Invalid ranking settings:");
		}

		@Test
		void wrapsMalformedYaml() {
			assertThatThrownBy(() -> loader.parseString("pantry: [unclosed"))
					.isInstanceOf(SettingsException.class)
					.hasMessage("Failed to parse settings");
		}
	}

	@Test
	void loadsFromFile(@TempDir Path dir) throws IOException {
		Path file = dir.resolve("settings.yml");
		Files.writeString(file, """
				pantry:
				  assistant:
				    ranking:
				      max-recommendations: 5
				""");

		assertThat(loader.load(file).ranking().maxRecommendations()).isEqualTo(5);
	}

	@Test
	void reportsMissingFile(@TempDir Path dir) {
		Path missing = dir.resolve("absent.yml");

		assertThatThrownBy(() -> loader.load(missing))
				.isInstanceOf(SettingsException.class)
				.hasMessageContaining("absent.yml");
	}
}
