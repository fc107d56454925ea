package org.javai.springai.pantry.adaptation;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.javai.springai.pantry.delegation.Collaborators;
import org.javai.springai.pantry.delegation.DelegationRouter;
import org.javai.springai.pantry.delegation.DispatchScope;
import org.javai.springai.pantry.delegation.ExpectedSchema;
import org.javai.springai.pantry.delegation.SubstitutionCatalog;
import org.javai.springai.pantry.delegation.TextGenerationCapability;
import org.javai.springai.pantry.inventory.InMemoryInventoryStore;
import org.javai.springai.pantry.model.Preferences;
import org.javai.springai.pantry.substitution.InMemorySubstitutionCatalog;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("DelegatedAlternativeSource")
class DelegatedAlternativeSourceTest {

	private static final Preferences PEANUT_FREE = new Preferences(Set.of(), Set.of("peanut"), Set.of(), null);

	private DelegationRouter router;

	@AfterEach
	void tearDown() {
		router.close();
	}

	@Test
	@DisplayName("answers from the catalog without asking the model")
	void catalogFirst() {
		TextGenerationCapability model = mock(TextGenerationCapability.class);
		SubstitutionCatalog catalog = new InMemorySubstitutionCatalog(Map.of("butter", List.of("olive oil")));
		router = new DelegationRouter(Collaborators.builder(new InMemoryInventoryStore())
				.substitutionCatalog(catalog).textGeneration(model).build());

		DelegatedAlternativeSource source = new DelegatedAlternativeSource(router, DispatchScope.NONE, PEANUT_FREE);

		assertThat(source.alternativesFor("Butter")).containsExactly("olive oil");
		verify(model, never()).complete(anyString(), any(ExpectedSchema.class));
	}

	@Test
	@DisplayName("asks the model when the catalog has nothing, and remembers the answer")
	void modelSecond() throws Exception {
		TextGenerationCapability model = mock(TextGenerationCapability.class);
		when(model.complete(anyString(), any(ExpectedSchema.class))).thenReturn(
				new ObjectMapper().readTree("{\"alternatives\": [\"sunflower seed butter\", 7, \"tahini\"]}"));
		router = new DelegationRouter(Collaborators.builder(new InMemoryInventoryStore())
				.substitutionCatalog(new InMemorySubstitutionCatalog(Map.of())).textGeneration(model).build());

		DelegatedAlternativeSource source = new DelegatedAlternativeSource(router, DispatchScope.NONE, PEANUT_FREE);

		assertThat(source.alternativesFor("satay sauce")).containsExactly("sunflower seed butter", "tahini");
		assertThat(source.alternativesFor("satay sauce")).containsExactly("sunflower seed butter", "tahini");
		verify(model, times(1)).complete(anyString(), any(ExpectedSchema.class));
	}

	@Test
	@DisplayName("answers with nothing when no collaborator can help")
	void nothingAvailable() {
		router = new DelegationRouter(Collaborators.builder(new InMemoryInventoryStore()).build());

		DelegatedAlternativeSource source = new DelegatedAlternativeSource(router, DispatchScope.NONE, PEANUT_FREE);

		assertThat(source.alternativesFor("butter")).isEmpty();
	}
}
