package org.javai.springai.pantry.delegation;

import java.util.Objects;

/**
 * The collaborators available to a router. Only the inventory store is mandatory; a request for
 * an absent collaborator fails as {@link FailureKind#UNAVAILABLE}.
 */
public record Collaborators(
		InventoryStore inventoryStore,
		SemanticSearchIndex searchIndex,
		KeywordRecipeIndex keywordIndex,
		TextGenerationCapability textGeneration,
		SubstitutionCatalog substitutionCatalog
) {

	public Collaborators {
		Objects.requireNonNull(inventoryStore, "inventoryStore must not be null");
	}

	public static Builder builder(InventoryStore inventoryStore) {
		return new Builder(inventoryStore);
	}

	<C> C require(C collaborator, Collaborator kind) {
		if (collaborator == null) {
			throw new CollaboratorUnavailableException(kind);
		}
		return collaborator;
	}

	public boolean has(Collaborator kind) {
		return switch (kind) {
			case INVENTORY_STORE -> true;
			case SEARCH_INDEX -> searchIndex != null;
			case KEYWORD_INDEX -> keywordIndex != null;
			case TEXT_GENERATION -> textGeneration != null;
			case SUBSTITUTION_CATALOG -> substitutionCatalog != null;
		};
	}

	public static final class Builder {
		private final InventoryStore inventoryStore;
		private SemanticSearchIndex searchIndex;
		private KeywordRecipeIndex keywordIndex;
		private TextGenerationCapability textGeneration;
		private SubstitutionCatalog substitutionCatalog;

		private Builder(InventoryStore inventoryStore) {
			this.inventoryStore = inventoryStore;
		}

		public Builder searchIndex(SemanticSearchIndex searchIndex) {
			this.searchIndex = searchIndex;
			return this;
		}

		public Builder keywordIndex(KeywordRecipeIndex keywordIndex) {
			this.keywordIndex = keywordIndex;
			return this;
		}

		public Builder textGeneration(TextGenerationCapability textGeneration) {
			this.textGeneration = textGeneration;
			return this;
		}

		public Builder substitutionCatalog(SubstitutionCatalog substitutionCatalog) {
			this.substitutionCatalog = substitutionCatalog;
			return this;
		}

		public Collaborators build() {
			return new Collaborators(inventoryStore, searchIndex, keywordIndex, textGeneration, substitutionCatalog);
		}
	}
}
