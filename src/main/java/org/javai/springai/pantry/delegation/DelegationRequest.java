package org.javai.springai.pantry.delegation;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.List;
import java.util.Objects;
import org.javai.springai.pantry.model.InventoryDelta;
import org.javai.springai.pantry.model.PantryItem;
import org.javai.springai.pantry.model.ScoredRecipe;

/**
 * A typed unit of work for one collaborator. The router never calls a collaborator except
 * through one of these.
 *
 * @param <T> the value a successful call produces
 */
public sealed interface DelegationRequest<T> {

	Collaborator collaborator();

	/**
	 * Performs the call. Runs on the router's executor.
	 */
	T invoke(Collaborators collaborators);

	/**
	 * Short description for the audit log; must not contain the full prompt.
	 */
	String describe();

	record FetchInventory(String sessionId) implements DelegationRequest<List<PantryItem>> {
		public FetchInventory {
			Objects.requireNonNull(sessionId, "sessionId must not be null");
		}

		@Override
		public Collaborator collaborator() {
			return Collaborator.INVENTORY_STORE;
		}

		@Override
		public List<PantryItem> invoke(Collaborators collaborators) {
			return List.copyOf(collaborators.inventoryStore().getInventory(sessionId));
		}

		@Override
		public String describe() {
			return "fetch inventory";
		}
	}

	record ApplyInventoryDeltas(String sessionId, List<InventoryDelta> deltas)
			implements DelegationRequest<List<PantryItem>> {
		public ApplyInventoryDeltas {
			Objects.requireNonNull(sessionId, "sessionId must not be null");
			deltas = List.copyOf(deltas);
		}

		@Override
		public Collaborator collaborator() {
			return Collaborator.INVENTORY_STORE;
		}

		@Override
		public List<PantryItem> invoke(Collaborators collaborators) {
			return List.copyOf(collaborators.inventoryStore().applyDeltas(sessionId, deltas));
		}

		@Override
		public String describe() {
			return "apply " + deltas;
		}
	}

	/**
	 * Embeds the query text and searches with the resulting vector.
	 */
	record QueryRecipes(String queryText, int topK, SearchFilter filter)
			implements DelegationRequest<List<ScoredRecipe>> {
		public QueryRecipes {
			Objects.requireNonNull(queryText, "queryText must not be null");
			if (topK < 1) {
				throw new IllegalArgumentException("topK must be >= 1");
			}
			filter = filter != null ? filter : SearchFilter.none();
		}

		@Override
		public Collaborator collaborator() {
			return Collaborator.SEARCH_INDEX;
		}

		@Override
		public List<ScoredRecipe> invoke(Collaborators collaborators) {
			SemanticSearchIndex index = collaborators.require(collaborators.searchIndex(), collaborator());
			float[] vector = index.embed(queryText);
			return List.copyOf(index.query(vector, topK, filter));
		}

		@Override
		public String describe() {
			return "semantic query top " + topK;
		}
	}

	record KeywordRecipes(List<String> terms, int topK) implements DelegationRequest<List<ScoredRecipe>> {
		public KeywordRecipes {
			terms = List.copyOf(terms);
			if (topK < 1) {
				throw new IllegalArgumentException("topK must be >= 1");
			}
		}

		@Override
		public Collaborator collaborator() {
			return Collaborator.KEYWORD_INDEX;
		}

		@Override
		public List<ScoredRecipe> invoke(Collaborators collaborators) {
			KeywordRecipeIndex index = collaborators.require(collaborators.keywordIndex(), collaborator());
			return List.copyOf(index.match(terms, topK));
		}

		@Override
		public String describe() {
			return "keyword match " + terms.size() + " term(s)";
		}
	}

	/**
	 * Asks the model for JSON and validates it against the schema before it counts as a success.
	 */
	record CompleteText(String prompt, ExpectedSchema schema) implements DelegationRequest<JsonNode> {
		public CompleteText {
			Objects.requireNonNull(prompt, "prompt must not be null");
			Objects.requireNonNull(schema, "schema must not be null");
		}

		@Override
		public Collaborator collaborator() {
			return Collaborator.TEXT_GENERATION;
		}

		@Override
		public JsonNode invoke(Collaborators collaborators) {
			TextGenerationCapability model = collaborators.require(collaborators.textGeneration(), collaborator());
			JsonNode answer = model.complete(prompt, schema);
			List<String> problems = schema.validate(answer);
			if (!problems.isEmpty()) {
				throw new SchemaViolationException(schema.name(), problems);
			}
			return answer;
		}

		@Override
		public String describe() {
			return "complete text for schema " + schema.name();
		}
	}

	record LookupSubstitutes(String ingredient) implements DelegationRequest<List<String>> {
		public LookupSubstitutes {
			Objects.requireNonNull(ingredient, "ingredient must not be null");
		}

		@Override
		public Collaborator collaborator() {
			return Collaborator.SUBSTITUTION_CATALOG;
		}

		@Override
		public List<String> invoke(Collaborators collaborators) {
			SubstitutionCatalog catalog = collaborators.require(collaborators.substitutionCatalog(), collaborator());
			return List.copyOf(catalog.lookup(ingredient));
		}

		@Override
		public String describe() {
			return "substitutes for " + ingredient;
		}
	}
}
