package org.javai.springai.pantry.substitution;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.javai.springai.pantry.delegation.SubstitutionCatalog;
import org.javai.springai.pantry.model.IngredientNames;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.Yaml;

/**
 * Substitution catalog backed by a map of ingredient to alternatives, best first.
 *
 * <p>{@link #fromClasspath(String)} reads a YAML document of the form:</p>
 * <pre>{@code
 * substitutions:
 *   butter: [olive oil, coconut oil]
 *   milk: [oat milk, soy milk]
 * }</pre>
 *
 * <p>Lookups fall back from the full name to its last word, so {@code unsalted butter} finds the
 * {@code butter} entry.</p>
 */
public class InMemorySubstitutionCatalog implements SubstitutionCatalog {

	private static final Logger logger = LoggerFactory.getLogger(InMemorySubstitutionCatalog.class);

	public static final String DEFAULT_RESOURCE = "substitutions.yml";

	private final Map<String, List<String>> entries;

	public InMemorySubstitutionCatalog(Map<String, List<String>> entries) {
		Map<String, List<String>> normalized = new LinkedHashMap<>();
		if (entries != null) {
			entries.forEach((ingredient, alternatives) -> {
				String key = IngredientNames.normalize(ingredient);
				if (!key.isEmpty() && alternatives != null) {
					normalized.put(key, List.copyOf(IngredientNames.normalizeAll(alternatives)));
				}
			});
		}
		this.entries = Map.copyOf(normalized);
	}

	public static InMemorySubstitutionCatalog fromClasspath(String resource) {
		try (InputStream in = InMemorySubstitutionCatalog.class.getClassLoader().getResourceAsStream(resource)) {
			if (in == null) {
				logger.warn("Substitution resource {} not found; catalog is empty", resource);
				return new InMemorySubstitutionCatalog(Map.of());
			}
			InMemorySubstitutionCatalog catalog = new InMemorySubstitutionCatalog(parse(new Yaml().load(in)));
			logger.debug("Loaded {} substitution entries from {}", catalog.size(), resource);
			return catalog;
		}
		catch (IOException e) {
			throw new UncheckedIOException("Failed to read " + resource, e);
		}
	}

	@Override
	public List<String> lookup(String ingredient) {
		String key = IngredientNames.normalize(ingredient);
		List<String> alternatives = entries.get(key);
		if (alternatives == null && key.contains(" ")) {
			alternatives = entries.get(key.substring(key.lastIndexOf(' ') + 1));
		}
		return alternatives != null ? alternatives : List.of();
	}

	public int size() {
		return entries.size();
	}

	private static Map<String, List<String>> parse(Object document) {
		Map<String, List<String>> result = new LinkedHashMap<>();
		if (!(document instanceof Map<?, ?> root)) {
			return result;
		}
		Object section = root.containsKey("substitutions") ? root.get("substitutions") : root;
		if (!(section instanceof Map<?, ?> map)) {
			return result;
		}
		map.forEach((key, value) -> {
			List<String> alternatives = new ArrayList<>();
			if (value instanceof List<?> list) {
				list.forEach(item -> alternatives.add(String.valueOf(item)));
			}
			else if (value != null) {
				alternatives.add(String.valueOf(value));
			}
			result.put(String.valueOf(key), alternatives);
		});
		return result;
	}
}
