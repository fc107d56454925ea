package org.javai.springai.pantry.delegation;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * The JSON object shape a caller expects back from the text-generation capability.
 *
 * @param name schema name used in prompts and errors
 * @param fields the top-level fields
 */
public record ExpectedSchema(String name, List<Field> fields) {

	public enum FieldType {
		STRING,
		NUMBER,
		INTEGER,
		BOOLEAN,
		ARRAY,
		OBJECT;

		boolean accepts(JsonNode node) {
			return switch (this) {
				case STRING -> node.isTextual();
				case NUMBER -> node.isNumber();
				case INTEGER -> node.isIntegralNumber();
				case BOOLEAN -> node.isBoolean();
				case ARRAY -> node.isArray();
				case OBJECT -> node.isObject();
			};
		}
	}

	public record Field(String name, FieldType type, boolean required) {
		public Field {
			Objects.requireNonNull(name, "name must not be null");
			Objects.requireNonNull(type, "type must not be null");
		}
	}

	public ExpectedSchema {
		Objects.requireNonNull(name, "name must not be null");
		fields = fields != null ? List.copyOf(fields) : List.of();
	}

	public static ExpectedSchema named(String name) {
		return new ExpectedSchema(name, List.of());
	}

	public ExpectedSchema required(String field, FieldType type) {
		return with(new Field(field, type, true));
	}

	public ExpectedSchema optional(String field, FieldType type) {
		return with(new Field(field, type, false));
	}

	private ExpectedSchema with(Field field) {
		List<Field> next = new ArrayList<>(fields);
		next.add(field);
		return new ExpectedSchema(name, next);
	}

	/**
	 * @return a description of every mismatch, empty when the node conforms
	 */
	public List<String> validate(JsonNode node) {
		List<String> problems = new ArrayList<>();
		if (node == null || !node.isObject()) {
			problems.add("expected a JSON object");
			return problems;
		}
		for (Field field : fields) {
			JsonNode value = node.get(field.name());
			if (value == null || value.isNull()) {
				if (field.required()) {
					problems.add("missing required field '" + field.name() + "'");
				}
			}
			else if (!field.type().accepts(value)) {
				problems.add("field '" + field.name() + "' should be " + field.type().name().toLowerCase(Locale.ROOT));
			}
		}
		return problems;
	}

	/**
	 * Renders the shape for inclusion in a prompt.
	 */
	public String describe() {
		return fields.stream()
				.map(f -> "\"" + f.name() + "\": " + f.type().name().toLowerCase(Locale.ROOT)
						+ (f.required() ? "" : " (optional)"))
				.collect(Collectors.joining(", ", "{", "}"));
	}
}
