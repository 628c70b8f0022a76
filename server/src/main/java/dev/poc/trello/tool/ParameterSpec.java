package dev.poc.trello.tool;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Declarative description of one tool parameter: its type, whether it is required, and the
 * constraints the {@link ToolRegistry} enforces generically.
 * @param name argument key
 * @param type declared value type
 * @param description human readable description advertised in the schema
 * @param required whether the argument must be present
 * @param nullable whether an explicit {@code null} is meaningful (for example to remove a due date)
 * @param nonBlank whether string values must contain non-whitespace characters
 * @param maxLength maximum trimmed length of string values, or {@code null}
 * @param minimum lower bound for integers, or {@code null}
 * @param maximum upper bound for integers, or {@code null}
 * @param allowedValues permitted string values, empty when unrestricted
 * @param defaultValue default advertised in the schema, or {@code null}
 * @param properties nested parameters of an object parameter
 */
public record ParameterSpec(String name, ParameterType type, String description, boolean required, boolean nullable,
		boolean nonBlank, Integer maxLength, Long minimum, Long maximum, List<String> allowedValues,
		Object defaultValue, List<ParameterSpec> properties) {

	public ParameterSpec {
		Objects.requireNonNull(name, "name");
		Objects.requireNonNull(type, "type");
		allowedValues = List.copyOf(allowedValues);
		properties = List.copyOf(properties);
	}

	public static Builder builder(String name, ParameterType type) {
		return new Builder(name, type);
	}

	/**
	 * Validate one argument value, appending human readable problems to {@code errors}.
	 * @param path argument path used in messages (for example {@code prefs.voting})
	 * @param value non-null argument value
	 * @param errors sink for type and constraint violations
	 */
	void check(String path, Object value, List<String> errors) {
		if (this.nullable && value instanceof String text && text.isBlank()) {
			return;
		}
		if (!this.type.accepts(value)) {
			errors.add(path + ": expected " + describeType());
			return;
		}
		if (value instanceof String text) {
			String trimmed = text.strip();
			if (this.nonBlank && trimmed.isEmpty()) {
				errors.add(path + ": must not be empty");
			}
			if (this.maxLength != null && trimmed.length() > this.maxLength) {
				errors.add(path + ": must not exceed " + this.maxLength + " characters");
			}
			if (!this.allowedValues.isEmpty() && !this.allowedValues.contains(trimmed)) {
				errors.add(path + ": must be one of " + this.allowedValues);
			}
		}
		if (this.type == ParameterType.INTEGER) {
			long number = ParameterType.integralValue(value).orElseThrow();
			if ((this.minimum != null && number < this.minimum) || (this.maximum != null && number > this.maximum)) {
				errors.add(path + ": must be between " + this.minimum + " and " + this.maximum);
			}
		}
		if (this.type == ParameterType.STRING_ARRAY && this.nonBlank) {
			for (Object element : (List<?>) value) {
				if (((String) element).isBlank()) {
					errors.add(path + ": must not contain empty values");
					break;
				}
			}
		}
		if (this.type == ParameterType.OBJECT && !this.properties.isEmpty()) {
			Map<?, ?> nested = (Map<?, ?>) value;
			for (ParameterSpec property : this.properties) {
				Object nestedValue = nested.get(property.name());
				if (nestedValue != null) {
					property.check(path + "." + property.name(), nestedValue, errors);
				}
			}
		}
	}

	/**
	 * Render this parameter as a JSON schema property.
	 * @return schema fragment
	 */
	public Map<String, Object> toJsonSchema() {
		Map<String, Object> schema = new LinkedHashMap<>();
		Object schemaType = this.type.schemaType();
		if (this.nullable && schemaType instanceof String single) {
			schema.put("type", List.of(single, "null"));
		}
		else {
			schema.put("type", schemaType);
		}
		if (this.description != null) {
			schema.put("description", this.description);
		}
		if (this.type == ParameterType.DATE) {
			schema.put("format", "date-time");
		}
		if (this.type == ParameterType.STRING_ARRAY) {
			schema.put("items", Map.of("type", "string"));
		}
		if (this.nonBlank && this.type == ParameterType.STRING) {
			schema.put("minLength", 1);
		}
		if (this.maxLength != null) {
			schema.put("maxLength", this.maxLength);
		}
		if (this.minimum != null) {
			schema.put("minimum", this.minimum);
		}
		if (this.maximum != null) {
			schema.put("maximum", this.maximum);
		}
		if (!this.allowedValues.isEmpty()) {
			schema.put("enum", this.allowedValues);
		}
		if (this.defaultValue != null) {
			schema.put("default", this.defaultValue);
		}
		if (!this.properties.isEmpty()) {
			Map<String, Object> nested = new LinkedHashMap<>();
			this.properties.forEach(property -> nested.put(property.name(), property.toJsonSchema()));
			schema.put("properties", nested);
		}
		return schema;
	}

	private String describeType() {
		return switch (this.type) {
			case STRING -> "a string";
			case BOOLEAN -> "a boolean";
			case INTEGER -> "an integer";
			case POSITION -> "'top', 'bottom' or a non-negative number";
			case STRING_ARRAY -> "an array of strings";
			case OBJECT -> "an object";
			case DATE -> "an ISO-8601 date (e.g. 2024-01-01T12:00:00Z)";
		};
	}

	/**
	 * Fluent builder used by the tool catalog.
	 */
	public static final class Builder {

		private final String name;

		private final ParameterType type;

		private String description;

		private boolean required;

		private boolean nullable;

		private boolean nonBlank;

		private Integer maxLength;

		private Long minimum;

		private Long maximum;

		private List<String> allowedValues = List.of();

		private Object defaultValue;

		private final List<ParameterSpec> properties = new ArrayList<>();

		private Builder(String name, ParameterType type) {
			this.name = name;
			this.type = type;
		}

		public Builder description(String description) {
			this.description = description;
			return this;
		}

		public Builder required() {
			this.required = true;
			return this;
		}

		public Builder nullable() {
			this.nullable = true;
			return this;
		}

		public Builder nonBlank() {
			this.nonBlank = true;
			return this;
		}

		public Builder maxLength(int maxLength) {
			this.maxLength = maxLength;
			return this;
		}

		public Builder range(long minimum, long maximum) {
			this.minimum = minimum;
			this.maximum = maximum;
			return this;
		}

		public Builder allowedValues(String... values) {
			this.allowedValues = List.of(values);
			return this;
		}

		public Builder defaultValue(Object defaultValue) {
			this.defaultValue = defaultValue;
			return this;
		}

		public Builder property(ParameterSpec property) {
			this.properties.add(property);
			return this;
		}

		public ParameterSpec build() {
			return new ParameterSpec(this.name, this.type, this.description, this.required, this.nullable,
					this.nonBlank, this.maxLength, this.minimum, this.maximum, this.allowedValues, this.defaultValue,
					this.properties);
		}

	}

}
