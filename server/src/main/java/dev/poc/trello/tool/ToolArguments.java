package dev.poc.trello.tool;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import org.springframework.util.StringUtils;

/**
 * Typed, read-only access to validated tool arguments.
 */
public final class ToolArguments {

	private final Map<String, Object> values;

	public ToolArguments(Map<String, Object> values) {
		this.values = values == null ? Map.of() : values;
	}

	/**
	 * Read a trimmed string argument.
	 * @param name argument name
	 * @return the value when present and non-blank
	 */
	public Optional<String> string(String name) {
		Object value = this.values.get(name);
		if (value instanceof String text && StringUtils.hasText(text)) {
			return Optional.of(text.strip());
		}
		return Optional.empty();
	}

	public String requiredString(String name) {
		return string(name).orElseThrow(() -> new IllegalStateException("Argument " + name + " was not validated"));
	}

	/**
	 * Read a string argument without trimming, keeping an empty string as a value.
	 * @param name argument name
	 * @return the raw value when present
	 */
	public Optional<String> text(String name) {
		return this.values.get(name) instanceof String text ? Optional.of(text) : Optional.empty();
	}

	public Optional<Boolean> bool(String name) {
		return this.values.get(name) instanceof Boolean flag ? Optional.of(flag) : Optional.empty();
	}

	public int integer(String name, int defaultValue) {
		return ParameterType.integralValue(this.values.get(name)).map(Long::intValue).orElse(defaultValue);
	}

	/**
	 * Read a position as Trello expects it: {@code top}, {@code bottom} or a plain number.
	 * @param name argument name
	 * @return rendered position
	 */
	public Optional<String> position(String name) {
		Object value = this.values.get(name);
		if (value instanceof Number number) {
			return Optional.of(new BigDecimal(number.toString()).stripTrailingZeros().toPlainString());
		}
		return string(name);
	}

	public List<String> stringList(String name) {
		if (this.values.get(name) instanceof List<?> list) {
			return list.stream().map(String::valueOf).map(String::strip).toList();
		}
		return List.of();
	}

	public Map<?, ?> object(String name) {
		return this.values.get(name) instanceof Map<?, ?> map ? map : Map.of();
	}

	/**
	 * Whether the caller supplied the key at all, including an explicit {@code null}.
	 * @param name argument name
	 * @return {@code true} if the key is present
	 */
	public boolean isPresent(String name) {
		return this.values.containsKey(name);
	}

}
