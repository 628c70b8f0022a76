package dev.poc.trello.tool;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import dev.poc.trello.exception.ErrorKind;
import dev.poc.trello.exception.TrelloMcpException;

/**
 * Registry of tool descriptors with a generic argument validator.
 */
public class ToolRegistry {

	private final Map<String, ToolDescriptor> descriptors = new LinkedHashMap<>();

	public ToolRegistry(List<ToolDescriptor> descriptors) {
		for (ToolDescriptor descriptor : descriptors) {
			if (this.descriptors.putIfAbsent(descriptor.name(), descriptor) != null) {
				throw new IllegalArgumentException("Duplicate tool: " + descriptor.name());
			}
		}
	}

	public Optional<ToolDescriptor> describe(String name) {
		return Optional.ofNullable(this.descriptors.get(name));
	}

	public List<ToolDescriptor> list() {
		return List.copyOf(this.descriptors.values());
	}

	/**
	 * Validate arguments for the named tool. Unknown argument keys are ignored. An explicit
	 * {@code null} is treated as absent unless the parameter is nullable.
	 * @param name tool name
	 * @param arguments call arguments, may be {@code null}
	 * @return validation outcome
	 * @throws TrelloMcpException with {@link ErrorKind#UNKNOWN_OPERATION} if the tool does not exist
	 */
	public ValidationResult validate(String name, Map<String, Object> arguments) {
		ToolDescriptor descriptor = describe(name)
			.orElseThrow(() -> new TrelloMcpException(ErrorKind.UNKNOWN_OPERATION, "Unknown tool: " + name));
		Map<String, Object> safe = arguments == null ? Map.of() : arguments;
		List<String> missing = new ArrayList<>();
		List<String> errors = new ArrayList<>();
		for (ParameterSpec parameter : descriptor.parameters()) {
			Object value = safe.get(parameter.name());
			if (value == null) {
				if (parameter.required()) {
					missing.add(parameter.name());
				}
				continue;
			}
			parameter.check(parameter.name(), value, errors);
		}
		for (List<String> group : descriptor.oneOfRequired()) {
			boolean satisfied = group.stream().map(safe::get).anyMatch(ToolRegistry::isSupplied);
			if (!satisfied) {
				missing.add(String.join(" or ", group));
			}
		}
		return new ValidationResult(missing, errors);
	}

	private static boolean isSupplied(Object value) {
		return value != null && !(value instanceof String text && text.isBlank());
	}

}
