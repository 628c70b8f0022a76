package dev.poc.trello.tool;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Outcome of validating tool arguments against a {@link ToolDescriptor}.
 * @param missingFields required arguments that were absent or {@code null}
 * @param typeErrors arguments with a wrong type or a violated constraint
 */
public record ValidationResult(List<String> missingFields, List<String> typeErrors) {

	public ValidationResult {
		missingFields = List.copyOf(missingFields);
		typeErrors = List.copyOf(typeErrors);
	}

	public boolean valid() {
		return this.missingFields.isEmpty() && this.typeErrors.isEmpty();
	}

	/**
	 * Client facing message listing every problem found.
	 * @return validation message
	 */
	public String message() {
		List<String> parts = new ArrayList<>();
		if (!this.missingFields.isEmpty()) {
			parts.add("missing required arguments: " + String.join(", ", this.missingFields));
		}
		if (!this.typeErrors.isEmpty()) {
			parts.add(String.join("; ", this.typeErrors));
		}
		return "Invalid arguments - " + String.join("; ", parts);
	}

	public Map<String, Object> details() {
		Map<String, Object> details = new LinkedHashMap<>();
		details.put("missing_fields", this.missingFields);
		details.put("type_errors", this.typeErrors);
		return details;
	}

}
