package dev.poc.trello.tool;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import io.modelcontextprotocol.spec.McpSchema;

/**
 * Immutable description of one tool: its name, description and parameters. Every descriptor also
 * accepts the optional {@code api_key} and {@code token} arguments used for explicit credentials.
 * @param name tool name
 * @param description human readable description
 * @param parameters declared parameters in schema order
 * @param oneOfRequired groups of parameters of which at least one must be supplied
 */
public record ToolDescriptor(String name, String description, List<ParameterSpec> parameters,
		List<List<String>> oneOfRequired) {

	public static final String API_KEY = "api_key";

	public static final String TOKEN = "token";

	public ToolDescriptor {
		parameters = List.copyOf(parameters);
		oneOfRequired = oneOfRequired.stream().map(List::copyOf).toList();
	}

	public static Builder builder(String name, String description) {
		return new Builder(name, description);
	}

	public Optional<ParameterSpec> parameter(String parameterName) {
		return this.parameters.stream().filter(parameter -> parameter.name().equals(parameterName)).findFirst();
	}

	public List<String> requiredParameters() {
		return this.parameters.stream().filter(ParameterSpec::required).map(ParameterSpec::name).toList();
	}

	/**
	 * Build the JSON schema describing this tool's input.
	 * @return schema definition
	 */
	public McpSchema.JsonSchema inputSchema() {
		Map<String, Object> properties = new LinkedHashMap<>();
		this.parameters.forEach(parameter -> properties.put(parameter.name(), parameter.toJsonSchema()));
		return new McpSchema.JsonSchema("object", properties, requiredParameters(), null, null, null);
	}

	/**
	 * Convert the descriptor into the MCP tool definition advertised by {@code tools/list}.
	 * @return MCP tool
	 */
	public McpSchema.Tool toMcpTool() {
		return McpSchema.Tool.builder().name(this.name).description(fullDescription()).inputSchema(inputSchema()).build();
	}

	private String fullDescription() {
		if (this.oneOfRequired.isEmpty()) {
			return this.description;
		}
		StringBuilder text = new StringBuilder(this.description);
		for (List<String> group : this.oneOfRequired) {
			text.append(" (requires one of: ").append(String.join(", ", group)).append(')');
		}
		return text.toString();
	}

	/**
	 * Builder used by {@link ToolCatalog}.
	 */
	public static final class Builder {

		private final String name;

		private final String description;

		private final List<ParameterSpec> parameters = new ArrayList<>();

		private final List<List<String>> oneOfRequired = new ArrayList<>();

		private Builder(String name, String description) {
			this.name = name;
			this.description = description;
		}

		public Builder parameter(ParameterSpec.Builder parameter) {
			this.parameters.add(parameter.build());
			return this;
		}

		public Builder oneOfRequired(String... names) {
			this.oneOfRequired.add(List.of(names));
			return this;
		}

		public ToolDescriptor build() {
			List<ParameterSpec> all = new ArrayList<>(this.parameters);
			all.add(ParameterSpec.builder(API_KEY, ParameterType.STRING)
				.description("Trello API key (optional, prompts or uses the server credentials when omitted)")
				.build());
			all.add(ParameterSpec.builder(TOKEN, ParameterType.STRING)
				.description("Trello API token (optional, prompts or uses the server credentials when omitted)")
				.build());
			return new ToolDescriptor(this.name, this.description, all, this.oneOfRequired);
		}

	}

}
