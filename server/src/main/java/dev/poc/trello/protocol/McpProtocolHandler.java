package dev.poc.trello.protocol;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.NullNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import dev.poc.trello.tool.OperationRequest;
import dev.poc.trello.tool.OperationResult;
import dev.poc.trello.tool.ToolDescriptor;
import dev.poc.trello.tool.ToolDispatcher;
import io.modelcontextprotocol.spec.McpSchema;

/**
 * Transport independent JSON-RPC 2.0 handler for the MCP methods this server supports. Each
 * inbound message yields at most one response; notifications yield none.
 */
public class McpProtocolHandler {

	private static final Logger logger = LoggerFactory.getLogger(McpProtocolHandler.class);

	public static final List<String> SUPPORTED_PROTOCOL_VERSIONS = List.of("2024-11-05", "2025-03-26",
			"2025-06-18");

	private static final TypeReference<Map<String, Object>> ARGUMENTS_TYPE = new TypeReference<>() {
	};

	private final ToolDispatcher dispatcher;

	private final ObjectMapper mapper;

	private final String serverName;

	private final String serverVersion;

	private final AtomicReference<ProtocolState> state = new AtomicReference<>(ProtocolState.UNINITIALIZED);

	public McpProtocolHandler(ToolDispatcher dispatcher, ObjectMapper mapper, String serverName,
			String serverVersion) {
		this.dispatcher = dispatcher;
		this.mapper = mapper;
		this.serverName = serverName;
		this.serverVersion = serverVersion;
	}

	public ProtocolState state() {
		return this.state.get();
	}

	/**
	 * Handle one raw JSON-RPC message.
	 * @param raw message text
	 * @return response envelope, empty for notifications
	 */
	public Optional<JsonNode> handle(String raw) {
		JsonNode message;
		try {
			message = this.mapper.readTree(raw);
		}
		catch (JsonProcessingException e) {
			logger.debug("Rejecting unparseable message", e);
			return Optional.of(error(NullNode.getInstance(), McpSchema.ErrorCodes.PARSE_ERROR, "Parse error", null));
		}
		return handle(message);
	}

	/**
	 * Handle one parsed JSON-RPC message.
	 * @param message message tree
	 * @return response envelope, empty for notifications
	 */
	public Optional<JsonNode> handle(JsonNode message) {
		if (message == null || !message.isObject()) {
			return Optional.of(error(NullNode.getInstance(), McpSchema.ErrorCodes.INVALID_REQUEST, "Invalid Request",
					null));
		}
		JsonNode id = message.get("id");
		boolean notification = id == null;
		JsonNode responseId = notification ? NullNode.getInstance() : id;
		if (!McpSchema.JSONRPC_VERSION.equals(message.path("jsonrpc").asText(null))) {
			return Optional.of(error(responseId, McpSchema.ErrorCodes.INVALID_REQUEST,
					"Invalid Request: jsonrpc must be \"2.0\"", null));
		}
		JsonNode method = message.get("method");
		if (method == null || !method.isTextual()) {
			if (message.has("result") || message.has("error")) {
				logger.debug("Ignoring client response for id {}", id);
				return Optional.empty();
			}
			return Optional.of(error(responseId, McpSchema.ErrorCodes.INVALID_REQUEST,
					"Invalid Request: method is required", null));
		}
		try {
			JsonNode result = dispatch(method.asText(), message.path("params"));
			return notification ? Optional.empty() : Optional.of(result(responseId, result));
		}
		catch (McpProtocolException e) {
			if (notification) {
				logger.debug("Dropping error for notification {}: {}", method.asText(), e.getMessage());
				return Optional.empty();
			}
			return Optional.of(error(responseId, e.code(), e.getMessage(), e.data()));
		}
		catch (RuntimeException e) {
			logger.error("Unexpected failure handling {}", method.asText(), e);
			return notification ? Optional.empty()
					: Optional.of(error(responseId, McpSchema.ErrorCodes.INTERNAL_ERROR, "Internal error", null));
		}
	}

	private JsonNode dispatch(String method, JsonNode params) {
		return switch (method) {
			case McpSchema.METHOD_INITIALIZE -> initialize(params);
			case McpSchema.METHOD_NOTIFICATION_INITIALIZED -> {
				logger.info("Client finished initialization");
				yield this.mapper.createObjectNode();
			}
			case McpSchema.METHOD_PING -> this.mapper.createObjectNode();
			case McpSchema.METHOD_TOOLS_LIST -> toolsList();
			case McpSchema.METHOD_TOOLS_CALL -> toolsCall(params);
			case McpSchema.METHOD_RESOURCES_LIST -> emptyListing("resources");
			case McpSchema.METHOD_PROMPT_LIST -> emptyListing("prompts");
			default -> throw new McpProtocolException(McpSchema.ErrorCodes.METHOD_NOT_FOUND,
					"Method not found: " + method);
		};
	}

	private JsonNode initialize(JsonNode params) {
		String requested = params.path("protocolVersion").asText(null);
		String negotiated = SUPPORTED_PROTOCOL_VERSIONS.contains(requested) ? requested
				: SUPPORTED_PROTOCOL_VERSIONS.get(SUPPORTED_PROTOCOL_VERSIONS.size() - 1);
		JsonNode clientInfo = params.path("clientInfo");
		logger.info("Initialize from {} {} (protocol {} -> {})", clientInfo.path("name").asText("unknown"),
				clientInfo.path("version").asText(""), requested, negotiated);
		this.state.set(ProtocolState.READY);

		ObjectNode result = this.mapper.createObjectNode();
		result.put("protocolVersion", negotiated);
		ObjectNode capabilities = result.putObject("capabilities");
		capabilities.putObject("tools").put("listChanged", false);
		ObjectNode serverInfo = result.putObject("serverInfo");
		serverInfo.put("name", this.serverName);
		serverInfo.put("version", this.serverVersion);
		return result;
	}

	private JsonNode toolsList() {
		ObjectNode result = this.mapper.createObjectNode();
		ArrayNode tools = result.putArray("tools");
		for (ToolDescriptor descriptor : this.dispatcher.registry().list()) {
			tools.add(this.mapper.valueToTree(descriptor.toMcpTool()));
		}
		return result;
	}

	private JsonNode toolsCall(JsonNode params) {
		JsonNode name = params.get("name");
		if (name == null || !name.isTextual() || name.asText().isBlank()) {
			throw new McpProtocolException(McpSchema.ErrorCodes.INVALID_PARAMS, "Invalid params: tool name is required");
		}
		JsonNode arguments = params.get("arguments");
		if (arguments != null && !arguments.isNull() && !arguments.isObject()) {
			throw new McpProtocolException(McpSchema.ErrorCodes.INVALID_PARAMS,
					"Invalid params: arguments must be an object");
		}
		Map<String, Object> values = arguments == null || arguments.isNull() ? Map.of()
				: this.mapper.convertValue(arguments, ARGUMENTS_TYPE);
		OperationResult outcome = this.dispatcher.invoke(OperationRequest.fromToolCall(name.asText(), values));
		if (outcome instanceof OperationResult.Failure failure) {
			Map<String, Object> data = new LinkedHashMap<>();
			data.put("kind", failure.kind().label());
			data.put("class", failure.kind().codeClass());
			data.putAll(failure.details());
			throw new McpProtocolException(failure.kind().code(), failure.message(), data);
		}
		OperationResult.Success success = (OperationResult.Success) outcome;
		McpSchema.CallToolResult result = McpSchema.CallToolResult.builder()
			.addTextContent(success.summary())
			.structuredContent(success.structured())
			.isError(false)
			.build();
		return this.mapper.valueToTree(result);
	}

	private JsonNode emptyListing(String field) {
		ObjectNode result = this.mapper.createObjectNode();
		result.putArray(field);
		return result;
	}

	private ObjectNode result(JsonNode id, JsonNode result) {
		ObjectNode response = this.mapper.createObjectNode();
		response.put("jsonrpc", McpSchema.JSONRPC_VERSION);
		response.set("id", id);
		response.set("result", result);
		return response;
	}

	private ObjectNode error(JsonNode id, int code, String message, Object data) {
		ObjectNode response = this.mapper.createObjectNode();
		response.put("jsonrpc", McpSchema.JSONRPC_VERSION);
		response.set("id", id);
		ObjectNode error = response.putObject("error");
		error.put("code", code);
		error.put("message", message);
		if (data != null) {
			error.set("data", this.mapper.valueToTree(data));
		}
		return response;
	}

}
