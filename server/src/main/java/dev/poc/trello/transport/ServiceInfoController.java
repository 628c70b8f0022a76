package dev.poc.trello.transport;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RestController;

import dev.poc.trello.config.TrelloMcpProperties;
import dev.poc.trello.credential.CredentialResolver;
import dev.poc.trello.protocol.McpProtocolHandler;
import dev.poc.trello.tool.ToolDescriptor;
import dev.poc.trello.tool.ToolRegistry;

/**
 * Plain HTTP endpoints around the MCP transport: health, service info, tool catalog and the
 * credential session.
 */
@RestController
public class ServiceInfoController {

	private static final Logger logger = LoggerFactory.getLogger(ServiceInfoController.class);

	private final McpProtocolHandler protocolHandler;

	private final ToolRegistry toolRegistry;

	private final CredentialResolver credentialResolver;

	private final String serverName;

	private final String serverVersion;

	public ServiceInfoController(McpProtocolHandler protocolHandler, ToolRegistry toolRegistry,
			CredentialResolver credentialResolver, TrelloMcpProperties properties) {
		this.protocolHandler = protocolHandler;
		this.toolRegistry = toolRegistry;
		this.credentialResolver = credentialResolver;
		this.serverName = properties.getServer().getName();
		this.serverVersion = properties.getServer().getVersion();
	}

	@GetMapping("/health")
	public Map<String, Object> health() {
		Map<String, Object> health = new LinkedHashMap<>();
		health.put("status", "healthy");
		health.put("service", this.serverName);
		health.put("version", this.serverVersion);
		health.put("protocol_state", this.protocolHandler.state().name().toLowerCase());
		health.put("timestamp", Instant.now().toString());
		health.put("credentials", this.credentialResolver.sessionInfo().toStructured());
		return health;
	}

	@GetMapping("/")
	public Map<String, Object> root() {
		Map<String, Object> info = new LinkedHashMap<>();
		info.put("name", this.serverName);
		info.put("version", this.serverVersion);
		info.put("description", "MCP server for Trello boards, lists and cards");
		info.put("protocol_versions", McpProtocolHandler.SUPPORTED_PROTOCOL_VERSIONS);
		info.put("endpoints", List.of("/mcp", "/health", "/tools", "/auth/login", "/auth/logout"));
		info.put("tools", this.toolRegistry.list().stream().map(ToolDescriptor::name).toList());
		return info;
	}

	@GetMapping("/tools")
	public Map<String, Object> tools() {
		List<Map<String, Object>> tools = this.toolRegistry.list().stream().map(descriptor -> {
			Map<String, Object> tool = new LinkedHashMap<>();
			tool.put("name", descriptor.name());
			tool.put("description", descriptor.description());
			tool.put("required", descriptor.requiredParameters());
			tool.put("oneOfRequired", descriptor.oneOfRequired());
			return tool;
		}).toList();
		return Map.of("count", tools.size(), "tools", tools);
	}

	@GetMapping("/auth/login")
	public Map<String, Object> login() {
		Map<String, Object> login = new LinkedHashMap<>(this.credentialResolver.sessionInfo().toStructured());
		login.put("instructions", List.of("Open " + this.credentialResolver.loginUrl(),
				"Copy your API key and generate a token",
				"Pass them as api_key and token arguments, or set TRELLO_API_KEY and TRELLO_TOKEN"));
		return login;
	}

	@PostMapping("/auth/logout")
	public Map<String, Object> logout() {
		this.credentialResolver.clear();
		logger.info("Credential cache cleared on request");
		return Map.of("status", "logged_out", "message", "Cached Trello credentials cleared");
	}

}
