package dev.poc.trello.config;

import java.util.Objects;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Configuration properties selecting how MCP messages reach the server: JSON-RPC over HTTP
 * {@code POST}, or newline-delimited JSON-RPC over standard input and output.
 */
@ConfigurationProperties(prefix = "trello.mcp.transport")
public class McpTransportProperties {

	/**
	 * Transport used to expose the MCP server. Defaults to HTTP.
	 */
	private TransportType type = TransportType.HTTP;

	/**
	 * HTTP endpoint path that accepts JSON-RPC messages. Defaults to {@code /mcp}.
	 */
	private String endpoint = "/mcp";

	/**
	 * Retrieve the selected transport type.
	 * @return currently configured transport
	 */
	public TransportType getType() {
		return type;
	}

	/**
	 * Update the selected transport type.
	 * @param type new transport to use
	 */
	public void setType(TransportType type) {
		this.type = Objects.requireNonNullElse(type, TransportType.HTTP);
	}

	public String getEndpoint() {
		return endpoint;
	}

	public void setEndpoint(String endpoint) {
		this.endpoint = endpoint;
	}

	/**
	 * Available transports.
	 */
	public enum TransportType {
		HTTP, STDIO
	}

}
