package dev.poc.trello.config;

import java.util.List;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Security properties for the HTTP transport. Basic authentication is off unless
 * {@code enabled} is set; CORS origins default to any origin.
 */
@ConfigurationProperties("trello.mcp.security")
public record McpSecurityProperties(boolean enabled, String username, String password, List<String> allowedOrigins) {

	public McpSecurityProperties {
		username = username == null || username.isBlank() ? "mcp" : username;
		password = password == null || password.isBlank() ? "change-me" : password;
		allowedOrigins = allowedOrigins == null || allowedOrigins.isEmpty() ? List.of("*") : List.copyOf(allowedOrigins);
	}

}
