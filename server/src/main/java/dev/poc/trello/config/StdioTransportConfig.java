package dev.poc.trello.config;

import java.io.FileDescriptor;
import java.io.FileOutputStream;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Profile;

import dev.poc.trello.protocol.McpProtocolHandler;
import dev.poc.trello.transport.StdioTransport;

/**
 * Starts the stdio transport under the {@code stdio} profile, the same profile that moves logging
 * to standard error and switches off the web server. Standard output is reserved for protocol
 * messages.
 */
@Configuration
@Profile("stdio")
public class StdioTransportConfig {

	@Bean(initMethod = "start", destroyMethod = "stop")
	public StdioTransport stdioTransport(McpProtocolHandler mcpProtocolHandler) {
		return new StdioTransport(mcpProtocolHandler, System.in, new FileOutputStream(FileDescriptor.out));
	}

}
