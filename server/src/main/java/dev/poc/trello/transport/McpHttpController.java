package dev.poc.trello.transport;

import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

import com.fasterxml.jackson.databind.JsonNode;

import lombok.RequiredArgsConstructor;

import dev.poc.trello.protocol.McpProtocolHandler;
import io.modelcontextprotocol.spec.McpSchema;

/**
 * Stateless HTTP transport: one JSON-RPC message per {@code POST}, answered with one JSON-RPC
 * response. Notifications are acknowledged with {@code 202 Accepted}.
 */
@RestController
@RequiredArgsConstructor
public class McpHttpController {

	private static final Logger logger = LoggerFactory.getLogger(McpHttpController.class);

	private static final String TRANSPORT = "http";

	private final McpProtocolHandler protocolHandler;

	@PostMapping(path = "${trello.mcp.transport.endpoint:/mcp}", produces = MediaType.APPLICATION_JSON_VALUE)
	public ResponseEntity<JsonNode> handle(@RequestBody(required = false) String body) {
		Wire.rx(TRANSPORT, body);
		Optional<JsonNode> response = this.protocolHandler.handle(body == null ? "" : body);
		if (response.isEmpty()) {
			return ResponseEntity.status(HttpStatus.ACCEPTED).build();
		}
		JsonNode envelope = response.get();
		Wire.tx(TRANSPORT, envelope.toString());
		int code = envelope.path("error").path("code").asInt(0);
		if (code == McpSchema.ErrorCodes.PARSE_ERROR || code == McpSchema.ErrorCodes.INVALID_REQUEST) {
			logger.debug("Malformed request answered with {}", code);
			return ResponseEntity.badRequest().contentType(MediaType.APPLICATION_JSON).body(envelope);
		}
		return ResponseEntity.ok().contentType(MediaType.APPLICATION_JSON).body(envelope);
	}

}
