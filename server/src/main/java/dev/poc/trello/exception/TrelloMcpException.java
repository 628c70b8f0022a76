package dev.poc.trello.exception;

import java.util.Map;

/**
 * Base runtime exception for failures raised while serving a tool call. Every instance carries the
 * {@link ErrorKind} that decides how the failure is reported to the client.
 * <p>
 * Messages are surfaced to MCP clients verbatim, so they must never contain credential values.
 */
public class TrelloMcpException extends RuntimeException {

	private final ErrorKind kind;

	/**
	 * Create an exception of the given kind.
	 * @param kind failure classification
	 * @param message client-safe detail message
	 */
	public TrelloMcpException(ErrorKind kind, String message) {
		super(message);
		this.kind = kind;
	}

	/**
	 * Create an exception of the given kind wrapping a lower-level cause.
	 * @param kind failure classification
	 * @param message client-safe detail message
	 * @param cause underlying exception, kept for logging only
	 */
	public TrelloMcpException(ErrorKind kind, String message, Throwable cause) {
		super(message, cause);
		this.kind = kind;
	}

	public ErrorKind kind() {
		return this.kind;
	}

	/**
	 * Additional structured details to include in the error payload.
	 * @return details map, empty by default
	 */
	public Map<String, Object> details() {
		return Map.of();
	}

}
