package dev.poc.trello.exception;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Failure reported by (or while talking to) the Trello REST API.
 */
public class TrelloApiException extends TrelloMcpException {

	private final Integer status;

	public TrelloApiException(ErrorKind kind, Integer status, String message) {
		super(kind, message);
		this.status = status;
	}

	public TrelloApiException(ErrorKind kind, Integer status, String message, Throwable cause) {
		super(kind, message, cause);
		this.status = status;
	}

	/**
	 * Map an HTTP status returned by Trello onto the error taxonomy.
	 * @param status HTTP status code
	 * @param operation short description of the attempted call, used in the message
	 * @return exception describing the failure
	 */
	public static TrelloApiException fromStatus(int status, String operation) {
		return switch (status) {
			case 400 -> new TrelloApiException(ErrorKind.INVALID_ARGUMENTS, status,
					"Trello rejected the request parameters for " + operation);
			case 401 -> new TrelloApiException(ErrorKind.UNAUTHORIZED, status,
					"Unauthorized - check your API key and token");
			case 403 -> new TrelloApiException(ErrorKind.UNAUTHORIZED, status,
					"Forbidden - insufficient permissions for " + operation);
			case 404 -> new TrelloApiException(ErrorKind.NOT_FOUND, status,
					"Not found - the requested resource does not exist (" + operation + ")");
			case 429 -> new TrelloApiException(ErrorKind.RATE_LIMITED, status, "Rate limit exceeded");
			default -> new TrelloApiException(ErrorKind.EXTERNAL_ERROR, status,
					"Trello API request failed with status " + status + " (" + operation + ")");
		};
	}

	/**
	 * HTTP status returned by Trello, or {@code null} for transport-level failures.
	 * @return status code when available
	 */
	public Integer status() {
		return this.status;
	}

	@Override
	public Map<String, Object> details() {
		if (this.status == null) {
			return Map.of();
		}
		Map<String, Object> details = new LinkedHashMap<>();
		details.put("status", this.status);
		return details;
	}

}
