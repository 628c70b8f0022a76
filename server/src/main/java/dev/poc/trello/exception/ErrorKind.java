package dev.poc.trello.exception;

/**
 * Failure taxonomy shared by the dispatcher and the protocol layer. Each kind maps onto a JSON-RPC
 * error code class that is reported to the MCP client.
 */
public enum ErrorKind {

	UNKNOWN_OPERATION(-32602, "invalid-request"),

	INVALID_ARGUMENTS(-32602, "invalid-request"),

	AUTHENTICATION_REQUIRED(-32001, "unauthorized"),

	UNAUTHORIZED(-32001, "unauthorized"),

	NOT_FOUND(-32004, "not-found"),

	RATE_LIMITED(-32029, "rate-limited"),

	EXTERNAL_ERROR(-32603, "internal");

	private final int code;

	private final String codeClass;

	ErrorKind(int code, String codeClass) {
		this.code = code;
		this.codeClass = codeClass;
	}

	/**
	 * JSON-RPC error code emitted for this kind.
	 * @return numeric error code
	 */
	public int code() {
		return this.code;
	}

	/**
	 * Coarse code class (invalid-request, unauthorized, not-found, rate-limited, internal).
	 * @return code class label
	 */
	public String codeClass() {
		return this.codeClass;
	}

	/**
	 * Lower-case identifier used in error payloads.
	 * @return snake case name of the kind
	 */
	public String label() {
		return name().toLowerCase();
	}

}
