package dev.poc.trello.protocol;

/**
 * JSON-RPC level failure carrying the error code and optional data that end up in the error
 * envelope.
 */
public class McpProtocolException extends RuntimeException {

	private final int code;

	private final transient Object data;

	public McpProtocolException(int code, String message) {
		this(code, message, null);
	}

	public McpProtocolException(int code, String message, Object data) {
		super(message);
		this.code = code;
		this.data = data;
	}

	public int code() {
		return this.code;
	}

	public Object data() {
		return this.data;
	}

}
