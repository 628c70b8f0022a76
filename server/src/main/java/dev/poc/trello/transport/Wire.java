package dev.poc.trello.transport;

import java.util.regex.Pattern;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Logs JSON-RPC traffic in the same format for every transport. Credential arguments are masked
 * before anything is written.
 */
public final class Wire {

	private static final Logger LOGGER = LoggerFactory.getLogger("WIRE");

	private static final Pattern CREDENTIAL_VALUE = Pattern.compile("(\"(?:api_key|token)\"\\s*:\\s*\")[^\"]*(\")");

	static final int MAX_LOGGED = 200;

	private Wire() {
	}

	public static void rx(String transport, String json) {
		if (LOGGER.isInfoEnabled()) {
			LOGGER.info("RX transport={} json={}", transport, truncate(redact(json), MAX_LOGGED));
		}
	}

	public static void tx(String transport, String json) {
		if (LOGGER.isInfoEnabled()) {
			LOGGER.info("TX transport={} json={}", transport, truncate(redact(json), MAX_LOGGED));
		}
	}

	public static String redact(String json) {
		if (json == null) {
			return null;
		}
		return CREDENTIAL_VALUE.matcher(json).replaceAll("$1***$2");
	}

	public static String truncate(String value, int max) {
		if (value == null) {
			return null;
		}
		if (value.length() <= max) {
			return value;
		}
		return value.substring(0, max) + "...";
	}

}
