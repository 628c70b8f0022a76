package dev.poc.trello.client;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.springframework.http.HttpMethod;

/**
 * Outbound Trello call: method, path template with its values, and query parameters. Values are
 * expanded as URI variables so they are always encoded.
 */
public final class TrelloRequest {

	private final HttpMethod method;

	private final String pathTemplate;

	private final List<Object> pathValues;

	private final Map<String, String> query = new LinkedHashMap<>();

	private final String description;

	private TrelloRequest(HttpMethod method, String description, String pathTemplate, Object... pathValues) {
		this.method = method;
		this.description = description;
		this.pathTemplate = pathTemplate;
		this.pathValues = List.of(pathValues);
	}

	public static TrelloRequest get(String description, String pathTemplate, Object... pathValues) {
		return new TrelloRequest(HttpMethod.GET, description, pathTemplate, pathValues);
	}

	public static TrelloRequest post(String description, String pathTemplate, Object... pathValues) {
		return new TrelloRequest(HttpMethod.POST, description, pathTemplate, pathValues);
	}

	public static TrelloRequest put(String description, String pathTemplate, Object... pathValues) {
		return new TrelloRequest(HttpMethod.PUT, description, pathTemplate, pathValues);
	}

	/**
	 * Add a query parameter. {@code null} values are skipped so omitted fields are never sent.
	 * @param name parameter name
	 * @param value parameter value, may be {@code null}
	 * @return this request
	 */
	public TrelloRequest param(String name, Object value) {
		if (value != null) {
			this.query.put(name, String.valueOf(value));
		}
		return this;
	}

	public HttpMethod method() {
		return this.method;
	}

	public String pathTemplate() {
		return this.pathTemplate;
	}

	public String description() {
		return this.description;
	}

	public Map<String, String> query() {
		return Collections.unmodifiableMap(this.query);
	}

	/**
	 * All URI variable values in template order: path values, then query values.
	 * @return ordered values
	 */
	List<Object> uriValues() {
		List<Object> values = new ArrayList<>(this.pathValues);
		values.addAll(this.query.values());
		return values;
	}

	@Override
	public String toString() {
		return this.method + " " + this.pathTemplate + " (" + this.description + ")";
	}

}
