package dev.poc.trello.model;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Null-tolerant accessors for Trello JSON payloads.
 */
final class JsonNodes {

	private JsonNodes() {
	}

	static String text(JsonNode node, String field) {
		JsonNode value = node == null ? null : node.get(field);
		return value == null || value.isNull() ? null : value.asText();
	}

	static boolean flag(JsonNode node, String field) {
		return node != null && node.path(field).asBoolean(false);
	}

	static Double number(JsonNode node, String field) {
		JsonNode value = node == null ? null : node.get(field);
		return value != null && value.isNumber() ? value.asDouble() : null;
	}

	static List<String> texts(JsonNode node, String field) {
		List<String> values = new ArrayList<>();
		JsonNode array = node == null ? null : node.get(field);
		if (array != null && array.isArray()) {
			array.forEach(element -> values.add(element.asText()));
		}
		return values;
	}

	static <T> List<T> elements(JsonNode node, Function<JsonNode, T> mapper) {
		List<T> values = new ArrayList<>();
		if (node != null && node.isArray()) {
			node.forEach(element -> values.add(mapper.apply(element)));
		}
		return values;
	}

}
