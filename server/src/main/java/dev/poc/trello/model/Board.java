package dev.poc.trello.model;

import java.util.LinkedHashMap;
import java.util.Map;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Trello board summary.
 * @param id board identifier
 * @param name board name
 * @param desc board description, may be empty
 * @param closed whether the board is closed
 * @param url board URL
 */
public record Board(String id, String name, String desc, boolean closed, String url) {

	public static Board from(JsonNode node) {
		return new Board(JsonNodes.text(node, "id"), JsonNodes.text(node, "name"), JsonNodes.text(node, "desc"),
				JsonNodes.flag(node, "closed"), JsonNodes.text(node, "url"));
	}

	public Map<String, Object> toStructured() {
		Map<String, Object> structured = new LinkedHashMap<>();
		structured.put("id", id);
		structured.put("name", name);
		structured.put("desc", desc);
		structured.put("closed", closed);
		structured.put("url", url);
		return structured;
	}

	public String summaryLine() {
		return "%s (%s)".formatted(name == null ? "Unnamed" : name, id);
	}

}
