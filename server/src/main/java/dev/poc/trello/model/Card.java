package dev.poc.trello.model;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Trello card.
 * @param id card identifier
 * @param name card title
 * @param desc card description
 * @param closed whether the card is archived
 * @param due due date as returned by Trello, may be {@code null}
 * @param url card URL
 * @param listId list holding the card
 * @param boardId board holding the card
 * @param labels label names
 * @param memberIds assigned member identifiers
 */
public record Card(String id, String name, String desc, boolean closed, String due, String url, String listId,
		String boardId, List<String> labels, List<String> memberIds) {

	public static Card from(JsonNode node) {
		List<String> labels = JsonNodes.elements(node == null ? null : node.get("labels"),
				label -> label.isObject() ? label.path("name").asText() : label.asText());
		return new Card(JsonNodes.text(node, "id"), JsonNodes.text(node, "name"), JsonNodes.text(node, "desc"),
				JsonNodes.flag(node, "closed"), JsonNodes.text(node, "due"), JsonNodes.text(node, "url"),
				JsonNodes.text(node, "idList"), JsonNodes.text(node, "idBoard"), List.copyOf(labels),
				List.copyOf(JsonNodes.texts(node, "idMembers")));
	}

	public Map<String, Object> toStructured() {
		Map<String, Object> structured = new LinkedHashMap<>();
		structured.put("id", id);
		structured.put("name", name);
		structured.put("desc", desc);
		structured.put("closed", closed);
		structured.put("due", due);
		structured.put("url", url);
		structured.put("idList", listId);
		structured.put("idBoard", boardId);
		structured.put("labels", labels);
		structured.put("idMembers", memberIds);
		return structured;
	}

	public String summaryLine() {
		return "%s (%s)".formatted(name == null ? "Unnamed" : name, id);
	}

}
