package dev.poc.trello.model;

import java.util.LinkedHashMap;
import java.util.Map;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Trello list (column) on a board.
 * @param id list identifier
 * @param name list name
 * @param closed whether the list is archived
 * @param pos sort position, may be {@code null}
 * @param boardId owning board
 */
public record BoardList(String id, String name, boolean closed, Double pos, String boardId) {

	public static BoardList from(JsonNode node) {
		return new BoardList(JsonNodes.text(node, "id"), JsonNodes.text(node, "name"), JsonNodes.flag(node, "closed"),
				JsonNodes.number(node, "pos"), JsonNodes.text(node, "idBoard"));
	}

	public Map<String, Object> toStructured() {
		Map<String, Object> structured = new LinkedHashMap<>();
		structured.put("id", id);
		structured.put("name", name);
		structured.put("closed", closed);
		structured.put("pos", pos);
		structured.put("idBoard", boardId);
		return structured;
	}

}
