package dev.poc.trello.model;

import java.util.LinkedHashMap;
import java.util.Map;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Board member.
 * @param id member identifier
 * @param username login name
 * @param fullName display name
 */
public record Member(String id, String username, String fullName) {

	public static Member from(JsonNode node) {
		return new Member(JsonNodes.text(node, "id"), JsonNodes.text(node, "username"),
				JsonNodes.text(node, "fullName"));
	}

	public Map<String, Object> toStructured() {
		Map<String, Object> structured = new LinkedHashMap<>();
		structured.put("id", id);
		structured.put("username", username);
		structured.put("fullName", fullName);
		return structured;
	}

}
