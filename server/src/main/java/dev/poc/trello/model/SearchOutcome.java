package dev.poc.trello.model;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Result of a card search that may span several boards. Boards whose query failed are listed in
 * {@code failedBoards} and make the outcome incomplete.
 * @param query search query
 * @param cards matching cards, capped at the requested limit
 * @param boardsSearched boards queried successfully
 * @param failedBoards boards whose query failed
 */
public record SearchOutcome(String query, List<Card> cards, List<String> boardsSearched, List<String> failedBoards) {

	public boolean incomplete() {
		return !failedBoards.isEmpty();
	}

	public Map<String, Object> toStructured() {
		Map<String, Object> structured = new LinkedHashMap<>();
		structured.put("query", query);
		structured.put("count", cards.size());
		structured.put("cards", cards.stream().map(Card::toStructured).toList());
		structured.put("boardsSearched", boardsSearched);
		structured.put("failedBoards", failedBoards);
		structured.put("incomplete", incomplete());
		return structured;
	}

	public String summaryLine() {
		String base = "Found %d cards matching '%s'".formatted(cards.size(), query);
		if (incomplete()) {
			return base + " (incomplete: %d of %d boards failed)".formatted(failedBoards.size(),
					failedBoards.size() + boardsSearched.size());
		}
		return base;
	}

}
