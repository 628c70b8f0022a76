package dev.poc.trello.model;

import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * A board together with its open lists, open cards and members.
 * @param board board summary
 * @param lists open lists
 * @param cards open cards
 * @param members board members
 */
public record BoardDetail(Board board, List<BoardList> lists, List<Card> cards, List<Member> members) {

	public static BoardDetail from(JsonNode node) {
		return new BoardDetail(Board.from(node), JsonNodes.elements(node.get("lists"), BoardList::from),
				JsonNodes.elements(node.get("cards"), Card::from), JsonNodes.elements(node.get("members"), Member::from));
	}

	public Map<String, Object> toStructured() {
		Map<String, Object> structured = board.toStructured();
		structured.put("lists", lists.stream().map(BoardList::toStructured).toList());
		structured.put("cards", cards.stream().map(Card::toStructured).toList());
		structured.put("members", members.stream().map(Member::toStructured).toList());
		return structured;
	}

	public String summaryLine() {
		return "Board %s with %d lists, %d cards and %d members".formatted(board.summaryLine(), lists.size(),
				cards.size(), members.size());
	}

}
