package dev.poc.trello.tool;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import lombok.RequiredArgsConstructor;

import dev.poc.trello.credential.CredentialPair;
import dev.poc.trello.model.Board;
import dev.poc.trello.model.BoardDetail;
import dev.poc.trello.model.BoardList;
import dev.poc.trello.model.Card;
import dev.poc.trello.model.Member;
import dev.poc.trello.model.SearchOutcome;
import dev.poc.trello.service.CardUpdate;
import dev.poc.trello.service.TrelloBoardService;

/**
 * Tool handlers for the {@link ToolCatalog}. Each handler reads its validated arguments, calls the
 * {@link TrelloBoardService} and shapes a summary plus structured payload.
 */
@RequiredArgsConstructor
public class TrelloToolOperations {

	private final TrelloBoardService boardService;

	/**
	 * Handlers keyed by tool name.
	 * @return one operation per catalog entry
	 */
	public Map<String, ToolOperation> operations() {
		Map<String, ToolOperation> operations = new LinkedHashMap<>();
		operations.put(ToolCatalog.LIST_BOARDS, this::listBoards);
		operations.put(ToolCatalog.GET_BOARD, this::getBoard);
		operations.put(ToolCatalog.CREATE_BOARD, this::createBoard);
		operations.put(ToolCatalog.UPDATE_BOARD, this::updateBoard);
		operations.put(ToolCatalog.GET_LISTS, this::getLists);
		operations.put(ToolCatalog.CREATE_LIST, this::createList);
		operations.put(ToolCatalog.GET_CARDS, this::getCards);
		operations.put(ToolCatalog.CREATE_CARD, this::createCard);
		operations.put(ToolCatalog.UPDATE_CARD, this::updateCard);
		operations.put(ToolCatalog.ADD_MEMBER_TO_CARD, this::addMemberToCard);
		operations.put(ToolCatalog.SEARCH_CARDS, this::searchCards);
		return operations;
	}

	private OperationResult.Success listBoards(CredentialPair credentials, ToolArguments arguments) {
		List<Board> boards = this.boardService.listBoards(credentials);
		Map<String, Object> structured = new LinkedHashMap<>();
		structured.put("count", boards.size());
		structured.put("boards", boards.stream().map(Board::toStructured).toList());
		if (boards.isEmpty()) {
			return new OperationResult.Success("No open boards found", structured);
		}
		return new OperationResult.Success("Found %d boards:%n%s".formatted(boards.size(), bullets(
				boards.stream().map(Board::summaryLine).toList())), structured);
	}

	private OperationResult.Success getBoard(CredentialPair credentials, ToolArguments arguments) {
		BoardDetail detail = this.boardService.getBoard(credentials, arguments.requiredString("board_id"));
		return new OperationResult.Success(detail.summaryLine(), detail.toStructured());
	}

	private OperationResult.Success createBoard(CredentialPair credentials, ToolArguments arguments) {
		Board board = this.boardService.createBoard(credentials, arguments.requiredString("name"),
				arguments.string("desc").orElse(null), arguments.string("organization_id").orElse(null),
				arguments.bool("default_lists").orElse(true), arguments.object("prefs"));
		return new OperationResult.Success("Created board " + board.summaryLine(), board.toStructured());
	}

	private OperationResult.Success updateBoard(CredentialPair credentials, ToolArguments arguments) {
		Board board = this.boardService.updateBoard(credentials, arguments.requiredString("board_id"),
				arguments.string("name").orElse(null), arguments.text("desc").orElse(null),
				arguments.bool("closed").orElse(null), arguments.object("prefs"));
		return new OperationResult.Success("Updated board " + board.summaryLine(), board.toStructured());
	}

	private OperationResult.Success getLists(CredentialPair credentials, ToolArguments arguments) {
		String boardId = arguments.requiredString("board_id");
		List<BoardList> lists = this.boardService.getLists(credentials, boardId);
		Map<String, Object> structured = new LinkedHashMap<>();
		structured.put("board_id", boardId);
		structured.put("count", lists.size());
		structured.put("lists", lists.stream().map(BoardList::toStructured).toList());
		if (lists.isEmpty()) {
			return new OperationResult.Success("No lists found on board " + boardId, structured);
		}
		return new OperationResult.Success("Found %d lists on board %s".formatted(lists.size(), boardId), structured);
	}

	private OperationResult.Success createList(CredentialPair credentials, ToolArguments arguments) {
		BoardList list = this.boardService.createList(credentials, arguments.requiredString("name"),
				arguments.requiredString("board_id"), arguments.position("pos").orElse(null));
		return new OperationResult.Success("Created list %s (%s) on board %s".formatted(list.name(), list.id(),
				list.boardId()), list.toStructured());
	}

	private OperationResult.Success getCards(CredentialPair credentials, ToolArguments arguments) {
		String listId = arguments.string("list_id").orElse(null);
		String boardId = arguments.string("board_id").orElse(null);
		List<Card> cards = this.boardService.getCards(credentials, boardId, listId);
		String source = listId != null ? "list " + listId : "board " + boardId;
		Map<String, Object> structured = new LinkedHashMap<>();
		structured.put("source", source);
		structured.put("count", cards.size());
		structured.put("cards", cards.stream().map(Card::toStructured).toList());
		if (cards.isEmpty()) {
			return new OperationResult.Success("No cards found in " + source, structured);
		}
		return new OperationResult.Success("Found %d cards in %s:%n%s".formatted(cards.size(), source,
				bullets(cards.stream().map(Card::summaryLine).toList())), structured);
	}

	private OperationResult.Success createCard(CredentialPair credentials, ToolArguments arguments) {
		Card card = this.boardService.createCard(credentials, arguments.requiredString("list_id"),
				arguments.requiredString("name"), arguments.string("desc").orElse(null),
				arguments.position("pos").orElse(null), dueDate(arguments), arguments.stringList("labels"),
				arguments.stringList("members"));
		return new OperationResult.Success("Created card " + card.summaryLine(), card.toStructured());
	}

	private OperationResult.Success updateCard(CredentialPair credentials, ToolArguments arguments) {
		boolean removeDue = arguments.isPresent("due") && arguments.string("due").isEmpty();
		CardUpdate update = new CardUpdate(arguments.string("name").orElse(null), arguments.text("desc").orElse(null),
				arguments.bool("closed").orElse(null), arguments.string("list_id").orElse(null),
				arguments.position("pos").orElse(null), dueDate(arguments), removeDue);
		Card card = this.boardService.updateCard(credentials, arguments.requiredString("card_id"), update);
		return new OperationResult.Success("Updated card " + card.summaryLine(), card.toStructured());
	}

	private OperationResult.Success addMemberToCard(CredentialPair credentials, ToolArguments arguments) {
		String cardId = arguments.requiredString("card_id");
		String memberId = arguments.requiredString("member_id");
		List<Member> members = this.boardService.addMemberToCard(credentials, cardId, memberId);
		Map<String, Object> structured = new LinkedHashMap<>();
		structured.put("card_id", cardId);
		structured.put("member_id", memberId);
		structured.put("members", members.stream().map(Member::toStructured).toList());
		return new OperationResult.Success("Added member %s to card %s".formatted(memberId, cardId), structured);
	}

	private OperationResult.Success searchCards(CredentialPair credentials, ToolArguments arguments) {
		SearchOutcome outcome = this.boardService.searchCards(credentials, arguments.requiredString("query"),
				arguments.stringList("board_ids"), arguments.integer("limit", ToolCatalog.DEFAULT_SEARCH_LIMIT));
		return new OperationResult.Success(outcome.summaryLine(), outcome.toStructured());
	}

	private static Instant dueDate(ToolArguments arguments) {
		return arguments.string("due").flatMap(ParameterType::parseDate).orElse(null);
	}

	private static String bullets(List<String> lines) {
		return lines.stream().map(line -> "- " + line).collect(Collectors.joining(System.lineSeparator()));
	}

}
