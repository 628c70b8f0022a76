package dev.poc.trello.service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.JsonNode;

import lombok.RequiredArgsConstructor;

import dev.poc.trello.client.TrelloClient;
import dev.poc.trello.client.TrelloRequest;
import dev.poc.trello.credential.CredentialPair;
import dev.poc.trello.exception.ErrorKind;
import dev.poc.trello.exception.TrelloMcpException;
import dev.poc.trello.model.Board;
import dev.poc.trello.model.BoardDetail;
import dev.poc.trello.model.BoardList;
import dev.poc.trello.model.Card;
import dev.poc.trello.model.Member;
import dev.poc.trello.model.SearchOutcome;

/**
 * Service layer mapping board, list and card operations onto Trello REST calls.
 */
@RequiredArgsConstructor
public class TrelloBoardService {

	private static final Logger logger = LoggerFactory.getLogger(TrelloBoardService.class);

	static final String BOARD_FIELDS = "id,name,desc,closed,url,prefs";

	static final String LIST_FIELDS = "id,name,closed,pos,idBoard";

	static final String CARD_FIELDS = "id,name,desc,closed,due,url,idList,idBoard,labels,idMembers";

	private final TrelloClient client;

	public List<Board> listBoards(CredentialPair credentials) {
		JsonNode boards = this.client.execute(TrelloRequest.get("list boards", "/members/me/boards")
			.param("fields", BOARD_FIELDS)
			.param("filter", "open"), credentials);
		return elements(boards, Board::from);
	}

	public BoardDetail getBoard(CredentialPair credentials, String boardId) {
		JsonNode board = this.client.execute(TrelloRequest.get("get board", "/boards/{boardId}", boardId)
			.param("fields", BOARD_FIELDS + ",labelNames")
			.param("lists", "open")
			.param("cards", "open")
			.param("members", "all"), credentials);
		return BoardDetail.from(board);
	}

	/**
	 * Create a board.
	 * @param credentials resolved credentials
	 * @param name board name
	 * @param desc description, omitted when {@code null}
	 * @param organizationId workspace, omitted when {@code null}
	 * @param defaultLists whether Trello should create its default lists
	 * @param prefs board preferences, sent as {@code prefs_<key>}
	 * @return created board
	 */
	public Board createBoard(CredentialPair credentials, String name, String desc, String organizationId,
			boolean defaultLists, Map<?, ?> prefs) {
		TrelloRequest request = TrelloRequest.post("create board", "/boards")
			.param("name", name)
			.param("defaultLists", defaultLists)
			.param("desc", desc)
			.param("idOrganization", organizationId);
		applyPrefs(request, prefs);
		return Board.from(this.client.execute(request, credentials));
	}

	public Board updateBoard(CredentialPair credentials, String boardId, String name, String desc, Boolean closed,
			Map<?, ?> prefs) {
		TrelloRequest request = TrelloRequest.put("update board", "/boards/{boardId}", boardId)
			.param("name", name)
			.param("desc", desc)
			.param("closed", closed);
		applyPrefs(request, prefs);
		return Board.from(this.client.execute(request, credentials));
	}

	public List<BoardList> getLists(CredentialPair credentials, String boardId) {
		JsonNode lists = this.client.execute(TrelloRequest.get("get lists", "/boards/{boardId}/lists", boardId)
			.param("fields", LIST_FIELDS)
			.param("filter", "open"), credentials);
		return elements(lists, BoardList::from);
	}

	public BoardList createList(CredentialPair credentials, String name, String boardId, String pos) {
		JsonNode list = this.client.execute(TrelloRequest.post("create list", "/lists")
			.param("name", name)
			.param("idBoard", boardId)
			.param("pos", pos), credentials);
		return BoardList.from(list);
	}

	/**
	 * Fetch open cards of a list, or of a board when no list is given.
	 * @param credentials resolved credentials
	 * @param boardId board to read, used when {@code listId} is {@code null}
	 * @param listId list to read
	 * @return open cards
	 */
	public List<Card> getCards(CredentialPair credentials, String boardId, String listId) {
		TrelloRequest request = listId != null
				? TrelloRequest.get("get cards", "/lists/{listId}/cards", listId)
				: TrelloRequest.get("get cards", "/boards/{boardId}/cards", boardId);
		JsonNode cards = this.client.execute(request.param("fields", CARD_FIELDS).param("filter", "open"),
				credentials);
		return elements(cards, Card::from);
	}

	public Card createCard(CredentialPair credentials, String listId, String name, String desc, String pos,
			Instant due, List<String> labels, List<String> members) {
		JsonNode card = this.client.execute(TrelloRequest.post("create card", "/cards")
			.param("name", name)
			.param("idList", listId)
			.param("desc", desc)
			.param("pos", pos)
			.param("due", due)
			.param("idLabels", labels.isEmpty() ? null : String.join(",", labels))
			.param("idMembers", members.isEmpty() ? null : String.join(",", members)), credentials);
		return Card.from(card);
	}

	public Card updateCard(CredentialPair credentials, String cardId, CardUpdate update) {
		TrelloRequest request = TrelloRequest.put("update card", "/cards/{cardId}", cardId)
			.param("name", update.name())
			.param("desc", update.desc())
			.param("closed", update.closed())
			.param("idList", update.listId())
			.param("pos", update.pos());
		if (update.removeDue()) {
			request.param("due", "null");
		}
		else {
			request.param("due", update.due());
		}
		return Card.from(this.client.execute(request, credentials));
	}

	public List<Member> addMemberToCard(CredentialPair credentials, String cardId, String memberId) {
		JsonNode members = this.client.execute(
				TrelloRequest.post("add member to card", "/cards/{cardId}/idMembers", cardId).param("value", memberId),
				credentials);
		return elements(members, Member::from);
	}

	/**
	 * Search cards board by board. When no boards are given, every open board is searched. A board
	 * whose query fails is skipped and reported; an authorization failure aborts the search, and if
	 * every board fails the last failure is raised.
	 * @param credentials resolved credentials
	 * @param query search text
	 * @param boardIds boards to search, empty for all open boards
	 * @param limit maximum number of cards returned
	 * @return matching cards with per-board bookkeeping
	 */
	public SearchOutcome searchCards(CredentialPair credentials, String query, List<String> boardIds, int limit) {
		List<String> scopes = boardIds.isEmpty()
				? listBoards(credentials).stream().map(Board::id).toList() : boardIds;
		Map<String, Card> found = new LinkedHashMap<>();
		List<String> searched = new ArrayList<>();
		List<String> failed = new ArrayList<>();
		TrelloMcpException lastFailure = null;
		for (String boardId : scopes) {
			try {
				JsonNode result = this.client.execute(TrelloRequest.get("search cards", "/search")
					.param("query", query)
					.param("modelTypes", "cards")
					.param("idBoards", boardId)
					.param("cards_limit", limit)
					.param("card_fields", CARD_FIELDS), credentials);
				for (Card card : elements(result.get("cards"), Card::from)) {
					if (found.size() < limit) {
						found.putIfAbsent(card.id(), card);
					}
				}
				searched.add(boardId);
			}
			catch (TrelloMcpException e) {
				if (e.kind() == ErrorKind.UNAUTHORIZED) {
					throw e;
				}
				logger.warn("Search on board {} failed ({}), continuing with remaining boards", boardId,
						e.kind().label());
				failed.add(boardId);
				lastFailure = e;
			}
		}
		if (searched.isEmpty() && lastFailure != null) {
			throw lastFailure;
		}
		return new SearchOutcome(query, List.copyOf(found.values()), searched, failed);
	}

	private static void applyPrefs(TrelloRequest request, Map<?, ?> prefs) {
		if (prefs == null) {
			return;
		}
		prefs.forEach((key, value) -> request.param("prefs_" + key, value));
	}

	private static <T> List<T> elements(JsonNode node, Function<JsonNode, T> mapper) {
		List<T> values = new ArrayList<>();
		if (node != null && node.isArray()) {
			node.forEach(element -> values.add(mapper.apply(element)));
		}
		return values;
	}

}
