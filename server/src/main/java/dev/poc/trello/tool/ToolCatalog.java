package dev.poc.trello.tool;

import java.util.List;

/**
 * The fixed catalog of Trello tools exposed over MCP.
 */
public final class ToolCatalog {

	public static final String LIST_BOARDS = "list_boards";

	public static final String GET_BOARD = "get_board";

	public static final String CREATE_BOARD = "create_board";

	public static final String UPDATE_BOARD = "update_board";

	public static final String GET_LISTS = "get_lists";

	public static final String CREATE_LIST = "create_list";

	public static final String GET_CARDS = "get_cards";

	public static final String CREATE_CARD = "create_card";

	public static final String UPDATE_CARD = "update_card";

	public static final String ADD_MEMBER_TO_CARD = "add_member_to_card";

	public static final String SEARCH_CARDS = "search_cards";

	static final int MAX_NAME_LENGTH = 16384;

	static final int DEFAULT_SEARCH_LIMIT = 50;

	private ToolCatalog() {
	}

	/**
	 * Build every tool descriptor in advertisement order.
	 * @return immutable list of descriptors
	 */
	public static List<ToolDescriptor> descriptors() {
		return List.of(
				ToolDescriptor.builder(LIST_BOARDS, "List all open Trello boards for the authenticated user").build(),
				ToolDescriptor.builder(GET_BOARD, "Get detailed information about a board, its lists, cards and members")
					.parameter(id("board_id", "ID of the board").required())
					.build(),
				ToolDescriptor.builder(CREATE_BOARD, "Create a new Trello board")
					.parameter(name("Name of the board").required())
					.parameter(ParameterSpec.builder("desc", ParameterType.STRING).description("Board description"))
					.parameter(id("organization_id", "Workspace (organization) to create the board in"))
					.parameter(ParameterSpec.builder("default_lists", ParameterType.BOOLEAN)
						.description("Create the default To Do / Doing / Done lists")
						.defaultValue(true))
					.parameter(prefs())
					.build(),
				ToolDescriptor.builder(UPDATE_BOARD, "Update an existing board")
					.parameter(id("board_id", "ID of the board").required())
					.parameter(name("New board name"))
					.parameter(ParameterSpec.builder("desc", ParameterType.STRING).description("New board description"))
					.parameter(ParameterSpec.builder("closed", ParameterType.BOOLEAN).description("Close or reopen the board"))
					.parameter(prefs())
					.build(),
				ToolDescriptor.builder(GET_LISTS, "Get all open lists on a board")
					.parameter(id("board_id", "ID of the board").required())
					.build(),
				ToolDescriptor.builder(CREATE_LIST, "Create a new list on a board")
					.parameter(name("Name of the list").required())
					.parameter(id("board_id", "ID of the board").required())
					.parameter(position("Position of the list"))
					.build(),
				ToolDescriptor.builder(GET_CARDS, "Get open cards from a board or a list")
					.parameter(id("board_id", "ID of the board (optional if list_id provided)"))
					.parameter(id("list_id", "ID of the list (optional if board_id provided)"))
					.oneOfRequired("board_id", "list_id")
					.build(),
				ToolDescriptor.builder(CREATE_CARD, "Create a new card in a list")
					.parameter(name("Name of the card").required())
					.parameter(id("list_id", "ID of the list").required())
					.parameter(ParameterSpec.builder("desc", ParameterType.STRING).description("Card description"))
					.parameter(position("Position of the card"))
					.parameter(ParameterSpec.builder("due", ParameterType.DATE).description("Due date (ISO-8601)"))
					.parameter(ParameterSpec.builder("labels", ParameterType.STRING_ARRAY).nonBlank().description("Label IDs"))
					.parameter(ParameterSpec.builder("members", ParameterType.STRING_ARRAY).nonBlank().description("Member IDs"))
					.build(),
				ToolDescriptor.builder(UPDATE_CARD, "Update an existing card")
					.parameter(id("card_id", "ID of the card").required())
					.parameter(name("New card name"))
					.parameter(ParameterSpec.builder("desc", ParameterType.STRING).description("New card description"))
					.parameter(ParameterSpec.builder("closed", ParameterType.BOOLEAN).description("Archive or restore the card"))
					.parameter(id("list_id", "Move the card to this list"))
					.parameter(position("New position"))
					.parameter(ParameterSpec.builder("due", ParameterType.DATE)
						.nullable()
						.description("Due date (ISO-8601), null or empty to remove"))
					.build(),
				ToolDescriptor.builder(ADD_MEMBER_TO_CARD, "Add a member to a card")
					.parameter(id("card_id", "ID of the card").required())
					.parameter(id("member_id", "ID of the member to add").required())
					.build(),
				ToolDescriptor.builder(SEARCH_CARDS, "Search cards across boards")
					.parameter(ParameterSpec.builder("query", ParameterType.STRING)
						.required()
						.nonBlank()
						.description("Search query"))
					.parameter(ParameterSpec.builder("board_ids", ParameterType.STRING_ARRAY)
						.nonBlank()
						.description("Board IDs to search in (all open boards when omitted)"))
					.parameter(ParameterSpec.builder("limit", ParameterType.INTEGER)
						.range(1, 1000)
						.defaultValue(DEFAULT_SEARCH_LIMIT)
						.description("Maximum number of cards to return"))
					.build());
	}

	private static ParameterSpec.Builder id(String name, String description) {
		return ParameterSpec.builder(name, ParameterType.STRING).nonBlank().description(description);
	}

	private static ParameterSpec.Builder name(String description) {
		return ParameterSpec.builder("name", ParameterType.STRING)
			.nonBlank()
			.maxLength(MAX_NAME_LENGTH)
			.description(description);
	}

	private static ParameterSpec.Builder position(String description) {
		return ParameterSpec.builder("pos", ParameterType.POSITION).description(description + " (top, bottom or a number)");
	}

	private static ParameterSpec.Builder prefs() {
		String[] audience = { "disabled", "members", "observers", "org", "public" };
		return ParameterSpec.builder("prefs", ParameterType.OBJECT)
			.description("Board preferences")
			.property(ParameterSpec.builder("permissionLevel", ParameterType.STRING)
				.allowedValues("private", "org", "public")
				.build())
			.property(ParameterSpec.builder("voting", ParameterType.STRING).allowedValues(audience).build())
			.property(ParameterSpec.builder("comments", ParameterType.STRING).allowedValues(audience).build())
			.property(ParameterSpec.builder("background", ParameterType.STRING).nonBlank().build());
	}

}
