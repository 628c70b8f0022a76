package dev.poc.trello.protocol;

import java.time.Instant;
import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import dev.poc.trello.credential.CredentialCache;
import dev.poc.trello.credential.CredentialSource;
import dev.poc.trello.exception.TrelloApiException;
import dev.poc.trello.model.Board;
import dev.poc.trello.service.TrelloBoardService;
import dev.poc.trello.support.MutableClock;
import dev.poc.trello.support.StubPrompter;
import dev.poc.trello.support.TestCredentials;
import dev.poc.trello.tool.ToolCatalog;
import dev.poc.trello.tool.ToolDispatcher;
import dev.poc.trello.tool.ToolRegistry;
import dev.poc.trello.tool.TrelloToolOperations;

import static dev.poc.trello.support.TestCredentials.EXPLICIT;
import static dev.poc.trello.support.TestCredentials.PROVISIONED;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class McpProtocolHandlerTest {

	@Mock
	private TrelloBoardService boardService;

	private CredentialCache cache;

	private McpProtocolHandler handler;

	private final ObjectMapper mapper = new ObjectMapper();

	@BeforeEach
	void setUp() {
		this.cache = new CredentialCache(new MutableClock(Instant.parse("2024-01-01T00:00:00Z")), TestCredentials.TTL);
		ToolDispatcher dispatcher = new ToolDispatcher(new ToolRegistry(ToolCatalog.descriptors()),
				TestCredentials.resolver(this.cache, null, StubPrompter.unavailable()),
				new TrelloToolOperations(this.boardService).operations());
		this.handler = new McpProtocolHandler(dispatcher, this.mapper, "trello-mcp-server", "1.0.0");
	}

	private JsonNode handle(String raw) {
		return this.handler.handle(raw).orElseThrow();
	}

	private String credentialsArguments() {
		return "\"api_key\":\"%s\",\"token\":\"%s\"".formatted(EXPLICIT.apiKey(), EXPLICIT.token());
	}

	@Test
	void initialize_shouldEchoSupportedProtocolVersion() {
		JsonNode response = handle("""
				{"jsonrpc":"2.0","id":1,"method":"initialize","params":{"protocolVersion":"2024-11-05",
				"clientInfo":{"name":"inspector","version":"0.1"}}}""");

		assertThat(response.path("id").asInt()).isEqualTo(1);
		assertThat(response.at("/result/protocolVersion").asText()).isEqualTo("2024-11-05");
		assertThat(response.at("/result/serverInfo/name").asText()).isEqualTo("trello-mcp-server");
		assertThat(response.at("/result/capabilities/tools/listChanged").asBoolean(true)).isFalse();
		assertThat(this.handler.state()).isEqualTo(ProtocolState.READY);
	}

	@Test
	void initialize_shouldFallBackToLatestVersionForUnknownRequest() {
		JsonNode response = handle("""
				{"jsonrpc":"2.0","id":"a","method":"initialize","params":{"protocolVersion":"1999-01-01"}}""");

		assertThat(response.at("/result/protocolVersion").asText()).isEqualTo("2025-06-18");
		assertThat(response.path("id").asText()).isEqualTo("a");
	}

	@Test
	void toolsList_shouldAdvertiseEveryTool() {
		JsonNode response = handle("{\"jsonrpc\":\"2.0\",\"id\":2,\"method\":\"tools/list\"}");

		JsonNode tools = response.at("/result/tools");
		assertThat(tools).hasSize(11);
		assertThat(tools.findValuesAsText("name")).contains("list_boards", "search_cards", "add_member_to_card");
		assertThat(tools.get(0).at("/inputSchema/type").asText()).isEqualTo("object");
	}

	@Test
	void toolsCall_shouldReturnSummaryAndStructuredContent() {
		when(this.boardService.listBoards(EXPLICIT)).thenReturn(List.of(new Board("b1", "Roadmap", "", false, "u")));

		JsonNode response = handle("""
				{"jsonrpc":"2.0","id":3,"method":"tools/call","params":{"name":"list_boards","arguments":{%s}}}"""
			.formatted(credentialsArguments()));

		assertThat(response.has("error")).isFalse();
		assertThat(response.at("/result/content/0/text").asText()).contains("Roadmap (b1)");
		assertThat(response.at("/result/structuredContent/count").asInt()).isEqualTo(1);
		assertThat(response.at("/result/isError").asBoolean(true)).isFalse();
	}

	@Test
	void toolsCall_shouldRejectMissingRequiredFieldsWithoutCallingTrello() {
		JsonNode response = handle("""
				{"jsonrpc":"2.0","id":4,"method":"tools/call","params":{"name":"create_card","arguments":{"name":"x"}}}""");

		assertThat(response.at("/error/code").asInt()).isEqualTo(-32602);
		assertThat(response.at("/error/data/kind").asText()).isEqualTo("invalid_arguments");
		assertThat(response.at("/error/data/missing_fields/0").asText()).isEqualTo("list_id");
		verifyNoInteractions(this.boardService);
	}

	@Test
	void toolsCall_shouldReportUnauthorizedAndClearCachedCredentials() {
		this.cache.store(PROVISIONED, CredentialSource.PRE_PROVISIONED);
		when(this.boardService.listBoards(any())).thenThrow(TrelloApiException.fromStatus(401, "list boards"));

		JsonNode response = handle("""
				{"jsonrpc":"2.0","id":5,"method":"tools/call","params":{"name":"list_boards","arguments":{}}}""");

		assertThat(response.at("/error/code").asInt()).isEqualTo(-32001);
		assertThat(response.at("/error/data/class").asText()).isEqualTo("unauthorized");
		assertThat(this.cache.current()).isEmpty();
		assertThat(response.toString()).doesNotContain(PROVISIONED.apiKey()).doesNotContain(PROVISIONED.token());
	}

	@Test
	void toolsCall_shouldNeverEchoExplicitCredentialsInErrors() {
		when(this.boardService.listBoards(any())).thenThrow(TrelloApiException.fromStatus(404, "list boards"));

		JsonNode response = handle("""
				{"jsonrpc":"2.0","id":6,"method":"tools/call","params":{"name":"list_boards","arguments":{%s}}}"""
			.formatted(credentialsArguments()));

		assertThat(response.at("/error/code").asInt()).isEqualTo(-32004);
		assertThat(response.toString()).doesNotContain(EXPLICIT.apiKey()).doesNotContain(EXPLICIT.token());
	}

	@Test
	void toolsCall_shouldRejectMissingToolName() {
		JsonNode response = handle("{\"jsonrpc\":\"2.0\",\"id\":7,\"method\":\"tools/call\",\"params\":{}}");

		assertThat(response.at("/error/code").asInt()).isEqualTo(-32602);
	}

	@Test
	void toolsCall_shouldRejectNonObjectArguments() {
		JsonNode response = handle("""
				{"jsonrpc":"2.0","id":8,"method":"tools/call","params":{"name":"list_boards","arguments":[1]}}""");

		assertThat(response.at("/error/code").asInt()).isEqualTo(-32602);
	}

	@Test
	void handle_shouldReportParseError() {
		JsonNode response = handle("{not json");

		assertThat(response.at("/error/code").asInt()).isEqualTo(-32700);
		assertThat(response.get("id").isNull()).isTrue();
	}

	@Test
	void handle_shouldRejectWrongJsonRpcVersion() {
		JsonNode response = handle("{\"jsonrpc\":\"1.0\",\"id\":9,\"method\":\"ping\"}");

		assertThat(response.at("/error/code").asInt()).isEqualTo(-32600);
		assertThat(response.path("id").asInt()).isEqualTo(9);
	}

	@Test
	void handle_shouldRejectNonObjectMessage() {
		assertThat(handle("[1,2]").at("/error/code").asInt()).isEqualTo(-32600);
	}

	@Test
	void handle_shouldReportUnknownMethod() {
		JsonNode response = handle("{\"jsonrpc\":\"2.0\",\"id\":10,\"method\":\"sampling/createMessage\"}");

		assertThat(response.at("/error/code").asInt()).isEqualTo(-32601);
	}

	@Test
	void handle_shouldNotAnswerNotifications() {
		assertThat(this.handler.handle("{\"jsonrpc\":\"2.0\",\"method\":\"notifications/initialized\"}")).isEmpty();
		assertThat(this.handler.handle("{\"jsonrpc\":\"2.0\",\"method\":\"no/such\"}")).isEmpty();
	}

	@Test
	void handle_shouldAnswerPingAndEmptyListings() {
		assertThat(handle("{\"jsonrpc\":\"2.0\",\"id\":11,\"method\":\"ping\"}").get("result").isObject()).isTrue();
		assertThat(handle("{\"jsonrpc\":\"2.0\",\"id\":12,\"method\":\"resources/list\"}").at("/result/resources"))
			.isEmpty();
		assertThat(handle("{\"jsonrpc\":\"2.0\",\"id\":13,\"method\":\"prompts/list\"}").at("/result/prompts"))
			.isEmpty();
	}

	@Test
	void handle_shouldServeToolsBeforeInitialize() {
		assertThat(this.handler.state()).isEqualTo(ProtocolState.UNINITIALIZED);

		JsonNode response = handle("{\"jsonrpc\":\"2.0\",\"id\":14,\"method\":\"tools/list\"}");

		assertThat(response.at("/result/tools")).hasSize(11);
	}

}
