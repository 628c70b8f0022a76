package dev.poc.trello.service;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.web.reactive.function.client.WebClient;

import com.fasterxml.jackson.databind.ObjectMapper;

import dev.poc.trello.client.TrelloClient;
import dev.poc.trello.config.HttpClientConfig;
import dev.poc.trello.exception.ErrorKind;
import dev.poc.trello.exception.TrelloMcpException;
import dev.poc.trello.model.Board;
import dev.poc.trello.model.Card;
import dev.poc.trello.model.SearchOutcome;
import dev.poc.trello.ratelimit.Sleeper;
import dev.poc.trello.ratelimit.SlidingWindowRateLimiter;
import okhttp3.mockwebserver.Dispatcher;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;

import static dev.poc.trello.support.TestCredentials.EXPLICIT;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TrelloBoardServiceTest {

	private MockWebServer mockWebServer;

	private SlidingWindowRateLimiter rateLimiter;

	private TrelloBoardService service;

	@BeforeEach
	void setUp() throws IOException {
		this.mockWebServer = new MockWebServer();
		this.mockWebServer.start();
		this.rateLimiter = new SlidingWindowRateLimiter(Clock.systemUTC(), Sleeper.THREAD, 300, Duration.ofSeconds(10));
		WebClient webClient = WebClient.builder().baseUrl(this.mockWebServer.url("/1").toString()).build();
		this.service = new TrelloBoardService(new TrelloClient(webClient, this.rateLimiter,
				HttpClientConfig.rateLimitRetry(Duration.ofMillis(10)), new ObjectMapper(), Duration.ofSeconds(5)));
	}

	@AfterEach
	void tearDown() throws IOException {
		this.mockWebServer.shutdown();
	}

	private static MockResponse json(int status, String body) {
		return new MockResponse().setResponseCode(status).setBody(body).addHeader("Content-Type", "application/json");
	}

	private static String cards(String... ids) {
		StringBuilder body = new StringBuilder("{\"cards\":[");
		for (int i = 0; i < ids.length; i++) {
			body.append(i == 0 ? "" : ",").append("{\"id\":\"").append(ids[i]).append("\",\"name\":\"Card ")
				.append(ids[i]).append("\"}");
		}
		return body.append("]}").toString();
	}

	/**
	 * Answers search calls per board so the result does not depend on request order.
	 */
	private void searchResponses(Map<String, MockResponse> byBoard) {
		this.mockWebServer.setDispatcher(new Dispatcher() {
			@Override
			public MockResponse dispatch(RecordedRequest request) {
				if (request.getRequestUrl().encodedPath().equals("/1/members/me/boards")) {
					return json(200, "[{\"id\":\"b1\"},{\"id\":\"b2\"},{\"id\":\"b3\"}]");
				}
				String board = request.getRequestUrl().queryParameter("idBoards");
				return byBoard.getOrDefault(board, json(404, "unknown board"));
			}
		});
	}

	@Test
	void listBoards_shouldRequestOpenBoards() throws InterruptedException {
		this.mockWebServer.enqueue(json(200, "[{\"id\":\"b1\",\"name\":\"Roadmap\",\"closed\":false,\"url\":\"u\"}]"));

		List<Board> boards = this.service.listBoards(EXPLICIT);

		assertThat(boards).containsExactly(new Board("b1", "Roadmap", null, false, "u"));
		RecordedRequest request = this.mockWebServer.takeRequest(1, TimeUnit.SECONDS);
		assertThat(request.getRequestUrl().encodedPath()).isEqualTo("/1/members/me/boards");
		assertThat(request.getRequestUrl().queryParameter("filter")).isEqualTo("open");
	}

	@Test
	void searchCards_shouldReturnPartialResultsWhenOneBoardFails() {
		searchResponses(Map.of("b1", json(200, cards("c1")), "b2", json(500, "boom"), "b3", json(200, cards("c3"))));

		SearchOutcome outcome = this.service.searchCards(EXPLICIT, "release", List.of("b1", "b2", "b3"), 50);

		assertThat(outcome.cards()).extracting(Card::id).containsExactly("c1", "c3");
		assertThat(outcome.boardsSearched()).containsExactly("b1", "b3");
		assertThat(outcome.failedBoards()).containsExactly("b2");
		assertThat(outcome.incomplete()).isTrue();
		assertThat(outcome.toStructured()).containsEntry("incomplete", true);
		assertThat(this.mockWebServer.getRequestCount()).isEqualTo(3);
		assertThat(this.rateLimiter.inFlightWindowSize()).isEqualTo(3);
	}

	@Test
	void searchCards_shouldSearchEveryOpenBoardWhenNoneGiven() {
		searchResponses(Map.of("b1", json(200, cards("c1")), "b2", json(200, cards("c2")), "b3",
				json(200, cards())));

		SearchOutcome outcome = this.service.searchCards(EXPLICIT, "release", List.of(), 50);

		assertThat(outcome.boardsSearched()).containsExactly("b1", "b2", "b3");
		assertThat(outcome.incomplete()).isFalse();
		assertThat(this.mockWebServer.getRequestCount()).isEqualTo(4);
		assertThat(this.rateLimiter.inFlightWindowSize()).isEqualTo(4);
	}

	@Test
	void searchCards_shouldCapAndDeduplicateResults() {
		searchResponses(Map.of("b1", json(200, cards("c1", "c2")), "b2", json(200, cards("c2", "c3"))));

		SearchOutcome outcome = this.service.searchCards(EXPLICIT, "x", List.of("b1", "b2"), 2);

		assertThat(outcome.cards()).extracting(Card::id).containsExactly("c1", "c2");
	}

	@Test
	void searchCards_shouldSurfaceLastFailureWhenEveryBoardFails() {
		searchResponses(Map.of("b1", json(500, "boom"), "b2", json(404, "gone")));

		assertThatThrownBy(() -> this.service.searchCards(EXPLICIT, "x", List.of("b1", "b2"), 50))
			.isInstanceOfSatisfying(TrelloMcpException.class, e -> assertThat(e.kind()).isEqualTo(ErrorKind.NOT_FOUND));
	}

	@Test
	void searchCards_shouldAbortOnUnauthorized() {
		searchResponses(Map.of("b1", json(401, "invalid token"), "b2", json(200, cards("c2"))));

		assertThatThrownBy(() -> this.service.searchCards(EXPLICIT, "x", List.of("b1", "b2"), 50))
			.isInstanceOfSatisfying(TrelloMcpException.class,
					e -> assertThat(e.kind()).isEqualTo(ErrorKind.UNAUTHORIZED));
		assertThat(this.mockWebServer.getRequestCount()).isEqualTo(1);
	}

	@Test
	void createBoard_shouldSendPrefsAndDefaultLists() throws InterruptedException {
		this.mockWebServer.enqueue(json(200, "{\"id\":\"b9\",\"name\":\"Launch\"}"));

		Board board = this.service.createBoard(EXPLICIT, "Launch", null, null, true, Map.of("voting", "members"));

		assertThat(board.id()).isEqualTo("b9");
		RecordedRequest request = this.mockWebServer.takeRequest(1, TimeUnit.SECONDS);
		assertThat(request.getMethod()).isEqualTo("POST");
		assertThat(request.getRequestUrl().queryParameter("defaultLists")).isEqualTo("true");
		assertThat(request.getRequestUrl().queryParameter("prefs_voting")).isEqualTo("members");
		assertThat(request.getRequestUrl().queryParameterNames()).doesNotContain("desc", "idOrganization");
	}

	@Test
	void createCard_shouldJoinLabelsAndMembers() throws InterruptedException {
		this.mockWebServer.enqueue(json(200, "{\"id\":\"c9\",\"name\":\"Ship\",\"idList\":\"l1\"}"));

		this.service.createCard(EXPLICIT, "l1", "Ship", null, "top", Instant.parse("2024-03-01T09:00:00Z"),
				List.of("lab1", "lab2"), List.of());

		RecordedRequest request = this.mockWebServer.takeRequest(1, TimeUnit.SECONDS);
		assertThat(request.getRequestUrl().queryParameter("idList")).isEqualTo("l1");
		assertThat(request.getRequestUrl().queryParameter("idLabels")).isEqualTo("lab1,lab2");
		assertThat(request.getRequestUrl().queryParameter("due")).isEqualTo("2024-03-01T09:00:00Z");
		assertThat(request.getRequestUrl().queryParameter("pos")).isEqualTo("top");
		assertThat(request.getRequestUrl().queryParameterNames()).doesNotContain("idMembers", "desc");
	}

	@Test
	void updateCard_shouldRemoveDueDate() throws InterruptedException {
		this.mockWebServer.enqueue(json(200, "{\"id\":\"c1\",\"name\":\"Ship\"}"));

		this.service.updateCard(EXPLICIT, "c1", new CardUpdate(null, null, null, null, null, null, true));

		RecordedRequest request = this.mockWebServer.takeRequest(1, TimeUnit.SECONDS);
		assertThat(request.getMethod()).isEqualTo("PUT");
		assertThat(request.getRequestUrl().encodedPath()).isEqualTo("/1/cards/c1");
		assertThat(request.getRequestUrl().queryParameterNames()).containsExactly("due");
		assertThat(request.getRequestUrl().queryParameter("due")).isEqualTo("null");
	}

	@Test
	void getCards_shouldPreferListScope() throws InterruptedException {
		this.mockWebServer.enqueue(json(200, "[{\"id\":\"c1\",\"labels\":[{\"name\":\"urgent\"}]}]"));

		List<Card> found = this.service.getCards(EXPLICIT, "b1", "l1");

		assertThat(found).singleElement().satisfies(card -> assertThat(card.labels()).containsExactly("urgent"));
		RecordedRequest request = this.mockWebServer.takeRequest(1, TimeUnit.SECONDS);
		assertThat(request.getRequestUrl().encodedPath()).isEqualTo("/1/lists/l1/cards");
	}

	@Test
	void addMemberToCard_shouldPostMemberId() throws InterruptedException {
		this.mockWebServer.enqueue(json(200, "[{\"id\":\"m1\",\"username\":\"ana\"}]"));

		assertThat(this.service.addMemberToCard(EXPLICIT, "c1", "m1")).hasSize(1);

		RecordedRequest request = this.mockWebServer.takeRequest(1, TimeUnit.SECONDS);
		assertThat(request.getRequestUrl().encodedPath()).isEqualTo("/1/cards/c1/idMembers");
		assertThat(request.getRequestUrl().queryParameter("value")).isEqualTo("m1");
	}

}
