package dev.poc.trello.tool;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import dev.poc.trello.credential.CredentialCache;
import dev.poc.trello.credential.CredentialPair;
import dev.poc.trello.credential.CredentialResolver;
import dev.poc.trello.credential.CredentialSource;
import dev.poc.trello.exception.ErrorKind;
import dev.poc.trello.exception.TrelloApiException;
import dev.poc.trello.support.MutableClock;
import dev.poc.trello.support.StubPrompter;
import dev.poc.trello.support.TestCredentials;

import static dev.poc.trello.support.TestCredentials.EXPLICIT;
import static dev.poc.trello.support.TestCredentials.PROMPTED;
import static dev.poc.trello.support.TestCredentials.PROVISIONED;
import static org.assertj.core.api.Assertions.assertThat;

class ToolDispatcherTest {

	private CredentialCache cache;

	private StubPrompter prompter;

	private CredentialResolver resolver;

	private Map<String, ToolOperation> operations;

	private final AtomicInteger invocations = new AtomicInteger();

	@BeforeEach
	void setUp() {
		this.cache = new CredentialCache(new MutableClock(Instant.parse("2024-01-01T00:00:00Z")), TestCredentials.TTL);
		this.prompter = StubPrompter.answering(PROMPTED);
		this.resolver = TestCredentials.resolver(this.cache, null, this.prompter);
		this.operations = new HashMap<>();
		for (ToolDescriptor descriptor : ToolCatalog.descriptors()) {
			this.operations.put(descriptor.name(), (credentials, arguments) -> {
				this.invocations.incrementAndGet();
				return new OperationResult.Success("ok", Map.of());
			});
		}
	}

	private ToolDispatcher dispatcher() {
		return new ToolDispatcher(new ToolRegistry(ToolCatalog.descriptors()), this.resolver, this.operations);
	}

	@Test
	void invoke_shouldReportUnknownTool() {
		OperationResult result = dispatcher().invoke(OperationRequest.fromToolCall("archive_world", Map.of()));

		assertThat(result).isInstanceOfSatisfying(OperationResult.Failure.class,
				failure -> assertThat(failure.kind()).isEqualTo(ErrorKind.UNKNOWN_OPERATION));
	}

	@Test
	void invoke_shouldRejectInvalidArgumentsBeforeResolvingCredentials() {
		OperationResult result = dispatcher().invoke(OperationRequest.fromToolCall("create_card", Map.of("name", "x")));

		assertThat(result).isInstanceOfSatisfying(OperationResult.Failure.class, failure -> {
			assertThat(failure.kind()).isEqualTo(ErrorKind.INVALID_ARGUMENTS);
			assertThat(failure.details()).containsEntry("missing_fields", List.of("list_id"));
		});
		assertThat(this.invocations).hasValue(0);
		assertThat(this.prompter.prompts()).isZero();
	}

	@Test
	void invoke_shouldPassExplicitCredentialsToOperation() {
		AtomicReference<CredentialPair> used = new AtomicReference<>();
		this.operations.put("get_board", (credentials, arguments) -> {
			used.set(credentials);
			return new OperationResult.Success("Board " + arguments.requiredString("board_id"), Map.of("id", "b1"));
		});
		Map<String, Object> arguments = Map.of("board_id", " b1 ", "api_key", EXPLICIT.apiKey(), "token",
				EXPLICIT.token());

		OperationResult result = dispatcher().invoke(OperationRequest.fromToolCall("get_board", arguments));

		assertThat(result).isEqualTo(new OperationResult.Success("Board b1", Map.of("id", "b1")));
		assertThat(used.get()).isEqualTo(EXPLICIT);
		assertThat(this.cache.current()).isEmpty();
	}

	@Test
	void invoke_shouldClearCacheWhenTrelloRejectsCredentials() {
		this.cache.store(PROMPTED, CredentialSource.INTERACTIVE);
		this.operations.put("list_boards", (credentials, arguments) -> {
			throw TrelloApiException.fromStatus(401, "list boards");
		});

		OperationResult result = dispatcher().invoke(OperationRequest.fromToolCall("list_boards", Map.of()));

		assertThat(result).isInstanceOfSatisfying(OperationResult.Failure.class, failure -> {
			assertThat(failure.kind()).isEqualTo(ErrorKind.UNAUTHORIZED);
			assertThat(failure.message()).isEqualTo("Unauthorized - check your API key and token");
		});
		assertThat(this.cache.current()).isEmpty();
	}

	@Test
	void invoke_shouldNotRetryRefusedPreProvisionedPair() {
		this.resolver = TestCredentials.resolver(this.cache, PROVISIONED, this.prompter);
		List<CredentialPair> used = new ArrayList<>();
		this.operations.put("list_boards", (credentials, arguments) -> {
			used.add(credentials);
			if (credentials.equals(PROVISIONED)) {
				throw TrelloApiException.fromStatus(401, "list boards");
			}
			return new OperationResult.Success("ok", Map.of());
		});
		ToolDispatcher dispatcher = dispatcher();

		OperationResult first = dispatcher.invoke(OperationRequest.fromToolCall("list_boards", Map.of()));
		OperationResult second = dispatcher.invoke(OperationRequest.fromToolCall("list_boards", Map.of()));

		assertThat(first).isInstanceOf(OperationResult.Failure.class);
		assertThat(second).isInstanceOf(OperationResult.Success.class);
		assertThat(used).containsExactly(PROVISIONED, PROMPTED);
		assertThat(this.prompter.prompts()).isEqualTo(1);
	}

	@Test
	void invoke_shouldKeepCacheForOtherFailures() {
		this.cache.store(PROMPTED, CredentialSource.INTERACTIVE);
		this.operations.put("get_board", (credentials, arguments) -> {
			throw TrelloApiException.fromStatus(404, "get board");
		});

		OperationResult result = dispatcher().invoke(OperationRequest.fromToolCall("get_board", Map.of("board_id", "b")));

		assertThat(result).isInstanceOfSatisfying(OperationResult.Failure.class,
				failure -> assertThat(failure.kind()).isEqualTo(ErrorKind.NOT_FOUND));
		assertThat(this.cache.current()).contains(PROMPTED);
	}

	@Test
	void invoke_shouldReportAuthenticationRequired() {
		this.resolver = TestCredentials.resolver(this.cache, null, StubPrompter.unavailable());

		OperationResult result = dispatcher().invoke(OperationRequest.fromToolCall("list_boards", Map.of()));

		assertThat(result).isInstanceOfSatisfying(OperationResult.Failure.class,
				failure -> assertThat(failure.kind()).isEqualTo(ErrorKind.AUTHENTICATION_REQUIRED));
		assertThat(this.invocations).hasValue(0);
	}

	@Test
	void invoke_shouldHideUnexpectedFailureDetails() {
		this.operations.put("list_boards", (credentials, arguments) -> {
			throw new IllegalStateException("boom at " + credentials.apiKey());
		});

		OperationResult result = dispatcher().invoke(OperationRequest.fromToolCall("list_boards", Map.of()));

		assertThat(result).isEqualTo(
				new OperationResult.Failure(ErrorKind.EXTERNAL_ERROR, "Tool execution failed", Map.of()));
	}

	@Test
	void fromToolCall_shouldLiftCredentialsOutOfArguments() {
		OperationRequest request = OperationRequest.fromToolCall("list_boards",
				Map.of("api_key", EXPLICIT.apiKey(), "token", EXPLICIT.token(), "extra", 1));

		assertThat(request.arguments()).containsOnlyKeys("extra");
		assertThat(request.explicit()).contains(EXPLICIT);
		assertThat(request.toString()).doesNotContain(EXPLICIT.apiKey());
	}

	@Test
	void fromToolCall_shouldIgnoreHalfAPair() {
		OperationRequest request = OperationRequest.fromToolCall("list_boards", Map.of("api_key", EXPLICIT.apiKey()));

		assertThat(request.explicit()).isEqualTo(Optional.empty());
	}

}
