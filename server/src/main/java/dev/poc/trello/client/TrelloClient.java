package dev.poc.trello.client;

import java.net.URI;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.TimeoutException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.util.StringUtils;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import org.springframework.web.util.UriBuilder;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.NullNode;

import dev.poc.trello.credential.CredentialPair;
import dev.poc.trello.exception.ErrorKind;
import dev.poc.trello.exception.TrelloApiException;
import dev.poc.trello.ratelimit.SlidingWindowRateLimiter;
import io.github.resilience4j.retry.Retry;

/**
 * Blocking client for the Trello REST API.
 * <p>
 * Each attempt is admitted by the shared {@link SlidingWindowRateLimiter}. Credentials travel in
 * the {@code Authorization} header only, never in the URL. A {@code 429} is retried according to
 * the configured {@link Retry} policy.
 */
public class TrelloClient {

	private static final Logger logger = LoggerFactory.getLogger(TrelloClient.class);

	private final WebClient webClient;

	private final SlidingWindowRateLimiter rateLimiter;

	private final Retry retry;

	private final ObjectMapper objectMapper;

	private final Duration timeout;

	public TrelloClient(WebClient webClient, SlidingWindowRateLimiter rateLimiter, Retry retry,
			ObjectMapper objectMapper, Duration timeout) {
		this.webClient = webClient;
		this.rateLimiter = rateLimiter;
		this.retry = retry;
		this.objectMapper = objectMapper;
		this.timeout = timeout;
	}

	/**
	 * Perform a request and return the parsed JSON body.
	 * @param request request description
	 * @param credentials resolved credential pair
	 * @return parsed body, {@link NullNode} for an empty body
	 * @throws TrelloApiException when the call fails
	 */
	public JsonNode execute(TrelloRequest request, CredentialPair credentials) {
		return this.retry.executeSupplier(() -> executeOnce(request, credentials));
	}

	private JsonNode executeOnce(TrelloRequest request, CredentialPair credentials) {
		admit(request);
		logger.info("Making {} request to {}", request.method(), request.pathTemplate());
		try {
			String body = this.webClient.method(request.method())
				.uri(builder -> buildUri(builder, request))
				.header(HttpHeaders.AUTHORIZATION, authorization(credentials))
				.retrieve()
				.bodyToMono(String.class)
				.timeout(this.timeout)
				.onErrorMap(TimeoutException.class, e -> timedOut(request, e))
				.block();
			return StringUtils.hasText(body) ? this.objectMapper.readTree(body) : NullNode.getInstance();
		}
		catch (WebClientResponseException e) {
			logger.warn("Trello responded {} to {}", e.getStatusCode().value(), request);
			throw TrelloApiException.fromStatus(e.getStatusCode().value(), request.description());
		}
		catch (WebClientRequestException e) {
			logger.warn("Network error calling {}: {}", request, e.getMostSpecificCause().getClass().getSimpleName());
			throw new TrelloApiException(ErrorKind.EXTERNAL_ERROR, null,
					"Network error while calling Trello (" + request.description() + ")", e);
		}
		catch (JsonProcessingException e) {
			throw new TrelloApiException(ErrorKind.EXTERNAL_ERROR, null,
					"Trello returned an unreadable response (" + request.description() + ")", e);
		}
	}

	private TrelloApiException timedOut(TrelloRequest request, TimeoutException e) {
		logger.warn("Timed out after {} calling {}", this.timeout, request);
		return new TrelloApiException(ErrorKind.EXTERNAL_ERROR, null,
				"Timed out waiting for Trello (" + request.description() + ")", e);
	}

	private void admit(TrelloRequest request) {
		try {
			this.rateLimiter.admit();
		}
		catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			throw new TrelloApiException(ErrorKind.EXTERNAL_ERROR, null,
					"Interrupted while waiting for rate limit admission (" + request.description() + ")", e);
		}
	}

	private static URI buildUri(UriBuilder builder, TrelloRequest request) {
		builder.path(request.pathTemplate());
		int index = 0;
		for (String name : request.query().keySet()) {
			builder.queryParam(name, "{q" + index++ + "}");
		}
		List<Object> values = request.uriValues();
		return builder.build(values.toArray());
	}

	static String authorization(CredentialPair credentials) {
		return "OAuth oauth_consumer_key=\"" + credentials.apiKey() + "\", oauth_token=\"" + credentials.token() + "\"";
	}

}
