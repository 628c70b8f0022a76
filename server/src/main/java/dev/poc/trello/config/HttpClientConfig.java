package dev.poc.trello.config;

import java.time.Duration;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;

import com.fasterxml.jackson.databind.ObjectMapper;

import dev.poc.trello.client.TrelloClient;
import dev.poc.trello.exception.ErrorKind;
import dev.poc.trello.exception.TrelloMcpException;
import dev.poc.trello.ratelimit.SlidingWindowRateLimiter;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import io.github.resilience4j.retry.RetryRegistry;

/**
 * Outbound HTTP client beans: the Trello {@link WebClient}, the {@code 429} retry policy and the
 * {@link TrelloClient} combining them with the rate limiter.
 */
@Configuration
public class HttpClientConfig {

	/**
	 * A rate-limited call is attempted twice: once, then once more after the fixed backoff.
	 */
	static final int RATE_LIMIT_ATTEMPTS = 2;

	@Bean
	public WebClient trelloWebClient(WebClient.Builder builder, TrelloMcpProperties properties) {
		return builder.baseUrl(properties.getApi().getBaseUrl())
			.defaultHeader(HttpHeaders.USER_AGENT, properties.getApi().getUserAgent())
			.defaultHeader(HttpHeaders.ACCEPT, MediaType.APPLICATION_JSON_VALUE)
			.build();
	}

	@Bean
	public Retry trelloRateLimitRetry(TrelloMcpProperties properties) {
		return rateLimitRetry(properties.getRateLimit().getRetryBackoff());
	}

	@Bean
	public TrelloClient trelloClient(WebClient trelloWebClient, SlidingWindowRateLimiter rateLimiter,
			Retry trelloRateLimitRetry, ObjectMapper objectMapper, TrelloMcpProperties properties) {
		return new TrelloClient(trelloWebClient, rateLimiter, trelloRateLimitRetry, objectMapper,
				properties.getApi().getTimeout());
	}

	/**
	 * Build the retry policy applied to rate-limited Trello calls.
	 * @param backoff fixed wait before the retry
	 * @return retry instance
	 */
	public static Retry rateLimitRetry(Duration backoff) {
		RetryConfig config = RetryConfig.custom()
			.maxAttempts(RATE_LIMIT_ATTEMPTS)
			.waitDuration(backoff)
			.retryOnException(e -> e instanceof TrelloMcpException failure && failure.kind() == ErrorKind.RATE_LIMITED)
			.build();
		return RetryRegistry.of(config).retry("trello-rate-limit");
	}

}
