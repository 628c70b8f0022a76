package dev.poc.trello.config;

import java.time.Clock;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import com.fasterxml.jackson.databind.ObjectMapper;

import dev.poc.trello.client.TrelloClient;
import dev.poc.trello.credential.CachedCredentialStrategy;
import dev.poc.trello.credential.ConsoleCredentialPrompter;
import dev.poc.trello.credential.CredentialCache;
import dev.poc.trello.credential.CredentialPair;
import dev.poc.trello.credential.CredentialPrompter;
import dev.poc.trello.credential.CredentialResolver;
import dev.poc.trello.credential.ExplicitCredentialStrategy;
import dev.poc.trello.credential.InteractiveCredentialStrategy;
import dev.poc.trello.credential.PreProvisionedCredentialStrategy;
import dev.poc.trello.protocol.McpProtocolHandler;
import dev.poc.trello.ratelimit.Sleeper;
import dev.poc.trello.ratelimit.SlidingWindowRateLimiter;
import dev.poc.trello.service.TrelloBoardService;
import dev.poc.trello.tool.ToolCatalog;
import dev.poc.trello.tool.ToolDispatcher;
import dev.poc.trello.tool.ToolRegistry;
import dev.poc.trello.tool.TrelloToolOperations;

/**
 * Core wiring: rate limiter, credential chain, tool registry, dispatcher and protocol handler.
 */
@Configuration
@EnableConfigurationProperties({ TrelloMcpProperties.class, McpTransportProperties.class })
public class TrelloMcpConfig {

	private static final Logger logger = LoggerFactory.getLogger(TrelloMcpConfig.class);

	@Bean
	@ConditionalOnMissingBean
	public Clock clock() {
		return Clock.systemUTC();
	}

	@Bean
	public SlidingWindowRateLimiter rateLimiter(Clock clock, TrelloMcpProperties properties) {
		TrelloMcpProperties.RateLimit rateLimit = properties.getRateLimit();
		return new SlidingWindowRateLimiter(clock, Sleeper.THREAD, rateLimit.getMaxCalls(), rateLimit.getWindow());
	}

	@Bean
	public CredentialCache credentialCache(Clock clock, TrelloMcpProperties properties) {
		return new CredentialCache(clock, properties.getCredentials().getCacheTtl());
	}

	@Bean
	@ConditionalOnMissingBean
	public CredentialPrompter credentialPrompter(TrelloMcpProperties properties) {
		TrelloMcpProperties.Credentials credentials = properties.getCredentials();
		return new ConsoleCredentialPrompter(credentials.getMinLength(), credentials.getPromptAttempts());
	}

	@Bean
	public CredentialResolver credentialResolver(CredentialCache cache, CredentialPrompter prompter,
			TrelloMcpProperties properties) {
		TrelloMcpProperties.Credentials credentials = properties.getCredentials();
		int minLength = credentials.getMinLength();
		PreProvisionedCredentialStrategy preProvisioned = new PreProvisionedCredentialStrategy(
				CredentialPair.ofNullable(credentials.getApiKey(), credentials.getToken()), cache, minLength);
		logger.info("Pre-provisioned Trello credentials {}", preProvisioned.isConfigured() ? "configured" : "not set");
		return new CredentialResolver(List.of(new ExplicitCredentialStrategy(minLength),
				new CachedCredentialStrategy(cache), preProvisioned,
				new InteractiveCredentialStrategy(prompter, cache, credentials.getLoginUrl(), minLength)), cache,
				credentials.getLoginUrl());
	}

	@Bean
	public ToolRegistry toolRegistry() {
		return new ToolRegistry(ToolCatalog.descriptors());
	}

	@Bean
	public TrelloBoardService trelloBoardService(TrelloClient trelloClient) {
		return new TrelloBoardService(trelloClient);
	}

	@Bean
	public ToolDispatcher toolDispatcher(ToolRegistry toolRegistry, CredentialResolver credentialResolver,
			TrelloBoardService trelloBoardService) {
		return new ToolDispatcher(toolRegistry, credentialResolver,
				new TrelloToolOperations(trelloBoardService).operations());
	}

	@Bean
	public McpProtocolHandler mcpProtocolHandler(ToolDispatcher toolDispatcher, ObjectMapper objectMapper,
			TrelloMcpProperties properties) {
		return new McpProtocolHandler(toolDispatcher, objectMapper, properties.getServer().getName(),
				properties.getServer().getVersion());
	}

}
