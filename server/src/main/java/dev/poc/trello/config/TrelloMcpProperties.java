package dev.poc.trello.config;

import java.time.Duration;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Configuration properties for the Trello MCP server: server identity, Trello API access,
 * credential handling and outbound rate limiting.
 */
@ConfigurationProperties(prefix = "trello.mcp")
public class TrelloMcpProperties {

	private final Server server = new Server();

	private final Api api = new Api();

	private final Credentials credentials = new Credentials();

	private final RateLimit rateLimit = new RateLimit();

	public Server getServer() {
		return server;
	}

	public Api getApi() {
		return api;
	}

	public Credentials getCredentials() {
		return credentials;
	}

	public RateLimit getRateLimit() {
		return rateLimit;
	}

	/**
	 * Identity reported to MCP clients.
	 */
	public static class Server {

		private String name = "trello-mcp-server";

		private String version = "1.0.0";

		public String getName() {
			return name;
		}

		public void setName(String name) {
			this.name = name;
		}

		public String getVersion() {
			return version;
		}

		public void setVersion(String version) {
			this.version = version;
		}

	}

	/**
	 * Trello REST API access.
	 */
	public static class Api {

		/**
		 * Base URL of the Trello REST API.
		 */
		private String baseUrl = "https://api.trello.com/1";

		/**
		 * Timeout applied to each outbound call.
		 */
		private Duration timeout = Duration.ofSeconds(30);

		private String userAgent = "Trello-MCP-Server/1.0.0";

		public String getBaseUrl() {
			return baseUrl;
		}

		public void setBaseUrl(String baseUrl) {
			this.baseUrl = baseUrl;
		}

		public Duration getTimeout() {
			return timeout;
		}

		public void setTimeout(Duration timeout) {
			this.timeout = timeout;
		}

		public String getUserAgent() {
			return userAgent;
		}

		public void setUserAgent(String userAgent) {
			this.userAgent = userAgent;
		}

	}

	/**
	 * Credential resolution settings. The API key and token are normally bound from
	 * {@code TRELLO_API_KEY} and {@code TRELLO_TOKEN}.
	 */
	public static class Credentials {

		private String apiKey;

		private String token;

		/**
		 * How long an acquired pair stays cached.
		 */
		private Duration cacheTtl = Duration.ofHours(8);

		/**
		 * Minimum length of both the API key and the token.
		 */
		private int minLength = 32;

		private String loginUrl = "https://trello.com/app-key";

		/**
		 * Number of times the interactive prompt re-asks for a value that is too short.
		 */
		private int promptAttempts = 3;

		public String getApiKey() {
			return apiKey;
		}

		public void setApiKey(String apiKey) {
			this.apiKey = apiKey;
		}

		public String getToken() {
			return token;
		}

		public void setToken(String token) {
			this.token = token;
		}

		public Duration getCacheTtl() {
			return cacheTtl;
		}

		public void setCacheTtl(Duration cacheTtl) {
			this.cacheTtl = cacheTtl;
		}

		public int getMinLength() {
			return minLength;
		}

		public void setMinLength(int minLength) {
			this.minLength = minLength;
		}

		public String getLoginUrl() {
			return loginUrl;
		}

		public void setLoginUrl(String loginUrl) {
			this.loginUrl = loginUrl;
		}

		public int getPromptAttempts() {
			return promptAttempts;
		}

		public void setPromptAttempts(int promptAttempts) {
			this.promptAttempts = promptAttempts;
		}

	}

	/**
	 * Outbound quota. Trello allows 300 requests per 10 seconds per token.
	 */
	public static class RateLimit {

		private int maxCalls = 300;

		private Duration window = Duration.ofSeconds(10);

		/**
		 * Fixed wait before the single retry of a call rejected with {@code 429}.
		 */
		private Duration retryBackoff = Duration.ofSeconds(1);

		public int getMaxCalls() {
			return maxCalls;
		}

		public void setMaxCalls(int maxCalls) {
			this.maxCalls = maxCalls;
		}

		public Duration getWindow() {
			return window;
		}

		public void setWindow(Duration window) {
			this.window = window;
		}

		public Duration getRetryBackoff() {
			return retryBackoff;
		}

		public void setRetryBackoff(Duration retryBackoff) {
			this.retryBackoff = retryBackoff;
		}

	}

}
