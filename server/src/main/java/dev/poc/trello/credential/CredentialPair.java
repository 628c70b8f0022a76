package dev.poc.trello.credential;

/**
 * Trello API key and token used to authorize outbound calls. The values are opaque; {@link #toString()}
 * never renders them.
 * @param apiKey Trello API key
 * @param token Trello API token
 */
public record CredentialPair(String apiKey, String token) {

	public CredentialPair {
		apiKey = apiKey == null ? null : apiKey.strip();
		token = token == null ? null : token.strip();
	}

	/**
	 * Build a pair only when both halves were supplied.
	 * @param apiKey candidate API key, may be {@code null}
	 * @param token candidate token, may be {@code null}
	 * @return pair, or {@code null} when either half is missing or blank
	 */
	public static CredentialPair ofNullable(String apiKey, String token) {
		if (apiKey == null || apiKey.isBlank() || token == null || token.isBlank()) {
			return null;
		}
		return new CredentialPair(apiKey, token);
	}

	/**
	 * Check the minimum-length policy for both halves.
	 * @param minLength minimum number of characters each value must have
	 * @return {@code true} when the pair may be cached or forwarded
	 */
	public boolean isValid(int minLength) {
		return this.apiKey != null && this.token != null && !this.apiKey.isBlank() && !this.token.isBlank()
				&& this.apiKey.length() >= minLength && this.token.length() >= minLength;
	}

	@Override
	public String toString() {
		return "CredentialPair[apiKey=***, token=***]";
	}

}
