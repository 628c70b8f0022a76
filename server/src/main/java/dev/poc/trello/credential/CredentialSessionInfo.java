package dev.poc.trello.credential;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Public view of the credential session.
 * @param hasCachedCredentials whether a live pair is cached
 * @param acquiredAt when the cached pair was acquired, if any
 * @param source how the cached pair was obtained, if any
 * @param cacheDurationMinutes configured cache time-to-live
 * @param loginUrl page where users obtain a key and token
 */
public record CredentialSessionInfo(boolean hasCachedCredentials, Instant acquiredAt, CredentialSource source,
		long cacheDurationMinutes, String loginUrl) {

	public Map<String, Object> toStructured() {
		Map<String, Object> structured = new LinkedHashMap<>();
		structured.put("has_cached_credentials", hasCachedCredentials);
		structured.put("cache_duration_minutes", cacheDurationMinutes);
		structured.put("credentials_timestamp", acquiredAt == null ? null : acquiredAt.toString());
		structured.put("credentials_source", source == null ? null : source.name().toLowerCase());
		structured.put("login_url", loginUrl);
		return structured;
	}

}
