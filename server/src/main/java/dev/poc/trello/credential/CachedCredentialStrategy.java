package dev.poc.trello.credential;

import java.util.Optional;

/**
 * Returns the cached pair while it is within its time-to-live.
 */
public final class CachedCredentialStrategy implements CredentialStrategy {

	private final CredentialCache cache;

	public CachedCredentialStrategy(CredentialCache cache) {
		this.cache = cache;
	}

	@Override
	public Optional<CredentialPair> resolve(Optional<CredentialPair> explicit) {
		return this.cache.current();
	}

}
