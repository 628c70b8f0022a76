package dev.poc.trello.credential;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

import dev.poc.trello.exception.AuthenticationRequiredException;

/**
 * Resolves the credential pair for a tool call by walking an ordered chain of
 * {@link CredentialStrategy strategies}: explicit, cached, pre-provisioned, interactive.
 * <p>
 * Leading strategies that do not touch shared state run without locking. From the first strategy
 * that does, the rest of the chain runs under a single lock, so at most one interactive prompt is
 * open and concurrent callers wait for its outcome instead of prompting again.
 */
public class CredentialResolver {

	private final List<CredentialStrategy> chain;

	private final CredentialCache cache;

	private final String loginUrl;

	private final ReentrantLock acquisitionLock = new ReentrantLock(true);

	public CredentialResolver(List<CredentialStrategy> chain, CredentialCache cache, String loginUrl) {
		if (chain.isEmpty()) {
			throw new IllegalArgumentException("At least one credential strategy must be configured");
		}
		this.chain = List.copyOf(chain);
		this.cache = cache;
		this.loginUrl = loginUrl;
	}

	/**
	 * Resolve the credentials to use for one tool call.
	 * @param explicit pair supplied with the request, if any
	 * @return the pair to forward to Trello
	 * @throws AuthenticationRequiredException if no strategy yields a pair
	 */
	public CredentialPair resolve(Optional<CredentialPair> explicit) {
		int index = 0;
		while (index < this.chain.size() && !this.chain.get(index).requiresExclusiveAccess()) {
			Optional<CredentialPair> resolved = this.chain.get(index).resolve(explicit);
			if (resolved.isPresent()) {
				return resolved.get();
			}
			index++;
		}
		this.acquisitionLock.lock();
		try {
			for (int i = index; i < this.chain.size(); i++) {
				Optional<CredentialPair> resolved = this.chain.get(i).resolve(explicit);
				if (resolved.isPresent()) {
					return resolved.get();
				}
			}
		}
		finally {
			this.acquisitionLock.unlock();
		}
		throw new AuthenticationRequiredException("No Trello credentials available. Visit " + this.loginUrl);
	}

	/**
	 * Wipe the cached pair, forcing the next call to resolve again.
	 */
	public void clear() {
		this.cache.clear();
	}

	/**
	 * Drop a pair Trello refused: wipe the cache and tell every strategy, so the next call acquires
	 * a different pair instead of repeating the refused one.
	 * @param rejected the refused pair
	 */
	public void reject(CredentialPair rejected) {
		this.acquisitionLock.lock();
		try {
			this.cache.clear();
			this.chain.forEach(strategy -> strategy.reject(rejected));
		}
		finally {
			this.acquisitionLock.unlock();
		}
	}

	/**
	 * Describe the current session without exposing credential values.
	 * @return session information
	 */
	public CredentialSessionInfo sessionInfo() {
		Optional<CachedCredential> cached = this.cache.snapshot();
		return new CredentialSessionInfo(cached.isPresent(), cached.map(CachedCredential::acquiredAt).orElse(null),
				cached.map(CachedCredential::source).orElse(null), this.cache.ttl().toMinutes(), this.loginUrl);
	}

	public String loginUrl() {
		return this.loginUrl;
	}

}
