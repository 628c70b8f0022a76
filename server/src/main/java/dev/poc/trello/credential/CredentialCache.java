package dev.poc.trello.credential;

import java.time.Clock;
import java.time.Duration;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Single-slot, process-local credential cache. Nothing is persisted; a restart starts empty.
 */
public final class CredentialCache {

	private static final Logger logger = LoggerFactory.getLogger(CredentialCache.class);

	private final Clock clock;

	private final Duration ttl;

	private CachedCredential slot;

	public CredentialCache(Clock clock, Duration ttl) {
		this.clock = clock;
		this.ttl = ttl;
	}

	/**
	 * Return the cached pair if it has not expired. An expired entry is dropped.
	 * @return the live cached pair
	 */
	public synchronized Optional<CredentialPair> current() {
		return snapshot().map(CachedCredential::pair);
	}

	/**
	 * Return the live cache entry including its metadata.
	 * @return the live cache entry
	 */
	public synchronized Optional<CachedCredential> snapshot() {
		if (this.slot == null) {
			return Optional.empty();
		}
		if (this.slot.isExpired(this.clock.instant(), this.ttl)) {
			logger.info("Cached credentials expired");
			this.slot = null;
			return Optional.empty();
		}
		return Optional.of(this.slot);
	}

	/**
	 * Store the pair with {@code acquiredAt = now}.
	 * @param pair validated credentials
	 * @param source where the pair came from
	 * @return the new cache entry
	 */
	public synchronized CachedCredential store(CredentialPair pair, CredentialSource source) {
		this.slot = new CachedCredential(pair, this.clock.instant(), source);
		logger.info("Credentials cached for session (source: {})", source);
		return this.slot;
	}

	public synchronized void clear() {
		if (this.slot != null) {
			logger.info("Credentials cleared");
		}
		this.slot = null;
	}

	public Duration ttl() {
		return this.ttl;
	}

}
