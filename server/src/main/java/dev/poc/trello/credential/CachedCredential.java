package dev.poc.trello.credential;

import java.time.Duration;
import java.time.Instant;

/**
 * A credential pair held in the session cache together with its acquisition time.
 * @param pair cached credentials
 * @param acquiredAt when the pair entered the cache
 * @param source how the pair was obtained
 */
public record CachedCredential(CredentialPair pair, Instant acquiredAt, CredentialSource source) {

	/**
	 * A cached pair expires once {@code ttl} has elapsed since acquisition; the boundary itself is
	 * already expired.
	 * @param now current instant
	 * @param ttl cache time-to-live
	 * @return {@code true} if the entry must be treated as absent
	 */
	public boolean isExpired(Instant now, Duration ttl) {
		return !now.isBefore(this.acquiredAt.plus(ttl));
	}

}
