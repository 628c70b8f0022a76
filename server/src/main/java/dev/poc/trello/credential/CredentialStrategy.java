package dev.poc.trello.credential;

import java.util.Optional;

/**
 * One link of the credential resolution chain. A strategy either resolves a pair or passes to the
 * next link by returning an empty result.
 */
public interface CredentialStrategy {

	/**
	 * Attempt to resolve credentials.
	 * @param explicit pair supplied with the request, if any
	 * @return the resolved pair, or empty to pass to the next strategy
	 */
	Optional<CredentialPair> resolve(Optional<CredentialPair> explicit);

	/**
	 * Whether this link touches shared state and therefore has to run under the resolver lock.
	 * @return {@code true} for strategies reading or writing the cache
	 */
	default boolean requiresExclusiveAccess() {
		return true;
	}

	/**
	 * Told that Trello refused a pair. Strategies holding a fixed pair stop offering it.
	 * @param rejected the refused pair
	 */
	default void reject(CredentialPair rejected) {
	}

}
