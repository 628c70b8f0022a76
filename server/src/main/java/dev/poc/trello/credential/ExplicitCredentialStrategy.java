package dev.poc.trello.credential;

import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Uses credentials passed with the tool call. The cache is left untouched.
 */
public final class ExplicitCredentialStrategy implements CredentialStrategy {

	private static final Logger logger = LoggerFactory.getLogger(ExplicitCredentialStrategy.class);

	private final int minLength;

	public ExplicitCredentialStrategy(int minLength) {
		this.minLength = minLength;
	}

	@Override
	public Optional<CredentialPair> resolve(Optional<CredentialPair> explicit) {
		if (explicit.isEmpty()) {
			return Optional.empty();
		}
		if (!explicit.get().isValid(this.minLength)) {
			logger.warn("Ignoring explicit credentials that do not meet the minimum length of {}", this.minLength);
			return Optional.empty();
		}
		logger.debug("Using credentials provided with the request");
		return explicit;
	}

	@Override
	public boolean requiresExclusiveAccess() {
		return false;
	}

}
