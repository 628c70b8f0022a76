package dev.poc.trello.credential;

import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Falls back to credentials loaded from configuration at start-up ({@code TRELLO_API_KEY} and
 * {@code TRELLO_TOKEN}). Both values must be set; a pair that fails validation or that Trello
 * has refused is ignored.
 */
public final class PreProvisionedCredentialStrategy implements CredentialStrategy {

	private static final Logger logger = LoggerFactory.getLogger(PreProvisionedCredentialStrategy.class);

	private final CredentialPair provisioned;

	private final CredentialCache cache;

	private volatile boolean rejected;

	public PreProvisionedCredentialStrategy(CredentialPair provisioned, CredentialCache cache, int minLength) {
		if (provisioned != null && !provisioned.isValid(minLength)) {
			logger.warn("Pre-provisioned Trello credentials are shorter than {} characters and will be ignored",
					minLength);
			provisioned = null;
		}
		this.provisioned = provisioned;
		this.cache = cache;
	}

	@Override
	public Optional<CredentialPair> resolve(Optional<CredentialPair> explicit) {
		if (this.provisioned == null || this.rejected) {
			return Optional.empty();
		}
		logger.info("Loading pre-provisioned credentials from configuration");
		this.cache.store(this.provisioned, CredentialSource.PRE_PROVISIONED);
		return Optional.of(this.provisioned);
	}

	/**
	 * Stops offering the configured pair once Trello refused it. Only a restart with new values
	 * brings it back.
	 */
	@Override
	public void reject(CredentialPair refused) {
		if (this.provisioned != null && this.provisioned.equals(refused) && !this.rejected) {
			logger.warn("Trello refused the pre-provisioned credentials, they will not be used again");
			this.rejected = true;
		}
	}

	public boolean isConfigured() {
		return this.provisioned != null;
	}

}
