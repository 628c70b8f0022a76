package dev.poc.trello.credential;

import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import dev.poc.trello.exception.AuthenticationRequiredException;

/**
 * Last link of the chain: asks the user through the {@link CredentialPrompter}. This link never
 * passes; it either yields a validated pair or fails with
 * {@link AuthenticationRequiredException}.
 */
public final class InteractiveCredentialStrategy implements CredentialStrategy {

	private static final Logger logger = LoggerFactory.getLogger(InteractiveCredentialStrategy.class);

	private final CredentialPrompter prompter;

	private final CredentialCache cache;

	private final String loginUrl;

	private final int minLength;

	public InteractiveCredentialStrategy(CredentialPrompter prompter, CredentialCache cache, String loginUrl,
			int minLength) {
		this.prompter = prompter;
		this.cache = cache;
		this.loginUrl = loginUrl;
		this.minLength = minLength;
	}

	@Override
	public Optional<CredentialPair> resolve(Optional<CredentialPair> explicit) {
		if (!this.prompter.isInteractive()) {
			throw new AuthenticationRequiredException("Trello credentials are required. Provide api_key and token "
					+ "arguments or configure TRELLO_API_KEY and TRELLO_TOKEN (keys: " + this.loginUrl + ")");
		}
		logger.info("No credentials provided or cached, prompting user to login");
		CredentialPair pair = this.prompter.promptForPair(this.loginUrl)
			.orElseThrow(() -> new AuthenticationRequiredException("Trello login was cancelled"));
		if (!pair.isValid(this.minLength)) {
			throw new AuthenticationRequiredException(
					"Entered Trello credentials must be at least " + this.minLength + " characters long");
		}
		this.cache.store(pair, CredentialSource.INTERACTIVE);
		return Optional.of(pair);
	}

}
