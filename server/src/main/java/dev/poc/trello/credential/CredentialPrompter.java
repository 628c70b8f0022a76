package dev.poc.trello.credential;

import java.util.Optional;

/**
 * Interactive channel used to ask a human for a Trello API key and token.
 */
public interface CredentialPrompter {

	/**
	 * Whether a human can be asked right now (for example, a terminal is attached).
	 * @return {@code true} if {@link #promptForPair(String)} may be called
	 */
	boolean isInteractive();

	/**
	 * Surface the login page and read the API key and token.
	 * @param loginUrl page where the user can look up their key and generate a token
	 * @return the entered pair, or empty if the user aborted
	 */
	Optional<CredentialPair> promptForPair(String loginUrl);

}
