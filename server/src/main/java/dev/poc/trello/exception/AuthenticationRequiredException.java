package dev.poc.trello.exception;

/**
 * Raised when no credential pair could be resolved and interactive acquisition is unavailable or
 * was aborted by the user.
 */
public class AuthenticationRequiredException extends TrelloMcpException {

	public AuthenticationRequiredException(String message) {
		super(ErrorKind.AUTHENTICATION_REQUIRED, message);
	}

}
