package dev.poc.trello.credential;

/**
 * Where a resolved credential pair came from.
 */
public enum CredentialSource {
	EXPLICIT, PRE_PROVISIONED, INTERACTIVE
}
