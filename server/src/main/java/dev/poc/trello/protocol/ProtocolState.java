package dev.poc.trello.protocol;

/**
 * Lifecycle of the MCP session.
 */
public enum ProtocolState {

	UNINITIALIZED, READY

}
