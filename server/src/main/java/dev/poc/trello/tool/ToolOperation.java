package dev.poc.trello.tool;

import dev.poc.trello.credential.CredentialPair;

/**
 * Handler for one tool. Failures are raised as {@code TrelloMcpException}s.
 */
@FunctionalInterface
public interface ToolOperation {

	OperationResult.Success execute(CredentialPair credentials, ToolArguments arguments);

}
