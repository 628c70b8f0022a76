package dev.poc.trello.tool;

import java.util.Map;

import dev.poc.trello.exception.ErrorKind;

/**
 * Result of a tool invocation.
 */
public sealed interface OperationResult permits OperationResult.Success, OperationResult.Failure {

	/**
	 * Successful invocation.
	 * @param summary one-line human readable summary
	 * @param structured structured payload returned as {@code structuredContent}
	 */
	record Success(String summary, Map<String, Object> structured) implements OperationResult {
	}

	/**
	 * Failed invocation. The message is client safe.
	 * @param kind failure classification
	 * @param message description of the failure
	 * @param details additional structured data
	 */
	record Failure(ErrorKind kind, String message, Map<String, Object> details) implements OperationResult {
	}

}
