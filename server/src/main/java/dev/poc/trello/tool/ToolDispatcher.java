package dev.poc.trello.tool;

import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import dev.poc.trello.credential.CredentialPair;
import dev.poc.trello.credential.CredentialResolver;
import dev.poc.trello.exception.ErrorKind;
import dev.poc.trello.exception.TrelloMcpException;

/**
 * Executes tool calls: lookup, validation, credential resolution, then the operation itself.
 * Every failure is converted to an {@link OperationResult.Failure} here and nowhere else.
 */
public class ToolDispatcher {

	private static final Logger logger = LoggerFactory.getLogger(ToolDispatcher.class);

	static final String MDC_TOOL = "tool";

	private final ToolRegistry registry;

	private final CredentialResolver credentialResolver;

	private final Map<String, ToolOperation> operations;

	public ToolDispatcher(ToolRegistry registry, CredentialResolver credentialResolver,
			Map<String, ToolOperation> operations) {
		for (ToolDescriptor descriptor : registry.list()) {
			if (!operations.containsKey(descriptor.name())) {
				throw new IllegalArgumentException("No operation registered for tool " + descriptor.name());
			}
		}
		this.registry = registry;
		this.credentialResolver = credentialResolver;
		this.operations = Map.copyOf(operations);
	}

	public ToolRegistry registry() {
		return this.registry;
	}

	/**
	 * Invoke a tool.
	 * @param request tool name, arguments and optional explicit credentials
	 * @return success with summary and payload, or a classified failure
	 */
	public OperationResult invoke(OperationRequest request) {
		String name = request.operation();
		MDC.put(MDC_TOOL, name);
		CredentialPair credentials = null;
		try {
			if (this.registry.describe(name).isEmpty()) {
				logger.warn("Unknown tool requested");
				return new OperationResult.Failure(ErrorKind.UNKNOWN_OPERATION, "Unknown tool: " + name,
						Map.of("tool", String.valueOf(name)));
			}
			ValidationResult validation = this.registry.validate(name, request.arguments());
			if (!validation.valid()) {
				logger.info("Rejected tool call: {}", validation.message());
				return new OperationResult.Failure(ErrorKind.INVALID_ARGUMENTS, validation.message(),
						validation.details());
			}
			logger.debug("Executing tool with arguments {}", request.arguments().keySet());
			credentials = this.credentialResolver.resolve(request.explicit());
			OperationResult.Success success = this.operations.get(name)
				.execute(credentials, new ToolArguments(request.arguments()));
			logger.info("Success response: {}", success.summary());
			return success;
		}
		catch (TrelloMcpException e) {
			if (e.kind() == ErrorKind.UNAUTHORIZED) {
				logger.info("Trello rejected the credentials, clearing the credential cache");
				if (credentials != null) {
					this.credentialResolver.reject(credentials);
				}
				else {
					this.credentialResolver.clear();
				}
			}
			logger.warn("Error response ({}): {}", e.kind().label(), e.getMessage());
			logger.debug("Tool failure detail", e);
			return new OperationResult.Failure(e.kind(), e.getMessage(), e.details());
		}
		catch (RuntimeException e) {
			logger.error("Tool execution failed", e);
			return new OperationResult.Failure(ErrorKind.EXTERNAL_ERROR, "Tool execution failed", Map.of());
		}
		finally {
			MDC.remove(MDC_TOOL);
		}
	}

}
