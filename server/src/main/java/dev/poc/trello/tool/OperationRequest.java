package dev.poc.trello.tool;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

import dev.poc.trello.credential.CredentialPair;

/**
 * A single tool invocation.
 * @param operation tool name
 * @param arguments tool arguments without credential keys
 * @param explicit credential pair supplied with the call, if any
 */
public record OperationRequest(String operation, Map<String, Object> arguments, Optional<CredentialPair> explicit) {

	/**
	 * Build a request from raw {@code tools/call} arguments, lifting {@code api_key} and
	 * {@code token} out of the argument map.
	 * @param operation tool name
	 * @param rawArguments arguments as received, may be {@code null}
	 * @return request
	 */
	public static OperationRequest fromToolCall(String operation, Map<String, Object> rawArguments) {
		Map<String, Object> arguments = new LinkedHashMap<>();
		if (rawArguments != null) {
			arguments.putAll(rawArguments);
		}
		Object apiKey = arguments.remove(ToolDescriptor.API_KEY);
		Object token = arguments.remove(ToolDescriptor.TOKEN);
		CredentialPair pair = apiKey instanceof String key && token instanceof String value
				? CredentialPair.ofNullable(key, value) : null;
		return new OperationRequest(operation, arguments, Optional.ofNullable(pair));
	}

	@Override
	public String toString() {
		return "OperationRequest[operation=" + this.operation + ", arguments=" + this.arguments.keySet()
				+ ", explicit=" + this.explicit.isPresent() + "]";
	}

}
