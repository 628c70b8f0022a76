package dev.poc.trello;

import java.util.Map;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Spring Boot entry point for the Trello MCP server.
 */
@SpringBootApplication
public class TrelloMcpServerApplication {

	static final String TRANSPORT_VARIABLE = "TRELLO_MCP_TRANSPORT";

	static final String STDIO_PROFILE = "stdio";

	public static void main(String[] args) {
		SpringApplication application = new SpringApplication(TrelloMcpServerApplication.class);
		application.setAdditionalProfiles(transportProfiles(System.getenv()));
		application.run(args);
	}

	/**
	 * Profiles implied by {@code TRELLO_MCP_TRANSPORT}. The stdio transport, its stderr logging and
	 * the disabled web server all hang off the {@code stdio} profile.
	 * @param environment process environment
	 * @return profiles to add, empty for the HTTP transport
	 */
	static String[] transportProfiles(Map<String, String> environment) {
		String transport = environment.get(TRANSPORT_VARIABLE);
		if (transport != null && STDIO_PROFILE.equalsIgnoreCase(transport.trim())) {
			return new String[] { STDIO_PROFILE };
		}
		return new String[0];
	}

}
