package dev.poc.trello;

import java.util.Map;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class TrelloMcpServerApplicationTest {

	@Test
	void transportProfiles_shouldActivateStdioProfileFromEnvironment() {
		assertThat(TrelloMcpServerApplication.transportProfiles(Map.of("TRELLO_MCP_TRANSPORT", "stdio")))
			.containsExactly("stdio");
		assertThat(TrelloMcpServerApplication.transportProfiles(Map.of("TRELLO_MCP_TRANSPORT", " STDIO ")))
			.containsExactly("stdio");
	}

	@Test
	void transportProfiles_shouldAddNothingForHttp() {
		assertThat(TrelloMcpServerApplication.transportProfiles(Map.of("TRELLO_MCP_TRANSPORT", "http"))).isEmpty();
		assertThat(TrelloMcpServerApplication.transportProfiles(Map.of())).isEmpty();
	}

}
