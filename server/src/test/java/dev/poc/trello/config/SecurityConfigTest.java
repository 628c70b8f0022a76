package dev.poc.trello.config;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Import;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import dev.poc.trello.credential.CredentialResolver;
import dev.poc.trello.protocol.McpProtocolHandler;
import dev.poc.trello.tool.ToolCatalog;
import dev.poc.trello.tool.ToolRegistry;
import dev.poc.trello.transport.ServiceInfoController;

import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(ServiceInfoController.class)
@Import({ SecurityConfig.class, SecurityConfigTest.ServiceInfoBeans.class })
class SecurityConfigTest {

	@Autowired
	private MockMvc mockMvc;

	@MockitoBean
	private McpProtocolHandler protocolHandler;

	@MockitoBean
	private CredentialResolver credentialResolver;

	@Test
	void logout_shouldBeAcceptedFromLoopback() throws Exception {
		this.mockMvc.perform(post("/auth/logout").with(request -> {
			request.setRemoteAddr("127.0.0.1");
			return request;
		})).andExpect(status().isOk());

		verify(this.credentialResolver).clear();
	}

	@Test
	void logout_shouldBeRefusedFromRemoteCaller() throws Exception {
		this.mockMvc.perform(post("/auth/logout").with(request -> {
			request.setRemoteAddr("203.0.113.7");
			return request;
		})).andExpect(status().isForbidden());

		verify(this.credentialResolver, never()).clear();
	}

	@Test
	void tools_shouldStayOpenWithoutBasicAuth() throws Exception {
		this.mockMvc.perform(get("/tools").with(request -> {
			request.setRemoteAddr("203.0.113.7");
			return request;
		})).andExpect(status().isOk());
	}

	@TestConfiguration
	@EnableConfigurationProperties(McpTransportProperties.class)
	static class ServiceInfoBeans {

		@Bean
		ToolRegistry toolRegistry() {
			return new ToolRegistry(ToolCatalog.descriptors());
		}

		@Bean
		TrelloMcpProperties trelloMcpProperties() {
			return new TrelloMcpProperties();
		}

	}

}
