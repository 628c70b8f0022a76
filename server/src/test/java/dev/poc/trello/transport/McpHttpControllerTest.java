package dev.poc.trello.transport;

import java.util.Optional;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import com.fasterxml.jackson.databind.ObjectMapper;

import dev.poc.trello.protocol.McpProtocolHandler;

import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@ExtendWith(MockitoExtension.class)
class McpHttpControllerTest {

	@Mock
	private McpProtocolHandler protocolHandler;

	private final ObjectMapper mapper = new ObjectMapper();

	private MockMvc mockMvc;

	@BeforeEach
	void setUp() {
		this.mockMvc = MockMvcBuilders.standaloneSetup(new McpHttpController(this.protocolHandler))
			.addPlaceholderValue("trello.mcp.transport.endpoint", "/mcp")
			.build();
	}

	@Test
	void post_shouldReturnResponseEnvelope() throws Exception {
		when(this.protocolHandler.handle(anyString()))
			.thenReturn(Optional.of(this.mapper.readTree("{\"jsonrpc\":\"2.0\",\"id\":1,\"result\":{}}")));

		this.mockMvc
			.perform(post("/mcp").contentType(MediaType.APPLICATION_JSON)
				.content("{\"jsonrpc\":\"2.0\",\"id\":1,\"method\":\"ping\"}"))
			.andExpect(status().isOk())
			.andExpect(jsonPath("$.id").value(1));
	}

	@Test
	void post_shouldAnswerMalformedRequestWithBadRequest() throws Exception {
		when(this.protocolHandler.handle(anyString())).thenReturn(Optional
			.of(this.mapper.readTree("{\"jsonrpc\":\"2.0\",\"id\":null,\"error\":{\"code\":-32700,\"message\":\"Parse error\"}}")));

		this.mockMvc.perform(post("/mcp").contentType(MediaType.APPLICATION_JSON).content("{oops"))
			.andExpect(status().isBadRequest())
			.andExpect(jsonPath("$.error.code").value(-32700));
	}

	@Test
	void post_shouldKeepToolErrorsOnOk() throws Exception {
		when(this.protocolHandler.handle(anyString())).thenReturn(Optional
			.of(this.mapper.readTree("{\"jsonrpc\":\"2.0\",\"id\":2,\"error\":{\"code\":-32001,\"message\":\"Unauthorized\"}}")));

		this.mockMvc
			.perform(post("/mcp").contentType(MediaType.APPLICATION_JSON)
				.content("{\"jsonrpc\":\"2.0\",\"id\":2,\"method\":\"tools/call\"}"))
			.andExpect(status().isOk())
			.andExpect(jsonPath("$.error.code").value(-32001));
	}

	@Test
	void post_shouldAcceptNotifications() throws Exception {
		when(this.protocolHandler.handle(anyString())).thenReturn(Optional.empty());

		this.mockMvc
			.perform(post("/mcp").contentType(MediaType.APPLICATION_JSON)
				.content("{\"jsonrpc\":\"2.0\",\"method\":\"notifications/initialized\"}"))
			.andExpect(status().isAccepted());
	}

}
