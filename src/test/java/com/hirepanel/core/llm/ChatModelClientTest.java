package com.hirepanel.core.llm;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.hirepanel.core.model.ErrorKind;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.chat.client.ChatClient.CallResponseSpec;
import org.springframework.ai.chat.client.ChatClient.ChatClientRequestSpec;
import org.springframework.ai.chat.prompt.Prompt;
import org.springframework.ai.ollama.api.OllamaOptions;
import org.springframework.web.client.ResourceAccessException;

import java.net.SocketTimeoutException;
import java.time.Duration;
import java.util.Map;

import static com.hirepanel.core.TestData.persona;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

/**
 * Unit tests for {@link ChatModelClient}.
 * <p>
 * Mocks the {@link ChatClient} chain so no backend is contacted.
 */
class ChatModelClientTest {

    private static final String VALID_RESPONSE = """
            {"scores": {"experience_match": {"score": 8, "reasoning": "Strong track record."}},
             "overall_assessment": {"persona_score": 8, "recommendation": "Advance"}}
            """;

    private final ObjectMapper mapper = new ObjectMapper();
    private ChatClient mockChatClient;
    private ChatClientRequestSpec mockRequestSpec;
    private CallResponseSpec mockCallResponse;
    private ChatModelClient client;
    private JsonNode schema;

    @BeforeEach
    void setUp() {
        mockChatClient = mock(ChatClient.class);
        mockRequestSpec = mock(ChatClientRequestSpec.class);
        mockCallResponse = mock(CallResponseSpec.class);

        when(mockChatClient.prompt(any(Prompt.class))).thenReturn(mockRequestSpec);
        when(mockRequestSpec.call()).thenReturn(mockCallResponse);

        ChatClient.Builder mockBuilder = mock(ChatClient.Builder.class);
        when(mockBuilder.build()).thenReturn(mockChatClient);

        client = new ChatModelClient(mockBuilder, mapper, "http://test:11434");
        schema = new EvaluationSchemaFactory(mapper).schemaFor(persona("hr", 1.0, "experience_match"));
    }

    private ModelRequest request() {
        return new ModelRequest("Evaluate {this} candidate", schema, "dolphin3:latest", 0.7, Duration.ofSeconds(30));
    }

    @Test
    @DisplayName("sends the prompt with model, sampling options and the schema as format")
    void sendsOptions() {
        when(mockCallResponse.content()).thenReturn(VALID_RESPONSE);

        client.evaluate(request());

        ArgumentCaptor<Prompt> captor = ArgumentCaptor.forClass(Prompt.class);
        verify(mockChatClient).prompt(captor.capture());
        Prompt prompt = captor.getValue();
        assertEquals("Evaluate {this} candidate", prompt.getUserMessage().getText());

        OllamaOptions options = (OllamaOptions) prompt.getOptions();
        assertEquals("dolphin3:latest", options.getModel());
        assertEquals(0.7, options.getTemperature());
        assertEquals(0.9, options.getTopP());
        assertEquals(1.1, options.getRepeatPenalty());
        assertEquals(12288, options.getNumCtx());
        assertInstanceOf(Map.class, options.getFormat());
        assertTrue(((Map<?, ?>) options.getFormat()).containsKey("properties"));
    }

    @Test
    @DisplayName("returns the parsed payload with the raw text")
    void returnsPayload() {
        when(mockCallResponse.content()).thenReturn("<think>hmm</think>" + VALID_RESPONSE);

        RawModelPayload payload = client.evaluate(request());

        assertEquals(8, payload.json().at("/scores/experience_match/score").asInt());
        assertTrue(payload.rawText().startsWith("<think>"));
        assertTrue(payload.elapsedMs() >= 0);
    }

    @Test
    @DisplayName("unparseable output is MALFORMED_JSON")
    void malformed() {
        when(mockCallResponse.content()).thenReturn("Sorry, I can't help with that.");

        var ex = assertThrows(ModelCallException.class, () -> client.evaluate(request()));
        assertEquals(ErrorKind.MALFORMED_JSON, ex.kind());
    }

    @Test
    @DisplayName("JSON missing a criterion is SCHEMA_VIOLATION")
    void schemaViolation() {
        when(mockCallResponse.content()).thenReturn(
                "{\"scores\": {}, \"overall_assessment\": {\"persona_score\": 5, \"recommendation\": \"Hold\"}}");

        var ex = assertThrows(ModelCallException.class, () -> client.evaluate(request()));
        assertEquals(ErrorKind.SCHEMA_VIOLATION, ex.kind());
        assertTrue(ex.getMessage().contains("experience_match"));
    }

    @Test
    @DisplayName("connection failures are BACKEND_UNREACHABLE")
    void unreachable() {
        when(mockChatClient.prompt(any(Prompt.class))).thenThrow(new ResourceAccessException("Connection refused"));

        var ex = assertThrows(ModelCallException.class, () -> client.evaluate(request()));
        assertEquals(ErrorKind.BACKEND_UNREACHABLE, ex.kind());
    }

    @Test
    @DisplayName("socket read timeouts are TIMEOUT")
    void socketTimeout() {
        when(mockChatClient.prompt(any(Prompt.class))).thenThrow(
                new ResourceAccessException("I/O error", new SocketTimeoutException("Read timed out")));

        var ex = assertThrows(ModelCallException.class, () -> client.evaluate(request()));
        assertEquals(ErrorKind.TIMEOUT, ex.kind());
    }

    @Test
    @DisplayName("other backend errors are BACKEND_UNREACHABLE")
    void otherErrors() {
        when(mockRequestSpec.call()).thenThrow(new IllegalStateException("model 'x' not found"));

        var ex = assertThrows(ModelCallException.class, () -> client.evaluate(request()));
        assertEquals(ErrorKind.BACKEND_UNREACHABLE, ex.kind());
        assertTrue(ex.getMessage().contains("not found"));
    }
}
