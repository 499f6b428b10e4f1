package com.hirepanel.core.llm;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.hirepanel.core.model.ErrorKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.chat.messages.UserMessage;
import org.springframework.ai.chat.prompt.Prompt;
import org.springframework.ai.ollama.api.OllamaOptions;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.web.client.ResourceAccessException;

import java.net.SocketTimeoutException;
import java.net.http.HttpTimeoutException;
import java.util.List;
import java.util.Map;

/**
 * {@link ModelClient} over Spring AI's {@link ChatClient} and a local Ollama backend.
 * <p>
 * The response schema travels as Ollama's {@code format} option so the backend
 * constrains generation to criterion-shaped JSON. The response is still cleaned,
 * parsed and validated here, since small models do not always honour the constraint.
 */
@Service
public class ChatModelClient implements ModelClient {

    private static final Logger log = LoggerFactory.getLogger(ChatModelClient.class);

    static final double TOP_P = 0.9;
    static final double REPEAT_PENALTY = 1.1;
    static final int CONTEXT_WINDOW = 12288;

    private static final TypeReference<Map<String, Object>> SCHEMA_TYPE = new TypeReference<>() {};

    private final ChatClient chatClient;
    private final ObjectMapper objectMapper;

    public ChatModelClient(ChatClient.Builder builder, ObjectMapper objectMapper,
                           @Value("${spring.ai.ollama.base-url:http://localhost:11434}") String baseUrl) {
        this.chatClient = builder.build();
        this.objectMapper = objectMapper;
        log.info("ChatModelClient initialized, Ollama base-url: {}", baseUrl);
    }

    @Override
    public RawModelPayload evaluate(ModelRequest request) {
        var options = OllamaOptions.builder()
                .model(request.modelName())
                .temperature(request.temperature())
                .topP(TOP_P)
                .repeatPenalty(REPEAT_PENALTY)
                .numCtx(CONTEXT_WINDOW)
                .format(objectMapper.convertValue(request.responseSchema(), SCHEMA_TYPE))
                .build();

        log.info("Model call started, model {} ({} prompt chars)", request.modelName(), request.prompt().length());
        long start = System.currentTimeMillis();
        String content;
        try {
            content = chatClient.prompt(new Prompt(new UserMessage(request.prompt()), options))
                    .call()
                    .content();
        } catch (ResourceAccessException e) {
            throw new ModelCallException(isTimeout(e) ? ErrorKind.TIMEOUT : ErrorKind.BACKEND_UNREACHABLE,
                    "Backend not reachable: " + e.getMessage(), e);
        } catch (RuntimeException e) {
            throw new ModelCallException(ErrorKind.BACKEND_UNREACHABLE,
                    "Backend call failed: " + e.getMessage(), e);
        }
        long elapsed = System.currentTimeMillis() - start;
        log.info("Model call complete ({}s)", String.format("%.1f", elapsed / 1000.0));
        log.debug("Raw model response: {}", content);

        JsonNode json = JsonResponseExtractor.extract(objectMapper, content);
        List<String> violations = ResponseSchemaValidator.validate(request.responseSchema(), json);
        if (!violations.isEmpty()) {
            log.warn("Model response violates schema: {}", violations);
            throw new ModelCallException(ErrorKind.SCHEMA_VIOLATION, String.join("; ", violations));
        }
        return new RawModelPayload(json, content, elapsed);
    }

    private static boolean isTimeout(Throwable e) {
        for (Throwable t = e; t != null; t = t.getCause()) {
            if (t instanceof SocketTimeoutException || t instanceof HttpTimeoutException) {
                return true;
            }
        }
        return false;
    }
}
