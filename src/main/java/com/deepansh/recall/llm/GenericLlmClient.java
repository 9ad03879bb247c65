package com.deepansh.recall.llm;

import com.deepansh.recall.exception.MemoryException;
import com.deepansh.recall.exception.TransientDependencyException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.HttpStatusCode;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;

import java.nio.charset.StandardCharsets;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * OpenAI-compatible chat-completions client. Works with OpenAI, Groq and Ollama's
 * /v1 endpoint.
 *
 * Error handling strategy:
 *
 * | Error               | Action                                              |
 * |---------------------|-----------------------------------------------------|
 * | 401 invalid key     | MemoryException (not retried, not a CB failure)     |
 * | 429 rate limited    | TransientDependencyException (retried)              |
 * | 4xx other           | MemoryException (not retried)                       |
 * | 5xx server error    | TransientDependencyException (retried)              |
 * | network error       | TransientDependencyException (retried)              |
 * | no choices returned | TransientDependencyException (retried)              |
 */
@Slf4j
public class GenericLlmClient implements LlmClient {

    private final LlmProviderProperties props;
    private final String providerName;
    private final RestClient restClient;

    public GenericLlmClient(LlmProviderProperties props,
                            String providerName,
                            RestClient.Builder restClientBuilder) {
        this.props = props;
        this.providerName = providerName;
        this.restClient = restClientBuilder
                .baseUrl(props.getBaseUrl())
                .defaultHeader("Authorization", "Bearer " + props.getApiKey())
                .defaultHeader("Content-Type", "application/json")
                .build();
    }

    @Override
    public LlmResponse chat(List<Message> messages, ChatOptions options) {
        Map<String, Object> requestBody = buildRequestBody(messages, options);

        log.debug("Sending {} messages to {} [model={}]", messages.size(), providerName, props.getModel());

        try {
            Map<String, Object> response = restClient.post()
                    .uri("/chat/completions")
                    .body(requestBody)
                    .retrieve()
                    .onStatus(HttpStatusCode::is4xxClientError, (req, res) -> {
                        String body = new String(res.getBody().readAllBytes(), StandardCharsets.UTF_8);
                        log.error("{} 4xx [{}]: {}", providerName, res.getStatusCode(), body);
                        handle4xxError(body, res.getStatusCode().value());
                    })
                    .onStatus(HttpStatusCode::is5xxServerError, (req, res) -> {
                        String body = new String(res.getBody().readAllBytes(), StandardCharsets.UTF_8);
                        log.error("{} 5xx [{}]: {}", providerName, res.getStatusCode(), body);
                        throw new TransientDependencyException(
                                providerName + " server error [" + res.getStatusCode() + "]: " + body);
                    })
                    .body(new ParameterizedTypeReference<>() {});

            return parseResponse(response);

        } catch (ResourceAccessException e) {
            throw new TransientDependencyException(providerName + " unreachable: " + e.getMessage(), e);
        }
    }

    private void handle4xxError(String body, int statusCode) {
        if (statusCode == 401) {
            throw new MemoryException(providerName + " API key is invalid. Check your "
                    + providerName.toUpperCase() + "_API_KEY environment variable.");
        }
        if (statusCode == 429) {
            throw new TransientDependencyException(providerName + " rate limit exceeded. Will retry.");
        }
        throw new MemoryException(providerName + " client error [" + statusCode + "]: " + body);
    }

    private Map<String, Object> buildRequestBody(List<Message> messages, ChatOptions options) {
        List<Map<String, Object>> formattedMessages = messages.stream()
                .map(m -> Map.<String, Object>of(
                        "role", m.getRole().name(),
                        "content", m.getContent() != null ? m.getContent() : ""))
                .toList();

        Map<String, Object> body = new HashMap<>();
        body.put("model", props.getModel());
        body.put("max_tokens", options.maxTokens() != null ? options.maxTokens() : props.getMaxTokens());
        body.put("temperature", options.temperature() != null ? options.temperature() : props.getTemperature());
        body.put("messages", formattedMessages);
        return body;
    }

    @SuppressWarnings("unchecked")
    private LlmResponse parseResponse(Map<String, Object> response) {
        List<Map<String, Object>> choices = response == null ? null
                : (List<Map<String, Object>>) response.get("choices");
        if (choices == null || choices.isEmpty()) {
            throw new TransientDependencyException(providerName + " returned no choices in response");
        }

        int promptTokens = 0, completionTokens = 0;
        Map<String, Object> usage = (Map<String, Object>) response.get("usage");
        if (usage != null) {
            promptTokens     = ((Number) usage.getOrDefault("prompt_tokens", 0)).intValue();
            completionTokens = ((Number) usage.getOrDefault("completion_tokens", 0)).intValue();
            log.debug("Token usage: prompt={} completion={}", promptTokens, completionTokens);
        }

        Map<String, Object> message = (Map<String, Object>) choices.get(0).get("message");
        return LlmResponse.builder()
                .content(message != null ? (String) message.get("content") : null)
                .promptTokens(promptTokens)
                .completionTokens(completionTokens)
                .build();
    }
}
