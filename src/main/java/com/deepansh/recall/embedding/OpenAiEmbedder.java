package com.deepansh.recall.embedding;

import com.deepansh.recall.exception.MemoryException;
import com.deepansh.recall.exception.TransientDependencyException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.http.HttpStatusCode;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Duration;
import java.util.HexFormat;
import java.util.List;
import java.util.Map;

/**
 * Generates text embeddings via an OpenAI-compatible /embeddings endpoint.
 *
 * Caching strategy:
 * - Redis cache key: embed:{model}:{sha256(text)}
 * - TTL: 7 days
 * - Cache failures are logged and ignored; Redis being down only costs an API call
 *
 * Summaries are embedded once at compaction time, so the cache mostly pays off
 * on repeated queries (retrieval embeds every inbound message).
 */
@Service
@Slf4j
public class OpenAiEmbedder implements Embedder {

    private static final String CACHE_PREFIX = "embed:";
    private static final Duration CACHE_TTL = Duration.ofDays(7);

    private final RestClient restClient;
    private final StringRedisTemplate redisTemplate;
    private final ObjectMapper objectMapper;
    private final String model;

    public OpenAiEmbedder(
            @Value("${embedding.base-url:https://api.openai.com/v1}") String baseUrl,
            @Value("${embedding.api-key:}") String apiKey,
            @Value("${embedding.model:text-embedding-3-small}") String model,
            RestClient.Builder restClientBuilder,
            StringRedisTemplate redisTemplate,
            ObjectMapper objectMapper) {
        this.model = model;
        this.redisTemplate = redisTemplate;
        this.objectMapper = objectMapper;
        this.restClient = restClientBuilder.clone()
                .baseUrl(baseUrl)
                .defaultHeader("Authorization", "Bearer " + apiKey)
                .defaultHeader("Content-Type", "application/json")
                .build();
    }

    @Override
    public float[] embed(String text) {
        String cacheKey = CACHE_PREFIX + model + ":" + hashText(text);

        float[] cached = readCache(cacheKey);
        if (cached != null) {
            log.debug("Embedding cache hit for text length={}", text.length());
            return cached;
        }

        float[] embedding = fetchEmbedding(text);
        writeCache(cacheKey, embedding);
        return embedding;
    }

    private float[] readCache(String cacheKey) {
        try {
            String json = redisTemplate.opsForValue().get(cacheKey);
            return json == null ? null : objectMapper.readValue(json, float[].class);
        } catch (Exception e) {
            log.warn("Embedding cache read failed, fetching fresh: {}", e.getMessage());
            return null;
        }
    }

    private void writeCache(String cacheKey, float[] embedding) {
        try {
            redisTemplate.opsForValue().set(cacheKey, objectMapper.writeValueAsString(embedding), CACHE_TTL);
        } catch (Exception e) {
            log.warn("Failed to cache embedding: {}", e.getMessage());
        }
    }

    @SuppressWarnings("unchecked")
    private float[] fetchEmbedding(String text) {
        log.debug("Fetching embedding for text length={}", text.length());

        Map<String, Object> response;
        try {
            response = restClient.post()
                    .uri("/embeddings")
                    .body(Map.of("model", model, "input", text))
                    .retrieve()
                    .onStatus(HttpStatusCode::is4xxClientError, (req, res) -> {
                        String body = new String(res.getBody().readAllBytes(), StandardCharsets.UTF_8);
                        log.error("Embedding 4xx [{}]: {}", res.getStatusCode(), body);
                        handle4xxError(body, res.getStatusCode().value());
                    })
                    .onStatus(HttpStatusCode::is5xxServerError, (req, res) -> {
                        String body = new String(res.getBody().readAllBytes(), StandardCharsets.UTF_8);
                        log.error("Embedding 5xx [{}]: {}", res.getStatusCode(), body);
                        throw new TransientDependencyException(
                                "Embedding server error [" + res.getStatusCode() + "]: " + body);
                    })
                    .body(new ParameterizedTypeReference<>() {});
        } catch (RestClientException e) {
            throw new TransientDependencyException("Embedding request failed: " + e.getMessage(), e);
        }

        List<Map<String, Object>> data = response == null ? null
                : (List<Map<String, Object>>) response.get("data");
        if (data == null || data.isEmpty()) {
            throw new TransientDependencyException("Embedding response contained no data");
        }
        List<Number> rawEmbedding = (List<Number>) data.get(0).get("embedding");
        if (rawEmbedding == null || rawEmbedding.isEmpty()) {
            throw new TransientDependencyException("Embedding response contained no embedding vector");
        }

        float[] result = new float[rawEmbedding.size()];
        for (int i = 0; i < rawEmbedding.size(); i++) {
            result[i] = rawEmbedding.get(i).floatValue();
        }

        log.debug("Fetched embedding: {} dimensions", result.length);
        return result;
    }

    /** 401 and other client errors are not retried; 429 is */
    private void handle4xxError(String body, int statusCode) {
        if (statusCode == 401) {
            throw new MemoryException("Embedding API key is invalid. Check the embedding.api-key property.");
        }
        if (statusCode == 429) {
            throw new TransientDependencyException("Embedding rate limit exceeded. Will retry.");
        }
        throw new MemoryException("Embedding client error [" + statusCode + "]: " + body);
    }

    private static String hashText(String text) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(text.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
