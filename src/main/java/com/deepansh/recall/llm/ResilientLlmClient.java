package com.deepansh.recall.llm;

import com.deepansh.recall.exception.TransientDependencyException;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.github.resilience4j.retry.annotation.Retry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Primary;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Decorator around the active LLM client that adds retry + circuit breaker for
 * the reply path.
 *
 * Retry config (application.yml, instance "llmClient"):
 * - 3 attempts, exponential backoff starting at 1s
 * - retries TransientDependencyException only; a bad API key is not retried
 *
 * Circuit breaker config:
 * - opens after 50% failures in a sliding window of 10 calls, half-opens after 30s
 *
 * Fallbacks surface a single exception type so the reply generator can degrade
 * to its canned answer.
 */
@Component
@Primary
@Slf4j
public class ResilientLlmClient implements LlmClient {

    private final LlmClient delegate;

    public ResilientLlmClient(@Qualifier("activeLlmClient") LlmClient delegate) {
        this.delegate = delegate;
    }

    @Override
    @Retry(name = "llmClient", fallbackMethod = "retryFallback")
    @CircuitBreaker(name = "llmClient", fallbackMethod = "circuitBreakerFallback")
    public LlmResponse chat(List<Message> messages, ChatOptions options) {
        return delegate.chat(messages, options);
    }

    public LlmResponse retryFallback(List<Message> messages, ChatOptions options, Exception ex) {
        log.error("LLM call failed after all retries: {}", ex.getMessage());
        throw new TransientDependencyException("LLM unavailable after retries", ex);
    }

    public LlmResponse circuitBreakerFallback(List<Message> messages, ChatOptions options, Exception ex) {
        log.error("LLM circuit breaker is OPEN, rejecting call: {}", ex.getMessage());
        throw new TransientDependencyException("LLM circuit open", ex);
    }
}
