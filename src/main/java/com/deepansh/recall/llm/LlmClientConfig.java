package com.deepansh.recall.llm;

import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestClient;

/**
 * Creates the raw LLM client for the provider selected by llm.provider.
 *
 * The raw client ("activeLlmClient") is what the background pipelines use: they
 * run their own bounded retries and must not share the reply path's circuit breaker.
 * The reply path gets ResilientLlmClient (@Primary).
 */
@Configuration
@Slf4j
public class LlmClientConfig {

    @Value("${llm.provider:groq}")
    private String provider;

    // OpenAI
    @Value("${openai.api-key:}") private String openAiKey;
    @Value("${openai.base-url:https://api.openai.com/v1}") private String openAiBaseUrl;
    @Value("${openai.model:gpt-4o-mini}") private String openAiModel;
    @Value("${openai.max-tokens:300}") private int openAiMaxTokens;
    @Value("${openai.temperature:0.3}") private double openAiTemp;

    // Groq
    @Value("${groq.api-key:}") private String groqKey;
    @Value("${groq.base-url:https://api.groq.com/openai/v1}") private String groqBaseUrl;
    @Value("${groq.model:llama-3.3-70b-versatile}") private String groqModel;
    @Value("${groq.max-tokens:300}") private int groqMaxTokens;
    @Value("${groq.temperature:0.3}") private double groqTemp;

    // Ollama (OpenAI-compatible /v1 endpoint, no key)
    @Value("${ollama.base-url:http://localhost:11434/v1}") private String ollamaBaseUrl;
    @Value("${ollama.model:llama3.2:3b}") private String ollamaModel;
    @Value("${ollama.max-tokens:300}") private int ollamaMaxTokens;
    @Value("${ollama.temperature:0.3}") private double ollamaTemp;

    @PostConstruct
    public void logActiveProvider() {
        log.info("================================================================");
        log.info("  Active LLM Provider : {}", provider.toUpperCase());
        log.info("  Model               : {}", activeProps().getModel());
        log.info("================================================================");
    }

    @Bean("activeLlmClient")
    public LlmClient activeLlmClient(RestClient.Builder builder) {
        LlmProviderProperties props = activeProps();
        if (!"ollama".equalsIgnoreCase(provider) && (props.getApiKey() == null || props.getApiKey().isBlank())) {
            log.error("  {} API key not set! Set env var: {}_API_KEY", provider.toUpperCase(), provider.toUpperCase());
        }
        return new GenericLlmClient(props, provider.toLowerCase(), builder.clone());
    }

    private LlmProviderProperties activeProps() {
        LlmProviderProperties p = new LlmProviderProperties();
        switch (provider.toLowerCase()) {
            case "openai" -> {
                p.setApiKey(openAiKey); p.setBaseUrl(openAiBaseUrl); p.setModel(openAiModel);
                p.setMaxTokens(openAiMaxTokens); p.setTemperature(openAiTemp);
            }
            case "ollama" -> {
                p.setApiKey("ollama"); p.setBaseUrl(ollamaBaseUrl); p.setModel(ollamaModel);
                p.setMaxTokens(ollamaMaxTokens); p.setTemperature(ollamaTemp);
            }
            default -> {
                p.setApiKey(groqKey); p.setBaseUrl(groqBaseUrl); p.setModel(groqModel);
                p.setMaxTokens(groqMaxTokens); p.setTemperature(groqTemp);
            }
        }
        return p;
    }
}
