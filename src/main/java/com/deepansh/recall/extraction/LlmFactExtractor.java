package com.deepansh.recall.extraction;

import com.deepansh.recall.llm.ChatOptions;
import com.deepansh.recall.llm.LlmClient;
import com.deepansh.recall.llm.Message;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Extracts candidate facts from one user message with the raw LLM client.
 *
 * 1. Uses @Qualifier("activeLlmClient"), bypassing the reply path's circuit breaker.
 *    Extraction failures must never affect reply availability.
 *
 * 2. A failed call throws TransientDependencyException; the extraction pipeline owns
 *    the retry budget.
 *
 * 3. Output the model got wrong (prose, fences, broken JSON) is not an error: it
 *    simply yields zero candidates.
 */
@Component
@Slf4j
public class LlmFactExtractor implements Extractor {

    private static final ChatOptions EXTRACTION_OPTIONS = new ChatOptions(300, 0.1);

    private static final String PROMPT = """
            Extract structured facts from the user's message. Return ONLY a JSON array.

            Use these canonical keys:
            - name, location, timezone, job, language, formatter, project
            - testing_framework, api_framework, type_hints, docstrings, line_length
            - database, latency_target

            Categories:
            - identity: name, location, job
            - preference: language, formatter, testing_framework, api_framework
            - constraint: line_length, latency_target
            - instruction: type_hints, docstrings

            Format: [{"category":"identity","key":"name","value":"Alex","confidence":0.9,"importance":0.8}]

            confidence and importance are numbers between 0.0 and 1.0.
            If no facts exist, return: []

            User message: %s

            JSON array:""";

    private final LlmClient llmClient;
    private final ObjectMapper objectMapper;

    public LlmFactExtractor(@Qualifier("activeLlmClient") LlmClient llmClient, ObjectMapper objectMapper) {
        this.llmClient = llmClient;
        this.objectMapper = objectMapper;
    }

    @Override
    public List<ExtractedFact> extract(String message) {
        String raw = llmClient.chat(List.of(
                Message.system("You are a memory extraction assistant. Output only valid JSON arrays. Nothing else."),
                Message.user(PROMPT.formatted(message))), EXTRACTION_OPTIONS).getContent();
        return parse(raw);
    }

    List<ExtractedFact> parse(String raw) {
        // Guard 1: null/blank
        if (raw == null || raw.isBlank()) {
            log.debug("Empty extraction response, no candidates");
            return List.of();
        }

        String cleaned = clean(raw);

        // Guard 2: not a JSON array (prose, refusal, object)
        if (!cleaned.startsWith("[")) {
            log.warn("Extraction response is not a JSON array, skipping. First 100 chars: '{}'",
                    cleaned.substring(0, Math.min(100, cleaned.length())));
            return List.of();
        }

        // Guard 3: malformed JSON counts as zero candidates
        JsonNode root;
        try {
            root = objectMapper.readTree(cleaned);
        } catch (JsonProcessingException e) {
            log.warn("Failed to parse extraction JSON, skipping. Error: {}", e.getOriginalMessage());
            return List.of();
        }

        List<ExtractedFact> facts = new ArrayList<>();
        for (JsonNode node : root) {
            if (!node.isObject()) continue;
            facts.add(new ExtractedFact(
                    text(node, "category"),
                    text(node, "key"),
                    text(node, "value"),
                    number(node, "confidence"),
                    number(node, "importance")));
        }
        return facts;
    }

    /**
     * Strip markdown fences and a leading "json" label, then cut to the outermost
     * array or object.
     */
    static String clean(String response) {
        String cleaned = response.strip();

        if (cleaned.startsWith("```")) {
            int firstNewline = cleaned.indexOf('\n');
            cleaned = firstNewline > 0 ? cleaned.substring(firstNewline + 1) : cleaned.substring(3);
            if (cleaned.endsWith("```")) {
                cleaned = cleaned.substring(0, cleaned.length() - 3);
            }
            cleaned = cleaned.strip();
        }

        if (cleaned.regionMatches(true, 0, "json", 0, 4)) {
            cleaned = cleaned.substring(4).strip();
        }

        int start = indexOfAny(cleaned, '[', '{');
        if (start < 0) return cleaned;
        int end = Math.max(cleaned.lastIndexOf(']'), cleaned.lastIndexOf('}'));
        return end > start ? cleaned.substring(start, end + 1) : cleaned.substring(start);
    }

    private static int indexOfAny(String s, char a, char b) {
        for (int i = 0; i < s.length(); i++) {
            if (s.charAt(i) == a || s.charAt(i) == b) return i;
        }
        return -1;
    }

    private static String text(JsonNode node, String field) {
        JsonNode v = node.get(field);
        return v == null || v.isNull() ? null : v.asText();
    }

    private static Double number(JsonNode node, String field) {
        JsonNode v = node.get(field);
        if (v == null || v.isNull()) return null;
        if (v.isNumber()) return v.doubleValue();
        try {
            return Double.parseDouble(v.asText().strip());
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
