package com.deepansh.recall.compaction;

import com.deepansh.recall.config.MemoryProperties;
import com.deepansh.recall.exception.TransientDependencyException;
import com.deepansh.recall.llm.ChatOptions;
import com.deepansh.recall.llm.LlmClient;
import com.deepansh.recall.llm.Message;
import com.deepansh.recall.model.Turn;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Summarizes a compaction slice with the raw LLM client. Retries belong to the
 * compaction pipeline, so this class makes exactly one call and throws on failure.
 */
@Component
@Slf4j
public class LlmSummarizer implements Summarizer {

    private static final ChatOptions SUMMARY_OPTIONS = new ChatOptions(150, 0.3);

    private static final String PROMPT = """
            Summarize this conversation in 2-3 concise sentences.

            Focus on:
            - Key facts shared by the user
            - Main topics discussed
            - Important decisions or commitments

            Only use information present in the conversation. Do not add anything.

            Conversation:
            %s

            Summary:""";

    private final LlmClient llmClient;
    private final int maxCharsPerTurn;

    public LlmSummarizer(@Qualifier("activeLlmClient") LlmClient llmClient, MemoryProperties properties) {
        this.llmClient = llmClient;
        this.maxCharsPerTurn = properties.getCompaction().getMaxCharsPerTurn();
    }

    @Override
    public String summarize(List<Turn> turns) {
        String conversation = turns.stream()
                .map(t -> label(t.getRole()) + ": " + clip(t.getContent()))
                .collect(Collectors.joining("\n"));

        String content = llmClient.chat(List.of(
                Message.system("You write short factual summaries of conversations."),
                Message.user(PROMPT.formatted(conversation))), SUMMARY_OPTIONS).getContent();

        if (content == null || content.isBlank()) {
            throw new TransientDependencyException("Summarizer returned an empty summary");
        }
        String summary = content.strip();
        log.info("Generated summary ({} chars) from {} turns", summary.length(), turns.size());
        return summary;
    }

    private String clip(String s) {
        return s.length() <= maxCharsPerTurn ? s : s.substring(0, maxCharsPerTurn);
    }

    private static String label(Turn.Role role) {
        return role == Turn.Role.user ? "User" : "Assistant";
    }
}
