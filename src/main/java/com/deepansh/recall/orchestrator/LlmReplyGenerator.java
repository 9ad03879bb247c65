package com.deepansh.recall.orchestrator;

import com.deepansh.recall.llm.ChatOptions;
import com.deepansh.recall.llm.LlmClient;
import com.deepansh.recall.llm.Message;
import com.deepansh.recall.model.Turn;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Reply generation through the @Primary (retry + circuit breaker) LLM client.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class LlmReplyGenerator implements ReplyGenerator {

    static final String FALLBACK_REPLY =
            "Sorry, I'm having trouble responding right now. Please try again in a moment.";

    private static final String SYSTEM_PROMPT = """
            You are a helpful assistant with long-term memory of this user.
            Use the memory below when it is relevant. Never invent facts about the user.

            %s""";

    private final LlmClient llmClient;

    @Override
    public String generate(String memoryContext, List<Turn> recentTurns) {
        List<Message> messages = new ArrayList<>(recentTurns.size() + 1);
        messages.add(Message.system(SYSTEM_PROMPT.formatted(memoryContext)));
        for (Turn turn : recentTurns) {
            messages.add(turn.getRole() == Turn.Role.user
                    ? Message.user(turn.getContent())
                    : Message.assistant(turn.getContent()));
        }

        try {
            String content = llmClient.chat(messages, ChatOptions.defaults()).getContent();
            if (content == null || content.isBlank()) {
                log.warn("LLM returned an empty reply, using fallback");
                return FALLBACK_REPLY;
            }
            return content.strip();
        } catch (Exception e) {
            log.error("Reply generation failed, using fallback: {}", e.getMessage());
            return FALLBACK_REPLY;
        }
    }
}
