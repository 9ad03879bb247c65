package com.deepansh.recall.compaction;

import com.deepansh.recall.config.MemoryProperties;
import com.deepansh.recall.exception.TransientDependencyException;
import com.deepansh.recall.llm.ChatOptions;
import com.deepansh.recall.llm.LlmClient;
import com.deepansh.recall.llm.LlmResponse;
import com.deepansh.recall.llm.Message;
import com.deepansh.recall.model.Turn;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class LlmSummarizerTest {

    @Mock LlmClient llmClient;

    @Test
    @SuppressWarnings("unchecked")
    void summarize_clipsLongTurnsAndLabelsRoles() {
        ArgumentCaptor<List<Message>> messages = ArgumentCaptor.forClass(List.class);
        when(llmClient.chat(messages.capture(), any(ChatOptions.class)))
                .thenReturn(LlmResponse.builder().content("  The user introduced themselves.  ").build());
        LlmSummarizer summarizer = new LlmSummarizer(llmClient, new MemoryProperties());

        String summary = summarizer.summarize(List.of(
                turn(Turn.Role.user, "x".repeat(250), 1),
                turn(Turn.Role.assistant, "Nice to meet you", 2)));

        assertThat(summary).isEqualTo("The user introduced themselves.");
        String prompt = messages.getValue().get(1).getContent();
        assertThat(prompt).contains("User: " + "x".repeat(100) + "\n");
        assertThat(prompt).doesNotContain("x".repeat(101));
        assertThat(prompt).contains("Assistant: Nice to meet you");
    }

    @Test
    void summarize_blankResponse_isTransientFailure() {
        when(llmClient.chat(anyList(), any(ChatOptions.class)))
                .thenReturn(LlmResponse.builder().content(" ").build());
        LlmSummarizer summarizer = new LlmSummarizer(llmClient, new MemoryProperties());

        assertThatThrownBy(() -> summarizer.summarize(List.of(turn(Turn.Role.user, "hello", 1))))
                .isInstanceOf(TransientDependencyException.class);
    }

    private static Turn turn(Turn.Role role, String content, long seq) {
        return Turn.builder().role(role).content(content).sequenceNumber(seq).build();
    }
}
