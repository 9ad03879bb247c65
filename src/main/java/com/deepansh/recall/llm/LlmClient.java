package com.deepansh.recall.llm;

import java.util.List;

public interface LlmClient {

    /**
     * Send a prompt conversation to the model.
     *
     * @param messages system + user/assistant messages, oldest first
     * @param options  per-call overrides of max tokens and temperature
     * @return the model's text answer
     * @throws com.deepansh.recall.exception.TransientDependencyException on retryable failures
     */
    LlmResponse chat(List<Message> messages, ChatOptions options);
}
