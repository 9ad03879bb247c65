package com.deepansh.recall.retrieval;

import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;

class RetrievalPolicyTest {

    private final RetrievalPolicy policy = new RetrievalPolicy();

    @ParameterizedTest
    @ValueSource(strings = {"hi", "Hello!", "  thanks.  ", "Thank you!!", "ok", "bye", "", "   "})
    void shouldRetrieve_smallTalkOrBlank_false(String message) {
        assertThat(policy.shouldRetrieve(message)).isFalse();
    }

    @ParameterizedTest
    @ValueSource(strings = {"What's my name?", "hi, can you remind me of my trip plans", "okay so about Lisbon"})
    void shouldRetrieve_substantiveMessage_true(String message) {
        assertThat(policy.shouldRetrieve(message)).isTrue();
    }
}
