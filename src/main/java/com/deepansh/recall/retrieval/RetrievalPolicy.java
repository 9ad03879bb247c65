package com.deepansh.recall.retrieval;

import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.Set;

/**
 * Decides per turn whether retrieval runs. Greetings and acknowledgements carry no
 * query worth embedding, so they are answered from the session buffer alone.
 */
@Component
public class RetrievalPolicy {

    private static final Set<String> SMALL_TALK = Set.of(
            "hi", "hello", "hey", "thanks", "thank you", "ok", "okay", "bye", "yes", "no");

    public boolean shouldRetrieve(String message) {
        if (message == null || message.isBlank()) return false;
        String normalized = message.strip().toLowerCase(Locale.ROOT).replaceAll("[!.?,]+$", "");
        return !SMALL_TALK.contains(normalized);
    }
}
