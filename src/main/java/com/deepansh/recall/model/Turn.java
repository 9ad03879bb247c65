package com.deepansh.recall.model;

import lombok.Builder;
import lombok.Value;

/**
 * One message in a conversation with its position in the user's turn sequence.
 * Immutable once created; lives in the session buffer until compacted.
 */
@Value
@Builder
public class Turn {

    public enum Role {
        user, assistant
    }

    Role role;
    String content;

    /** 1-based, strictly increasing per user */
    long sequenceNumber;
}
