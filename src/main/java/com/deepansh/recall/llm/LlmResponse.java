package com.deepansh.recall.llm;

import lombok.Builder;
import lombok.Data;

@Data
@Builder
public class LlmResponse {

    private String content;

    @Builder.Default
    private int promptTokens = 0;

    @Builder.Default
    private int completionTokens = 0;
}
