package com.deepansh.recall.model;

import com.deepansh.recall.retrieval.ContextBundle;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Data;

@Data
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ChatResponse {

    private String userId;
    private String reply;

    /** Only present when the request asked for it */
    private ContextBundle bundle;
    private String memoryContext;

    private int backgroundTasks;
}
