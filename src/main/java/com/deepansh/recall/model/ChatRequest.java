package com.deepansh.recall.model;

import jakarta.validation.constraints.NotBlank;
import lombok.Data;

@Data
public class ChatRequest {

    @NotBlank(message = "userId must not be blank")
    private String userId;

    @NotBlank(message = "message must not be blank")
    private String message;

    /** Include the retrieval bundle in the response, for inspection */
    private boolean includeBundle;
}
