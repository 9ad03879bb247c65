package com.deepansh.recall.api;

import com.deepansh.recall.model.ChatRequest;
import com.deepansh.recall.model.ChatResponse;
import com.deepansh.recall.orchestrator.MemoryOrchestrator;
import com.deepansh.recall.orchestrator.TurnResult;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Inbound message endpoint.
 *
 * POST /api/v1/chat
 *   {"userId": "u1", "message": "...", "includeBundle": false}
 *
 * Returns as soon as the reply exists; compaction and extraction continue
 * in the background.
 */
@RestController
@RequestMapping("/api/v1/chat")
@RequiredArgsConstructor
@Slf4j
public class ChatController {

    private final MemoryOrchestrator orchestrator;

    @PostMapping
    public ResponseEntity<ChatResponse> chat(@Valid @RequestBody ChatRequest request) {
        log.info("Chat request [userId={}, length={}]", request.getUserId(), request.getMessage().length());

        TurnResult result = orchestrator.onMessage(request.getUserId(), request.getMessage());

        ChatResponse.ChatResponseBuilder response = ChatResponse.builder()
                .userId(request.getUserId())
                .reply(result.getReply())
                .backgroundTasks(result.getBackgroundTasks().size());
        if (request.isIncludeBundle()) {
            response.bundle(result.getBundle()).memoryContext(result.getMemoryContext());
        }
        return ResponseEntity.ok(response.build());
    }
}
