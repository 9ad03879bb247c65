package com.deepansh.recall.api;

import com.deepansh.recall.observability.PipelineTrace;
import com.deepansh.recall.observability.TraceService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

/**
 * REST endpoints for background pipeline traces.
 *
 * GET /api/v1/traces/{userId}             all compaction/extraction traces for a user
 * GET /api/v1/traces/{userId}/analytics   status breakdown and average latency
 */
@RestController
@RequestMapping("/api/v1/traces")
@RequiredArgsConstructor
public class ObservabilityController {

    private final TraceService traceService;

    @GetMapping("/{userId}")
    public ResponseEntity<List<PipelineTrace>> getTraces(@PathVariable String userId) {
        return ResponseEntity.ok(traceService.getTracesForUser(userId));
    }

    @GetMapping("/{userId}/analytics")
    public ResponseEntity<Map<String, Object>> getAnalytics(@PathVariable String userId) {
        return ResponseEntity.ok(traceService.getAnalytics(userId));
    }
}
