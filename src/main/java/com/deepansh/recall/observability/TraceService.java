package com.deepansh.recall.observability;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;

import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Persists background task events as traces and exposes per-user analytics.
 *
 * Persistence is @Async on its own executor, so a slow or unavailable Mongo
 * never backs up the memory worker pool.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class TraceService {

    private static final int MAX_DETAIL_LENGTH = 2000;

    private final PipelineTraceRepository traceRepository;

    @Async("traceTaskExecutor")
    @EventListener
    public void onTaskEvent(MemoryTaskEvent event) {
        try {
            PipelineTrace trace = PipelineTrace.builder()
                    .userId(event.userId())
                    .type(event.type())
                    .status(event.status())
                    .attempts(event.attempts())
                    .latencyMs(event.latencyMs())
                    .detail(truncate(event.detail(), MAX_DETAIL_LENGTH))
                    .createdAt(event.occurredAt())
                    .build();

            traceRepository.save(trace);

            log.debug("Trace persisted [user={}, type={}, status={}, latency={}ms]",
                    event.userId(), event.type(), event.status(), event.latencyMs());

        } catch (Exception e) {
            // Trace persistence must never crash the app
            log.error("Failed to persist pipeline trace for user={}", event.userId(), e);
        }
    }

    public List<PipelineTrace> getTracesForUser(String userId) {
        return traceRepository.findByUserIdOrderByCreatedAtDesc(userId);
    }

    /**
     * Summary analytics for a user: average latency and status breakdown per task type.
     */
    public Map<String, Object> getAnalytics(String userId) {
        List<PipelineTrace> traces = traceRepository.findByUserIdOrderByCreatedAtDesc(userId);

        Map<TaskType, Map<TaskStatus, Long>> breakdown = new EnumMap<>(TaskType.class);
        long totalLatency = 0;
        for (PipelineTrace trace : traces) {
            breakdown.computeIfAbsent(trace.getType(), t -> new EnumMap<>(TaskStatus.class))
                    .merge(trace.getStatus(), 1L, Long::sum);
            totalLatency += trace.getLatencyMs();
        }

        Map<String, Object> analytics = new LinkedHashMap<>();
        analytics.put("userId", userId);
        analytics.put("totalTasks", traces.size());
        analytics.put("avgLatencyMs", traces.isEmpty() ? 0 : Math.round((double) totalLatency / traces.size()));
        analytics.put("statusBreakdown", breakdown);
        return analytics;
    }

    private String truncate(String s, int max) {
        if (s == null) return null;
        return s.length() <= max ? s : s.substring(0, max) + "...[truncated]";
    }
}
