package com.deepansh.recall.observability;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.CreatedDate;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.index.CompoundIndexes;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;

/**
 * Persisted record of one background memory task (compaction or extraction).
 *
 * Collection: pipeline_traces
 *
 * DROPPED rows are the ones operators care about: those compactions lost turns.
 * E.g: db.pipeline_traces.find({status: "DROPPED"}).sort({createdAt: -1})
 */
@Document(collection = "pipeline_traces")
@CompoundIndexes({
    @CompoundIndex(name = "idx_trace_user_date", def = "{'userId': 1, 'createdAt': -1}"),
    @CompoundIndex(name = "idx_trace_status", def = "{'status': 1}")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PipelineTrace {

    @Id
    private String id;

    private String userId;

    private TaskType type;

    private TaskStatus status;

    private int attempts;

    private long latencyMs;

    private String detail;

    @CreatedDate
    private Instant createdAt;
}
