package com.deepansh.recall.observability;

import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface PipelineTraceRepository extends MongoRepository<PipelineTrace, String> {

    List<PipelineTrace> findByUserIdOrderByCreatedAtDesc(String userId);
}
