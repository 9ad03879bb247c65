package com.deepansh.recall.observability;

public enum TaskType {
    COMPACTION, EXTRACTION
}
