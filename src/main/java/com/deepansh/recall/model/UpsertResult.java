package com.deepansh.recall.model;

public enum UpsertResult {
    INSERTED,
    UPDATED,
    REJECTED
}
