package com.deepansh.recall.buffer;

import com.deepansh.recall.model.Turn;

import java.util.List;

/**
 * Result of the atomic split: the aged turns handed to compaction and the
 * recent tail that stayed resident.
 */
public record CompactionSlice(List<Turn> slice, List<Turn> retained) {

    public boolean isEmpty() {
        return slice.isEmpty();
    }

    public long turnStart() {
        return slice.get(0).getSequenceNumber();
    }

    public long turnEnd() {
        return slice.get(slice.size() - 1).getSequenceNumber();
    }
}
