package io.backfill.core;

import java.util.List;

/**
 * An ordered, non-empty group of records. Only the final batch of a run may be shorter than the batch size.
 */
public record Batch(long index, List<Record> records) {
    public Batch {
        records = List.copyOf(records);
        if (records.isEmpty()) throw new IllegalArgumentException("batch " + index + " is empty");
    }

    public int size() { return records.size(); }
}
