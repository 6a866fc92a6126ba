package io.backfill.stage;

import io.backfill.channel.Inlet;
import io.backfill.channel.Outlet;
import io.backfill.core.Batch;
import io.backfill.core.Record;
import io.backfill.metrics.Metrics;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.List;

/**
 * Regroups record groups of arbitrary size into batches of exactly {@code batchSize} records; the last batch
 * of a run carries the remainder and an empty batch is never emitted.
 */
public class Batcher extends Stage<List<Record>, Batch> {
    private final int batchSize;
    private final ArrayDeque<Record> pending = new ArrayDeque<>();
    private long nextBatchIndex = 0;
    private long recordsBatched = 0;

    public Batcher(int batchSize, Inlet<List<Record>> inlet, Outlet<Batch> outlet, Metrics metrics) {
        super("batcher", inlet, outlet, metrics);
        if (batchSize < 1) throw new IllegalArgumentException("batchSize must be >= 1: " + batchSize);
        this.batchSize = batchSize;
    }

    @Override
    protected void onElement(List<Record> records) throws InterruptedException {
        pending.addAll(records);
        // emit() may park here; pending and nextBatchIndex stay as they are until it returns
        while (pending.size() >= batchSize) {
            emitBatch(batchSize);
        }
    }

    @Override
    protected void onEndOfInput() throws InterruptedException {
        if (!pending.isEmpty()) emitBatch(pending.size());
    }

    private void emitBatch(int size) throws InterruptedException {
        List<Record> slice = new ArrayList<>(size);
        for (int i = 0; i < size; i++) slice.add(pending.pollFirst());
        Batch batch = new Batch(nextBatchIndex, slice);
        emit(batch);
        nextBatchIndex++;
        recordsBatched += size;
    }

    public int batchSize() { return batchSize; }
    public long batchCount() { return nextBatchIndex; }
    public long recordCount() { return recordsBatched; }

    /** Records received but not yet part of an emitted batch. */
    public int pendingCount() { return pending.size(); }
}
