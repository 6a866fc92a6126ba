package io.backfill.config;

import java.util.Map;
import java.util.Properties;

/**
 * Tuning knobs of one pipeline run, passed explicitly to the pipeline.
 *
 * @param batchSize       records per batch
 * @param chunkSize       bytes read from the source per chunk
 * @param bufferDepth     capacity of the record-group and batch channels
 * @param lineBufferDepth capacity of the channel between formatter and sink
 */
public record BackfillConfig(
        int batchSize,
        int chunkSize,
        int bufferDepth,
        int lineBufferDepth
) {
    public static final int DEFAULT_BATCH_SIZE = 10;
    public static final int DEFAULT_CHUNK_SIZE = 64 * 1024;
    public static final int DEFAULT_BUFFER_DEPTH = 1;
    public static final int DEFAULT_LINE_BUFFER_DEPTH = 16;

    public BackfillConfig {
        requirePositive("batchSize", batchSize);
        requirePositive("chunkSize", chunkSize);
        requirePositive("bufferDepth", bufferDepth);
        requirePositive("lineBufferDepth", lineBufferDepth);
    }

    public static BackfillConfig defaults() {
        return new BackfillConfig(DEFAULT_BATCH_SIZE, DEFAULT_CHUNK_SIZE, DEFAULT_BUFFER_DEPTH, DEFAULT_LINE_BUFFER_DEPTH);
    }

    public BackfillConfig withBatchSize(int n) { return new BackfillConfig(n, chunkSize, bufferDepth, lineBufferDepth); }
    public BackfillConfig withChunkSize(int n) { return new BackfillConfig(batchSize, n, bufferDepth, lineBufferDepth); }
    public BackfillConfig withBufferDepth(int n) { return new BackfillConfig(batchSize, chunkSize, n, lineBufferDepth); }
    public BackfillConfig withLineBufferDepth(int n) { return new BackfillConfig(batchSize, chunkSize, bufferDepth, n); }

    /**
     * Reads system properties first, then environment variables ({@code BATCH_SIZE}, {@code BACKFILL_CHUNK_SIZE},
     * {@code BACKFILL_BUFFER_DEPTH}, {@code BACKFILL_LINE_BUFFER_DEPTH}). Missing, unparsable or non-positive
     * values fall back to the defaults.
     */
    public static BackfillConfig fromEnv() {
        return fromEnv(System.getenv(), System.getProperties());
    }

    public static BackfillConfig fromEnv(Map<String, String> env, Properties props) {
        int batch = positiveOr(props.getProperty("backfill.batchSize", env.get("BATCH_SIZE")), DEFAULT_BATCH_SIZE);
        int chunk = positiveOr(props.getProperty("backfill.chunkSize", env.get("BACKFILL_CHUNK_SIZE")), DEFAULT_CHUNK_SIZE);
        int depth = positiveOr(props.getProperty("backfill.bufferDepth", env.get("BACKFILL_BUFFER_DEPTH")), DEFAULT_BUFFER_DEPTH);
        int lines = positiveOr(props.getProperty("backfill.lineBufferDepth", env.get("BACKFILL_LINE_BUFFER_DEPTH")), DEFAULT_LINE_BUFFER_DEPTH);
        return new BackfillConfig(batch, chunk, depth, lines);
    }

    private static int positiveOr(String raw, int fallback) {
        if (raw == null || raw.isBlank()) return fallback;
        try {
            int v = Integer.parseInt(raw.trim());
            return v > 0 ? v : fallback;
        } catch (NumberFormatException e) {
            return fallback;
        }
    }

    private static void requirePositive(String name, int value) {
        if (value < 1) throw new IllegalArgumentException(name + " must be >= 1: " + value);
    }
}
