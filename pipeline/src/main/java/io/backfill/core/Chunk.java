package io.backfill.core;

/**
 * An opaque slice of source bytes. Chunks arrive in increasing seq order and may cut records,
 * or multi-byte characters, anywhere.
 */
public record Chunk(long seq, byte[] bytes) {
    public int length() { return bytes.length; }
}
