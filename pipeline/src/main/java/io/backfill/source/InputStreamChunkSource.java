package io.backfill.source;

import io.backfill.core.Chunk;
import io.backfill.core.Source;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

/**
 * Streams an input as fixed-size chunks to avoid loading it whole. The last chunk may be shorter.
 */
public class InputStreamChunkSource implements Source<Chunk> {
    private final InputStream in;
    private final int chunkSize;
    private long seq = 0;
    private boolean exhausted = false;

    public InputStreamChunkSource(InputStream in, int chunkSize) {
        this.in = in;
        this.chunkSize = Math.max(1, chunkSize);
    }

    public static InputStreamChunkSource open(Path file, int chunkSize) throws IOException {
        return new InputStreamChunkSource(Files.newInputStream(file), chunkSize);
    }

    @Override
    public Optional<Chunk> next() throws IOException {
        if (exhausted) return Optional.empty();
        byte[] buf = in.readNBytes(chunkSize);
        if (buf.length == 0) {
            exhausted = true;
            return Optional.empty();
        }
        return Optional.of(new Chunk(seq++, buf));
    }

    public long chunkCount() { return seq; }

    @Override
    public void close() throws IOException {
        in.close();
    }
}
