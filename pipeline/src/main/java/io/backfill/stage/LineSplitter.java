package io.backfill.stage;

import io.backfill.channel.Inlet;
import io.backfill.channel.Outlet;
import io.backfill.core.Chunk;
import io.backfill.core.Record;
import io.backfill.error.MalformedInputException;
import io.backfill.metrics.Metrics;

import java.nio.ByteBuffer;
import java.nio.CharBuffer;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * Reframes a stream of byte chunks into newline-separated records, carrying the unfinished record (and any
 * incomplete UTF-8 sequence) across chunk boundaries. Emits one group per chunk that completes at least one
 * record, so the result is the same whatever the chunk sizes are.
 */
public class LineSplitter extends Stage<Chunk, List<Record>> {
    public static final char SEPARATOR = '\n';

    private final CharsetDecoder decoder = StandardCharsets.UTF_8.newDecoder()
            .onMalformedInput(CodingErrorAction.REPLACE)
            .onUnmappableCharacter(CodingErrorAction.REPLACE);
    private byte[] pendingBytes = new byte[0];
    private final StringBuilder carry = new StringBuilder();
    private long nextOrdinal = 0;

    public LineSplitter(Inlet<Chunk> inlet, Outlet<List<Record>> outlet, Metrics metrics) {
        super("splitter", inlet, outlet, metrics);
    }

    @Override
    protected void onElement(Chunk chunk) throws InterruptedException {
        carry.append(decode(chunk.bytes(), false));
        List<Record> records = cutRecords();
        if (!records.isEmpty()) emit(records);
    }

    @Override
    protected void onEndOfInput() throws MalformedInputException {
        carry.append(decode(new byte[0], true));
        if (carry.length() > 0) {
            throw new MalformedInputException(nextOrdinal, carry.length());
        }
    }

    public long recordCount() { return nextOrdinal; }

    /** Chars of the unfinished record currently held. */
    public int carryLength() { return carry.length(); }

    private List<Record> cutRecords() {
        List<Record> out = new ArrayList<>();
        int start = 0;
        int sep;
        while ((sep = carry.indexOf("\n", start)) >= 0) {
            out.add(new Record(nextOrdinal++, carry.substring(start, sep)));
            start = sep + 1;
        }
        carry.delete(0, start);
        return out;
    }

    private String decode(byte[] bytes, boolean endOfInput) {
        // combine the bytes left over from the previous chunk with the new ones
        byte[] combined = new byte[pendingBytes.length + bytes.length];
        System.arraycopy(pendingBytes, 0, combined, 0, pendingBytes.length);
        System.arraycopy(bytes, 0, combined, pendingBytes.length, bytes.length);

        ByteBuffer in = ByteBuffer.wrap(combined);
        // UTF-8 never yields more chars than bytes; +1 leaves room for a replacement char on flush
        CharBuffer out = CharBuffer.allocate(combined.length + 1);
        decoder.decode(in, out, endOfInput);
        if (endOfInput) {
            decoder.flush(out);
            decoder.reset();
        }
        pendingBytes = new byte[in.remaining()];
        in.get(pendingBytes);
        out.flip();
        return out.toString();
    }
}
