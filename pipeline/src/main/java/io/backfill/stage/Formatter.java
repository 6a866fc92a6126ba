package io.backfill.stage;

import io.backfill.channel.Inlet;
import io.backfill.channel.Outlet;
import io.backfill.core.Batch;
import io.backfill.core.Record;
import io.backfill.log.ProgressLog;
import io.backfill.metrics.Metrics;

import java.io.IOException;
import java.util.List;

/**
 * Turns each batch into one output line per record, in record order, and reports the batch to the
 * progress log once all of its lines were accepted downstream.
 */
public class Formatter extends Stage<Batch, String> {
    private final ProgressLog progress;
    private long batchesFormatted = 0;
    private long linesFormatted = 0;

    public Formatter(ProgressLog progress, Inlet<Batch> inlet, Outlet<String> outlet, Metrics metrics) {
        super("formatter", inlet, outlet, metrics);
        this.progress = progress;
    }

    @Override
    protected void onElement(Batch batch) throws InterruptedException, IOException {
        List<Record> records = batch.records();
        // a declined line parks inside emit(i); i only advances once line i was accepted
        for (int i = 0; i < records.size(); i++) {
            emit(format(records.get(i)));
            linesFormatted++;
        }
        batchesFormatted++;
        progress.log("Back-filling " + records.size() + " account numbers");
    }

    @Override
    protected void onEndOfInput() {
        // nothing buffered between batches
    }

    static String format(Record record) {
        return record.text() + LineSplitter.SEPARATOR;
    }

    public long batchCount() { return batchesFormatted; }
    public long lineCount() { return linesFormatted; }
}
