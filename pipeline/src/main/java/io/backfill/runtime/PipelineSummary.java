package io.backfill.runtime;

import java.time.Duration;

/**
 * Outcome of a successful run.
 */
public record PipelineSummary(long records, long batches, long lines, Duration elapsed) {
    /** Whole seconds, rounded up, as reported in the progress log. */
    public long elapsedSecondsRoundedUp() {
        long millis = elapsed.toMillis();
        return (millis + 999) / 1000;
    }
}
