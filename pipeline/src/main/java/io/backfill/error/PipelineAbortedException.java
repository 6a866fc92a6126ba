package io.backfill.error;

/**
 * Raised inside a stage blocked on a channel that was aborted because some other stage failed.
 */
public class PipelineAbortedException extends RuntimeException {
    public PipelineAbortedException(String channel, Throwable cause) {
        super("channel '" + channel + "' aborted", cause);
    }
}
