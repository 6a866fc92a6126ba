package io.backfill.error;

/**
 * Terminal failure of a pipeline run. The cause is the first error raised by any stage.
 */
public class PipelineFailedException extends Exception {
    private final String stage;

    public PipelineFailedException(String stage, Throwable cause) {
        super("stage '" + stage + "' failed: " + cause, cause);
        this.stage = stage;
    }

    public String stage() { return stage; }
}
