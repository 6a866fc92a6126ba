package io.backfill.stage;

import java.util.EnumSet;
import java.util.Set;

/**
 * Lifecycle of a stage. Any non-terminal state may fail; {@link #CLOSED} and {@link #FAILED} are terminal.
 */
public enum StageState {
    IDLE,
    ACCEPTING,
    AWAITING_READINESS,
    FLUSHING,
    CLOSED,
    FAILED;

    public boolean isTerminal() { return this == CLOSED || this == FAILED; }

    public boolean canTransitionTo(StageState next) {
        return allowedNext().contains(next);
    }

    private Set<StageState> allowedNext() {
        return switch (this) {
            case IDLE -> EnumSet.of(ACCEPTING, FAILED);
            case ACCEPTING -> EnumSet.of(AWAITING_READINESS, FLUSHING, FAILED);
            // back to whichever phase suspended
            case AWAITING_READINESS -> EnumSet.of(ACCEPTING, FLUSHING, FAILED);
            case FLUSHING -> EnumSet.of(AWAITING_READINESS, CLOSED, FAILED);
            case CLOSED, FAILED -> EnumSet.noneOf(StageState.class);
        };
    }
}
