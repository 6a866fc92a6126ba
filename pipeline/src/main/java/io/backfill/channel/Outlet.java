package io.backfill.channel;

/**
 * Sending end of a stage connection with an explicit, level-triggered backpressure protocol:
 * {@link #offer} declines when the downstream buffer is full, {@link #awaitReadiness} returns as soon as
 * a slot is free (immediately if one already is), and {@link #awaitDrained} tells the sender that
 * everything it ever offered has been taken.
 */
public interface Outlet<T> {
    /** Try to hand over one unit. {@code false} means declined: nothing was enqueued. */
    boolean offer(T unit);

    /** Block until at least one slot is free. */
    void awaitReadiness() throws InterruptedException;

    /** Signal end of stream. No offer is allowed afterwards. */
    void complete();

    /** Block until every accepted unit has been received downstream. */
    void awaitDrained() throws InterruptedException;

    /** Outlet for terminal stages, which emit nothing. */
    static <T> Outlet<T> none() {
        return new Outlet<>() {
            @Override public boolean offer(T unit) { throw new IllegalStateException("terminal stage cannot emit"); }
            @Override public void awaitReadiness() {}
            @Override public void complete() {}
            @Override public void awaitDrained() {}
        };
    }
}
