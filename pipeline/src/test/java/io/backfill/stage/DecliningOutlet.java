package io.backfill.stage;

import io.backfill.channel.Outlet;

import java.util.ArrayList;
import java.util.List;

/**
 * Outlet that declines every {@code period}-th offer, starting with the first. Readiness is always immediate.
 */
final class DecliningOutlet<T> implements Outlet<T> {
    final List<T> accepted = new ArrayList<>();
    private final int period;
    int offers;
    int readinessWaits;
    boolean completed;
    boolean drainAwaited;

    private DecliningOutlet(int period) { this.period = period; }

    static <T> DecliningOutlet<T> everyOther() { return new DecliningOutlet<>(2); }
    static <T> DecliningOutlet<T> never() { return new DecliningOutlet<>(0); }

    @Override
    public boolean offer(T unit) {
        if (completed) throw new IllegalStateException("offer after complete");
        offers++;
        if (period > 0 && offers % period == 1) return false;
        accepted.add(unit);
        return true;
    }

    @Override public void awaitReadiness() { readinessWaits++; }
    @Override public void complete() { completed = true; }
    @Override public void awaitDrained() { drainAwaited = true; }
}
