package io.backfill.stage;

import com.codahale.metrics.Counter;
import com.codahale.metrics.Meter;
import io.backfill.channel.Inlet;
import io.backfill.channel.Outlet;
import io.backfill.metrics.Metrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.Callable;

/**
 * Base class for one pipeline step: pulls units from an {@link Inlet}, hands zero or more units per input to
 * {@link #emit}, and on end of input flushes its own buffer before closing.
 * <p>
 * {@link #emit} is where backpressure happens: a declined offer parks the stage in
 * {@link StageState#AWAITING_READINESS} until the outlet has a free slot, then retries the same unit. Since
 * the wait happens inside the subclass's own loop, the loop resumes exactly where it stopped.
 * <p>
 * A stage is {@link StageState#CLOSED} only after its outlet reports drained, which is checked explicitly
 * and never inferred from the last offer having been accepted.
 */
public abstract class Stage<I, O> implements Callable<Long> {
    private static final Logger log = LoggerFactory.getLogger(Stage.class);

    private final String name;
    private final Inlet<I> inlet;
    private final Outlet<O> outlet;
    private final Meter emittedMeter;
    private final Counter declinedCounter;
    private volatile StageState state = StageState.IDLE;
    private StageState suspendedFrom;
    private long received;
    private long emitted;
    private long declined;

    protected Stage(String name, Inlet<I> inlet, Outlet<O> outlet, Metrics metrics) {
        this.name = Objects.requireNonNull(name, "name");
        this.inlet = Objects.requireNonNull(inlet, "inlet");
        this.outlet = Objects.requireNonNull(outlet, "outlet");
        Metrics scoped = metrics.scoped(name);
        this.emittedMeter = scoped.meter("emitted");
        this.declinedCounter = scoped.counter("declined");
    }

    /** Handle one input unit. */
    protected abstract void onElement(I element) throws Exception;

    /** Upstream is exhausted: emit whatever is still buffered. */
    protected abstract void onEndOfInput() throws Exception;

    /**
     * Runs the stage to completion on the calling thread.
     *
     * @return number of units emitted downstream
     */
    @Override
    public final Long call() throws Exception {
        transition(StageState.ACCEPTING);
        try {
            Optional<I> next;
            while ((next = inlet.receive()).isPresent()) {
                received++;
                onElement(next.get());
            }
            transition(StageState.FLUSHING);
            onEndOfInput();
            outlet.complete();
            outlet.awaitDrained();
            transition(StageState.CLOSED);
            log.debug("stage {} closed: received={} emitted={}", name, received, emitted);
            return emitted;
        } catch (Exception | Error e) {
            state = StageState.FAILED;
            throw e;
        }
    }

    /**
     * Hand one unit downstream, suspending for as long as the outlet declines it.
     */
    protected final void emit(O unit) throws InterruptedException {
        while (!outlet.offer(unit)) {
            declined++;
            declinedCounter.inc();
            suspendedFrom = state;
            transition(StageState.AWAITING_READINESS);
            outlet.awaitReadiness();
            transition(suspendedFrom);
        }
        emitted++;
        emittedMeter.mark();
    }

    private void transition(StageState next) {
        StageState current = state;
        if (!current.canTransitionTo(next)) {
            throw new IllegalStateException("stage " + name + ": illegal transition " + current + " -> " + next);
        }
        state = next;
        log.debug("stage {}: {} -> {}", name, current, next);
    }

    public String name() { return name; }
    public StageState state() { return state; }
    public long receivedCount() { return received; }
    public long emittedCount() { return emitted; }
    public long declinedCount() { return declined; }
}
