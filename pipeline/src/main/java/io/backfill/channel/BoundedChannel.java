package io.backfill.channel;

import com.codahale.metrics.Gauge;
import com.codahale.metrics.MetricRegistry;
import io.backfill.error.PipelineAbortedException;

import java.util.ArrayDeque;
import java.util.Optional;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Single-producer, single-consumer FIFO with a fixed capacity, connecting two stages.
 * <p>
 * Readiness is level-triggered: every waiter re-checks the buffer state under the lock before it parks,
 * so a slot freed between a declined offer and the matching {@link #awaitReadiness()} is never missed,
 * and a wakeup with nothing to do just parks again.
 */
public class BoundedChannel<T> implements Inlet<T>, Outlet<T> {
    private final String name;
    private final int capacity;
    private final ArrayDeque<T> buffer;
    private final ReentrantLock lock = new ReentrantLock();
    private final Condition notEmpty = lock.newCondition();
    private final Condition notFull = lock.newCondition(); // also signalled when the last unit is taken
    private boolean completed;
    private Throwable abortCause;
    private long accepted;
    private long received;

    public BoundedChannel(String name, int capacity) {
        if (capacity < 1) throw new IllegalArgumentException("capacity must be >= 1: " + capacity);
        this.name = name;
        this.capacity = capacity;
        this.buffer = new ArrayDeque<>(capacity);
    }

    @Override
    public boolean offer(T unit) {
        lock.lock();
        try {
            checkNotAborted();
            if (completed) throw new IllegalStateException("channel '" + name + "' already completed");
            if (buffer.size() >= capacity) return false;
            buffer.addLast(unit);
            accepted++;
            notEmpty.signal();
            return true;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void awaitReadiness() throws InterruptedException {
        lock.lockInterruptibly();
        try {
            while (buffer.size() >= capacity && abortCause == null) notFull.await();
            checkNotAborted();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public Optional<T> receive() throws InterruptedException {
        lock.lockInterruptibly();
        try {
            while (buffer.isEmpty() && !completed && abortCause == null) notEmpty.await();
            checkNotAborted();
            T unit = buffer.pollFirst();
            if (unit == null) return Optional.empty();
            received++;
            notFull.signalAll();
            return Optional.of(unit);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void complete() {
        lock.lock();
        try {
            completed = true;
            notEmpty.signalAll();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void awaitDrained() throws InterruptedException {
        lock.lockInterruptibly();
        try {
            while (received < accepted && abortCause == null) notFull.await();
            checkNotAborted();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Fail the channel: every current and future operation on either end throws
     * {@link PipelineAbortedException}. Only the first cause is kept.
     */
    public void abort(Throwable cause) {
        lock.lock();
        try {
            if (abortCause == null) abortCause = cause;
            notEmpty.signalAll();
            notFull.signalAll();
        } finally {
            lock.unlock();
        }
    }

    public boolean isDrained() {
        lock.lock();
        try { return received == accepted; } finally { lock.unlock(); }
    }

    public int size() {
        lock.lock();
        try { return buffer.size(); } finally { lock.unlock(); }
    }

    public long acceptedCount() {
        lock.lock();
        try { return accepted; } finally { lock.unlock(); }
    }

    public String name() { return name; }
    public int capacity() { return capacity; }

    public void registerMetrics(MetricRegistry registry, String prefix) {
        registry.register(MetricRegistry.name(prefix, "channel", name, "depth"), (Gauge<Integer>) this::size);
    }

    private void checkNotAborted() {
        if (abortCause != null) throw new PipelineAbortedException(name, abortCause);
    }

    @Override
    public String toString() {
        return "BoundedChannel{" + name + ", capacity=" + capacity + '}';
    }
}
