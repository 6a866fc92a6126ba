package io.backfill.runtime;

import com.codahale.metrics.MetricRegistry;
import com.codahale.metrics.Timer;
import io.backfill.channel.BoundedChannel;
import io.backfill.channel.SourceInlet;
import io.backfill.config.BackfillConfig;
import io.backfill.core.Batch;
import io.backfill.core.Chunk;
import io.backfill.core.Record;
import io.backfill.core.Sink;
import io.backfill.core.Source;
import io.backfill.error.PipelineFailedException;
import io.backfill.log.ProgressLog;
import io.backfill.metrics.Metrics;
import io.backfill.stage.Batcher;
import io.backfill.stage.Formatter;
import io.backfill.stage.LineSplitter;
import io.backfill.stage.SinkStage;
import io.backfill.stage.Stage;
import io.backfill.stage.StageState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Source -> splitter -> batcher -> formatter -> sink, each stage on its own thread, connected by
 * {@link BoundedChannel}s so a slow consumer pushes back all the way to the source reads.
 * <p>
 * {@link #run()} returns only when every stage is {@link StageState#CLOSED} and the record count is the same
 * at every boundary; otherwise it throws {@link PipelineFailedException} carrying the first stage failure.
 * The source, sink and progress log are owned by the pipeline and closed exactly once when the run ends; the
 * closing {@code Took ~N seconds} line is written only after source and sink closed cleanly.
 */
public class BackfillPipeline implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(BackfillPipeline.class);
    static final String METRICS_PREFIX = "backfill";

    private final Source<Chunk> source;
    private final Sink<String> sink;
    private final ProgressLog progressLog;
    private final BackfillConfig config;
    private final Metrics metrics;

    private final SourceInlet<Chunk> sourceInlet;
    private final BoundedChannel<List<Record>> groups;
    private final BoundedChannel<Batch> batches;
    private final BoundedChannel<String> lines;
    private final LineSplitter splitter;
    private final Batcher batcher;
    private final Formatter formatter;
    private final SinkStage sinkStage;

    private final AtomicBoolean started = new AtomicBoolean(false);
    private final AtomicBoolean dataClosed = new AtomicBoolean(false);
    private final AtomicBoolean logClosed = new AtomicBoolean(false);
    private final AtomicReference<StageFailure> firstFailure = new AtomicReference<>();

    BackfillPipeline(Source<Chunk> source,
                     Sink<String> sink,
                     ProgressLog progressLog,
                     BackfillConfig config,
                     MetricRegistry registry) {
        this.source = Objects.requireNonNull(source);
        this.sink = Objects.requireNonNull(sink);
        this.progressLog = Objects.requireNonNull(progressLog);
        this.config = Objects.requireNonNull(config);
        this.metrics = new Metrics(Objects.requireNonNull(registry), METRICS_PREFIX);

        this.groups = new BoundedChannel<>("groups", config.bufferDepth());
        this.batches = new BoundedChannel<>("batches", config.bufferDepth());
        this.lines = new BoundedChannel<>("lines", config.lineBufferDepth());
        for (BoundedChannel<?> ch : channels()) {
            registry.remove(MetricRegistry.name(METRICS_PREFIX, "channel", ch.name(), "depth"));
            ch.registerMetrics(registry, METRICS_PREFIX);
        }

        this.sourceInlet = new SourceInlet<>(source);
        this.splitter = new LineSplitter(sourceInlet, groups, metrics);
        this.batcher = new Batcher(config.batchSize(), groups, batches, metrics);
        this.formatter = new Formatter(progressLog, batches, lines, metrics);
        this.sinkStage = new SinkStage(sink, lines, metrics);
    }

    public static BackfillPipelineBuilder builder() {
        return new BackfillPipelineBuilder();
    }

    /**
     * Runs the pipeline to completion on a private pool, one thread per stage. May be called once.
     */
    public PipelineSummary run() throws PipelineFailedException {
        if (!started.compareAndSet(false, true)) throw new IllegalStateException("pipeline already ran");
        log.info("backfill starting: batchSize={} bufferDepth={} lineBufferDepth={}",
                config.batchSize(), config.bufferDepth(), config.lineBufferDepth());
        long t0 = System.nanoTime();
        PipelineSummary summary;
        try (Timer.Context ignored = metrics.timer("run.time").time()) {
            runStages();
            summary = verify(Duration.ofNanos(System.nanoTime() - t0));
        } catch (PipelineFailedException e) {
            throw fail(e);
        }

        List<IOException> closeErrors = new ArrayList<>();
        closeData(closeErrors);
        if (!closeErrors.isEmpty()) throw fail(controllerFailure(closeErrors));
        try {
            progressLog.log("Took ~" + summary.elapsedSecondsRoundedUp() + " seconds");
        } catch (IOException e) {
            throw fail(new PipelineFailedException("controller", e));
        }
        closeLog(closeErrors);
        if (!closeErrors.isEmpty()) throw fail(controllerFailure(closeErrors));
        log.info("backfill finished: records={} batches={} lines={} elapsed={}ms",
                summary.records(), summary.batches(), summary.lines(), summary.elapsed().toMillis());
        return summary;
    }

    private PipelineFailedException fail(PipelineFailedException e) {
        log.error("backfill failed in stage '{}'", e.stage(), e.getCause());
        closeResources().forEach(e::addSuppressed);
        return e;
    }

    private static PipelineFailedException controllerFailure(List<IOException> errors) {
        PipelineFailedException failure = new PipelineFailedException("controller", errors.get(0));
        errors.stream().skip(1).forEach(failure::addSuppressed);
        return failure;
    }

    private void runStages() throws PipelineFailedException {
        AtomicInteger threadIdx = new AtomicInteger();
        ExecutorService pool = Executors.newFixedThreadPool(stages().size(),
                r -> new Thread(r, "backfill-stage-" + threadIdx.getAndIncrement()));
        try {
            Map<Stage<?, ?>, Future<Long>> futures = new LinkedHashMap<>();
            for (Stage<?, ?> stage : stages()) {
                futures.put(stage, pool.submit(() -> runStage(stage)));
            }
            for (Map.Entry<Stage<?, ?>, Future<Long>> f : futures.entrySet()) {
                try {
                    f.getValue().get();
                } catch (ExecutionException e) {
                    recordFailure(f.getKey().name(), e.getCause());
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    recordFailure("controller", e);
                    pool.shutdownNow();
                    break;
                }
            }
        } finally {
            pool.shutdown();
        }
        StageFailure failure = firstFailure.get();
        if (failure != null) throw new PipelineFailedException(failure.stage(), failure.cause());
    }

    private Long runStage(Stage<?, ?> stage) throws Exception {
        Thread.currentThread().setName("backfill-" + stage.name());
        try {
            return stage.call();
        } catch (Exception | Error e) {
            recordFailure(stage.name(), e);
            throw e;
        }
    }

    private void recordFailure(String stage, Throwable cause) {
        if (firstFailure.compareAndSet(null, new StageFailure(stage, cause))) {
            metrics.counter("failures").inc();
            // wake every stage parked on a channel; none of them may read or emit any further
            sourceInlet.abort(cause);
            for (BoundedChannel<?> ch : channels()) ch.abort(cause);
        }
    }

    private PipelineSummary verify(Duration elapsed) throws PipelineFailedException {
        for (Stage<?, ?> stage : stages()) {
            if (stage.state() != StageState.CLOSED) {
                throw new PipelineFailedException(stage.name(),
                        new IllegalStateException("stage ended in state " + stage.state()));
            }
        }
        long split = splitter.recordCount();
        long batched = batcher.recordCount();
        long formatted = formatter.lineCount();
        long written = sinkStage.writtenCount();
        if (split != batched || batched != formatted || formatted != written) {
            throw new PipelineFailedException("controller", new IllegalStateException(
                    "record count mismatch: split=" + split + " batched=" + batched
                            + " formatted=" + formatted + " written=" + written));
        }
        return new PipelineSummary(split, batcher.batchCount(), written, elapsed);
    }

    /**
     * Closes whatever of source, sink and progress log is still open.
     *
     * @return the close errors, empty when all closed cleanly
     */
    private List<IOException> closeResources() {
        List<IOException> errors = new ArrayList<>();
        closeData(errors);
        closeLog(errors);
        return errors;
    }

    private void closeData(List<IOException> errors) {
        if (!dataClosed.compareAndSet(false, true)) return;
        closeTo(source, errors);
        closeTo(sink, errors);
    }

    private void closeLog(List<IOException> errors) {
        if (logClosed.compareAndSet(false, true)) closeTo(progressLog, errors);
    }

    private static void closeTo(Closeable c, List<IOException> errors) {
        try {
            c.close();
        } catch (IOException e) {
            errors.add(e);
        }
    }

    public List<Stage<?, ?>> stages() { return List.of(splitter, batcher, formatter, sinkStage); }
    public BackfillConfig config() { return config; }

    private List<BoundedChannel<?>> channels() { return List.of(groups, batches, lines); }

    /** Releases the source, sink and progress log if {@link #run()} never did. */
    @Override
    public void close() throws IOException {
        List<IOException> errors = closeResources();
        if (errors.isEmpty()) return;
        IOException first = errors.get(0);
        errors.stream().skip(1).forEach(first::addSuppressed);
        throw first;
    }

    private record StageFailure(String stage, Throwable cause) {}
}
