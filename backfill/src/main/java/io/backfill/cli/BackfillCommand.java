package io.backfill.cli;

import com.codahale.metrics.Counter;
import com.codahale.metrics.Meter;
import com.codahale.metrics.MetricRegistry;
import com.codahale.metrics.Timer;
import com.google.inject.Guice;
import com.google.inject.Injector;
import com.google.inject.ProvisionException;
import io.backfill.config.BackfillConfig;
import io.backfill.error.PipelineFailedException;
import io.backfill.runtime.BackfillPipeline;
import io.backfill.runtime.PipelineSummary;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Map;
import java.util.concurrent.Callable;

/**
 * CLI that re-emits the records of an input file, batch by batch, into an output file and logs progress.
 */
@CommandLine.Command(name = "backfill", mixinStandardHelpOptions = true, version = "backfill 0.1.0",
        exitCodeOnInvalidInput = 1,
        description = "Copy newline-separated records from <in> to <out> in batches, logging progress to <log>")
public final class BackfillCommand implements Callable<Integer> {
    private static final Logger log = LoggerFactory.getLogger(BackfillCommand.class);

    static final int EXIT_OK = 0;
    static final int EXIT_PIPELINE_FAILURE = 2;

    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    @CommandLine.Parameters(index = "0", paramLabel = "<in>", description = "Input file, one record per line")
    Path input;

    @CommandLine.Parameters(index = "1", paramLabel = "<out>", description = "Output file")
    Path output;

    @CommandLine.Parameters(index = "2", paramLabel = "<log>", description = "Progress log file")
    Path logFile;

    @CommandLine.Option(names = {"-b", "--batch-size"}, description = "Records per batch (default: $BATCH_SIZE or 10)")
    Integer batchSize;

    @CommandLine.Option(names = "--chunk-size", description = "Bytes read per chunk (default: 65536)")
    Integer chunkSize;

    @CommandLine.Option(names = "--buffer-depth", description = "Record groups / batches buffered between stages (default: 1)")
    Integer bufferDepth;

    @CommandLine.Option(names = "--line-buffer-depth", description = "Lines buffered ahead of the output file (default: 16)")
    Integer lineBufferDepth;

    public static void main(String[] args) {
        int code = new CommandLine(new BackfillCommand()).execute(args);
        System.exit(code);
    }

    @Override
    public Integer call() {
        BackfillConfig config = resolveConfig(BackfillConfig.fromEnv());
        Injector injector = Guice.createInjector(new BackfillModule(config, new BackfillPaths(input, output, logFile)));
        MetricRegistry registry = injector.getInstance(MetricRegistry.class);
        try (BackfillPipeline pipeline = injector.getInstance(BackfillPipeline.class)) {
            PipelineSummary summary = pipeline.run();
            log.info("wrote {} records in {} batches to {}", summary.lines(), summary.batches(), output);
            return EXIT_OK;
        } catch (ProvisionException e) {
            Throwable cause = e.getCause() == null ? e : e.getCause();
            log.debug("provisioning failed", e);
            spec.commandLine().getErr().println("backfill failed: cannot open files: " + cause);
            return EXIT_PIPELINE_FAILURE;
        } catch (PipelineFailedException e) {
            spec.commandLine().getErr().println("backfill failed: " + e.getCause());
            return EXIT_PIPELINE_FAILURE;
        } catch (IOException e) {
            log.error("cannot release files", e);
            return EXIT_PIPELINE_FAILURE;
        } finally {
            printMetrics(registry);
        }
    }

    BackfillConfig resolveConfig(BackfillConfig base) {
        BackfillConfig config = base;
        if (batchSize != null) config = config.withBatchSize(requirePositive("--batch-size", batchSize));
        if (chunkSize != null) config = config.withChunkSize(requirePositive("--chunk-size", chunkSize));
        if (bufferDepth != null) config = config.withBufferDepth(requirePositive("--buffer-depth", bufferDepth));
        if (lineBufferDepth != null) config = config.withLineBufferDepth(requirePositive("--line-buffer-depth", lineBufferDepth));
        return config;
    }

    private int requirePositive(String option, int value) {
        if (value < 1) {
            throw new CommandLine.ParameterException(spec.commandLine(), option + " must be a positive integer: " + value);
        }
        return value;
    }

    private static void printMetrics(MetricRegistry r) {
        if (!log.isDebugEnabled()) return;
        StringBuilder sb = new StringBuilder("metrics:");
        for (Map.Entry<String, Meter> e : r.getMeters().entrySet()) {
            sb.append(' ').append(e.getKey()).append('=').append(e.getValue().getCount());
        }
        for (Map.Entry<String, Counter> e : r.getCounters().entrySet()) {
            sb.append(' ').append(e.getKey()).append('=').append(e.getValue().getCount());
        }
        for (Map.Entry<String, Timer> e : r.getTimers().entrySet()) {
            sb.append(' ').append(e.getKey()).append("(ms)=")
              .append(String.format("%.3f", e.getValue().getSnapshot().getMax() / 1_000_000.0));
        }
        log.debug(sb.toString());
    }
}
