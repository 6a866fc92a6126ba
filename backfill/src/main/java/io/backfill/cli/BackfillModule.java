package io.backfill.cli;

import com.codahale.metrics.MetricRegistry;
import com.google.inject.AbstractModule;
import com.google.inject.Provides;
import com.google.inject.Singleton;
import io.backfill.config.BackfillConfig;
import io.backfill.core.Chunk;
import io.backfill.core.Sink;
import io.backfill.core.Source;
import io.backfill.log.FileProgressLog;
import io.backfill.log.ProgressLog;
import io.backfill.runtime.BackfillPipeline;
import io.backfill.sink.OutputStreamLineSink;
import io.backfill.source.InputStreamChunkSource;

import java.io.Closeable;
import java.io.IOException;

public class BackfillModule extends AbstractModule {
    private final BackfillConfig config;
    private final BackfillPaths paths;

    public BackfillModule(BackfillConfig config, BackfillPaths paths) {
        this.config = config;
        this.paths = paths;
    }

    @Override
    protected void configure() {
        bind(BackfillConfig.class).toInstance(config);
        bind(BackfillPaths.class).toInstance(paths);
    }

    @Provides @Singleton MetricRegistry metricRegistry() { return new MetricRegistry(); }

    /**
     * Opens input, output and log in that order; whatever was already opened is closed again if a later
     * one cannot be.
     */
    @Provides @Singleton
    BackfillPipeline pipeline(MetricRegistry registry) throws IOException {
        Source<Chunk> source = InputStreamChunkSource.open(paths.input(), config.chunkSize());
        Sink<String> sink = null;
        try {
            sink = OutputStreamLineSink.open(paths.output());
            ProgressLog progress = new FileProgressLog(paths.log());
            return BackfillPipeline.builder()
                    .source(source)
                    .sink(sink)
                    .progressLog(progress)
                    .config(config)
                    .metrics(registry)
                    .build();
        } catch (IOException | RuntimeException e) {
            closeAfterFailure(sink, e);
            closeAfterFailure(source, e);
            throw e;
        }
    }

    private static void closeAfterFailure(Closeable c, Exception failure) {
        if (c == null) return;
        try {
            c.close();
        } catch (IOException e) {
            failure.addSuppressed(e);
        }
    }
}
