package io.backfill.runtime;

import com.codahale.metrics.MetricRegistry;
import io.backfill.config.BackfillConfig;
import io.backfill.core.Chunk;
import io.backfill.core.Sink;
import io.backfill.core.Source;
import io.backfill.log.ProgressLog;

import java.util.Objects;

public class BackfillPipelineBuilder {
    private Source<Chunk> source;
    private Sink<String> sink;
    private ProgressLog progressLog;
    private BackfillConfig config = BackfillConfig.defaults();
    private MetricRegistry metricRegistry = new MetricRegistry();

    public BackfillPipelineBuilder source(Source<Chunk> s) { this.source = s; return this; }
    public BackfillPipelineBuilder sink(Sink<String> s) { this.sink = s; return this; }
    public BackfillPipelineBuilder progressLog(ProgressLog l) { this.progressLog = l; return this; }
    public BackfillPipelineBuilder config(BackfillConfig c) { this.config = c; return this; }
    public BackfillPipelineBuilder batchSize(int n) { this.config = config.withBatchSize(n); return this; }
    public BackfillPipelineBuilder bufferDepth(int n) { this.config = config.withBufferDepth(n); return this; }
    public BackfillPipelineBuilder lineBufferDepth(int n) { this.config = config.withLineBufferDepth(n); return this; }
    public BackfillPipelineBuilder metrics(MetricRegistry r) { this.metricRegistry = r; return this; }

    public BackfillPipeline build() {
        Objects.requireNonNull(source, "source");
        Objects.requireNonNull(sink, "sink");
        Objects.requireNonNull(progressLog, "progressLog");
        Objects.requireNonNull(config, "config");
        Objects.requireNonNull(metricRegistry, "metricRegistry");
        return new BackfillPipeline(source, sink, progressLog, config, metricRegistry);
    }
}
