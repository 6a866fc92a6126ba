package io.backfill.cli;

import com.codahale.metrics.MetricRegistry;
import com.google.inject.Guice;
import com.google.inject.Injector;
import com.google.inject.ProvisionException;
import io.backfill.config.BackfillConfig;
import io.backfill.runtime.BackfillPipeline;
import io.backfill.runtime.PipelineSummary;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

public class BackfillModuleTest {
    @TempDir
    Path dir;

    @Test
    void provides_a_wired_pipeline_sharing_the_registry() throws Exception {
        Path in = dir.resolve("in.txt");
        Files.writeString(in, "a\nb\nc\n");
        var paths = new BackfillPaths(in, dir.resolve("out.txt"), dir.resolve("run.log"));
        Injector injector = Guice.createInjector(new BackfillModule(BackfillConfig.defaults().withBatchSize(2), paths));

        BackfillPipeline pipeline = injector.getInstance(BackfillPipeline.class);
        assertSame(pipeline, injector.getInstance(BackfillPipeline.class));
        assertEquals(2, pipeline.config().batchSize());

        PipelineSummary summary = pipeline.run();
        assertEquals(2, summary.batches());
        assertEquals("a\nb\nc\n", Files.readString(paths.output()));
        MetricRegistry registry = injector.getInstance(MetricRegistry.class);
        assertEquals(3, registry.meter("backfill.formatter.emitted").getCount());
    }

    @Test
    void unreadable_input_fails_provisioning() {
        var paths = new BackfillPaths(dir.resolve("missing.txt"), dir.resolve("out.txt"), dir.resolve("run.log"));
        Injector injector = Guice.createInjector(new BackfillModule(BackfillConfig.defaults(), paths));
        assertThrows(ProvisionException.class, () -> injector.getInstance(BackfillPipeline.class));
        assertFalse(Files.exists(paths.output()));
    }
}
