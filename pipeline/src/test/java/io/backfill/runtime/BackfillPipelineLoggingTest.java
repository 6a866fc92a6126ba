package io.backfill.runtime;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import io.backfill.error.PipelineFailedException;
import io.backfill.sink.OutputStreamLineSink;
import io.backfill.stage.Stage;
import io.backfill.stage.RecordingProgressLog;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayOutputStream;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class BackfillPipelineLoggingTest {
    private Logger logger;
    private ListAppender<ILoggingEvent> appender;

    @BeforeEach
    void attach() {
        logger = (Logger) LoggerFactory.getLogger(BackfillPipeline.class);
        appender = new ListAppender<>();
        appender.start();
        logger.addAppender(appender);
    }

    @AfterEach
    void detach() {
        logger.detachAppender(appender);
        appender.stop();
    }

    @Test
    void success_logs_start_and_finish() throws Exception {
        BackfillPipeline.builder()
                .source(BackfillPipelineTest.source("a\nb\n", 1))
                .sink(new OutputStreamLineSink(new ByteArrayOutputStream()))
                .progressLog(new RecordingProgressLog())
                .build()
                .run();

        List<String> messages = appender.list.stream().map(ILoggingEvent::getFormattedMessage).toList();
        assertTrue(messages.get(0).startsWith("backfill starting: batchSize=10"), messages.toString());
        assertTrue(messages.stream().anyMatch(m -> m.startsWith("backfill finished: records=2 batches=1 lines=2")),
                messages.toString());
    }

    @Test
    void failure_is_logged_once_at_error_with_the_stage() {
        var pipeline = BackfillPipeline.builder()
                .source(BackfillPipelineTest.source("a\nb", 1))
                .sink(new OutputStreamLineSink(new ByteArrayOutputStream()))
                .progressLog(new RecordingProgressLog())
                .build();
        assertThrows(PipelineFailedException.class, pipeline::run);

        List<ILoggingEvent> errors = appender.list.stream().filter(e -> e.getLevel() == Level.ERROR).toList();
        assertEquals(1, errors.size());
        assertEquals("backfill failed in stage 'splitter'", errors.get(0).getFormattedMessage());
        assertNotNull(errors.get(0).getThrowableProxy());
    }

    @Test
    void stage_transitions_are_logged_at_debug() throws Exception {
        Logger stageLogger = (Logger) LoggerFactory.getLogger(Stage.class);
        ListAppender<ILoggingEvent> stageEvents = new ListAppender<>();
        stageEvents.start();
        stageLogger.addAppender(stageEvents);
        try {
            BackfillPipeline.builder()
                    .source(BackfillPipelineTest.source("a\n", 4))
                    .sink(new OutputStreamLineSink(new ByteArrayOutputStream()))
                    .progressLog(new RecordingProgressLog())
                    .build()
                    .run();
        } finally {
            stageLogger.detachAppender(stageEvents);
            stageEvents.stop();
        }

        List<String> debug = stageEvents.list.stream()
                .filter(e -> e.getLevel() == Level.DEBUG)
                .map(ILoggingEvent::getFormattedMessage)
                .toList();
        assertTrue(debug.contains("stage splitter: IDLE -> ACCEPTING"), debug.toString());
        assertTrue(debug.contains("stage batcher: FLUSHING -> CLOSED"), debug.toString());
    }
}
