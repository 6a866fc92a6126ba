package io.backfill.cli;

import io.backfill.config.BackfillConfig;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class BackfillCommandTest {
    @TempDir
    Path dir;

    private Path in;
    private Path out;
    private Path log;
    private StringWriter err;

    @BeforeEach
    void setUp() {
        in = dir.resolve("accounts.txt");
        out = dir.resolve("out").resolve("backfill.sql");
        log = dir.resolve("backfill.log");
        err = new StringWriter();
    }

    private int execute(String... args) {
        CommandLine cmd = new CommandLine(new BackfillCommand());
        cmd.setErr(new PrintWriter(err, true));
        cmd.setOut(new PrintWriter(new StringWriter(), true));
        return cmd.execute(args);
    }

    @Test
    void missing_arguments_print_usage_and_exit_1() {
        assertEquals(1, execute(in.toString(), out.toString()));
        assertTrue(err.toString().contains("Missing required parameter"), err.toString());
        assertTrue(err.toString().contains("Usage: backfill"), err.toString());
        assertFalse(Files.exists(out), "nothing processed");
        assertFalse(Files.exists(log));
    }

    @Test
    void copies_records_and_logs_progress() throws Exception {
        Files.writeString(in, "1\n2\n3\n4\n5\n");
        assertEquals(0, execute("--batch-size", "2", in.toString(), out.toString(), log.toString()));
        assertEquals("1\n2\n3\n4\n5\n", Files.readString(out));
        List<String> lines = Files.readAllLines(log);
        assertEquals(4, lines.size());
        assertEquals("Back-filling 2 account numbers", lines.get(0));
        assertEquals("Back-filling 2 account numbers", lines.get(1));
        assertEquals("Back-filling 1 account numbers", lines.get(2));
        assertTrue(lines.get(3).matches("Took ~\\d+ seconds"), lines.get(3));
    }

    @Test
    void tiny_chunks_and_buffers_still_copy_everything() throws Exception {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < 300; i++) sb.append(i).append('\n');
        Files.writeString(in, sb.toString());
        assertEquals(0, execute("-b", "7", "--chunk-size", "1", "--buffer-depth", "1", "--line-buffer-depth", "1",
                in.toString(), out.toString(), log.toString()));
        assertEquals(sb.toString(), Files.readString(out));
        assertEquals(43 + 1, Files.readAllLines(log).size());
    }

    @Test
    void unterminated_input_exits_2() throws Exception {
        Files.writeString(in, "1\n2\n3");
        assertEquals(BackfillCommand.EXIT_PIPELINE_FAILURE, execute(in.toString(), out.toString(), log.toString()));
        assertTrue(err.toString().contains("Left over data"), err.toString());
        assertTrue(Files.readAllLines(log).stream().noneMatch(l -> l.startsWith("Took")));
    }

    @Test
    void missing_input_file_exits_2_without_creating_outputs() {
        assertEquals(BackfillCommand.EXIT_PIPELINE_FAILURE, execute(in.toString(), out.toString(), log.toString()));
        assertFalse(Files.exists(out));
        assertFalse(Files.exists(log));
    }

    @Test
    void non_positive_batch_size_is_a_usage_error() throws Exception {
        Files.writeString(in, "1\n");
        assertEquals(1, execute("--batch-size", "0", in.toString(), out.toString(), log.toString()));
        assertTrue(err.toString().contains("--batch-size must be a positive integer"), err.toString());
    }

    @Test
    void options_override_environment_defaults() {
        var command = new BackfillCommand();
        new CommandLine(command).parseArgs("-b", "3", "--line-buffer-depth", "4", "a", "b", "c");
        BackfillConfig config = command.resolveConfig(new BackfillConfig(25, 100, 2, 8));
        assertEquals(new BackfillConfig(3, 100, 2, 4), config);
    }
}
