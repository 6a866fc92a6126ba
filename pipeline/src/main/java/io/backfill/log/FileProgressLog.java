package io.backfill.log;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;

/**
 * Writes each message as one newline-terminated line and flushes it, so the log reflects progress even when
 * the run later fails.
 */
public class FileProgressLog implements ProgressLog {
    private final Path file;
    private final BufferedWriter writer;

    public FileProgressLog(Path file) throws IOException {
        this.file = file;
        Path parent = file.toAbsolutePath().getParent();
        if (parent != null) Files.createDirectories(parent);
        this.writer = Files.newBufferedWriter(file, StandardCharsets.UTF_8,
                StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING, StandardOpenOption.WRITE);
    }

    @Override
    public synchronized void log(String message) throws IOException {
        writer.write(message);
        writer.write('\n');
        writer.flush();
    }

    public Path file() { return file; }

    @Override
    public synchronized void close() throws IOException {
        writer.close();
    }
}
