package io.backfill.stage;

import io.backfill.log.ProgressLog;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

public final class RecordingProgressLog implements ProgressLog {
    public final List<String> lines = Collections.synchronizedList(new ArrayList<>());
    public int closeCount;

    @Override public void log(String message) { lines.add(message); }
    @Override public void close() { closeCount++; }
}
