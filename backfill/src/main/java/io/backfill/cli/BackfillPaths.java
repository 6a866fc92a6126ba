package io.backfill.cli;

import java.nio.file.Path;

/** Files of one run: records in, formatted lines out, progress log. */
public record BackfillPaths(Path input, Path output, Path log) {
}
