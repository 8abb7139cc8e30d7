package com.sqlstage.sqlstage.db;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * Runs an external command to completion.
 */
public interface CommandRunner {

    /**
     * @param command argument list, program first
     * @param stdin   file streamed to the command's input, or {@code null}
     * @param stdout  file receiving the command's output, or {@code null} to keep it as diagnostics
     */
    CommandResult run(List<String> command, Path stdin, Path stdout) throws IOException;
}
