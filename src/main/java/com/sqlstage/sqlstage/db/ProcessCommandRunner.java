package com.sqlstage.sqlstage.db;

import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.List;

/**
 * {@link CommandRunner} backed by {@link ProcessBuilder}. Waits without timeout.
 */
@Component
public class ProcessCommandRunner implements CommandRunner {

    @Override
    public CommandResult run(List<String> command, Path stdin, Path stdout) throws IOException {
        ProcessBuilder builder = new ProcessBuilder(command);
        if (stdin != null) {
            builder.redirectInput(stdin.toFile());
        }
        if (stdout != null) {
            builder.redirectOutput(stdout.toFile());
        } else {
            builder.redirectErrorStream(true);
        }

        Process process = builder.start();
        if (stdin == null) {
            process.getOutputStream().close();
        }

        String diagnostics;
        try (InputStream output = stdout != null ? process.getErrorStream() : process.getInputStream()) {
            diagnostics = new String(output.readAllBytes(), StandardCharsets.UTF_8).trim();
        }

        try {
            return new CommandResult(process.waitFor(), diagnostics);
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            process.destroy();
            throw new IOException("Interrupted while waiting for " + command.get(0), ex);
        }
    }
}
