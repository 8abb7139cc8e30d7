package com.sqlstage.sqlstage.db;

/**
 * Exit status of an external command plus whatever it printed for diagnostics.
 */
public record CommandResult(int exitCode, String diagnostics) {

    public boolean succeeded() {
        return exitCode == 0;
    }
}
