package com.sqlstage.sqlstage.db;

/**
 * Administrative credentials of one engine. Only ever handed to the engine's command-line tools.
 */
public record DbCredentials(String rootPassword) {

    @Override
    public String toString() {
        return "DbCredentials[rootPassword=****]";
    }
}
