package com.sqlstage.sqlstage.cache;

import com.sqlstage.sqlstage.config.SqlStageConstants;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Directory roots of the local asset cache. Directories are created on first use.
 */
public record CacheLayout(Path archives, Path extracted, Path stagedSql, Path stagedQuestions, Path schemas) {

    public static CacheLayout under(Path root) {
        return new CacheLayout(
                root.resolve(SqlStageConstants.DIR_ARCHIVES),
                root.resolve(SqlStageConstants.DIR_EXTRACTED),
                root.resolve(SqlStageConstants.DIR_STAGED_SQL),
                root.resolve(SqlStageConstants.DIR_STAGED_QUESTIONS),
                root.resolve(SqlStageConstants.DIR_SCHEMAS)
        );
    }

    public Path archiveFile(String fileName) {
        return ensureDirectory(archives).resolve(fileName);
    }

    public Path extractionDir(String dirName) {
        return ensureDirectory(extracted.resolve(dirName));
    }

    public Path stagedSqlFile(String fileName) {
        return ensureDirectory(stagedSql).resolve(fileName);
    }

    public Path stagedQuestionsFile(String dataset) {
        return ensureDirectory(stagedQuestions).resolve(questionsFileName(dataset));
    }

    /**
     * Location of the staged questions file without creating anything.
     */
    public Path questionsLocation(String dataset) {
        return stagedQuestions.resolve(questionsFileName(dataset));
    }

    public Path schemaFile(String engine, String database) {
        return ensureDirectory(schemas.resolve(engine)).resolve(database + SqlStageConstants.SCHEMA_SUFFIX);
    }

    public static Path ensureDirectory(Path dir) {
        try {
            return Files.createDirectories(dir);
        } catch (IOException ex) {
            throw new CacheUnavailableException(SqlStageConstants.MSG_CACHE_UNAVAILABLE.formatted(dir), ex);
        }
    }

    private static String questionsFileName(String dataset) {
        return dataset + SqlStageConstants.QUESTIONS_SUFFIX;
    }
}
