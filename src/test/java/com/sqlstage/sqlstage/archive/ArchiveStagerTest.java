package com.sqlstage.sqlstage.archive;

import com.sqlstage.sqlstage.asset.AssetResolutionException;
import com.sqlstage.sqlstage.support.TestArchives;
import org.junit.jupiter.api.Assumptions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.PosixFilePermissions;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ArchiveStagerTest {

    @TempDir
    Path dir;

    private final ArchiveStager stager = new ArchiveStager();

    @Test
    void shouldExtractAllEntriesAndWriteMarker() throws IOException {
        Path archive = bundle(Map.of("sqlizer/IMDB.database.sql", "CREATE TABLE movie (id INT);"));
        Path dest = dir.resolve("extracted/sqlizer");

        stager.extract(archive, dest, false);

        assertEquals("CREATE TABLE movie (id INT);", Files.readString(dest.resolve("sqlizer/IMDB.database.sql")));
        assertTrue(Files.exists(dest.resolve(".extracted.ok")));
    }

    @Test
    void shouldReuseExtractionWhenMarkerPresent() throws IOException {
        Path archive = bundle(Map.of("a.sql", "A"));
        Path dest = dir.resolve("extracted/bundle");
        stager.extract(archive, dest, false);
        Files.writeString(dest.resolve("sentinel.txt"), "kept");

        stager.extract(archive, dest, false);

        assertTrue(Files.exists(dest.resolve("sentinel.txt")));
    }

    @Test
    void shouldWipeAndReextractWhenForced() throws IOException {
        Path archive = bundle(Map.of("a.sql", "A"));
        Path dest = dir.resolve("extracted/bundle");
        stager.extract(archive, dest, false);
        Files.writeString(dest.resolve("sentinel.txt"), "stale");

        stager.extract(archive, dest, true);

        assertFalse(Files.exists(dest.resolve("sentinel.txt")));
        assertEquals("A", Files.readString(dest.resolve("a.sql")));
    }

    @Test
    void shouldReextractWhenMarkerMissing() throws IOException {
        Path archive = bundle(Map.of("a.sql", "A"));
        Path dest = Files.createDirectories(dir.resolve("extracted/bundle"));
        Files.writeString(dest.resolve("leftover.sql"), "partial");

        stager.extract(archive, dest, false);

        assertFalse(Files.exists(dest.resolve("leftover.sql")));
        assertTrue(Files.exists(dest.resolve(".extracted.ok")));
    }

    @Test
    void shouldRejectGarbageWithoutMarker() throws IOException {
        Path archive = Files.write(dir.resolve("broken.tgz"), "this is not gzip".getBytes());
        Path dest = dir.resolve("extracted/broken");

        assertThrows(ArchiveCorruptException.class, () -> stager.extract(archive, dest, false));

        assertFalse(Files.exists(dest.resolve(".extracted.ok")));
    }

    @Test
    void shouldRejectTruncatedArchiveWithoutMarker() throws IOException {
        Map<String, String> entries = new LinkedHashMap<>();
        entries.put("a.sql", "A".repeat(20_000));
        entries.put("b.sql", "B".repeat(20_000));
        byte[] full = TestArchives.tarGz(entries);
        Path archive = Files.write(dir.resolve("truncated.tgz"), Arrays.copyOf(full, full.length / 2));
        Path dest = dir.resolve("extracted/truncated");

        assertThrows(ArchiveCorruptException.class, () -> stager.extract(archive, dest, false));

        assertFalse(Files.exists(dest.resolve(".extracted.ok")));
    }

    @Test
    void shouldRejectEntriesEscapingDestination() throws IOException {
        Path archive = bundle(Map.of("../escape.sql", "nope"));
        Path dest = dir.resolve("extracted/evil");

        assertThrows(ArchiveCorruptException.class, () -> stager.extract(archive, dest, false));

        assertFalse(Files.exists(dir.resolve("extracted/escape.sql")));
        assertFalse(Files.exists(dest.resolve(".extracted.ok")));
    }

    @Test
    void shouldExtractEveryGzipMemberOfConcatenatedArchive() throws IOException {
        Map<String, String> entries = new LinkedHashMap<>();
        entries.put("sqlizer/MAS.database.sql", "CREATE TABLE author (aid INT);");
        entries.put("sqlizer/YELP.database.sql", "CREATE TABLE business (bid INT);");
        Path archive = Files.write(dir.resolve("multi.tgz"), TestArchives.tarGzTwoMembers(entries, 1024));
        Path dest = dir.resolve("extracted/multi");

        stager.extract(archive, dest, false);

        assertEquals("CREATE TABLE author (aid INT);", Files.readString(dest.resolve("sqlizer/MAS.database.sql")));
        assertEquals("CREATE TABLE business (bid INT);", Files.readString(dest.resolve("sqlizer/YELP.database.sql")));
    }

    @Test
    void shouldLocateMemberDirectlyOrBySearch() throws IOException {
        Path root = Files.createDirectories(dir.resolve("tree"));
        Files.writeString(root.resolve("top.sql"), "top");
        Files.createDirectories(root.resolve("nested/deeper"));
        Files.writeString(root.resolve("nested/deeper/MAS.database.sql"), "mas");

        assertEquals(root.resolve("top.sql"), stager.locateMember(root, "top.sql"));
        assertEquals(root.resolve("nested/deeper/MAS.database.sql"), stager.locateMember(root, "MAS.database.sql"));
    }

    @Test
    void shouldPickFirstMatchInPathOrder() throws IOException {
        Path root = Files.createDirectories(dir.resolve("tree"));
        Files.createDirectories(root.resolve("b"));
        Files.createDirectories(root.resolve("a"));
        Files.writeString(root.resolve("b/YELP.database.sql"), "b");
        Files.writeString(root.resolve("a/YELP.database.sql"), "a");

        assertEquals(root.resolve("a/YELP.database.sql"), stager.locateMember(root, "YELP.database.sql"));
    }

    @Test
    void shouldFailWhenMemberIsMissing() throws IOException {
        Path root = Files.createDirectories(dir.resolve("tree"));

        MemberNotFoundException ex = assertThrows(MemberNotFoundException.class,
                () -> stager.locateMember(root, "IMDB.database.sql"));
        assertTrue(ex.getMessage().contains("IMDB.database.sql"));
    }

    @Test
    void shouldWrapUnreadableSubdirectoryDuringSearch() throws IOException {
        Path root = Files.createDirectories(dir.resolve("tree"));
        Path locked = Files.createDirectories(root.resolve("locked"));
        Files.writeString(locked.resolve("IMDB.database.sql"), "hidden");
        Files.setPosixFilePermissions(locked, PosixFilePermissions.fromString("---------"));
        try {
            Assumptions.assumeFalse(Files.isReadable(locked), "Skipping: permissions are not enforced for this user");

            AssetResolutionException ex = assertThrows(AssetResolutionException.class,
                    () -> stager.locateMember(root, "IMDB.database.sql"));
            assertInstanceOf(UncheckedIOException.class, ex.getCause());
        } finally {
            Files.setPosixFilePermissions(locked, PosixFilePermissions.fromString("rwx------"));
        }
    }

    private Path bundle(Map<String, String> entries) throws IOException {
        return Files.write(dir.resolve("bundle-" + System.nanoTime() + ".tgz"), TestArchives.tarGz(entries));
    }
}
