package io.lexis.cli;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for LexisCli - subcommands against a small corpus on disk.
 */
class LexisCliTest {

    @TempDir
    Path tempDir;

    private final ByteArrayOutputStream output = new ByteArrayOutputStream();
    private PrintStream originalOut;

    @BeforeEach
    void setUp() throws IOException {
        originalOut = System.out;
        System.setOut(new PrintStream(output, true, StandardCharsets.UTF_8));

        write("src/limiter.ts", "/** Token bucket rate limiter. */\nexport class RateLimiter { refill tokens bucket }\n");
        write("src/bucket.md", "# Buckets\n\nA token bucket refills tokens at a fixed rate.\n");
        write("src/other.md", "unrelated notes about cooking pasta\n");
    }

    @AfterEach
    void tearDown() {
        System.setOut(originalOut);
    }

    @Test
    void testRebuildWritesIndex() {
        int exitCode = run("rebuild");

        assertEquals(0, exitCode);
        assertTrue(Files.exists(tempDir.resolve(".lexis/lexis-index.json")));
        assertTrue(output().contains("Indexed 3 of 3 files"));
    }

    @Test
    void testSearchPrintsRankedResults() {
        run("rebuild");
        output.reset();

        int exitCode = run("search", "token", "bucket");

        assertEquals(0, exitCode);
        String printed = output();
        assertTrue(printed.contains("src/bucket.md"));
        assertFalse(printed.contains("src/other.md"));
    }

    @Test
    void testSearchJsonOmitsEmbeddings() {
        run("rebuild");
        output.reset();

        run("search", "--json", "token bucket");

        String printed = output();
        assertTrue(printed.contains("\"highlights\""));
        assertFalse(printed.contains("\"embedding\""));
    }

    @Test
    void testStatsJson() {
        run("rebuild");
        output.reset();

        int exitCode = run("stats", "--json");

        assertEquals(0, exitCode);
        assertTrue(output().contains("\"documentCount\" : 3"));
    }

    @Test
    void testSyncAfterChanges() throws IOException {
        run("rebuild");
        Files.delete(tempDir.resolve("src/other.md"));
        output.reset();

        run("sync");

        assertTrue(output().contains("removed 1"));
    }

    @Test
    void testAddAndRemove() throws IOException {
        run("rebuild");
        Path extra = write("src/extra.md", "more about token buckets and tokens");
        output.reset();

        assertEquals(0, run("add", extra.toString()));
        assertTrue(output().contains("1 of 1 files indexed"));

        output.reset();
        assertEquals(0, run("remove", extra.toString()));
        assertTrue(output().contains("Removed 1 of 1 files"));
    }

    @Test
    void testAddAndRemoveResolveAgainstBaseDir() throws IOException {
        run("rebuild");
        write("src/extra.md", "more about token buckets and tokens");
        output.reset();

        assertEquals(0, run("add", "src/extra.md"));
        assertTrue(output().contains("1 of 1 files indexed"));

        output.reset();
        assertEquals(0, run("remove", "src/extra.md"));
        assertTrue(output().contains("Removed 1 of 1 files"));
        assertFalse(output().contains("Not indexed"));
    }

    @Test
    void testInvalidLimitFails() {
        run("rebuild");

        assertNotEquals(0, run("search", "--limit", "0", "token"));
    }

    private int run(String command, String... args) {
        String[] full = new String[args.length + 3];
        full[0] = command;
        full[1] = "--base-dir";
        full[2] = tempDir.toString();
        System.arraycopy(args, 0, full, 3, args.length);
        return new CommandLine(new LexisCli()).execute(full);
    }

    private String output() {
        return output.toString(StandardCharsets.UTF_8);
    }

    private Path write(String relative, String content) throws IOException {
        Path file = tempDir.resolve(relative);
        Files.createDirectories(file.getParent());
        Files.writeString(file, content);
        return file;
    }
}
