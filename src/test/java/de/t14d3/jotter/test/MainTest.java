package de.t14d3.jotter.test;

import de.t14d3.jotter.Main;
import de.t14d3.jotter.connection.DatabaseConnection;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

public class MainTest {
    private String dbUrl;
    private ByteArrayOutputStream out;
    private ByteArrayOutputStream err;

    @BeforeEach
    void setup() {
        dbUrl = "jdbc:h2:mem:cli_" + UUID.randomUUID().toString().replace("-", "") + ";DB_CLOSE_DELAY=-1";
        assertEquals(0, run("schema"));
        try (DatabaseConnection connection = new DatabaseConnection(dbUrl)) {
            connection.getExecutor().executeInsert("INSERT INTO users (username, password, salt) VALUES (?, ?, ?)",
                    List.of("alice", "digest", "salt"));
        }
    }

    private int run(String... args) {
        out = new ByteArrayOutputStream();
        err = new ByteArrayOutputStream();
        String[] withDb = new String[args.length + 2];
        System.arraycopy(args, 0, withDb, 0, args.length);
        withDb[args.length] = "--db-url";
        withDb[args.length + 1] = dbUrl;
        return Main.run(withDb, new PrintStream(out, true, StandardCharsets.UTF_8),
                new PrintStream(err, true, StandardCharsets.UTF_8));
    }

    private String stdout() {
        return out.toString(StandardCharsets.UTF_8);
    }

    private String stderr() {
        return err.toString(StandardCharsets.UTF_8);
    }

    @Test
    void testPostAndBrowse() {
        assertEquals(0, run("post", "1", "hello", "world"));
        assertTrue(stdout().startsWith("Created note 1"), stdout());
        assertEquals(0, run("post", "1", "hidden", "--private"));

        assertEquals(0, run("recent", "0"));
        assertTrue(stdout().contains("Recent notes 1-1 of 1"), stdout());
        assertTrue(stdout().contains("alice [public] hello world"), stdout());

        assertEquals(0, run("stats"));
        assertTrue(stdout().contains("Public notes: 1"), stdout());
        assertTrue(stdout().contains("Notes:        2"), stdout());

        assertEquals(0, run("notes", "1"));
        assertTrue(stdout().contains("[private] hidden"), stdout());
    }

    @Test
    void testShowHonorsVisibility() {
        assertEquals(0, run("post", "1", "secret", "--private"));

        assertEquals(3, run("show", "1"));
        assertTrue(stderr().contains("Not found: note 1"));

        assertEquals(0, run("show", "1", "--as", "1"));
        assertTrue(stdout().contains("Older: -"), stdout());
        assertTrue(stdout().contains("Newer: -"), stdout());
    }

    @Test
    void testEmptyRecentPageIsNotFound() {
        assertEquals(3, run("recent", "0"));
        assertTrue(stderr().contains("Not found: page 0"));
    }

    @Test
    void testBadArguments() {
        assertEquals(1, run("recent", "first"));
        assertTrue(stderr().contains("must be a number"), stderr());

        assertEquals(1, run("stats", "--bogus"));
        assertTrue(stderr().contains("Unknown option: --bogus"), stderr());

        assertEquals(3, run("post", "9", "nobody"));
        assertEquals(1, run("frobnicate"));
    }

    @Test
    void testHelp() {
        assertEquals(0, Main.run(new String[]{"help"}, new PrintStream(new ByteArrayOutputStream()), System.err));
        assertEquals(1, Main.run(new String[0], new PrintStream(new ByteArrayOutputStream()), System.err));
    }
}
