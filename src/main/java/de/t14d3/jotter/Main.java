package de.t14d3.jotter;

import de.t14d3.jotter.cache.NoteCache;
import de.t14d3.jotter.cache.NoteContext;
import de.t14d3.jotter.cache.NotePage;
import de.t14d3.jotter.config.JotterSettings;
import de.t14d3.jotter.connection.DatabaseConnection;
import de.t14d3.jotter.exceptions.LoadFailureException;
import de.t14d3.jotter.mapping.EntityMetadata;
import de.t14d3.jotter.mapping.EntityScanner;
import de.t14d3.jotter.model.Note;
import de.t14d3.jotter.schema.SchemaGenerator;
import de.t14d3.jotter.store.JdbcNoteStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.PrintStream;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Jotter CLI - loads the note cache from the configured store and runs one command against it.
 *
 * Usage:
 *   java -cp ... de.t14d3.jotter.Main [command] [options]
 *
 * Commands:
 *   schema [--drop]                       - Create the users and notes tables
 *   stats                                 - Load the cache and print its counters
 *   recent <page>                         - Print a page of recent public notes
 *   notes <user-id>                       - Print every note of a user
 *   show <note-id> [--as <user-id>]       - Print a note with its older/newer neighbors
 *   post <user-id> <content> [--private]  - Create a note
 *   help                                  - Show this help message
 *
 * Options:
 *   --db-url <url>                        - Database URL (default: jotter.database.url)
 *   --env <name>                          - Configuration environment (default: $JOTTER_ENV or local)
 *   --verbose                             - Print stack traces on failure
 */
public class Main {
    private static final Logger logger = LoggerFactory.getLogger(Main.class);

    public static void main(String[] args) {
        int status = run(args, System.out, System.err);
        if (status != 0) {
            System.exit(status);
        }
    }

    /**
     * Runs one command and returns the process exit status.
     */
    public static int run(String[] args, PrintStream out, PrintStream err) {
        if (args.length == 0) {
            printHelp(out);
            return 1;
        }

        Options options;
        try {
            options = Options.parse(args);
        } catch (IllegalArgumentException e) {
            err.println("Error: " + e.getMessage());
            return 1;
        }

        String command = options.command().toLowerCase();
        if (command.equals("help") || command.equals("--help") || command.equals("-h")) {
            printHelp(out);
            return 0;
        }

        try {
            JotterSettings settings = options.env() == null ? JotterSettings.load() : JotterSettings.load(options.env());
            String dbUrl = options.dbUrl() == null ? settings.databaseUrl() : options.dbUrl();
            try (DatabaseConnection connection = new DatabaseConnection(dbUrl,
                    settings.databaseUsername(), settings.databasePassword())) {
                if (command.equals("schema")) {
                    return handleSchema(connection, options, out);
                }

                NoteCache cache = new NoteCache(new JdbcNoteStore(connection.getExecutor()), settings.pageSize());
                try {
                    cache.initialize();
                } catch (LoadFailureException e) {
                    logger.error("Cannot start: note cache failed to load", e);
                    err.println("Error: " + e.getMessage());
                    return 2;
                }

                return switch (command) {
                    case "stats" -> handleStats(cache, out);
                    case "recent" -> handleRecent(cache, options, out, err);
                    case "notes" -> handleNotes(cache, options, out, err);
                    case "show" -> handleShow(cache, options, out, err);
                    case "post" -> handlePost(cache, options, out, err);
                    default -> {
                        err.println("Unknown command: " + command);
                        out.println();
                        printHelp(out);
                        yield 1;
                    }
                };
            }
        } catch (RuntimeException e) {
            err.println("Error: " + e.getMessage());
            if (options.verbose()) {
                e.printStackTrace(err);
            }
            return 1;
        }
    }

    private static void printHelp(PrintStream out) {
        out.println("Jotter CLI - note cache over a relational store");
        out.println();
        out.println("Usage:");
        out.println("  java -cp ... de.t14d3.jotter.Main [command] [options]");
        out.println();
        out.println("Commands:");
        out.println("  schema [--drop]                       - Create the users and notes tables");
        out.println("  stats                                 - Load the cache and print its counters");
        out.println("  recent <page>                         - Print a page of recent public notes");
        out.println("  notes <user-id>                       - Print every note of a user");
        out.println("  show <note-id> [--as <user-id>]       - Print a note with its older/newer neighbors");
        out.println("  post <user-id> <content> [--private]  - Create a note");
        out.println("  help                                  - Show this help message");
        out.println();
        out.println("Options:");
        out.println("  --db-url <url>                        - Database URL (default: jotter.database.url)");
        out.println("  --env <name>                          - Configuration environment (default: $JOTTER_ENV or local)");
        out.println("  --verbose                             - Print stack traces on failure");
    }

    private static int handleSchema(DatabaseConnection connection, Options options, PrintStream out) {
        List<EntityMetadata> entities = EntityScanner.scanModel();
        SchemaGenerator generator = new SchemaGenerator(connection.getDialect());
        List<String> statements = new ArrayList<>();
        if (options.drop()) {
            statements.addAll(generator.dropStatements(entities));
        }
        statements.addAll(generator.createStatements(entities));
        generator.apply(connection.getExecutor(), statements);
        out.println("Applied " + statements.size() + " statement(s) for "
                + entities.stream().map(EntityMetadata::getTableName).toList());
        return 0;
    }

    private static int handleStats(NoteCache cache, PrintStream out) {
        out.println("Generation:   " + cache.generation());
        out.println("Users:        " + cache.userCount());
        out.println("Notes:        " + cache.noteCount());
        out.println("Public notes: " + cache.publicCount());
        out.println("Page size:    " + cache.pageSize());
        return 0;
    }

    private static int handleRecent(NoteCache cache, Options options, PrintStream out, PrintStream err) {
        int page = (int) options.requireNumber(0, "page");
        Optional<NotePage> result = cache.page(page);
        if (result.isEmpty()) {
            err.println("Not found: page " + page);
            return 3;
        }
        NotePage notes = result.get();
        out.println("Recent notes " + notes.pageStart() + "-" + notes.pageEnd() + " of " + notes.total());
        notes.notes().forEach(note -> out.println(describe(note)));
        return 0;
    }

    private static int handleNotes(NoteCache cache, Options options, PrintStream out, PrintStream err) {
        long userId = options.requireNumber(0, "user-id");
        if (cache.user(userId).isEmpty()) {
            err.println("Not found: user " + userId);
            return 3;
        }
        cache.userNotes(userId).forEach(note -> out.println(describe(note)));
        return 0;
    }

    private static int handleShow(NoteCache cache, Options options, PrintStream out, PrintStream err) {
        long noteId = options.requireNumber(0, "note-id");
        Optional<NoteContext> result = cache.noteWithContext(noteId, options.requester());
        if (result.isEmpty()) {
            err.println("Not found: note " + noteId);
            return 3;
        }
        NoteContext context = result.get();
        out.println(describe(context.note()));
        out.println(context.note().getContent());
        out.println("Older: " + context.older().map(Main::describe).orElse("-"));
        out.println("Newer: " + context.newer().map(Main::describe).orElse("-"));
        return 0;
    }

    private static int handlePost(NoteCache cache, Options options, PrintStream out, PrintStream err) {
        long userId = options.requireNumber(0, "user-id");
        if (options.positional().size() < 2) {
            err.println("Usage: post <user-id> <content> [--private]");
            return 1;
        }
        if (cache.user(userId).isEmpty()) {
            err.println("Not found: user " + userId);
            return 3;
        }
        String content = String.join(" ", options.positional().subList(1, options.positional().size()));
        long id = cache.createNote(userId, content, options.isPrivate());
        out.println("Created note " + id);
        return 0;
    }

    private static String describe(Note note) {
        return String.format("#%d %s %s [%s] %s", note.getId(), note.getCreatedAt(), note.getOwnerName(),
                note.isPrivate() ? "private" : "public", note.firstLine());
    }

    record Options(String command, List<String> positional, String dbUrl, String env, Long requester,
                   boolean isPrivate, boolean drop, boolean verbose) {

        static Options parse(String[] args) {
            List<String> positional = new ArrayList<>();
            String dbUrl = null;
            String env = null;
            Long requester = null;
            boolean isPrivate = false;
            boolean drop = false;
            boolean verbose = false;

            int i = 1;
            while (i < args.length) {
                switch (args[i]) {
                    case "--db-url" -> {
                        dbUrl = valueOf(args, i);
                        i += 2;
                    }
                    case "--env" -> {
                        env = valueOf(args, i);
                        i += 2;
                    }
                    case "--as" -> {
                        requester = parseNumber(valueOf(args, i), "--as");
                        i += 2;
                    }
                    case "--private" -> {
                        isPrivate = true;
                        i++;
                    }
                    case "--drop" -> {
                        drop = true;
                        i++;
                    }
                    case "--verbose" -> {
                        verbose = true;
                        i++;
                    }
                    default -> {
                        if (args[i].startsWith("--")) {
                            throw new IllegalArgumentException("Unknown option: " + args[i]);
                        }
                        positional.add(args[i]);
                        i++;
                    }
                }
            }
            return new Options(args[0], List.copyOf(positional), dbUrl, env, requester, isPrivate, drop, verbose);
        }

        long requireNumber(int index, String name) {
            if (positional.size() <= index) {
                throw new IllegalArgumentException("Missing <" + name + "> for " + command);
            }
            return parseNumber(positional.get(index), "<" + name + ">");
        }

        private static String valueOf(String[] args, int i) {
            if (i + 1 >= args.length) {
                throw new IllegalArgumentException(args[i] + " requires a value");
            }
            return args[i + 1];
        }

        private static long parseNumber(String text, String name) {
            try {
                return Long.parseLong(text);
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException(name + " must be a number but was '" + text + "'", e);
            }
        }
    }
}
