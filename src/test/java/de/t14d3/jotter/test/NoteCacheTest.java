package de.t14d3.jotter.test;

import de.t14d3.jotter.cache.NoteCache;
import de.t14d3.jotter.cache.NoteContext;
import de.t14d3.jotter.exceptions.LoadFailureException;
import de.t14d3.jotter.exceptions.StoreException;
import de.t14d3.jotter.model.Note;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class NoteCacheTest {
    private InMemoryNoteStore store;
    private NoteCache cache;

    @BeforeEach
    void setup() {
        store = new InMemoryNoteStore();
        store.addUser(1, "alice");
        store.addUser(2, "bob");
        store.addNote(1, "first", false, "2024-01-01 10:00:00");
        store.addNote(2, "second", false, "2024-01-01 10:00:01");
        store.addNote(1, "third", false, "2024-01-01 10:00:02");
        store.addNote(2, "secret", true, "2024-01-01 10:00:03");
        cache = new NoteCache(store, 2, new SteppingClock(Instant.parse("2024-06-01T12:00:00Z")));
    }

    private static List<String> contents(List<Note> notes) {
        return notes.stream().map(Note::getContent).toList();
    }

    @Test
    void testQueriesBeforeInitializeFail() {
        assertThrows(IllegalStateException.class, () -> cache.page(0));
        assertThrows(IllegalStateException.class, () -> cache.publicCount());
        assertThrows(IllegalStateException.class, () -> cache.createNote(1, "early", false));
        assertEquals(4, store.noteRows(), "nothing may be persisted before the cache is loaded");
        assertEquals(0, cache.generation());
    }

    @Test
    void testInitializeMirrorsStore() {
        cache.initialize();

        assertEquals(1, cache.generation());
        assertEquals(2, cache.userCount());
        assertEquals(4, cache.noteCount());
        assertEquals(3, cache.publicCount());
        assertEquals(List.of("third", "second"), contents(cache.topPage().orElseThrow().notes()));
        assertEquals(List.of("first"), contents(cache.page(1).orElseThrow().notes()));
        assertTrue(cache.page(2).isEmpty());
        assertEquals("bob", cache.note(2).orElseThrow().getOwnerName());
        assertEquals("alice", cache.userByName("alice").orElseThrow().getUsername());
    }

    @Test
    void testCreateNotePersistsThenCaches() {
        cache.initialize();

        long id = cache.createNote(2, "hello\nworld", false);

        assertEquals(5, store.noteRows());
        Note cached = cache.note(id).orElseThrow();
        assertEquals("bob", cached.getOwnerName());
        assertEquals("hello", cached.firstLine());
        assertEquals("2024-06-01 12:00:00", cached.getCreatedAt());
        assertEquals(cached.getCreatedAt(), cached.getUpdatedAt());
        assertEquals(4, cache.publicCount());
        assertEquals(id, cache.topPage().orElseThrow().notes().get(0).getId());
    }

    @Test
    void testCreatePrivateNoteDoesNotCountAsPublic() {
        cache.initialize();

        long id = cache.createNote(1, "diary", true);

        assertEquals(3, cache.publicCount());
        assertEquals(5, cache.noteCount());
        assertTrue(cache.noteWithContext(id, null).isEmpty());
        assertTrue(cache.noteWithContext(id, 2L).isEmpty());
        NoteContext own = cache.noteWithContext(id, 1L).orElseThrow();
        assertEquals("diary", own.note().getContent());
        assertEquals("third", own.older().orElseThrow().getContent(),
                "bob's private note is outside alice's scope");
        assertTrue(own.newer().isEmpty());
    }

    @Test
    void testFailedInsertLeavesCacheUnchanged() {
        cache.initialize();
        store.failInsert = true;

        StoreException e = assertThrows(StoreException.class, () -> cache.createNote(1, "lost", false));

        assertEquals("insert rejected", e.getMessage(), "store errors propagate unchanged");
        assertEquals(4, cache.noteCount());
        assertEquals(3, cache.publicCount());
    }

    @Test
    void testInsertForUnknownOwnerPropagatesStoreError() {
        cache.initialize();

        assertThrows(StoreException.class, () -> cache.createNote(77, "who", false));
        assertEquals(4, cache.noteCount());
    }

    @Test
    void testReloadDropsStaleEntries() {
        cache.initialize();
        store.removeNote(1);
        store.addNote(1, "external", false, "2024-01-02 00:00:00");

        cache.initialize();

        assertEquals(2, cache.generation());
        assertTrue(cache.note(1).isEmpty());
        assertEquals(4, cache.noteCount());
        assertEquals(3, cache.publicCount());
        assertEquals("external", cache.topPage().orElseThrow().notes().get(0).getContent());
    }

    @Test
    void testFailedReloadKeepsPreviousGeneration() {
        cache.initialize();
        long created = cache.createNote(1, "kept", false);
        store.failListNotes = true;

        assertThrows(LoadFailureException.class, () -> cache.initialize());

        assertEquals(1, cache.generation());
        assertEquals(5, cache.noteCount());
        assertEquals(4, cache.publicCount());
        assertTrue(cache.note(created).isPresent());
    }

    @Test
    void testInitialLoadFailureLeavesCacheUnusable() {
        store.failListUsers = true;

        LoadFailureException e = assertThrows(LoadFailureException.class, () -> cache.initialize());

        assertInstanceOf(StoreException.class, e.getCause());
        assertThrows(IllegalStateException.class, () -> cache.topPage());
    }

    @Test
    void testDanglingOwnerFailsLoad() {
        store.addNote(9, "orphan", false, "2024-01-01 11:00:00");

        assertThrows(LoadFailureException.class, () -> cache.initialize());
        assertEquals(0, cache.generation());
    }

    @Test
    void testPublicCountMatchesScanAfterEveryStep() {
        cache.initialize();
        assertCounterConsistent();
        for (int i = 0; i < 10; i++) {
            cache.createNote(i % 2 + 1, "n" + i, i % 3 == 0);
            assertCounterConsistent();
        }
        cache.initialize();
        assertCounterConsistent();
    }

    private void assertCounterConsistent() {
        long scanned = cache.userNotes(1).stream().filter(Note::isPublic).count()
                + cache.userNotes(2).stream().filter(Note::isPublic).count();
        assertEquals(scanned, cache.publicCount());
        assertEquals(cache.noteCount(), cache.userNotes(1).size() + cache.userNotes(2).size());
    }

    @Test
    void testRejectsNonPositivePageSize() {
        assertThrows(IllegalArgumentException.class, () -> new NoteCache(store, 0));
    }
}
