package de.t14d3.jotter.test;

import de.t14d3.jotter.cache.NoteCache;
import de.t14d3.jotter.cache.NotePage;
import de.t14d3.jotter.model.Note;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

public class NoteCacheConcurrencyTest {
    private ExecutorService executor;

    @BeforeEach
    void setup() {
        executor = Executors.newFixedThreadPool(8);
    }

    @AfterEach
    void teardown() throws InterruptedException {
        executor.shutdownNow();
        assertTrue(executor.awaitTermination(5, TimeUnit.SECONDS));
    }

    @Test
    void testConcurrentReadersAndWriters() throws Exception {
        InMemoryNoteStore store = new InMemoryNoteStore();
        store.addUser(1, "alice");
        store.addUser(2, "bob");
        NoteCache cache = new NoteCache(store, 10);
        cache.initialize();

        int writers = 4;
        int notesPerWriter = 200;
        Set<Long> created = ConcurrentHashMap.newKeySet();
        CountDownLatch start = new CountDownLatch(1);
        List<Future<?>> futures = new ArrayList<>();

        for (int w = 0; w < writers; w++) {
            long owner = w % 2 + 1;
            futures.add(executor.submit(() -> {
                start.await();
                for (int i = 0; i < notesPerWriter; i++) {
                    created.add(cache.createNote(owner, "note " + i, i % 4 == 0));
                }
                return null;
            }));
        }
        for (int r = 0; r < 3; r++) {
            futures.add(executor.submit(() -> {
                start.await();
                for (int i = 0; i < 500; i++) {
                    cache.topPage().ifPresent(NoteCacheConcurrencyTest::assertPageConsistent);
                    cache.userNotes(1).forEach(note -> assertEquals("alice", note.getOwnerName()));
                }
                return null;
            }));
        }
        futures.add(executor.submit(() -> {
            start.await();
            for (int i = 0; i < 5; i++) {
                cache.initialize();
            }
            return null;
        }));

        start.countDown();
        for (Future<?> future : futures) {
            future.get(30, TimeUnit.SECONDS);
        }

        assertEquals(writers * notesPerWriter, created.size());
        for (long id : created) {
            assertTrue(cache.note(id).isPresent(), "note " + id + " lost");
        }
        assertEquals(writers * notesPerWriter, cache.noteCount());
        long publicNotes = created.stream().map(id -> cache.note(id).orElseThrow()).filter(Note::isPublic).count();
        assertEquals(publicNotes, cache.publicCount());
    }

    private static void assertPageConsistent(NotePage page) {
        assertTrue(page.notes().size() <= page.total());
        assertTrue(page.notes().stream().allMatch(Note::isPublic));
        for (int i = 1; i < page.notes().size(); i++) {
            assertTrue(page.notes().get(i - 1).getCreatedAt().compareTo(page.notes().get(i).getCreatedAt()) >= 0);
        }
    }

    @Test
    void testNoteCreatedDuringReloadSurvivesSwap() throws Exception {
        BlockingListStore store = new BlockingListStore();
        store.addUser(1, "alice");
        store.addNote(1, "existing", false, "2024-01-01 10:00:00");
        NoteCache cache = new NoteCache(store, 10);
        cache.initialize();

        store.block = true;
        Future<?> reload = executor.submit(() -> {
            cache.initialize();
            return null;
        });
        assertTrue(store.listed.await(5, TimeUnit.SECONDS));

        // the reload is fetching; the old generation keeps serving and accepts writes
        assertEquals(1, cache.topPage().orElseThrow().notes().size());
        long id = cache.createNote(1, "written mid-reload", false);
        assertTrue(cache.note(id).isPresent());

        store.release.countDown();
        reload.get(5, TimeUnit.SECONDS);

        assertEquals(2, cache.generation());
        assertTrue(cache.note(id).isPresent(), "note written during the fetch must be replayed");
        assertEquals(2, cache.noteCount());
        assertEquals(2, cache.publicCount());
    }

    /**
     * Takes its note snapshot, then waits to be released before returning it.
     */
    private static class BlockingListStore extends InMemoryNoteStore {
        final CountDownLatch listed = new CountDownLatch(1);
        final CountDownLatch release = new CountDownLatch(1);
        volatile boolean block;

        @Override
        public List<Note> listNotes() {
            List<Note> snapshot = super.listNotes();
            if (block) {
                listed.countDown();
                try {
                    assertTrue(release.await(5, TimeUnit.SECONDS));
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    throw new IllegalStateException(e);
                }
            }
            return snapshot;
        }
    }
}
