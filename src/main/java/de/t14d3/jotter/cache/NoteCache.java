package de.t14d3.jotter.cache;

import de.t14d3.jotter.exceptions.LoadFailureException;
import de.t14d3.jotter.model.Note;
import de.t14d3.jotter.model.Timestamps;
import de.t14d3.jotter.model.User;
import de.t14d3.jotter.store.NoteStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Function;

/**
 * In-memory mirror of the note store, serving paged, visibility-filtered and neighbor-aware
 * views without going back to the store.
 * <p>
 * The whole cache is one {@link NoteRegistry} behind one read/write lock. Queries share the read
 * lock. Inserts and the swap to a new generation take the write lock, so no reader ever sees a
 * half-applied change. {@link #initialize()} fetches and builds the next generation without
 * holding the lock and only takes it for the swap. Notes created while a reload is fetching are
 * replayed into the new generation before it goes live.
 * <p>
 * The cache never evicts. It holds every note for the lifetime of the process.
 */
public class NoteCache {
    private static final Logger logger = LoggerFactory.getLogger(NoteCache.class);

    private final NoteStore store;
    private final int pageSize;
    private final Clock clock;

    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
    private final ReentrantLock reloadLock = new ReentrantLock();

    // guarded by lock
    private NoteRegistry registry;
    private long generation;
    private List<Note> createdDuringReload;

    public NoteCache(NoteStore store, int pageSize) {
        this(store, pageSize, Clock.systemDefaultZone());
    }

    public NoteCache(NoteStore store, int pageSize, Clock clock) {
        if (pageSize <= 0) {
            throw new IllegalArgumentException("pageSize must be positive but was " + pageSize);
        }
        this.store = Objects.requireNonNull(store, "store");
        this.pageSize = pageSize;
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * Loads a new generation from the store and makes it the one being served.
     * <p>
     * On failure the previous generation, if there is one, keeps serving.
     *
     * @throws LoadFailureException if either listing fails or a note references an unknown user
     */
    public void initialize() {
        reloadLock.lock();
        try {
            withWriteLock(() -> createdDuringReload = new ArrayList<>());
            boolean swapped = false;
            try {
                NoteRegistry staged = fetchGeneration();
                withWriteLock(() -> {
                    for (Note note : createdDuringReload) {
                        staged.insert(note);
                    }
                    registry = staged;
                    generation++;
                    createdDuringReload = null;
                });
                swapped = true;
                logger.info("Note cache generation {} loaded: {} users, {} notes, {} public",
                        generation(), staged.userCount(), staged.noteCount(), staged.publicCount());
            } finally {
                if (!swapped) {
                    withWriteLock(() -> createdDuringReload = null);
                }
            }
        } finally {
            reloadLock.unlock();
        }
    }

    private NoteRegistry fetchGeneration() {
        List<User> users;
        List<Note> notes;
        try {
            users = store.listUsers();
            notes = store.listNotes();
        } catch (RuntimeException e) {
            throw new LoadFailureException("Failed to list users and notes from the store", e);
        }
        return NoteRegistry.build(users, notes);
    }

    /**
     * Persists a new note, then adds it to the cache. Store failures propagate unchanged and leave
     * the cache untouched.
     *
     * @return the id the store assigned to the note
     */
    public long createNote(long ownerId, String content, boolean isPrivate) {
        Objects.requireNonNull(content, "content");
        requireInitialized();
        String now = Timestamps.now(clock);
        long id = store.insertNote(ownerId, content, isPrivate, now);

        Note note = new Note(id, ownerId, content, isPrivate, now, now);
        Optional<Note> stored = write(current -> {
            Optional<Note> added = current.insert(note);
            if (createdDuringReload != null) {
                createdDuringReload.add(note);
            }
            return added;
        });
        if (stored.isEmpty()) {
            logger.debug("Note {} was already cached", id);
        } else if (stored.get().getOwnerName() == null) {
            logger.warn("Note {} cached for user {} who is not in the cache", id, ownerId);
        }
        return id;
    }

    /**
     * Page {@code page} (zero-based) of public notes, newest first, or empty when out of range.
     */
    public Optional<NotePage> page(int page) {
        return read(current -> NoteQueries.page(current, page, pageSize));
    }

    public Optional<NotePage> topPage() {
        return page(0);
    }

    /**
     * Every note of a user, private ones included, newest first. Not paged.
     */
    public List<Note> userNotes(long userId) {
        return read(current -> NoteQueries.userNotes(current, userId));
    }

    /**
     * The note and its older/newer neighbors, as seen by {@code requesterId} ({@code null} for an
     * anonymous request). Empty when the note does not exist or is private to someone else.
     */
    public Optional<NoteContext> noteWithContext(long noteId, Long requesterId) {
        return read(current -> NoteQueries.noteWithContext(current, noteId, requesterId));
    }

    public Optional<Note> note(long noteId) {
        return read(current -> current.get(noteId));
    }

    public Optional<User> user(long userId) {
        return read(current -> current.user(userId));
    }

    public Optional<User> userByName(String username) {
        return read(current -> current.userByName(username));
    }

    public int publicCount() {
        return read(NoteRegistry::publicCount);
    }

    public int noteCount() {
        return read(NoteRegistry::noteCount);
    }

    public int userCount() {
        return read(NoteRegistry::userCount);
    }

    public int pageSize() {
        return pageSize;
    }

    /**
     * Number of generations loaded so far; 0 before the first successful {@link #initialize()}.
     */
    public long generation() {
        lock.readLock().lock();
        try {
            return generation;
        } finally {
            lock.readLock().unlock();
        }
    }

    private <T> T read(Function<NoteRegistry, T> query) {
        lock.readLock().lock();
        try {
            return query.apply(current());
        } finally {
            lock.readLock().unlock();
        }
    }

    private <T> T write(Function<NoteRegistry, T> mutation) {
        lock.writeLock().lock();
        try {
            return mutation.apply(current());
        } finally {
            lock.writeLock().unlock();
        }
    }

    private void withWriteLock(Runnable action) {
        lock.writeLock().lock();
        try {
            action.run();
        } finally {
            lock.writeLock().unlock();
        }
    }

    private void requireInitialized() {
        lock.readLock().lock();
        try {
            current();
        } finally {
            lock.readLock().unlock();
        }
    }

    private NoteRegistry current() {
        if (registry == null) {
            throw new IllegalStateException("Note cache has not been initialized");
        }
        return registry;
    }
}
