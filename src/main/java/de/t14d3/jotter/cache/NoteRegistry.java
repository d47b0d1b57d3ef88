package de.t14d3.jotter.cache;

import de.t14d3.jotter.exceptions.LoadFailureException;
import de.t14d3.jotter.model.Note;
import de.t14d3.jotter.model.User;

import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * One generation of cached users and notes.
 * <p>
 * Not thread-safe. {@link NoteCache} owns the live instance and only touches it under its lock.
 * A registry only grows: notes are added, never removed or replaced.
 */
public final class NoteRegistry {
    private final Map<Long, User> users = new HashMap<>();
    private final Map<String, User> usersByName = new HashMap<>();
    private final Map<Long, Note> notes = new HashMap<>();
    private int publicCount;

    /**
     * Builds a registry from full listings of the store.
     *
     * @throws LoadFailureException if a row has no id or a note's owner is not among {@code users}
     */
    public static NoteRegistry build(List<User> users, List<Note> notes) {
        NoteRegistry registry = new NoteRegistry();
        for (User user : users) {
            if (user.getId() == null) {
                throw new LoadFailureException("User row without id: " + user);
            }
            registry.users.put(user.getId(), user);
            registry.usersByName.putIfAbsent(user.getUsername(), user);
        }
        for (Note note : notes) {
            if (note.getId() == null) {
                throw new LoadFailureException("Note row without id: " + note);
            }
            if (!registry.users.containsKey(note.getOwnerId())) {
                throw new LoadFailureException("Note " + note.getId() + " references unknown user " + note.getOwnerId());
            }
            registry.insert(note);
        }
        registry.publicCount = (int) registry.notes.values().stream().filter(Note::isPublic).count();
        return registry;
    }

    /**
     * Adds a note unless one with the same id is already present. The owner's current name is
     * copied onto the stored note when the owner is known.
     *
     * @return the stored note, or empty if the id was already taken
     */
    public Optional<Note> insert(Note note) {
        if (notes.containsKey(note.getId())) {
            return Optional.empty();
        }
        User owner = users.get(note.getOwnerId());
        Note stored = owner == null ? note : note.withOwnerName(owner.getUsername());
        notes.put(stored.getId(), stored);
        if (stored.isPublic()) {
            publicCount++;
        }
        return Optional.of(stored);
    }

    public Optional<Note> get(long id) {
        return Optional.ofNullable(notes.get(id));
    }

    public Optional<User> user(long id) {
        return Optional.ofNullable(users.get(id));
    }

    public Optional<User> userByName(String username) {
        return Optional.ofNullable(usersByName.get(username));
    }

    public int publicCount() {
        return publicCount;
    }

    public int noteCount() {
        return notes.size();
    }

    public int userCount() {
        return users.size();
    }

    /**
     * Read-only view of every note, in no particular order.
     */
    Collection<Note> notes() {
        return Collections.unmodifiableCollection(notes.values());
    }
}
