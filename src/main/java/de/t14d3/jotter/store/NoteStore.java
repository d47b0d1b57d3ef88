package de.t14d3.jotter.store;

import de.t14d3.jotter.model.Note;
import de.t14d3.jotter.model.User;

import java.util.List;

/**
 * The persisted store the note cache mirrors.
 * <p>
 * Implementations report failures with unchecked exceptions, normally
 * {@link de.t14d3.jotter.exceptions.StoreException}.
 */
public interface NoteStore {

    /**
     * Every user row.
     */
    List<User> listUsers();

    /**
     * Every note row. The returned notes carry no owner name.
     */
    List<Note> listNotes();

    /**
     * Inserts a note and returns the id the store generated for it. {@code createdAt} is also used
     * as the update timestamp. Fails if the owner does not exist.
     */
    long insertNote(long ownerId, String content, boolean isPrivate, String createdAt);

    /**
     * Records that a user signed in at {@code at}.
     */
    void touchLastAccess(long userId, String at);
}
