package de.t14d3.jotter.cache;

import de.t14d3.jotter.model.Note;

import java.util.Objects;
import java.util.Optional;

/**
 * A note with its neighbors among the notes the requester may see.
 *
 * @param note  the requested note
 * @param older the next note going back in time, if any
 * @param newer the next note going forward in time, if any
 */
public record NoteContext(Note note, Optional<Note> older, Optional<Note> newer) {
    public NoteContext {
        Objects.requireNonNull(note, "note");
        Objects.requireNonNull(older, "older");
        Objects.requireNonNull(newer, "newer");
    }
}
