package de.t14d3.jotter.cache;

import de.t14d3.jotter.model.Note;

import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.function.Predicate;

/**
 * Read-only queries over a {@link NoteRegistry}. Callers hold the registry's read lock.
 * <p>
 * Every listing uses {@link #NEWEST_FIRST}. Notes created in the same second are ordered by
 * descending id, which for store-generated ids means insertion order.
 */
public final class NoteQueries {
    public static final Comparator<Note> NEWEST_FIRST = Comparator.comparing(Note::getCreatedAt)
            .thenComparing(Note::getId)
            .reversed();

    private NoteQueries() {
    }

    /**
     * Page {@code page} of public notes, or empty when the page starts at or past the last public
     * note. A negative page is never found.
     */
    public static Optional<NotePage> page(NoteRegistry registry, int page, int pageSize) {
        int total = registry.publicCount();
        long start = (long) page * pageSize;
        if (page < 0 || start >= total) {
            return Optional.empty();
        }
        List<Note> recent = sorted(registry, Note::isPublic);
        int from = (int) start;
        int to = Math.min(from + pageSize, recent.size());
        List<Note> slice = recent.subList(from, to);
        return Optional.of(new NotePage(page, slice, total, from + 1, from + slice.size()));
    }

    /**
     * Every note of one user, private ones included, newest first.
     */
    public static List<Note> userNotes(NoteRegistry registry, long userId) {
        return sorted(registry, note -> note.getOwnerId() == userId);
    }

    /**
     * The note with its neighbors, or empty when it does not exist or the requester may not see it.
     * A private note is visible to its owner only. The neighbors come from the public notes, plus
     * the owner's private notes when the owner is the requester.
     */
    public static Optional<NoteContext> noteWithContext(NoteRegistry registry, long noteId, Long requesterId) {
        Optional<Note> found = registry.get(noteId);
        if (found.isEmpty()) {
            return Optional.empty();
        }
        Note note = found.get();
        boolean ownerIsAsking = note.isOwnedBy(requesterId);
        if (note.isPrivate() && !ownerIsAsking) {
            return Optional.empty();
        }

        Predicate<Note> visible = ownerIsAsking
                ? candidate -> candidate.isPublic() || candidate.getOwnerId().equals(note.getOwnerId())
                : Note::isPublic;

        // Single pass: the closest note on either side of `note` in NEWEST_FIRST order.
        Note older = null;
        Note newer = null;
        for (Note candidate : registry.notes()) {
            if (candidate.getId().equals(note.getId()) || !visible.test(candidate)) {
                continue;
            }
            int order = NEWEST_FIRST.compare(candidate, note);
            if (order > 0) {
                if (older == null || NEWEST_FIRST.compare(candidate, older) < 0) {
                    older = candidate;
                }
            } else if (newer == null || NEWEST_FIRST.compare(candidate, newer) > 0) {
                newer = candidate;
            }
        }
        return Optional.of(new NoteContext(note, Optional.ofNullable(older), Optional.ofNullable(newer)));
    }

    private static List<Note> sorted(NoteRegistry registry, Predicate<Note> filter) {
        return registry.notes().stream()
                .filter(filter)
                .sorted(NEWEST_FIRST)
                .toList();
    }
}
