package de.t14d3.jotter.cache;

import de.t14d3.jotter.model.Note;

import java.util.List;

/**
 * One page of recent public notes.
 *
 * @param page      zero-based page index
 * @param notes     the notes on the page, newest first
 * @param total     number of public notes in the cache
 * @param pageStart one-based position of the first note on the page
 * @param pageEnd   one-based position of the last note on the page
 */
public record NotePage(int page, List<Note> notes, int total, int pageStart, int pageEnd) {
    public NotePage {
        notes = List.copyOf(notes);
    }
}
