package de.t14d3.jotter.store;

import de.t14d3.jotter.connection.QueryExecutor;
import de.t14d3.jotter.exceptions.StoreException;
import de.t14d3.jotter.mapping.EntityMetadata;
import de.t14d3.jotter.model.Note;
import de.t14d3.jotter.model.User;

import java.util.List;

/**
 * {@link NoteStore} over the {@code users} and {@code notes} tables.
 */
public class JdbcNoteStore implements NoteStore {
    private final QueryExecutor executor;
    private final String insertNoteSql;
    private final String touchUserSql;

    public JdbcNoteStore(QueryExecutor executor) {
        this.executor = executor;
        this.insertNoteSql = String.format(
                "INSERT INTO %s (user_id, content, is_private, created_at, updated_at) VALUES (?, ?, ?, ?, ?)",
                EntityMetadata.of(Note.class).getTableName());
        this.touchUserSql = String.format("UPDATE %s SET last_access = ? WHERE id = ?",
                EntityMetadata.of(User.class).getTableName());
    }

    @Override
    public List<User> listUsers() {
        return executor.findAll(User.class);
    }

    @Override
    public List<Note> listNotes() {
        return executor.findAll(Note.class);
    }

    @Override
    public long insertNote(long ownerId, String content, boolean isPrivate, String createdAt) {
        return executor.executeInsert(insertNoteSql,
                List.of(ownerId, content, isPrivate ? 1 : 0, createdAt, createdAt));
    }

    @Override
    public void touchLastAccess(long userId, String at) {
        int updated = executor.executeUpdate(touchUserSql, List.of(at, userId));
        if (updated == 0) {
            throw new StoreException("No user with id " + userId);
        }
    }
}
