package de.t14d3.jotter.model;

import de.t14d3.jotter.annotations.Column;
import de.t14d3.jotter.annotations.Entity;
import de.t14d3.jotter.annotations.Id;
import de.t14d3.jotter.annotations.Table;

import java.util.Objects;

/**
 * A note as stored in the {@code notes} table, plus the owner's display name.
 * <p>
 * Instances handed out by the cache are never changed afterwards. {@code ownerName} is not a
 * column: it is copied from the owning {@link User} when the note enters a registry and is not
 * refreshed if that user is renamed later.
 */
@Entity
@Table(name = "notes")
public class Note {
    @Id(generated = true)
    @Column(name = "id", nullable = false)
    private Long id;

    @Column(name = "user_id", nullable = false, references = "users")
    private Long ownerId;

    @Column(name = "content", type = "TEXT")
    private String content;

    @Column(name = "is_private", nullable = false, type = "TINYINT")
    private boolean isPrivate;

    @Column(name = "created_at", nullable = false, type = "TIMESTAMP")
    private String createdAt;

    @Column(name = "updated_at", type = "TIMESTAMP")
    private String updatedAt;

    private String ownerName;

    public Note() {}

    public Note(Long id, Long ownerId, String content, boolean isPrivate, String createdAt, String updatedAt) {
        this(id, ownerId, content, isPrivate, createdAt, updatedAt, null);
    }

    private Note(Long id, Long ownerId, String content, boolean isPrivate, String createdAt, String updatedAt,
                 String ownerName) {
        this.id = id;
        this.ownerId = ownerId;
        this.content = content;
        this.isPrivate = isPrivate;
        this.createdAt = createdAt;
        this.updatedAt = updatedAt;
        this.ownerName = ownerName;
    }

    /**
     * Copy of this note carrying the given owner display name.
     */
    public Note withOwnerName(String ownerName) {
        return new Note(id, ownerId, content, isPrivate, createdAt, updatedAt, ownerName);
    }

    public Long getId() { return id; }

    public Long getOwnerId() { return ownerId; }

    public String getContent() { return content; }

    public boolean isPrivate() { return isPrivate; }

    public boolean isPublic() { return !isPrivate; }

    public String getCreatedAt() { return createdAt; }

    public String getUpdatedAt() { return updatedAt; }

    public String getOwnerName() { return ownerName; }

    public boolean isOwnedBy(Long userId) {
        return userId != null && userId.equals(ownerId);
    }

    /**
     * The content up to the first line break, used as the note's title in listings.
     */
    public String firstLine() {
        if (content == null) {
            return "";
        }
        int newline = content.indexOf('\n');
        return newline < 0 ? content : content.substring(0, newline);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Note note)) return false;
        return isPrivate == note.isPrivate
                && Objects.equals(id, note.id)
                && Objects.equals(ownerId, note.ownerId)
                && Objects.equals(content, note.content)
                && Objects.equals(createdAt, note.createdAt)
                && Objects.equals(updatedAt, note.updatedAt)
                && Objects.equals(ownerName, note.ownerName);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, ownerId, content, isPrivate, createdAt, updatedAt, ownerName);
    }

    @Override
    public String toString() {
        return "Note#" + id + "(" + (isPrivate ? "private" : "public") + ", " + createdAt + ")";
    }
}
