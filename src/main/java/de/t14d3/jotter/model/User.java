package de.t14d3.jotter.model;

import de.t14d3.jotter.annotations.Column;
import de.t14d3.jotter.annotations.Entity;
import de.t14d3.jotter.annotations.Id;
import de.t14d3.jotter.annotations.Table;

import java.util.Objects;

/**
 * An account that owns notes. Password digest and salt are carried but never interpreted here.
 */
@Entity
@Table(name = "users")
public class User {
    @Id(generated = true)
    @Column(name = "id", nullable = false)
    private Long id;

    @Column(name = "username", nullable = false, type = "VARCHAR(255)")
    private String username;

    @Column(name = "password", nullable = false, type = "VARCHAR(255)")
    private String password;

    @Column(name = "salt", nullable = false, type = "VARCHAR(255)")
    private String salt;

    @Column(name = "last_access", type = "TIMESTAMP")
    private String lastAccess;

    public User() {}

    public User(Long id, String username, String password, String salt, String lastAccess) {
        this.id = id;
        this.username = username;
        this.password = password;
        this.salt = salt;
        this.lastAccess = lastAccess;
    }

    public Long getId() { return id; }

    public String getUsername() { return username; }

    public String getPassword() { return password; }

    public String getSalt() { return salt; }

    public String getLastAccess() { return lastAccess; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof User user)) return false;
        return Objects.equals(id, user.id)
                && Objects.equals(username, user.username)
                && Objects.equals(password, user.password)
                && Objects.equals(salt, user.salt)
                && Objects.equals(lastAccess, user.lastAccess);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, username, password, salt, lastAccess);
    }

    @Override
    public String toString() {
        return "User#" + id + "(" + username + ")";
    }
}
