package com.example.timesheet.user;

import java.util.Objects;

/**
 * The user performing an operation, as supplied by the identity collaborator.
 */
public record Actor(Long id, Role role) {

    public Actor {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(role, "role");
    }

    public boolean isAdmin() {
        return role == Role.ADMIN;
    }

    public boolean is(Long userId) {
        return id.equals(userId);
    }
}
