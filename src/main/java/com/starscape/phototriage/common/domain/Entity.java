package com.starscape.phototriage.common.domain;

import java.io.Serializable;
import java.util.Objects;

/**
 * Base type for domain entities. Identity is defined by {@link #getId()} alone.
 */
public abstract class Entity<ID extends Serializable> {

    protected Entity() {
        // JPA constructor
    }

    protected Entity(ID id) {
        if (id == null) {
            throw new IllegalArgumentException("Entity ID cannot be null");
        }
    }

    public abstract ID getId();

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Entity<?> other = (Entity<?>) o;
        return getId() != null && Objects.equals(getId(), other.getId());
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(getId());
    }
}
