package com.starscape.contacts.common.domain;

import java.io.Serializable;
import java.util.Objects;

/**
 * Base class for identifiable domain objects. Identity is the application-assigned id,
 * so equality holds before and after the object is persisted.
 */
public abstract class Entity<ID extends Serializable> {

    protected Entity() {
        // JPA constructor
    }

    protected Entity(ID id) {
        Objects.requireNonNull(id, "id");
    }

    public abstract ID getId();

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        Entity<?> other = (Entity<?>) o;
        return getId() != null && getId().equals(other.getId());
    }

    @Override
    public int hashCode() {
        return getClass().hashCode();
    }
}
