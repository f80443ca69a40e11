package com.starscape.tasktrack.common.domain;

import java.io.Serializable;
import java.util.Objects;

/**
 * Base type for persistent domain entities. Identity is the id alone;
 * entities without an id yet are only equal to themselves.
 */
public abstract class Entity<ID extends Serializable> {
    
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
        return getClass().hashCode();
    }
}
