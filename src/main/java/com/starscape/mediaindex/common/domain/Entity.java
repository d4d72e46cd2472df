package com.starscape.mediaindex.common.domain;

import org.hibernate.Hibernate;

import java.io.Serializable;
import java.util.Objects;

/**
 * Base type for domain entities with a stable business identity.
 * Equality is based on {@link #getId()}, never on the storage row key.
 * <p>
 * The id is assigned at first save, so the hash code depends only on the
 * entity type and stays the same across persist. Hibernate proxies compare
 * equal to the entity they stand for.
 */
public abstract class Entity<ID extends Serializable> {
    
    protected Entity() {
        // JPA and subclass constructor
    }
    
    public abstract ID getId();
    
    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || Hibernate.getClass(this) != Hibernate.getClass(o)) return false;
        Entity<?> that = (Entity<?>) o;
        ID id = getId();
        return id != null && Objects.equals(id, that.getId());
    }
    
    @Override
    public int hashCode() {
        return Hibernate.getClass(this).hashCode();
    }
}
