package net.vcc.graph;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import net.vcc.util.NamedMap;

/**
 * An ordered collection of entities owned by a single entity.
 *
 * Containers preserve insertion order. A name-unique container also
 * refuses a second child with the same name, which makes lookups by name
 * unambiguous; other containers (statements, operands) look up the first
 * child with a matching name.
 */
public class EntityContainer<E extends Entity> {

    private final Entity owner;
    private final List<E> entities;
    private final List<E> view;
    private final NamedMap<E> index;

    public EntityContainer(Entity owner, boolean uniqueNames) {
        if (owner == null)
            throw new NullPointerException(
                "Container owner may not be null");
        this.owner = owner;
        this.entities = new ArrayList<E>();
        this.view = Collections.unmodifiableList(entities);
        this.index = (uniqueNames) ? new NamedMap<E>() : null;
    }

    /**
     * Live, read-only view of the contained entities in insertion order.
     */
    public List<E> getEntities() {
        return view;
    }

    public int size() {
        return entities.size();
    }

    public boolean isEmpty() {
        return entities.isEmpty();
    }

    public boolean contains(E entity) {
        return (entity != null && entity.getParent() == owner &&
                entities.contains(entity));
    }

    /**
     * Return the contained entity called name, or null if there is none.
     */
    public E get(String name) {
        if (index != null) return index.get(name);
        for (E ent : entities) {
            if (ent.getName().equals(name)) return ent;
        }
        return null;
    }

    /**
     * Append entity, making this container's owner its parent.
     */
    public void add(E entity) {
        if (entity == null)
            throw new NullPointerException("Cannot add null entity");
        if (entity.getParent() != null)
            throw new IllegalArgumentException("Entity " + entity +
                " is already owned by " + entity.getParent());
        if (entity.isAncestorOf(owner))
            throw new IllegalArgumentException("Adding " + entity +
                " to " + owner + " would create a cycle");
        if (index != null && ! index.add(entity))
            throw new DuplicateEntityException(owner, entity.getName());
        entities.add(entity);
        entity.setParent(owner);
    }

    /**
     * Remove entity, clearing its parent.
     * Returns whether the entity was contained at all.
     */
    public boolean remove(E entity) {
        if (! contains(entity)) return false;
        entities.remove(entity);
        if (index != null) index.removeValue(entity);
        entity.setParent(null);
        return true;
    }

    Entity findById(long id) {
        for (E ent : entities) {
            Entity ret = ent.findById(id);
            if (ret != null) return ret;
        }
        return null;
    }

}
