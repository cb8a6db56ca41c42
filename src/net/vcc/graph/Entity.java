package net.vcc.graph;

import net.vcc.api.NamedValue;

/**
 * Base class of every program graph node.
 *
 * Every entity has a name (possibly empty), a numeric id that is stable
 * for its whole lifetime, and at most one parent: the container that owns
 * it. The parent edge is managed exclusively by {@link EntityContainer}
 * (and {@link ReturnStatement} for its single expression).
 *
 * Entities compare by identity.
 */
public abstract class Entity implements NamedValue {

    private static final ThreadLocal<long[]> COUNTER =
        new ThreadLocal<long[]>() {
            protected long[] initialValue() {
                return new long[1];
            }
        };

    private final long id;
    private String name;
    private Entity parent;

    protected Entity(String name) {
        this.id = ++COUNTER.get()[0];
        setName(name);
    }
    protected Entity() {
        this("");
    }

    public String toString() {
        return String.format("%s#%d[name=%s]", getKind(), getId(),
                             getName());
    }

    /**
     * A short description of the entity's variant, like "Function".
     */
    public abstract String getKind();

    public long getId() {
        return id;
    }

    public String getName() {
        return name;
    }
    /**
     * Rename this entity.
     * Only detached entities may be renamed, since name-unique containers
     * index their children by name.
     */
    public void setName(String n) {
        if (n == null)
            throw new NullPointerException("Entity name may not be null");
        if (parent != null && ! n.equals(name))
            throw new IllegalStateException("Cannot rename " + this +
                " while it is owned by " + parent);
        name = n;
    }

    public Entity getParent() {
        return parent;
    }
    void setParent(Entity p) {
        parent = p;
    }

    /**
     * Whether this entity is other or (transitively) owns it.
     */
    public boolean isAncestorOf(Entity other) {
        for (Entity e = other; e != null; e = e.getParent()) {
            if (e == this) return true;
        }
        return false;
    }

    /**
     * Find the entity with the given id among this entity and the ones it
     * owns, or null.
     */
    public Entity findById(long id) {
        return (this.id == id) ? this : null;
    }

}
