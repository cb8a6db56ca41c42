package net.vcc.graph;

/**
 * Raised when adding an entity to a name-unique container that already
 * holds an entity of the same name.
 */
public class DuplicateEntityException extends IllegalArgumentException {

    private final Entity container;
    private final String entityName;

    public DuplicateEntityException(Entity container, String entityName) {
        super("Duplicate name \"" + entityName + "\" in " + container);
        this.container = container;
        this.entityName = entityName;
    }

    public Entity getContainer() {
        return container;
    }

    public String getEntityName() {
        return entityName;
    }

}
