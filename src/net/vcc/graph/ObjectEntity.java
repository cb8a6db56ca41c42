package net.vcc.graph;

/**
 * A declared value, such as a function parameter.
 */
public class ObjectEntity extends Entity {

    private final ClassEntity cls;

    public ObjectEntity(String name, ClassEntity cls) {
        super(name);
        this.cls = cls;
    }
    public ObjectEntity(ClassEntity cls) {
        this("", cls);
    }
    public ObjectEntity() {
        this("", null);
    }

    public String getKind() {
        return "Object";
    }

    public ClassEntity getObjectClass() {
        return cls;
    }

}
