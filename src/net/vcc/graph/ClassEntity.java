package net.vcc.graph;

/**
 * The fundamental entity of the typing system.
 * Every object has a class; for now, a class carries nothing but its name.
 */
public class ClassEntity extends Entity {

    public ClassEntity(String name) {
        super(name);
    }
    public ClassEntity() {
        this("");
    }

    public String getKind() {
        return "Class";
    }

}
