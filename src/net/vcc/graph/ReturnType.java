package net.vcc.graph;

/**
 * Return semantics of a function.
 */
public enum ReturnType {
    // The function returns no objects
    NONE("none"),
    // The function returns an object by value (a copy is made)
    VALUE("value");

    private final String displayName;

    private ReturnType(String displayName) {
        this.displayName = displayName;
    }

    public String toString() {
        return displayName;
    }

}
