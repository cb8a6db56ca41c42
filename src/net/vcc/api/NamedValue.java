package net.vcc.api;

/**
 * A generic interface for marking objects with textual names.
 */
public interface NamedValue {

    /**
     * The name of this object.
     * May be empty for anonymous objects, but never null.
     */
    String getName();

}
