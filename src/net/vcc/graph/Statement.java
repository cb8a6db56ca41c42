package net.vcc.graph;

/**
 * The fundamental execution unit of a function body.
 * The set of variants is closed; see {@link StatementVisitor}.
 */
public abstract class Statement extends Entity {

    protected Statement() {
        super();
    }

    public abstract <R> R accept(StatementVisitor<R> visitor);

}
