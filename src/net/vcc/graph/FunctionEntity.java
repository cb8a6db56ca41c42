package net.vcc.graph;

import java.util.List;

/**
 * A grouping of program logic.
 *
 * Functions accept parameters (the objects they contain, in declaration
 * order) and may return an object of their return class to the caller.
 * The body is an ordered list of statements.
 */
public class FunctionEntity extends Entity {

    private final EntityContainer<ObjectEntity> objects;
    private final EntityContainer<Statement> statements;
    private ReturnType returnType;
    private ClassEntity returnClass;

    public FunctionEntity(String name) {
        super(name);
        objects = new EntityContainer<ObjectEntity>(this, true);
        statements = new EntityContainer<Statement>(this, false);
        returnType = ReturnType.NONE;
        returnClass = null;
    }
    public FunctionEntity() {
        this("");
    }

    public String getKind() {
        return "Function";
    }

    public ReturnType getReturnType() {
        return returnType;
    }
    public void setReturnType(ReturnType rt) {
        if (rt == null)
            throw new NullPointerException("Return type may not be null");
        returnType = rt;
    }

    /**
     * The class of the returned object.
     * Not applicable (and normally null) for ReturnType.NONE. This is a
     * reference, not ownership; the class belongs to its package.
     */
    public ClassEntity getReturnClass() {
        return returnClass;
    }
    public void setReturnClass(ClassEntity cls) {
        returnClass = cls;
    }

    /**
     * Make this function return objects of cls by value.
     */
    public void returnsValue(ClassEntity cls) {
        if (cls == null)
            throw new NullPointerException("Return class may not be null");
        setReturnType(ReturnType.VALUE);
        setReturnClass(cls);
    }

    public ObjectEntity getObject(String name) {
        return objects.get(name);
    }
    public List<ObjectEntity> getObjects() {
        return objects.getEntities();
    }
    public void addObject(ObjectEntity obj) {
        objects.add(obj);
    }
    public boolean removeObject(ObjectEntity obj) {
        return objects.remove(obj);
    }

    public List<Statement> getStatements() {
        return statements.getEntities();
    }
    public void addStatement(Statement stmt) {
        statements.add(stmt);
    }
    public boolean removeStatement(Statement stmt) {
        return statements.remove(stmt);
    }

    public Entity findById(long id) {
        Entity ret = super.findById(id);
        if (ret == null) ret = objects.findById(id);
        if (ret == null) ret = statements.findById(id);
        return ret;
    }

}
