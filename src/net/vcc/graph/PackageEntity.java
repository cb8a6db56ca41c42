package net.vcc.graph;

import java.util.List;

/**
 * The top-level entity, containing all other entities directly or
 * indirectly. Exactly one package exists per compilation.
 */
public class PackageEntity extends Entity {

    public static final String DEFAULT_NAME = "default";

    public static final String INT_CLASS = "int";

    private final EntityContainer<ClassEntity> classes;
    private final EntityContainer<FunctionEntity> functions;

    public PackageEntity(String name) {
        super(name);
        classes = new EntityContainer<ClassEntity>(this, true);
        functions = new EntityContainer<FunctionEntity>(this, true);
    }
    public PackageEntity() {
        this("");
    }

    public String getKind() {
        return "Package";
    }

    public ClassEntity getClassEntity(String name) {
        return classes.get(name);
    }
    public List<ClassEntity> getClasses() {
        return classes.getEntities();
    }
    public void addClass(ClassEntity cls) {
        classes.add(cls);
    }
    public boolean removeClass(ClassEntity cls) {
        return classes.remove(cls);
    }

    public FunctionEntity getFunction(String name) {
        return functions.get(name);
    }
    public List<FunctionEntity> getFunctions() {
        return functions.getEntities();
    }
    public void addFunction(FunctionEntity func) {
        functions.add(func);
    }
    public boolean removeFunction(FunctionEntity func) {
        return functions.remove(func);
    }

    public Entity findById(long id) {
        Entity ret = super.findById(id);
        if (ret == null) ret = classes.findById(id);
        if (ret == null) ret = functions.findById(id);
        return ret;
    }

    /**
     * Create the package every compilation starts out with: named
     * "default", holding the built-in class "int".
     */
    public static PackageEntity createDefault() {
        PackageEntity ret = new PackageEntity(DEFAULT_NAME);
        ret.addClass(new ClassEntity(INT_CLASS));
        return ret;
    }

}
