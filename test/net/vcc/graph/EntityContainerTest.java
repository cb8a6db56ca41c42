package net.vcc.graph;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

public class EntityContainerTest {

    @Test
    public void preservesInsertionOrder() {
        FunctionEntity f = new FunctionEntity("f");
        f.addObject(new ObjectEntity("z", null));
        f.addObject(new ObjectEntity("a", null));
        f.addObject(new ObjectEntity("m", null));
        assertEquals("z", f.getObjects().get(0).getName());
        assertEquals("a", f.getObjects().get(1).getName());
        assertEquals("m", f.getObjects().get(2).getName());
    }

    @Test
    public void uniqueContainersRejectDuplicateNames() {
        PackageEntity pkg = PackageEntity.createDefault();
        DuplicateEntityException exc = assertThrows(
            DuplicateEntityException.class,
            () -> pkg.addClass(new ClassEntity("int")));
        assertSame(pkg, exc.getContainer());
        assertEquals("int", exc.getEntityName());
        assertEquals(1, pkg.getClasses().size());
    }

    @Test
    public void otherContainersAllowRepeatedNames() {
        FunctionEntity f = new FunctionEntity("f");
        f.addStatement(new ReturnStatement());
        f.addStatement(new ReturnStatement());
        assertEquals(2, f.getStatements().size());
    }

    @Test
    public void addingSetsParentAndRemovingClearsIt() {
        PackageEntity pkg = new PackageEntity("p");
        FunctionEntity f = new FunctionEntity("f");
        assertNull(f.getParent());
        pkg.addFunction(f);
        assertSame(pkg, f.getParent());
        assertSame(f, pkg.getFunction("f"));
        assertTrue(pkg.removeFunction(f));
        assertNull(f.getParent());
        assertNull(pkg.getFunction("f"));
        assertFalse(pkg.removeFunction(f));
    }

    @Test
    public void removingObjectFreesItsName() {
        FunctionEntity f = new FunctionEntity("f");
        ObjectEntity a = new ObjectEntity("a", null);
        f.addObject(a);
        assertThrows(DuplicateEntityException.class,
                     () -> f.addObject(new ObjectEntity("a", null)));
        assertTrue(f.removeObject(a));
        assertNull(a.getParent());
        assertNull(f.getObject("a"));
        ObjectEntity other = new ObjectEntity("a", null);
        f.addObject(other);
        assertSame(other, f.getObject("a"));
        assertFalse(f.removeObject(a));
    }

    @Test
    public void removingStatementKeepsTheRestInOrder() {
        FunctionEntity f = new FunctionEntity("f");
        ReturnStatement first = new ReturnStatement();
        ReturnStatement second = new ReturnStatement();
        ReturnStatement third = new ReturnStatement();
        f.addStatement(first);
        f.addStatement(second);
        f.addStatement(third);
        assertTrue(f.removeStatement(second));
        assertNull(second.getParent());
        assertEquals(2, f.getStatements().size());
        assertSame(first, f.getStatements().get(0));
        assertSame(third, f.getStatements().get(1));
        assertFalse(f.removeStatement(second));
    }

    @Test
    public void removedOperandCanMoveElsewhere() {
        OperatorExpression sum = new OperatorExpression(OperatorType.PLUS);
        ObjectExpression a = new ObjectExpression();
        sum.addOperand(a);
        sum.addOperand(new ObjectExpression());
        assertTrue(sum.isComplete());
        assertTrue(sum.removeOperand(a));
        assertFalse(sum.isComplete());
        assertNull(a.getParent());
        ReturnStatement ret = new ReturnStatement();
        ret.setExpression(a);
        assertSame(ret, a.getParent());
        assertFalse(sum.removeOperand(a));
    }

    @Test
    public void entitiesHaveASingleOwner() {
        PackageEntity p1 = new PackageEntity("p1");
        PackageEntity p2 = new PackageEntity("p2");
        ClassEntity cls = new ClassEntity("c");
        p1.addClass(cls);
        assertThrows(IllegalArgumentException.class, () -> p2.addClass(cls));
        assertFalse(p2.removeClass(cls));
        assertTrue(p1.removeClass(cls));
        p2.addClass(cls);
        assertSame(p2, cls.getParent());
    }

    @Test
    public void cyclesAreRejected() {
        OperatorExpression outer = new OperatorExpression(OperatorType.PLUS);
        OperatorExpression inner = new OperatorExpression(OperatorType.PLUS);
        assertThrows(IllegalArgumentException.class,
                     () -> outer.addOperand(outer));
        outer.addOperand(inner);
        assertThrows(IllegalArgumentException.class,
                     () -> inner.addOperand(outer));
        assertTrue(outer.isAncestorOf(inner));
        assertFalse(inner.isAncestorOf(outer));
    }

    @Test
    public void attachedEntitiesCannotBeRenamed() {
        PackageEntity pkg = PackageEntity.createDefault();
        ClassEntity cls = pkg.getClassEntity("int");
        assertThrows(IllegalStateException.class, () -> cls.setName("long"));
        cls.setName("int");
        pkg.removeClass(cls);
        cls.setName("long");
        pkg.addClass(cls);
        assertSame(cls, pkg.getClassEntity("long"));
        assertThrows(NullPointerException.class, () -> cls.setName(null));
    }

    @Test
    public void viewsAreReadOnly() {
        PackageEntity pkg = PackageEntity.createDefault();
        assertThrows(UnsupportedOperationException.class,
                     () -> pkg.getClasses().clear());
        assertThrows(UnsupportedOperationException.class,
                     () -> pkg.getFunctions().add(new FunctionEntity("f")));
    }

    @Test
    public void returnStatementOwnsItsExpression() {
        ReturnStatement ret = new ReturnStatement();
        ObjectExpression first = new ObjectExpression();
        ObjectExpression second = new ObjectExpression();
        ret.setExpression(first);
        assertSame(ret, first.getParent());
        ret.setExpression(second);
        assertNull(first.getParent());
        assertSame(ret, second.getParent());
        ReturnStatement other = new ReturnStatement();
        assertThrows(IllegalArgumentException.class,
                     () -> other.setExpression(second));
        ret.setExpression(null);
        assertFalse(ret.hasExpression());
        assertNull(second.getParent());
    }

    @Test
    public void entitiesAreFoundById() {
        PackageEntity pkg = PackageEntity.createDefault();
        FunctionEntity f = new FunctionEntity("f");
        ObjectEntity a = new ObjectEntity("a", pkg.getClassEntity("int"));
        f.addObject(a);
        OperatorExpression sum = new OperatorExpression(OperatorType.PLUS);
        ObjectExpression ref = new ObjectExpression(a);
        sum.addOperand(ref);
        sum.addOperand(new ObjectExpression(a));
        f.addStatement(new ReturnStatement(sum));
        pkg.addFunction(f);

        assertSame(pkg, pkg.findById(pkg.getId()));
        assertSame(a, pkg.findById(a.getId()));
        assertSame(ref, pkg.findById(ref.getId()));
        assertSame(pkg.getClassEntity("int"),
                   pkg.findById(pkg.getClassEntity("int").getId()));
        assertNull(f.findById(pkg.getId()));
        assertNull(pkg.findById(-1));
    }

    @Test
    public void idsAreDistinctAndIncreasing() {
        ClassEntity first = new ClassEntity("a");
        ClassEntity second = new ClassEntity("a");
        assertTrue(second.getId() > first.getId());
    }

    @Test
    public void defaultPackageHoldsIntClass() {
        PackageEntity pkg = PackageEntity.createDefault();
        assertEquals(PackageEntity.DEFAULT_NAME, pkg.getName());
        assertEquals(1, pkg.getClasses().size());
        ClassEntity cls = pkg.getClasses().get(0);
        assertEquals("int", cls.getName());
        assertSame(pkg, cls.getParent());
    }

    @Test
    public void expressionsVisitAsStatements() {
        Statement stmt = new ObjectExpression();
        String kind = stmt.accept(new StatementVisitor<String>() {
            public String visitReturn(ReturnStatement s) {
                return "return";
            }
            public String visitExpression(Expression e) {
                return "expression";
            }
        });
        assertEquals("expression", kind);
    }

}
