package org.astbridge.symbolic;

import org.astbridge.ast.AstContext;
import org.astbridge.ast.AbstractNode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class InMemorySymbolicEngineTest {

    private InMemorySymbolicEngine engine;

    @BeforeEach
    void setUp() {
        engine = new InMemorySymbolicEngine();
    }

    @Test
    @DisplayName("变量按 SymVar_<id> 命名，id 从 0 递增")
    void testNewSymbolicVariable_Naming() {
        SymbolicVariable a = engine.newSymbolicVariable(8);
        SymbolicVariable b = engine.newSymbolicVariable(32, "rax");

        assertAll(
                () -> assertEquals(0, a.getId()),
                () -> assertEquals("SymVar_0", a.getName()),
                () -> assertEquals("SymVar_1", b.getName()),
                () -> assertEquals(32, b.getBitSize()),
                () -> assertEquals("rax", b.getComment()),
                () -> assertEquals("", a.getComment())
        );
    }

    @Test
    @DisplayName("按 id 解析变量和表达式，未知 id 返回 null")
    void testResolution() {
        SymbolicVariable v = engine.newSymbolicVariable(8);
        AbstractNode root = new AstContext().bv(1, 8);
        SymbolicExpression e = engine.newSymbolicExpression(root, "flag");

        assertSame(v, engine.getSymbolicVariableFromId(v.getId()));
        assertSame(e, engine.getSymbolicExpressionFromId(e.getId()));
        assertSame(root, e.getAst());
        assertNull(engine.getSymbolicVariableFromId(99));
        assertNull(engine.getSymbolicExpressionFromId(99));
    }

    @Test
    @DisplayName("移除后的变量不再可解析")
    void testRemoveSymbolicVariable() {
        SymbolicVariable v = engine.newSymbolicVariable(8);

        engine.removeSymbolicVariable(v.getId());

        assertNull(engine.getSymbolicVariableFromId(v.getId()));
        assertTrue(engine.getSymbolicVariables().isEmpty());
        assertDoesNotThrow(() -> engine.removeSymbolicVariable(v.getId()));
    }

    @Test
    @DisplayName("非法位宽被拒绝")
    void testInvalidSize() {
        assertThrows(IllegalArgumentException.class, () -> engine.newSymbolicVariable(0));
        assertThrows(NullPointerException.class, () -> engine.newSymbolicExpression(null));
    }

    @Test
    @DisplayName("返回的映射不可修改")
    void testMapsAreUnmodifiable() {
        SymbolicVariable v = engine.newSymbolicVariable(8);

        assertThrows(UnsupportedOperationException.class,
                () -> engine.getSymbolicVariables().put(5L, v));
    }
}
