package org.astbridge.solver.z3;

import com.microsoft.z3.BitVecExpr;
import com.microsoft.z3.BitVecNum;
import com.microsoft.z3.BoolExpr;
import com.microsoft.z3.Expr;
import com.microsoft.z3.Model;
import com.microsoft.z3.Solver;
import com.microsoft.z3.Status;
import org.astbridge.ast.AbstractNode;
import org.astbridge.ast.AstContext;
import org.astbridge.ast.NodeKind;
import org.astbridge.ast.VariableNode;
import org.astbridge.exceptions.SortMismatchException;
import org.astbridge.symbolic.InMemorySymbolicEngine;
import org.astbridge.translation.AstTranslator;
import org.astbridge.translation.TranslationOptions;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;

import static org.junit.jupiter.api.Assertions.*;

class Z3SolverBackendTest {

    private Z3SolverBackend backend;
    private InMemorySymbolicEngine engine;
    private AstContext ast;

    @BeforeEach
    void setUp() {
        backend = new Z3SolverBackend();
        engine = new InMemorySymbolicEngine();
        ast = new AstContext();
    }

    @AfterEach
    void tearDown() {
        ast.getGarbageCollector().close();
        backend.close();
    }

    private Expr<?> translate(AbstractNode root, boolean concretize) {
        return new AstTranslator<>(engine, backend, TranslationOptions.of(concretize)).translate(root);
    }

    private static BitVecNum asNumeral(Expr<?> expr) {
        return assertInstanceOf(BitVecNum.class, expr.simplify());
    }

    @Nested
    @DisplayName("翻译到 Z3 (Translation to Z3)")
    class TranslationTests {

        @Test
        @DisplayName("extract(7, 0, bv(0x1234, 16)) 化简为 8 位的 0x34")
        void testExtract() {
            Expr<?> result = translate(ast.extract(7, 0, ast.bv(0x1234, 16)), false);

            BitVecNum value = asNumeral(result);
            assertEquals(0x34, value.getLong());
            assertEquals(8, value.getSortSize());
            assertEquals(0x34, backend.getUintValue(result));
        }

        @Test
        @DisplayName("concat 的第一个子节点是最低有效部分")
        void testConcat() {
            Expr<?> result = translate(ast.concat(ast.bv(0x01, 8), ast.bv(0x02, 8)), false);

            BitVecNum value = asNumeral(result);
            assertEquals(0x0201, value.getLong());
            assertEquals(16, value.getSortSize());
        }

        @Test
        @DisplayName("具体化模式下变量被替换为当前具体值")
        void testVariable_Concretized() {
            VariableNode x = ast.variable(engine.newSymbolicVariable(8));
            x.setConcreteValue(BigInteger.valueOf(5));

            Expr<?> result = translate(x, true);

            assertTrue(result.isNumeral());
            assertEquals(5, asNumeral(result).getLong());
            assertEquals(8, ((BitVecExpr) result).getSortSize());
        }

        @Test
        @DisplayName("符号模式下变量成为以变量名命名的自由常量")
        void testVariable_Symbolic() {
            VariableNode x = ast.variable(engine.newSymbolicVariable(8));

            Expr<?> result = translate(x, false);

            assertTrue(result.isConst());
            assertEquals("SymVar_0", result.toString());
            assertSame(result, backend.getVariableManager().getVariables().get("SymVar_0"));
        }

        @Test
        @DisplayName("翻译出的约束可被 Z3 求解：x + 1 == 3 得到 x = 2")
        void testSolve() {
            VariableNode x = ast.variable(engine.newSymbolicVariable(8));
            AbstractNode constraint = ast.equal(ast.operator(NodeKind.BVADD, x, ast.bv(1, 8)), ast.bv(3, 8));

            BoolExpr formula = (BoolExpr) translate(constraint, false);
            Solver solver = backend.getCtx().mkSolver();
            solver.add(formula);

            assertEquals(Status.SATISFIABLE, solver.check());
            Model model = solver.getModel();
            Expr<?> value = model.eval(backend.getVariableManager().getZ3Var("SymVar_0", 8), true);
            assertEquals(2, asNumeral(value).getLong());
        }

        @Test
        @DisplayName("LET 绑定在 body 中可见")
        void testLet() {
            AbstractNode body = ast.operator(NodeKind.BVADD, ast.string("t"), ast.string("t"));
            Expr<?> result = translate(ast.let("t", ast.bv(21, 8), body), false);

            assertEquals(42, backend.getUintValue(result));
        }

        @Test
        @DisplayName("ITE 按布尔条件选择分支")
        void testIte() {
            AbstractNode cond = ast.operator(NodeKind.BVULT, ast.bv(1, 8), ast.bv(2, 8));
            Expr<?> result = translate(ast.ite(cond, ast.bv(10, 8), ast.bv(20, 8)), false);

            assertEquals(10, backend.getUintValue(result));
        }

        @Test
        @DisplayName("LAND/LOR/LNOT 组合布尔结果")
        void testBooleanConnectives() {
            AbstractNode t = ast.equal(ast.bv(1, 8), ast.bv(1, 8));
            AbstractNode f = ast.distinct(ast.bv(1, 8), ast.bv(1, 8));
            AbstractNode root = ast.land(t, ast.lor(f, t), ast.lnot(f));

            Expr<?> result = translate(root, false).simplify();

            assertTrue(result.isBool());
            assertTrue(result.isTrue());
        }

        @Test
        @DisplayName("旋转与扩展使用字面量参数")
        void testRotateAndExtend() {
            assertEquals(0x03, backend.getUintValue(translate(ast.bvrol(1, ast.bv(0x81, 8)), false)));
            assertEquals(0xC0, backend.getUintValue(translate(ast.bvror(1, ast.bv(0x81, 8)), false)));
            assertEquals(0xFF80, backend.getUintValue(translate(ast.sx(8, ast.bv(0x80, 8)), false)));
            assertEquals(0x0080, backend.getUintValue(translate(ast.zx(8, ast.bv(0x80, 8)), false)));
        }
    }

    @Nested
    @DisplayName("错误处理 (Error handling)")
    class FailureTests {

        @Test
        @DisplayName("非数值表达式的读回抛出 SortMismatchException")
        void testReadback_NonNumeral_ShouldThrow() {
            Expr<?> x = backend.mkVariable("SymVar_9", 8);

            assertThrows(SortMismatchException.class, () -> backend.getUintValue(x));
            assertThrows(SortMismatchException.class, () -> backend.getStringValue(x));
        }

        @Test
        @DisplayName("位向量运算的操作数为布尔时抛出 SortMismatchException")
        void testBvOperation_OnBool_ShouldThrow() {
            Expr<?> bool = backend.getCtx().mkTrue();
            Expr<?> bv = backend.mkBitVector("1", 8);

            assertThrows(SortMismatchException.class, () -> backend.bvAdd(bool, bv));
            assertThrows(SortMismatchException.class, () -> backend.and(bv, bool));
        }

        @Test
        @DisplayName("同名变量以不同位宽请求时抛出 IllegalArgumentException")
        void testVariable_WidthMismatch_ShouldThrow() {
            backend.mkVariable("SymVar_0", 8);

            assertThrows(IllegalArgumentException.class, () -> backend.mkVariable("SymVar_0", 16));
        }

        @Test
        @DisplayName("借用的 Context 在关闭后端后仍然可用")
        void testBorrowedContext_NotClosed() {
            Z3SolverBackend borrowing = new Z3SolverBackend(backend.getCtx());
            borrowing.close();

            assertDoesNotThrow(() -> backend.getCtx().mkBV(1, 8));
        }
    }
}
