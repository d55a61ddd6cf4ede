package org.astbridge.solver.z3;

import com.microsoft.z3.BitVecExpr;
import com.microsoft.z3.BitVecNum;
import com.microsoft.z3.BoolExpr;
import com.microsoft.z3.Context;
import com.microsoft.z3.Expr;
import com.microsoft.z3.IntNum;
import lombok.Getter;
import org.astbridge.exceptions.SortMismatchException;
import org.astbridge.translation.SolverBackend;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigInteger;
import java.util.Objects;

/**
 * 基于 Z3 Java API 的 {@link SolverBackend} 实现。
 * 可以包装外部传入的 Context（借用，不负责关闭），也可以自行创建并拥有一个 Context。
 */
@SuppressWarnings({"rawtypes", "unchecked"})
public class Z3SolverBackend implements SolverBackend<Expr<?>>, AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(Z3SolverBackend.class);

    @Getter
    private final Context ctx;

    @Getter
    private final Z3VariableManager variableManager;

    private final boolean ownsContext;

    /**
     * 包装一个外部 Context，关闭时不会关闭它。
     * @param ctx Z3 Context 实例。
     */
    public Z3SolverBackend(Context ctx) {
        this(ctx, false);
    }

    /**
     * 创建并拥有一个新的 Context。
     */
    public Z3SolverBackend() {
        this(new Context(), true);
    }

    private Z3SolverBackend(Context ctx, boolean ownsContext) {
        this.ctx = Objects.requireNonNull(ctx, "Z3 Context cannot be null.");
        this.variableManager = new Z3VariableManager(ctx);
        this.ownsContext = ownsContext;
        logger.debug("Z3SolverBackend 初始化完成，ownsContext={}", ownsContext);
    }

    // --- 数值 ---

    @Override
    public Expr<?> mkInteger(String decimal) {
        return ctx.mkInt(decimal);
    }

    @Override
    public Expr<?> mkBitVector(String decimal, int size) {
        return ctx.mkBV(decimal, size);
    }

    @Override
    public Expr<?> mkVariable(String name, int size) {
        return variableManager.getZ3Var(name, size);
    }

    // --- 布尔 ---

    @Override
    public Expr<?> and(Expr<?> left, Expr<?> right) {
        return ctx.mkAnd(bool(left), bool(right));
    }

    @Override
    public Expr<?> or(Expr<?> left, Expr<?> right) {
        return ctx.mkOr(bool(left), bool(right));
    }

    @Override
    public Expr<?> not(Expr<?> operand) {
        return ctx.mkNot(bool(operand));
    }

    @Override
    public Expr<?> distinct(Expr<?> left, Expr<?> right) {
        return ctx.mkDistinct(new Expr[]{left, right});
    }

    @Override
    public Expr<?> equal(Expr<?> left, Expr<?> right) {
        return ctx.mkEq((Expr) left, (Expr) right);
    }

    // --- 位向量 ---

    @Override
    public Expr<?> bvAdd(Expr<?> left, Expr<?> right) {
        return ctx.mkBVAdd(bv(left), bv(right));
    }

    @Override
    public Expr<?> bvSub(Expr<?> left, Expr<?> right) {
        return ctx.mkBVSub(bv(left), bv(right));
    }

    @Override
    public Expr<?> bvMul(Expr<?> left, Expr<?> right) {
        return ctx.mkBVMul(bv(left), bv(right));
    }

    @Override
    public Expr<?> bvAnd(Expr<?> left, Expr<?> right) {
        return ctx.mkBVAND(bv(left), bv(right));
    }

    @Override
    public Expr<?> bvOr(Expr<?> left, Expr<?> right) {
        return ctx.mkBVOR(bv(left), bv(right));
    }

    @Override
    public Expr<?> bvXor(Expr<?> left, Expr<?> right) {
        return ctx.mkBVXOR(bv(left), bv(right));
    }

    @Override
    public Expr<?> bvNand(Expr<?> left, Expr<?> right) {
        return ctx.mkBVNAND(bv(left), bv(right));
    }

    @Override
    public Expr<?> bvNor(Expr<?> left, Expr<?> right) {
        return ctx.mkBVNOR(bv(left), bv(right));
    }

    @Override
    public Expr<?> bvXnor(Expr<?> left, Expr<?> right) {
        return ctx.mkBVXNOR(bv(left), bv(right));
    }

    @Override
    public Expr<?> bvShl(Expr<?> left, Expr<?> right) {
        return ctx.mkBVSHL(bv(left), bv(right));
    }

    @Override
    public Expr<?> bvLshr(Expr<?> left, Expr<?> right) {
        return ctx.mkBVLSHR(bv(left), bv(right));
    }

    @Override
    public Expr<?> bvAshr(Expr<?> left, Expr<?> right) {
        return ctx.mkBVASHR(bv(left), bv(right));
    }

    @Override
    public Expr<?> bvSdiv(Expr<?> left, Expr<?> right) {
        return ctx.mkBVSDiv(bv(left), bv(right));
    }

    @Override
    public Expr<?> bvUdiv(Expr<?> left, Expr<?> right) {
        return ctx.mkBVUDiv(bv(left), bv(right));
    }

    @Override
    public Expr<?> bvSrem(Expr<?> left, Expr<?> right) {
        return ctx.mkBVSRem(bv(left), bv(right));
    }

    @Override
    public Expr<?> bvUrem(Expr<?> left, Expr<?> right) {
        return ctx.mkBVURem(bv(left), bv(right));
    }

    @Override
    public Expr<?> bvSmod(Expr<?> left, Expr<?> right) {
        return ctx.mkBVSMod(bv(left), bv(right));
    }

    @Override
    public Expr<?> bvSge(Expr<?> left, Expr<?> right) {
        return ctx.mkBVSGE(bv(left), bv(right));
    }

    @Override
    public Expr<?> bvSgt(Expr<?> left, Expr<?> right) {
        return ctx.mkBVSGT(bv(left), bv(right));
    }

    @Override
    public Expr<?> bvSle(Expr<?> left, Expr<?> right) {
        return ctx.mkBVSLE(bv(left), bv(right));
    }

    @Override
    public Expr<?> bvSlt(Expr<?> left, Expr<?> right) {
        return ctx.mkBVSLT(bv(left), bv(right));
    }

    @Override
    public Expr<?> bvUge(Expr<?> left, Expr<?> right) {
        return ctx.mkBVUGE(bv(left), bv(right));
    }

    @Override
    public Expr<?> bvUgt(Expr<?> left, Expr<?> right) {
        return ctx.mkBVUGT(bv(left), bv(right));
    }

    @Override
    public Expr<?> bvUle(Expr<?> left, Expr<?> right) {
        return ctx.mkBVULE(bv(left), bv(right));
    }

    @Override
    public Expr<?> bvUlt(Expr<?> left, Expr<?> right) {
        return ctx.mkBVULT(bv(left), bv(right));
    }

    @Override
    public Expr<?> bvNeg(Expr<?> operand) {
        return ctx.mkBVNeg(bv(operand));
    }

    @Override
    public Expr<?> bvNot(Expr<?> operand) {
        return ctx.mkBVNot(bv(operand));
    }

    @Override
    public Expr<?> rotateLeft(int amount, Expr<?> value) {
        return ctx.mkBVRotateLeft(amount, bv(value));
    }

    @Override
    public Expr<?> rotateRight(int amount, Expr<?> value) {
        return ctx.mkBVRotateRight(amount, bv(value));
    }

    @Override
    public Expr<?> signExtend(int amount, Expr<?> value) {
        return ctx.mkSignExt(amount, bv(value));
    }

    @Override
    public Expr<?> zeroExtend(int amount, Expr<?> value) {
        return ctx.mkZeroExt(amount, bv(value));
    }

    @Override
    public Expr<?> extract(int high, int low, Expr<?> value) {
        return ctx.mkExtract(high, low, bv(value));
    }

    @Override
    public Expr<?> concat(Expr<?> high, Expr<?> low) {
        return ctx.mkConcat(bv(high), bv(low));
    }

    @Override
    public Expr<?> ite(Expr<?> condition, Expr<?> thenExpr, Expr<?> elseExpr) {
        return ctx.mkITE(bool(condition), (Expr) thenExpr, (Expr) elseExpr);
    }

    // --- 内省 ---

    @Override
    public boolean isBool(Expr<?> expr) {
        return expr.isBool();
    }

    @Override
    public long getUintValue(Expr<?> expr) {
        BigInteger value = numeral(expr);
        if (value.signum() < 0 || value.bitLength() > 63) {
            throw new SortMismatchException("The numeral does not fit an unsigned machine integer: " + value);
        }
        return value.longValue();
    }

    @Override
    public String getStringValue(Expr<?> expr) {
        return numeral(expr).toString();
    }

    @Override
    public void close() {
        if (ownsContext) {
            ctx.close();
            logger.debug("关闭自有的 Z3 Context");
        }
    }

    /**
     * 读回数值表达式的值；非数值先化简一次再判断。
     */
    private static BigInteger numeral(Expr<?> expr) {
        Expr<?> value = expr.isNumeral() ? expr : expr.simplify();
        if (value instanceof IntNum) {
            return ((IntNum) value).getBigInteger();
        }
        if (value instanceof BitVecNum) {
            return ((BitVecNum) value).getBigInteger();
        }
        throw new SortMismatchException("The ast is not a numerical value: " + expr);
    }

    private static BitVecExpr bv(Expr<?> expr) {
        if (!(expr instanceof BitVecExpr)) {
            throw new SortMismatchException("Expected a bit-vector expression, got " + expr.getSort());
        }
        return (BitVecExpr) expr;
    }

    private static BoolExpr bool(Expr<?> expr) {
        if (!(expr instanceof BoolExpr)) {
            throw new SortMismatchException("Expected a boolean expression, got " + expr.getSort());
        }
        return (BoolExpr) expr;
    }
}
