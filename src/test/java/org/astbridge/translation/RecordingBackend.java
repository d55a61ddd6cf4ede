package org.astbridge.translation;

import org.astbridge.exceptions.SortMismatchException;

import java.math.BigInteger;
import java.util.HashMap;
import java.util.Map;

/**
 * 记录每种构造调用次数的假后端。
 * extract 和 concat 作用在数值上时直接折叠为数值，便于断言场景结果。
 */
class RecordingBackend implements SolverBackend<Term> {

    private final Map<String, Integer> calls = new HashMap<>();

    int calls(String op) {
        return calls.getOrDefault(op, 0);
    }

    int totalCalls() {
        return calls.values().stream().mapToInt(Integer::intValue).sum();
    }

    private void record(String op) {
        calls.merge(op, 1, Integer::sum);
    }

    private Term bin(String op, Term left, Term right) {
        record(op);
        return Term.apply(op, Term.Sort.BV, left.getWidth(), left, right);
    }

    private Term cmp(String op, Term left, Term right) {
        record(op);
        return Term.apply(op, Term.Sort.BOOL, 0, left, right);
    }

    private static BigInteger mask(int width) {
        return BigInteger.ONE.shiftLeft(width).subtract(BigInteger.ONE);
    }

    @Override
    public Term mkInteger(String decimal) {
        record("int");
        return Term.numeral("int", Term.Sort.INT, 0, new BigInteger(decimal));
    }

    @Override
    public Term mkBitVector(String decimal, int size) {
        record("bv");
        return Term.numeral("bv", Term.Sort.BV, size, new BigInteger(decimal).and(mask(size)));
    }

    @Override
    public Term mkVariable(String name, int size) {
        record("var");
        return Term.symbol(name, size);
    }

    @Override
    public Term and(Term left, Term right) {
        return cmp("and", left, right);
    }

    @Override
    public Term or(Term left, Term right) {
        return cmp("or", left, right);
    }

    @Override
    public Term not(Term operand) {
        record("not");
        return Term.apply("not", Term.Sort.BOOL, 0, operand);
    }

    @Override
    public Term distinct(Term left, Term right) {
        return cmp("distinct", left, right);
    }

    @Override
    public Term equal(Term left, Term right) {
        return cmp("=", left, right);
    }

    @Override
    public Term bvAdd(Term left, Term right) {
        return bin("bvadd", left, right);
    }

    @Override
    public Term bvSub(Term left, Term right) {
        return bin("bvsub", left, right);
    }

    @Override
    public Term bvMul(Term left, Term right) {
        return bin("bvmul", left, right);
    }

    @Override
    public Term bvAnd(Term left, Term right) {
        return bin("bvand", left, right);
    }

    @Override
    public Term bvOr(Term left, Term right) {
        return bin("bvor", left, right);
    }

    @Override
    public Term bvXor(Term left, Term right) {
        return bin("bvxor", left, right);
    }

    @Override
    public Term bvNand(Term left, Term right) {
        return bin("bvnand", left, right);
    }

    @Override
    public Term bvNor(Term left, Term right) {
        return bin("bvnor", left, right);
    }

    @Override
    public Term bvXnor(Term left, Term right) {
        return bin("bvxnor", left, right);
    }

    @Override
    public Term bvShl(Term left, Term right) {
        return bin("bvshl", left, right);
    }

    @Override
    public Term bvLshr(Term left, Term right) {
        return bin("bvlshr", left, right);
    }

    @Override
    public Term bvAshr(Term left, Term right) {
        return bin("bvashr", left, right);
    }

    @Override
    public Term bvSdiv(Term left, Term right) {
        return bin("bvsdiv", left, right);
    }

    @Override
    public Term bvUdiv(Term left, Term right) {
        return bin("bvudiv", left, right);
    }

    @Override
    public Term bvSrem(Term left, Term right) {
        return bin("bvsrem", left, right);
    }

    @Override
    public Term bvUrem(Term left, Term right) {
        return bin("bvurem", left, right);
    }

    @Override
    public Term bvSmod(Term left, Term right) {
        return bin("bvsmod", left, right);
    }

    @Override
    public Term bvSge(Term left, Term right) {
        return cmp("bvsge", left, right);
    }

    @Override
    public Term bvSgt(Term left, Term right) {
        return cmp("bvsgt", left, right);
    }

    @Override
    public Term bvSle(Term left, Term right) {
        return cmp("bvsle", left, right);
    }

    @Override
    public Term bvSlt(Term left, Term right) {
        return cmp("bvslt", left, right);
    }

    @Override
    public Term bvUge(Term left, Term right) {
        return cmp("bvuge", left, right);
    }

    @Override
    public Term bvUgt(Term left, Term right) {
        return cmp("bvugt", left, right);
    }

    @Override
    public Term bvUle(Term left, Term right) {
        return cmp("bvule", left, right);
    }

    @Override
    public Term bvUlt(Term left, Term right) {
        return cmp("bvult", left, right);
    }

    @Override
    public Term bvNeg(Term operand) {
        record("bvneg");
        return Term.apply("bvneg", Term.Sort.BV, operand.getWidth(), operand);
    }

    @Override
    public Term bvNot(Term operand) {
        record("bvnot");
        return Term.apply("bvnot", Term.Sort.BV, operand.getWidth(), operand);
    }

    @Override
    public Term rotateLeft(int amount, Term value) {
        record("rotate_left");
        return Term.apply("rotate_left_" + amount, Term.Sort.BV, value.getWidth(), value);
    }

    @Override
    public Term rotateRight(int amount, Term value) {
        record("rotate_right");
        return Term.apply("rotate_right_" + amount, Term.Sort.BV, value.getWidth(), value);
    }

    @Override
    public Term signExtend(int amount, Term value) {
        record("sign_extend");
        return Term.apply("sign_extend_" + amount, Term.Sort.BV, value.getWidth() + amount, value);
    }

    @Override
    public Term zeroExtend(int amount, Term value) {
        record("zero_extend");
        return Term.apply("zero_extend_" + amount, Term.Sort.BV, value.getWidth() + amount, value);
    }

    @Override
    public Term extract(int high, int low, Term value) {
        record("extract");
        int width = high - low + 1;
        if (value.isNumeral()) {
            return Term.numeral("bv", Term.Sort.BV, width, value.getValue().shiftRight(low).and(mask(width)));
        }
        return Term.apply("extract_" + high + "_" + low, Term.Sort.BV, width, value);
    }

    @Override
    public Term concat(Term high, Term low) {
        record("concat");
        int width = high.getWidth() + low.getWidth();
        if (high.isNumeral() && low.isNumeral()) {
            return Term.numeral("bv", Term.Sort.BV, width, high.getValue().shiftLeft(low.getWidth()).or(low.getValue()));
        }
        return Term.apply("concat", Term.Sort.BV, width, high, low);
    }

    @Override
    public Term ite(Term condition, Term thenExpr, Term elseExpr) {
        record("ite");
        return Term.apply("ite", thenExpr.getSort(), thenExpr.getWidth(), condition, thenExpr, elseExpr);
    }

    @Override
    public boolean isBool(Term expr) {
        return expr.getSort() == Term.Sort.BOOL;
    }

    @Override
    public long getUintValue(Term expr) {
        if (!expr.isNumeral()) {
            throw new SortMismatchException("not a numeral: " + expr);
        }
        return expr.getValue().longValueExact();
    }

    @Override
    public String getStringValue(Term expr) {
        if (!expr.isNumeral()) {
            throw new SortMismatchException("not a numeral: " + expr);
        }
        return expr.getValue().toString();
    }
}
