package org.astbridge.translation;

/**
 * 翻译器依赖的外部求解器能力。
 * 每个方法构造一个求解器原生表达式；实现不得持有翻译器的状态。
 *
 * @param <E> 求解器原生表达式类型。
 */
public interface SolverBackend<E> {

    // --- 数值 ---

    /** 由十进制字符串构造任意精度整数数值。 */
    E mkInteger(String decimal);

    /** 由十进制字符串和位宽构造定长位向量数值。 */
    E mkBitVector(String decimal, int size);

    /** 给定名字和位宽的自由位向量符号。 */
    E mkVariable(String name, int size);

    // --- 布尔 ---

    E and(E left, E right);

    E or(E left, E right);

    E not(E operand);

    E distinct(E left, E right);

    E equal(E left, E right);

    // --- 位向量算术与位运算 ---

    E bvAdd(E left, E right);

    E bvSub(E left, E right);

    E bvMul(E left, E right);

    E bvAnd(E left, E right);

    E bvOr(E left, E right);

    E bvXor(E left, E right);

    E bvNand(E left, E right);

    E bvNor(E left, E right);

    E bvXnor(E left, E right);

    E bvShl(E left, E right);

    E bvLshr(E left, E right);

    E bvAshr(E left, E right);

    E bvSdiv(E left, E right);

    E bvUdiv(E left, E right);

    E bvSrem(E left, E right);

    E bvUrem(E left, E right);

    E bvSmod(E left, E right);

    // --- 比较 ---

    E bvSge(E left, E right);

    E bvSgt(E left, E right);

    E bvSle(E left, E right);

    E bvSlt(E left, E right);

    E bvUge(E left, E right);

    E bvUgt(E left, E right);

    E bvUle(E left, E right);

    E bvUlt(E left, E right);

    // --- 一元 ---

    E bvNeg(E operand);

    E bvNot(E operand);

    // --- 结构性 ---

    E rotateLeft(int amount, E value);

    E rotateRight(int amount, E value);

    E signExtend(int amount, E value);

    E zeroExtend(int amount, E value);

    E extract(int high, int low, E value);

    /**
     * 拼接两个位向量，high 占据结果的高位。
     */
    E concat(E high, E low);

    E ite(E condition, E thenExpr, E elseExpr);

    // --- 内省 ---

    boolean isBool(E expr);

    /**
     * 将数值表达式读回为无符号机器整数。
     * @throws org.astbridge.exceptions.SortMismatchException 如果表达式不是数值。
     */
    long getUintValue(E expr);

    /**
     * 将数值表达式读回为十进制字符串。
     * @throws org.astbridge.exceptions.SortMismatchException 如果表达式不是数值。
     */
    String getStringValue(E expr);
}
