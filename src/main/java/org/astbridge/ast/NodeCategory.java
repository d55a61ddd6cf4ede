package org.astbridge.ast;

/**
 * 节点种类的分组，决定子节点个数的约束。
 */
public enum NodeCategory {

    /** 恰好两个子节点的位向量/布尔运算 */
    BINARY,
    /** 恰好一个子节点 */
    UNARY,
    /** 固定个数的结构性运算：rotate, extract, extend, ite, bv */
    STRUCTURAL,
    /** 至少两个子节点，从左到右两两折叠 */
    VARIADIC,
    /** 叶子，没有子节点 */
    LEAF,
    /** LET(name, bound, body) */
    BINDING,
    /** REFERENCE：自身无子节点，指向历史表达式 */
    INDIRECTION
}
