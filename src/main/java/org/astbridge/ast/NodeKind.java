package org.astbridge.ast;

import lombok.Getter;

/**
 * 表达式图中节点种类的封闭集合。
 * 每种节点都声明了所属分组和允许的子节点个数。
 */
@Getter
public enum NodeKind {

    BVADD(NodeCategory.BINARY, 2),
    BVAND(NodeCategory.BINARY, 2),
    BVASHR(NodeCategory.BINARY, 2),
    BVLSHR(NodeCategory.BINARY, 2),
    BVMUL(NodeCategory.BINARY, 2),
    BVNAND(NodeCategory.BINARY, 2),
    BVNOR(NodeCategory.BINARY, 2),
    BVOR(NodeCategory.BINARY, 2),
    BVSDIV(NodeCategory.BINARY, 2),
    BVSGE(NodeCategory.BINARY, 2),
    BVSGT(NodeCategory.BINARY, 2),
    BVSHL(NodeCategory.BINARY, 2),
    BVSLE(NodeCategory.BINARY, 2),
    BVSLT(NodeCategory.BINARY, 2),
    BVSMOD(NodeCategory.BINARY, 2),
    BVSREM(NodeCategory.BINARY, 2),
    BVSUB(NodeCategory.BINARY, 2),
    BVUDIV(NodeCategory.BINARY, 2),
    BVUGE(NodeCategory.BINARY, 2),
    BVUGT(NodeCategory.BINARY, 2),
    BVULE(NodeCategory.BINARY, 2),
    BVULT(NodeCategory.BINARY, 2),
    BVUREM(NodeCategory.BINARY, 2),
    BVXNOR(NodeCategory.BINARY, 2),
    BVXOR(NodeCategory.BINARY, 2),
    DISTINCT(NodeCategory.BINARY, 2),
    EQUAL(NodeCategory.BINARY, 2),

    BVNEG(NodeCategory.UNARY, 1),
    BVNOT(NodeCategory.UNARY, 1),
    LNOT(NodeCategory.UNARY, 1),

    BVROL(NodeCategory.STRUCTURAL, 2),   // (amount, value)
    BVROR(NodeCategory.STRUCTURAL, 2),   // (amount, value)
    BV(NodeCategory.STRUCTURAL, 2),      // (value, width)
    EXTRACT(NodeCategory.STRUCTURAL, 3), // (high, low, value)
    ITE(NodeCategory.STRUCTURAL, 3),     // (cond, then, else)
    SX(NodeCategory.STRUCTURAL, 2),      // (amount, value)
    ZX(NodeCategory.STRUCTURAL, 2),      // (amount, value)

    CONCAT(NodeCategory.VARIADIC, 2),
    LAND(NodeCategory.VARIADIC, 2),
    LOR(NodeCategory.VARIADIC, 2),
    /** 一组公式的并列，仅用于外部导出，翻译器不支持 */
    COMPOUND(NodeCategory.VARIADIC, 1),

    DECIMAL(NodeCategory.LEAF, 0),
    STRING(NodeCategory.LEAF, 0),
    VARIABLE(NodeCategory.LEAF, 0),

    LET(NodeCategory.BINDING, 3),        // (name, bound, body)

    REFERENCE(NodeCategory.INDIRECTION, 0);

    private final NodeCategory category;

    /**
     * 子节点个数。对 VARIADIC 种类表示最小个数，其余种类为精确个数。
     */
    private final int arity;

    NodeKind(NodeCategory category, int arity) {
        this.category = category;
        this.arity = arity;
    }

    /**
     * 检查给定的子节点个数对此种类是否合法。
     * @param childCount 子节点个数。
     * @return 合法时返回 true。
     */
    public boolean accepts(int childCount) {
        if (category == NodeCategory.VARIADIC) {
            return childCount >= arity;
        }
        return childCount == arity;
    }

    public boolean isLeaf() {
        return category == NodeCategory.LEAF || category == NodeCategory.INDIRECTION;
    }
}
