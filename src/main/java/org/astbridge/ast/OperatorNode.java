package org.astbridge.ast;

import java.util.List;

/**
 * 非叶子节点：一元、二元、结构性、可变参数运算以及 LET。
 */
public final class OperatorNode extends AbstractNode {

    public OperatorNode(NodeKind kind, List<AbstractNode> children) {
        super(checkKind(kind), children);
    }

    private static NodeKind checkKind(NodeKind kind) {
        if (kind != null && kind.isLeaf()) {
            throw new IllegalArgumentException(kind + " 是叶子种类，不能作为运算节点");
        }
        return kind;
    }
}
