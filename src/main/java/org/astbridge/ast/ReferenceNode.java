package org.astbridge.ast;

import lombok.Getter;
import org.astbridge.symbolic.SymbolicExpression;

import java.util.Collections;
import java.util.Objects;

/**
 * 指向执行历史中某个符号表达式的间接节点。
 * 它没有自己的子节点；翻译时其引用的表达式根节点被当作直接子节点展开。
 */
@Getter
public final class ReferenceNode extends AbstractNode {

    private final SymbolicExpression symbolicExpression;

    public ReferenceNode(SymbolicExpression symbolicExpression) {
        super(NodeKind.REFERENCE, Collections.emptyList(),
                Long.hashCode(Objects.requireNonNull(symbolicExpression, "Symbolic expression cannot be null.").getId()));
        this.symbolicExpression = symbolicExpression;
    }

    /**
     * 返回被引用表达式的根节点。
     */
    public AbstractNode resolve() {
        return symbolicExpression.getAst();
    }

    @Override
    public String toString() {
        return "ref!" + symbolicExpression.getId();
    }
}
