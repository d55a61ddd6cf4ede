package org.astbridge.symbolic;

import lombok.Getter;
import org.astbridge.ast.AbstractNode;

import java.util.Objects;

/**
 * 执行历史中记录下来的一条符号表达式：id 加上其表达式图的根节点。
 */
@Getter
public final class SymbolicExpression {

    private final long id;

    private final AbstractNode ast;

    private final String comment;

    public SymbolicExpression(long id, AbstractNode ast, String comment) {
        this.id = id;
        this.ast = Objects.requireNonNull(ast, "Expression root cannot be null.");
        this.comment = comment == null ? "" : comment;
    }

    public SymbolicExpression(long id, AbstractNode ast) {
        this(id, ast, "");
    }

    @Override
    public String toString() {
        return "#" + id + " = " + ast + (comment.isEmpty() ? "" : " ; " + comment);
    }
}
