package org.astbridge.exceptions;

import lombok.Getter;
import org.astbridge.ast.NodeKind;

/**
 * 翻译器遇到了无法处理的节点种类。
 */
@Getter
public class UnsupportedNodeKindException extends AstTranslationException {

    private final NodeKind kind;

    public UnsupportedNodeKindException(NodeKind kind) {
        super("Invalid kind of node: " + kind);
        this.kind = kind;
    }
}
