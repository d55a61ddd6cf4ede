package org.astbridge.translation;

import org.astbridge.ast.AbstractNode;

/**
 * 逐节点翻译的跟踪接收器，通过 {@link TranslationOptions} 显式传给翻译器。
 */
@FunctionalInterface
public interface TranslationTracer {

    TranslationTracer NONE = (node, translation) -> { };

    /**
     * 每个节点翻译完成后调用。
     * @param node 刚翻译的节点。
     * @param translation 该节点的求解器表达式。
     */
    void trace(AbstractNode node, Object translation);
}
