package org.astbridge.translation;

import org.astbridge.ast.AbstractNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.stream.Collectors;

/**
 * 将每个节点的翻译结果写到 DEBUG 日志：节点哈希、种类、子节点哈希以及求解器表达式。
 */
public class Slf4jTranslationTracer implements TranslationTracer {

    private static final Logger logger = LoggerFactory.getLogger(Slf4jTranslationTracer.class);

    @Override
    public void trace(AbstractNode node, Object translation) {
        if (!logger.isDebugEnabled()) {
            return;
        }
        String children = node.getChildren().stream()
                .map(child -> String.format("%016x", child.getHash()))
                .collect(Collectors.joining(" "));
        logger.debug("处理节点 {} kind {}，子节点 [{}] -> {}",
                String.format("%016x", node.getHash()), node.getKind(), children, translation);
    }
}
