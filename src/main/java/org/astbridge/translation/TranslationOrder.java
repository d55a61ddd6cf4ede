package org.astbridge.translation;

import lombok.Getter;
import org.apache.commons.lang3.tuple.Pair;
import org.astbridge.ast.AbstractNode;
import org.astbridge.ast.NodeKind;
import org.astbridge.ast.ReferenceNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * 计算一次翻译的线性处理顺序，不使用与图深度成正比的调用栈。
 * <p>
 * 每个节点排在其全部依赖之后：普通节点的依赖是它的子节点；REFERENCE 的依赖是被引用表达式的根节点；
 * LET 的依赖是被绑定子树和 body（名字叶子只是字面量），并在两者之间插入一个绑定步骤。
 * 被多个父节点共享的节点只调度一次，位置由最先到达它的路径决定。
 * <p>
 * 工作栈上的每一帧是 (节点, 已调度的依赖个数)，与显式的后序遍历相同。
 */
@Getter
public final class TranslationOrder {

    private static final Logger logger = LoggerFactory.getLogger(TranslationOrder.class);

    private final AbstractNode root;

    private final List<Step> steps;

    private TranslationOrder(AbstractNode root, List<Step> steps) {
        this.root = root;
        this.steps = Collections.unmodifiableList(steps);
    }

    /**
     * 为以 root 为根的图计算处理顺序。
     * @param root 根节点。
     * @return 处理顺序。
     * @throws IllegalStateException 如果依赖关系中存在环。
     */
    public static TranslationOrder of(AbstractNode root) {
        Objects.requireNonNull(root, "Root node cannot be null.");
        List<Step> steps = new ArrayList<>();
        Set<AbstractNode> scheduled = newIdentitySet();
        Set<AbstractNode> onPath = newIdentitySet();
        Deque<Pair<AbstractNode, Integer>> workStack = new ArrayDeque<>();

        workStack.push(Pair.of(root, 0));
        onPath.add(root);
        while (!workStack.isEmpty()) {
            Pair<AbstractNode, Integer> frame = workStack.peek();
            AbstractNode node = frame.getLeft();
            int index = frame.getRight();
            List<AbstractNode> dependencies = dependenciesOf(node);

            if (index < dependencies.size()) {
                workStack.pop();
                workStack.push(Pair.of(node, index + 1));
                if (node.getKind() == NodeKind.LET && index == 1) {
                    steps.add(Step.bind(node));
                }
                AbstractNode dependency = dependencies.get(index);
                if (scheduled.contains(dependency)) {
                    continue;
                }
                if (!onPath.add(dependency)) {
                    throw new IllegalStateException("Dependency cycle detected at node " + dependency);
                }
                workStack.push(Pair.of(dependency, 0));
            } else {
                workStack.pop();
                onPath.remove(node);
                scheduled.add(node);
                steps.add(Step.translate(node));
            }
        }
        logger.debug("调度完成：{} 个节点，{} 个步骤", scheduled.size(), steps.size());
        return new TranslationOrder(root, steps);
    }

    /**
     * 返回节点在调度意义上的依赖，顺序即处理顺序。
     */
    static List<AbstractNode> dependenciesOf(AbstractNode node) {
        switch (node.getKind()) {
            case REFERENCE:
                return List.of(((ReferenceNode) node).resolve());
            case LET:
                return List.of(node.getChild(1), node.getChild(2));
            default:
                return node.getChildren();
        }
    }

    public int size() {
        return steps.size();
    }

    private static Set<AbstractNode> newIdentitySet() {
        return Collections.newSetFromMap(new IdentityHashMap<>());
    }

    /**
     * 处理顺序中的一步：翻译一个节点，或者执行 LET 的名字绑定。
     */
    @Getter
    public static final class Step {

        private final AbstractNode node;

        private final boolean binding;

        private Step(AbstractNode node, boolean binding) {
            this.node = node;
            this.binding = binding;
        }

        static Step translate(AbstractNode node) {
            return new Step(node, false);
        }

        static Step bind(AbstractNode letNode) {
            return new Step(letNode, true);
        }

        @Override
        public String toString() {
            return (binding ? "bind " : "") + node;
        }
    }
}
