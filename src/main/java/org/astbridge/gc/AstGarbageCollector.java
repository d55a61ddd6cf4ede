package org.astbridge.gc;

import org.astbridge.ast.AbstractNode;
import org.astbridge.ast.NodeKind;
import org.astbridge.ast.VariableNode;
import org.astbridge.exceptions.DuplicateVariableException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * 表达式图节点的所有者（垃圾回收器）。
 * <p>
 * 跟踪所有存活的节点（按对象身份），维护变量名到声明它的节点的映射，支持按集合释放、全部释放，
 * 以及用于执行路径分叉/回退的快照对齐（{@link #restoreFrom(AstGarbageCollector)}）。
 * <p>
 * 实例分为两种：拥有所有权的实例，以及"借用"（备份）实例。借用实例在 {@link #close()} 时不释放任何节点。
 * <p>
 * 调用方义务：传给 {@link #freeAstNodes(Set)} 的集合必须恰好是被丢弃子树独占可达的节点，
 * 本类不做任何释放后使用检测。此类不是线程安全的。
 */
public class AstGarbageCollector implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(AstGarbageCollector.class);

    private Set<AbstractNode> allocatedNodes;

    private Map<String, AbstractNode> variableNodes;

    private boolean backup;

    private final List<NodeReleaseListener> releaseListeners = new ArrayList<>();

    /**
     * 创建一个拥有所有权的实例。
     */
    public AstGarbageCollector() {
        this(false);
    }

    /**
     * @param backup 为 true 时创建借用实例，关闭时不释放节点。
     */
    public AstGarbageCollector(boolean backup) {
        this.allocatedNodes = newIdentitySet();
        this.variableNodes = new HashMap<>();
        this.backup = backup;
    }

    /**
     * 以 other 为快照创建一个借用实例：拷贝（而非共享）其节点集合和变量映射。
     * @param other 被拷贝的实例。
     * @return 新的借用实例。
     */
    public static AstGarbageCollector snapshotOf(AstGarbageCollector other) {
        AstGarbageCollector snapshot = new AstGarbageCollector(true);
        snapshot.restoreFrom(other);
        return snapshot;
    }

    /**
     * 接管一个新构造的节点的所有权。调用方不得重复登记同一节点。
     * @param node 新节点。
     * @return 同一个节点，便于链式构造。
     */
    public <T extends AbstractNode> T recordAstNode(T node) {
        Objects.requireNonNull(node, "Node cannot be null.");
        allocatedNodes.add(node);
        return node;
    }

    /**
     * 将变量名关联到声明它的节点。不隐含 {@link #recordAstNode}。
     * @param name 变量名。
     * @param node 声明该变量的节点。
     * @throws DuplicateVariableException 如果该名字已被登记。
     */
    public void recordVariableAstNode(String name, AbstractNode node) {
        Objects.requireNonNull(name, "Variable name cannot be null.");
        Objects.requireNonNull(node, "Node cannot be null.");
        if (variableNodes.putIfAbsent(name, node) != null) {
            throw new DuplicateVariableException(name);
        }
        logger.debug("登记变量节点 {}", name);
    }

    /**
     * 释放调用方给出的节点集合：从所有权集合中移除每个节点，若为变量叶子则同时移除其名字绑定，
     * 然后释放节点。完成后清空输入集合。
     * @param nodes 被丢弃子树独占可达的节点集合。
     */
    public void freeAstNodes(Set<AbstractNode> nodes) {
        Objects.requireNonNull(nodes, "Nodes cannot be null.");
        for (AbstractNode node : nodes) {
            allocatedNodes.remove(node);
            if (node.getKind() == NodeKind.VARIABLE) {
                variableNodes.remove(((VariableNode) node).getVarName());
            }
            release(node);
        }
        logger.debug("释放了 {} 个节点，剩余 {} 个", nodes.size(), allocatedNodes.size());
        nodes.clear();
    }

    /**
     * 释放所有持有的节点并清空变量映射。用于整体拆除。
     */
    public void freeAllAstNodes() {
        int count = allocatedNodes.size();
        for (AbstractNode node : allocatedNodes) {
            release(node);
        }
        allocatedNodes.clear();
        variableNodes.clear();
        logger.info("释放全部 {} 个节点", count);
    }

    /**
     * 收集从 root 沿子节点边可达的所有不同节点（按身份）。不跟随 REFERENCE 间接。
     * 结果通常作为 {@link #freeAstNodes(Set)} 的输入。
     * @param root 子树根节点，可为 null。
     * @return 可达节点集合；root 为 null 时为空集合。
     */
    public Set<AbstractNode> extractUniqueAstNodes(AbstractNode root) {
        Set<AbstractNode> uniqueNodes = newIdentitySet();
        if (root == null) {
            return uniqueNodes;
        }
        Deque<AbstractNode> worklist = new ArrayDeque<>();
        worklist.push(root);
        while (!worklist.isEmpty()) {
            AbstractNode node = worklist.pop();
            if (uniqueNodes.add(node)) {
                for (AbstractNode child : node.getChildren()) {
                    worklist.push(child);
                }
            }
        }
        return uniqueNodes;
    }

    /**
     * 快照对齐：释放自身持有但 other 未持有的节点，然后接管 other 的节点集合与变量映射，
     * 并从此标记为借用实例。两个实例在对齐期间都不得有并发的登记或释放。
     * @param other 保留下来的快照。
     */
    public void restoreFrom(AstGarbageCollector other) {
        Objects.requireNonNull(other, "Other collector cannot be null.");
        if (other == this) {
            backup = true;
            return;
        }
        int freed = releaseAbsentFrom(other.allocatedNodes);
        Set<AbstractNode> adopted = newIdentitySet();
        adopted.addAll(other.allocatedNodes);
        this.allocatedNodes = adopted;
        this.variableNodes = new HashMap<>(other.variableNodes);
        this.backup = true;
        logger.info("快照对齐完成：释放 {} 个节点，接管 {} 个节点", freed, adopted.size());
    }

    /**
     * 替换所有权集合：先释放当前持有但不在 nodes 中的节点，再接管 nodes。
     * @param nodes 新的节点集合。
     */
    public void setAllocatedAstNodes(Collection<AbstractNode> nodes) {
        Objects.requireNonNull(nodes, "Nodes cannot be null.");
        Set<AbstractNode> replacement = newIdentitySet();
        replacement.addAll(nodes);
        releaseAbsentFrom(replacement);
        this.allocatedNodes = replacement;
    }

    public void setAstVariableNodes(Map<String, AbstractNode> nodes) {
        Objects.requireNonNull(nodes, "Variable nodes cannot be null.");
        this.variableNodes = new HashMap<>(nodes);
    }

    public Set<AbstractNode> getAllocatedAstNodes() {
        return Collections.unmodifiableSet(allocatedNodes);
    }

    public Map<String, AbstractNode> getAstVariableNodes() {
        return Collections.unmodifiableMap(variableNodes);
    }

    /**
     * 按名字获取变量节点。
     * @param name 变量名。
     * @return 对应的节点；不存在时返回 null。
     */
    public AbstractNode getAstVariableNode(String name) {
        return variableNodes.get(name);
    }

    public boolean isOwned(AbstractNode node) {
        return allocatedNodes.contains(node);
    }

    public boolean isBackup() {
        return backup;
    }

    public void addReleaseListener(NodeReleaseListener listener) {
        releaseListeners.add(Objects.requireNonNull(listener, "Listener cannot be null."));
    }

    /**
     * 拆除：非借用实例释放全部节点；借用实例什么也不释放。
     */
    @Override
    public void close() {
        if (backup) {
            logger.debug("借用实例关闭，保留 {} 个节点", allocatedNodes.size());
            return;
        }
        freeAllAstNodes();
    }

    private int releaseAbsentFrom(Set<AbstractNode> retained) {
        int freed = 0;
        for (AbstractNode node : allocatedNodes) {
            if (!retained.contains(node)) {
                release(node);
                freed++;
            }
        }
        return freed;
    }

    private void release(AbstractNode node) {
        if (!node.release()) {
            logger.warn("节点 {} 被重复释放", node);
        }
        for (NodeReleaseListener listener : releaseListeners) {
            listener.onRelease(node);
        }
    }

    private static Set<AbstractNode> newIdentitySet() {
        return Collections.newSetFromMap(new IdentityHashMap<>());
    }
}
