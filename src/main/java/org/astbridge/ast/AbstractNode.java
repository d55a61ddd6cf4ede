package org.astbridge.ast;

import lombok.Getter;
import org.apache.commons.lang3.Validate;

import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * 表达式图中的节点。
 * 节点一旦构造完成即不可变（释放标记除外）；子节点顺序有语义（如 concat 的顺序、extract 的边界）。
 * 节点的身份即对象引用：缓存和所有权集合都以引用为键，equals/hashCode 不被重写。
 * 注册到 {@link org.astbridge.gc.AstGarbageCollector} 之后由其独占所有权，其他代码只持有非所有权引用。
 */
@Getter
public abstract class AbstractNode {

    private static final long HASH_PRIME = 0x100000001b3L;

    private final NodeKind kind;

    private final List<AbstractNode> children;

    /**
     * 由内容推导的哈希，仅用于对外标识节点，不参与翻译的正确性。
     */
    private final long hash;

    private boolean released;

    protected AbstractNode(NodeKind kind, List<AbstractNode> children) {
        this(kind, children, 0L);
    }

    /**
     * @param payloadHash 叶子载荷（数值、名字等）的哈希，混入内容哈希。
     */
    protected AbstractNode(NodeKind kind, List<AbstractNode> children, long payloadHash) {
        this.kind = Objects.requireNonNull(kind, "Node kind cannot be null.");
        Objects.requireNonNull(children, "Children cannot be null.");
        Validate.isTrue(kind.accepts(children.size()),
                "%s 节点不接受 %d 个子节点", kind, children.size());
        for (AbstractNode child : children) {
            Objects.requireNonNull(child, "Child node cannot be null.");
        }
        this.children = children.isEmpty() ? Collections.emptyList() : List.copyOf(children);
        this.hash = computeHash(payloadHash);
    }

    private long computeHash(long payloadHash) {
        long h = 0xcbf29ce484222325L ^ kind.ordinal();
        h = h * HASH_PRIME ^ payloadHash;
        for (AbstractNode child : children) {
            h = h * HASH_PRIME ^ child.hash;
        }
        return h;
    }

    public AbstractNode getChild(int index) {
        return children.get(index);
    }

    /**
     * 标记此节点已被其所有者释放。
     * @return 首次释放时返回 true，重复释放返回 false。
     */
    public boolean release() {
        if (released) {
            return false;
        }
        released = true;
        return true;
    }

    @Override
    public String toString() {
        return kind + "@" + Long.toHexString(hash);
    }
}
