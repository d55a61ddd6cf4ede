package org.astbridge.ast;

import lombok.Getter;
import org.apache.commons.lang3.Validate;
import org.astbridge.gc.AstGarbageCollector;
import org.astbridge.symbolic.SymbolicExpression;
import org.astbridge.symbolic.SymbolicVariable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigInteger;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * 表达式图节点工厂。
 * 通过它创建的每个节点都会登记到所绑定的 {@link AstGarbageCollector}；
 * 变量节点按名字去重：同一个变量只会有一个声明节点。
 */
public class AstContext {

    private static final Logger logger = LoggerFactory.getLogger(AstContext.class);

    @Getter
    private final AstGarbageCollector garbageCollector;

    public AstContext(AstGarbageCollector garbageCollector) {
        this.garbageCollector = Objects.requireNonNull(garbageCollector, "Garbage collector cannot be null.");
    }

    public AstContext() {
        this(new AstGarbageCollector());
    }

    // --- 叶子 ---

    public DecimalNode decimal(BigInteger value) {
        return garbageCollector.recordAstNode(new DecimalNode(value));
    }

    public DecimalNode decimal(long value) {
        Validate.isTrue(value >= 0, "Decimal literal cannot be negative: %d", value);
        return decimal(BigInteger.valueOf(value));
    }

    public StringNode string(String value) {
        return garbageCollector.recordAstNode(new StringNode(value));
    }

    /**
     * 获取变量的声明节点；若尚不存在则创建、登记并声明。
     * @param variable 符号变量。
     * @return 该变量唯一的 VariableNode。
     */
    public VariableNode variable(SymbolicVariable variable) {
        Objects.requireNonNull(variable, "Symbolic variable cannot be null.");
        AbstractNode existing = garbageCollector.getAstVariableNode(variable.getName());
        if (existing != null) {
            return (VariableNode) existing;
        }
        VariableNode node = garbageCollector.recordAstNode(new VariableNode(variable));
        garbageCollector.recordVariableAstNode(variable.getName(), node);
        logger.debug("创建变量节点 {}", variable);
        return node;
    }

    public ReferenceNode reference(SymbolicExpression expression) {
        return garbageCollector.recordAstNode(new ReferenceNode(expression));
    }

    // --- 运算 ---

    /**
     * 创建任意种类的运算节点，子节点个数按 {@link NodeKind} 校验。
     */
    public OperatorNode operator(NodeKind kind, AbstractNode... children) {
        return operator(kind, Arrays.asList(children));
    }

    public OperatorNode operator(NodeKind kind, List<AbstractNode> children) {
        return garbageCollector.recordAstNode(new OperatorNode(kind, children));
    }

    public OperatorNode bv(BigInteger value, int size) {
        Validate.isTrue(size > 0, "Bit-vector size must be positive: %d", size);
        return operator(NodeKind.BV, decimal(value), decimal(size));
    }

    public OperatorNode bv(long value, int size) {
        return bv(BigInteger.valueOf(value), size);
    }

    public OperatorNode extract(int high, int low, AbstractNode value) {
        Validate.isTrue(high >= low && low >= 0, "Invalid extract bounds [%d:%d]", high, low);
        return operator(NodeKind.EXTRACT, decimal(high), decimal(low), value);
    }

    public OperatorNode sx(int amount, AbstractNode value) {
        return operator(NodeKind.SX, decimal(amount), value);
    }

    public OperatorNode zx(int amount, AbstractNode value) {
        return operator(NodeKind.ZX, decimal(amount), value);
    }

    public OperatorNode bvrol(int amount, AbstractNode value) {
        return operator(NodeKind.BVROL, decimal(amount), value);
    }

    public OperatorNode bvror(int amount, AbstractNode value) {
        return operator(NodeKind.BVROR, decimal(amount), value);
    }

    public OperatorNode ite(AbstractNode condition, AbstractNode thenNode, AbstractNode elseNode) {
        return operator(NodeKind.ITE, condition, thenNode, elseNode);
    }

    /**
     * 拼接：第一个子节点是最低有效部分。
     */
    public OperatorNode concat(AbstractNode... chunks) {
        return operator(NodeKind.CONCAT, chunks);
    }

    public OperatorNode land(AbstractNode... operands) {
        return operator(NodeKind.LAND, operands);
    }

    public OperatorNode lor(AbstractNode... operands) {
        return operator(NodeKind.LOR, operands);
    }

    public OperatorNode lnot(AbstractNode operand) {
        return operator(NodeKind.LNOT, operand);
    }

    public OperatorNode equal(AbstractNode left, AbstractNode right) {
        return operator(NodeKind.EQUAL, left, right);
    }

    public OperatorNode distinct(AbstractNode left, AbstractNode right) {
        return operator(NodeKind.DISTINCT, left, right);
    }

    /**
     * LET(name, bound, body)：在 body 中可以用 STRING(name) 引用 bound。
     */
    public OperatorNode let(String name, AbstractNode bound, AbstractNode body) {
        return operator(NodeKind.LET, string(name), bound, body);
    }
}
