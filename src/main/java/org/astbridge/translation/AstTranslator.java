package org.astbridge.translation;

import lombok.Getter;
import org.astbridge.ast.AbstractNode;
import org.astbridge.ast.DecimalNode;
import org.astbridge.ast.NodeKind;
import org.astbridge.ast.ReferenceNode;
import org.astbridge.ast.StringNode;
import org.astbridge.ast.VariableNode;
import org.astbridge.exceptions.AstTranslationException;
import org.astbridge.exceptions.NullInputException;
import org.astbridge.exceptions.SortMismatchException;
import org.astbridge.exceptions.UnresolvedSymbolException;
import org.astbridge.exceptions.UnresolvedVariableException;
import org.astbridge.exceptions.UnsupportedNodeKindException;
import org.astbridge.symbolic.SymbolicEngine;
import org.astbridge.symbolic.SymbolicVariable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigInteger;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.BinaryOperator;
import java.util.function.UnaryOperator;

/**
 * 将表达式图翻译为外部求解器的原生表达式。
 * <p>
 * 翻译分两个阶段：先由 {@link TranslationOrder} 计算出满足依赖关系的线性顺序，
 * 再按该顺序逐个翻译节点。子节点的结果总是从按节点身份索引的缓存中取得，共享子树只翻译一次。
 * 整个过程不在调用栈上递归，适用于非常深的图。
 * <p>
 * 缓存和 LET 符号表的作用域是一次 {@link #translate} 调用。符号表是扁平的：
 * 同一调用中后出现的同名 LET 会覆盖先前的绑定。
 * 翻译从不修改节点的所有权状态。
 *
 * @param <E> 求解器原生表达式类型。
 */
public class AstTranslator<E> {

    private static final Logger logger = LoggerFactory.getLogger(AstTranslator.class);

    private final SymbolicEngine symbolicEngine;

    private final SolverBackend<E> backend;

    @Getter
    private final TranslationOptions options;

    private final Map<NodeKind, BinaryOperator<E>> binaryOperators = new EnumMap<>(NodeKind.class);

    private final Map<NodeKind, UnaryOperator<E>> unaryOperators = new EnumMap<>(NodeKind.class);

    public AstTranslator(SymbolicEngine symbolicEngine, SolverBackend<E> backend, TranslationOptions options) {
        this.symbolicEngine = Objects.requireNonNull(symbolicEngine, "The symbolic engine cannot be null.");
        this.backend = Objects.requireNonNull(backend, "The solver backend cannot be null.");
        this.options = Objects.requireNonNull(options, "Translation options cannot be null.");

        binaryOperators.put(NodeKind.BVADD, backend::bvAdd);
        binaryOperators.put(NodeKind.BVAND, backend::bvAnd);
        binaryOperators.put(NodeKind.BVASHR, backend::bvAshr);
        binaryOperators.put(NodeKind.BVLSHR, backend::bvLshr);
        binaryOperators.put(NodeKind.BVMUL, backend::bvMul);
        binaryOperators.put(NodeKind.BVNAND, backend::bvNand);
        binaryOperators.put(NodeKind.BVNOR, backend::bvNor);
        binaryOperators.put(NodeKind.BVOR, backend::bvOr);
        binaryOperators.put(NodeKind.BVSDIV, backend::bvSdiv);
        binaryOperators.put(NodeKind.BVSGE, backend::bvSge);
        binaryOperators.put(NodeKind.BVSGT, backend::bvSgt);
        binaryOperators.put(NodeKind.BVSHL, backend::bvShl);
        binaryOperators.put(NodeKind.BVSLE, backend::bvSle);
        binaryOperators.put(NodeKind.BVSLT, backend::bvSlt);
        binaryOperators.put(NodeKind.BVSMOD, backend::bvSmod);
        binaryOperators.put(NodeKind.BVSREM, backend::bvSrem);
        binaryOperators.put(NodeKind.BVSUB, backend::bvSub);
        binaryOperators.put(NodeKind.BVUDIV, backend::bvUdiv);
        binaryOperators.put(NodeKind.BVUGE, backend::bvUge);
        binaryOperators.put(NodeKind.BVUGT, backend::bvUgt);
        binaryOperators.put(NodeKind.BVULE, backend::bvUle);
        binaryOperators.put(NodeKind.BVULT, backend::bvUlt);
        binaryOperators.put(NodeKind.BVUREM, backend::bvUrem);
        binaryOperators.put(NodeKind.BVXNOR, backend::bvXnor);
        binaryOperators.put(NodeKind.BVXOR, backend::bvXor);
        binaryOperators.put(NodeKind.DISTINCT, backend::distinct);
        binaryOperators.put(NodeKind.EQUAL, backend::equal);

        unaryOperators.put(NodeKind.BVNEG, backend::bvNeg);
        unaryOperators.put(NodeKind.BVNOT, backend::bvNot);

        logger.debug("创建 AstTranslator，{}", options);
    }

    public AstTranslator(SymbolicEngine symbolicEngine, SolverBackend<E> backend, boolean concretize) {
        this(symbolicEngine, backend, TranslationOptions.of(concretize));
    }

    public boolean isConcretize() {
        return options.isConcretize();
    }

    /**
     * 翻译以 root 为根的表达式图。
     * @param root 根节点。
     * @return root 的求解器表达式（若 root 是 REFERENCE，则为被引用表达式的翻译）。
     * @throws NullInputException 如果 root 为 null。
     * @throws AstTranslationException 如果图中存在不支持的节点、类型错误或无法解析的符号/变量。
     */
    public E translate(AbstractNode root) {
        if (root == null) {
            throw new NullInputException("The root node cannot be null.");
        }
        TranslationOrder order = TranslationOrder.of(root);
        Session session = new Session();
        TranslationTracer tracer = options.getTracer();

        for (TranslationOrder.Step step : order.getSteps()) {
            AbstractNode node = step.getNode();
            if (step.isBinding()) {
                session.bind(node);
                continue;
            }
            E result = session.translateNode(node);
            session.cache.put(node, result);
            tracer.trace(node, result);
        }
        logger.debug("翻译完成：{} 个节点", session.cache.size());
        return session.lookup(root);
    }

    /**
     * 一次 translate 调用的私有状态：节点到表达式的缓存和扁平的 LET 符号表。
     */
    private final class Session {

        private final Map<AbstractNode, E> cache = new IdentityHashMap<>();

        private final Map<String, AbstractNode> symbols = new HashMap<>();

        private E lookup(AbstractNode node) {
            E result = cache.get(node);
            if (result == null) {
                throw new IllegalStateException("节点 " + node + " 尚未被翻译");
            }
            return result;
        }

        private E child(AbstractNode node, int index) {
            return lookup(node.getChild(index));
        }

        /**
         * 将 LET 的名字绑定到未翻译的第二个子节点。
         */
        private void bind(AbstractNode letNode) {
            AbstractNode name = letNode.getChild(0);
            if (!(name instanceof StringNode)) {
                throw new SortMismatchException("LET expects a STRING name, got " + name.getKind());
            }
            symbols.put(((StringNode) name).getValue(), letNode.getChild(1));
        }

        private E translateNode(AbstractNode node) {
            NodeKind kind = node.getKind();
            switch (kind.getCategory()) {
                case BINARY:
                    return binaryOperators.get(kind).apply(child(node, 0), child(node, 1));
                case UNARY:
                    if (kind == NodeKind.LNOT) {
                        return backend.not(requireBool(child(node, 0), "LNOT"));
                    }
                    return unaryOperators.get(kind).apply(child(node, 0));
                default:
                    break;
            }

            switch (kind) {
                case BVROL:
                    return backend.rotateLeft(literalAmount(node), child(node, 1));
                case BVROR:
                    return backend.rotateRight(literalAmount(node), child(node, 1));
                case BV: {
                    String value = backend.getStringValue(child(node, 0));
                    int size = readUint(child(node, 1));
                    return backend.mkBitVector(value, size);
                }
                case EXTRACT:
                    return backend.extract(readUint(child(node, 0)), readUint(child(node, 1)), child(node, 2));
                case SX:
                    return backend.signExtend(readUint(child(node, 0)), child(node, 1));
                case ZX:
                    return backend.zeroExtend(readUint(child(node, 0)), child(node, 1));
                case ITE:
                    return backend.ite(requireBool(child(node, 0), "ITE"), child(node, 1), child(node, 2));
                case CONCAT:
                    return concat(node.getChildren());
                case LAND:
                    return foldBool(node.getChildren(), backend::and, "LAND");
                case LOR:
                    return foldBool(node.getChildren(), backend::or, "LOR");
                case DECIMAL:
                    return backend.mkInteger(((DecimalNode) node).getValue().toString());
                case LET:
                    return child(node, 2);
                case STRING:
                    return resolveSymbol((StringNode) node);
                case REFERENCE:
                    return lookup(((ReferenceNode) node).resolve());
                case VARIABLE:
                    return variable((VariableNode) node);
                default:
                    throw new UnsupportedNodeKindException(kind);
            }
        }

        /**
         * 第一个子节点是最低有效部分：acc = concat(child_i, acc)。
         */
        private E concat(List<AbstractNode> chunks) {
            E current = lookup(chunks.get(0));
            for (int i = 1; i < chunks.size(); i++) {
                current = backend.concat(lookup(chunks.get(i)), current);
            }
            return current;
        }

        private E foldBool(List<AbstractNode> operands, BinaryOperator<E> op, String name) {
            E current = requireBool(lookup(operands.get(0)), name);
            for (int i = 1; i < operands.size(); i++) {
                current = op.apply(current, requireBool(lookup(operands.get(i)), name));
            }
            return current;
        }

        private E resolveSymbol(StringNode node) {
            AbstractNode bound = symbols.get(node.getValue());
            if (bound == null) {
                throw new UnresolvedSymbolException(node.getValue());
            }
            return lookup(bound);
        }

        private E variable(VariableNode node) {
            long id = node.getVariable().getId();
            SymbolicVariable variable = symbolicEngine.getSymbolicVariableFromId(id);
            if (variable == null) {
                throw new UnresolvedVariableException(id);
            }
            if (options.isConcretize()) {
                return backend.mkBitVector(node.currentConcreteValue().toString(), variable.getBitSize());
            }
            return backend.mkVariable(variable.getName(), variable.getBitSize());
        }

        /**
         * rotate 的位移量必须是编译期的十进制叶子。
         */
        private int literalAmount(AbstractNode node) {
            AbstractNode amount = node.getChild(0);
            if (!(amount instanceof DecimalNode)) {
                throw new SortMismatchException(node.getKind() + " expects a DECIMAL amount, got " + amount.getKind());
            }
            BigInteger value = ((DecimalNode) amount).getValue();
            if (value.bitLength() > 31) {
                throw new SortMismatchException("Rotation amount out of range: " + value);
            }
            return value.intValue();
        }

        private int readUint(E expr) {
            long value = backend.getUintValue(expr);
            if (value < 0 || value > Integer.MAX_VALUE) {
                throw new SortMismatchException("Value out of unsigned range: " + value);
            }
            return (int) value;
        }

        private E requireBool(E expr, String operation) {
            if (!backend.isBool(expr)) {
                throw new SortMismatchException(operation + " can be applied only on bool values.");
            }
            return expr;
        }
    }
}
