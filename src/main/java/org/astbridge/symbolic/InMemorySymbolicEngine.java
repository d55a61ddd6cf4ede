package org.astbridge.symbolic;

import org.apache.commons.lang3.Validate;
import org.astbridge.ast.AbstractNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;

/**
 * 基于内存映射的最小符号引擎。
 * 负责分配符号变量（命名规则为 "SymVar_" + id）和记录符号表达式，并按 id 解析二者。
 * 不是线程安全的，与所属的执行上下文一起单线程使用。
 */
public class InMemorySymbolicEngine implements SymbolicEngine {

    private static final Logger logger = LoggerFactory.getLogger(InMemorySymbolicEngine.class);

    public static final String VARIABLE_PREFIX = "SymVar_";

    private final Map<Long, SymbolicVariable> variables = new HashMap<>();
    private final Map<Long, SymbolicExpression> expressions = new HashMap<>();

    private long nextVariableId;
    private long nextExpressionId;

    /**
     * 创建一个新的符号变量。
     * @param bitSize 位宽。
     * @param comment 注释，可为 null。
     * @return 新的 SymbolicVariable。
     */
    public SymbolicVariable newSymbolicVariable(int bitSize, String comment) {
        Validate.isTrue(bitSize > 0, "Variable size must be positive: %d", bitSize);
        long id = nextVariableId++;
        SymbolicVariable variable = new SymbolicVariable(id, VARIABLE_PREFIX + id, bitSize, comment);
        variables.put(id, variable);
        logger.debug("创建符号变量 {}，位宽 {}", variable.getName(), bitSize);
        return variable;
    }

    public SymbolicVariable newSymbolicVariable(int bitSize) {
        return newSymbolicVariable(bitSize, null);
    }

    /**
     * 记录一条新的符号表达式。
     * @param ast 表达式根节点。
     * @param comment 注释，可为 null。
     * @return 新的 SymbolicExpression。
     */
    public SymbolicExpression newSymbolicExpression(AbstractNode ast, String comment) {
        Objects.requireNonNull(ast, "Expression root cannot be null.");
        long id = nextExpressionId++;
        SymbolicExpression expression = new SymbolicExpression(id, ast, comment);
        expressions.put(id, expression);
        logger.debug("记录符号表达式 #{}", id);
        return expression;
    }

    public SymbolicExpression newSymbolicExpression(AbstractNode ast) {
        return newSymbolicExpression(ast, null);
    }

    /**
     * 从引擎中移除一个符号变量。之后按其 id 解析将失败。
     * @param id 变量 id。
     */
    public void removeSymbolicVariable(long id) {
        if (variables.remove(id) != null) {
            logger.debug("移除符号变量 id {}", id);
        }
    }

    @Override
    public SymbolicVariable getSymbolicVariableFromId(long id) {
        return variables.get(id);
    }

    @Override
    public SymbolicExpression getSymbolicExpressionFromId(long id) {
        return expressions.get(id);
    }

    public Map<Long, SymbolicVariable> getSymbolicVariables() {
        return Collections.unmodifiableMap(variables);
    }

    public Map<Long, SymbolicExpression> getSymbolicExpressions() {
        return Collections.unmodifiableMap(expressions);
    }
}
