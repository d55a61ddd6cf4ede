package org.astbridge.symbolic;

/**
 * 翻译器所需的符号引擎能力：按 id 解析符号变量和历史表达式。
 */
public interface SymbolicEngine {

    /**
     * 根据 id 获取符号变量。
     * @param id 变量 id。
     * @return 对应的符号变量；不存在时返回 null。
     */
    SymbolicVariable getSymbolicVariableFromId(long id);

    /**
     * 根据 id 获取历史符号表达式。
     * @param id 表达式 id。
     * @return 对应的符号表达式；不存在时返回 null。
     */
    SymbolicExpression getSymbolicExpressionFromId(long id);
}
