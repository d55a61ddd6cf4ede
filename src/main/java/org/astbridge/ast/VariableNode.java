package org.astbridge.ast;

import lombok.Getter;
import org.astbridge.symbolic.SymbolicVariable;

import java.math.BigInteger;
import java.util.Collections;
import java.util.Objects;

/**
 * 指向外部符号变量记录的叶子。
 * 节点本身携带变量当前的具体值，由符号执行引擎在执行过程中更新。
 */
@Getter
public final class VariableNode extends AbstractNode {

    private final SymbolicVariable variable;

    private BigInteger concreteValue;

    public VariableNode(SymbolicVariable variable) {
        super(NodeKind.VARIABLE, Collections.emptyList(),
                Objects.requireNonNull(variable, "Symbolic variable cannot be null.").getName().hashCode());
        this.variable = variable;
        this.concreteValue = BigInteger.ZERO;
    }

    public String getVarName() {
        return variable.getName();
    }

    /**
     * 更新变量的当前具体值。
     * @param value 新的具体值，不能为负。
     */
    public void setConcreteValue(BigInteger value) {
        Objects.requireNonNull(value, "Concrete value cannot be null.");
        if (value.signum() < 0) {
            throw new IllegalArgumentException("具体值不能为负: " + value);
        }
        this.concreteValue = value;
    }

    /**
     * 返回变量当前的具体值，用于具体化翻译。
     */
    public BigInteger currentConcreteValue() {
        return concreteValue;
    }

    @Override
    public String toString() {
        return variable.getName();
    }
}
