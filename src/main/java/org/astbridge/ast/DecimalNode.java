package org.astbridge.ast;

import lombok.Getter;

import java.math.BigInteger;
import java.util.Collections;
import java.util.Objects;

/**
 * 任意精度的十进制整数字面量。
 */
@Getter
public final class DecimalNode extends AbstractNode {

    private final BigInteger value;

    public DecimalNode(BigInteger value) {
        super(NodeKind.DECIMAL, Collections.emptyList(),
                Objects.requireNonNull(value, "Decimal value cannot be null.").hashCode());
        this.value = value;
    }

    @Override
    public String toString() {
        return value.toString();
    }
}
