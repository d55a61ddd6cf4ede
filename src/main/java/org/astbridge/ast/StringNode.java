package org.astbridge.ast;

import lombok.Getter;

import java.util.Collections;
import java.util.Objects;

/**
 * 不透明的字符串叶子：一个符号名，只在 LET 作用域内有意义。
 */
@Getter
public final class StringNode extends AbstractNode {

    private final String value;

    public StringNode(String value) {
        super(NodeKind.STRING, Collections.emptyList(),
                Objects.requireNonNull(value, "String value cannot be null.").hashCode());
        this.value = value;
    }

    @Override
    public String toString() {
        return value;
    }
}
