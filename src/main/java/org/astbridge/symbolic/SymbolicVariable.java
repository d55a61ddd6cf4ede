package org.astbridge.symbolic;

import lombok.Getter;
import org.apache.commons.lang3.Validate;

import java.util.Objects;

/**
 * 符号变量记录：id、名字和位宽。
 * 此类是不可变的。
 */
@Getter
public final class SymbolicVariable {

    private final long id;

    private final String name;

    private final int bitSize;

    private final String comment;

    public SymbolicVariable(long id, String name, int bitSize, String comment) {
        Validate.isTrue(id >= 0, "Variable id cannot be negative: %d", id);
        Validate.isTrue(bitSize > 0, "Variable size must be positive: %d", bitSize);
        this.id = id;
        this.name = Objects.requireNonNull(name, "Variable name cannot be null.");
        this.bitSize = bitSize;
        this.comment = comment == null ? "" : comment;
    }

    public SymbolicVariable(long id, String name, int bitSize) {
        this(id, name, bitSize, "");
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        SymbolicVariable that = (SymbolicVariable) o;
        return id == that.id && bitSize == that.bitSize && name.equals(that.name);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, name, bitSize);
    }

    @Override
    public String toString() {
        return name + ":" + bitSize;
    }
}
