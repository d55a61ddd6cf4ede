package org.astbridge.exceptions;

import lombok.Getter;

/**
 * 符号引擎无法根据 id 找到对应的符号变量。
 */
@Getter
public class UnresolvedVariableException extends AstTranslationException {

    private final long variableId;

    public UnresolvedVariableException(long variableId) {
        super("Can't get the symbolic variable with id " + variableId);
        this.variableId = variableId;
    }
}
