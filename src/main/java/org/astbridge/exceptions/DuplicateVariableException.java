package org.astbridge.exceptions;

import lombok.Getter;

/**
 * 在同一个 AstGarbageCollector 中重复登记同名变量时抛出。
 */
@Getter
public class DuplicateVariableException extends AstException {

    private final String variableName;

    public DuplicateVariableException(String variableName) {
        super("Can't register variable '" + variableName + "' as it already exists");
        this.variableName = variableName;
    }
}
