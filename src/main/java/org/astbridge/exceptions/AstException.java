package org.astbridge.exceptions;

/**
 * 表达式图相关异常的根类型。
 * 所有异常均为非受检异常：调用方违反图构造契约时抛出，不期望被重试。
 */
public class AstException extends RuntimeException {

    public AstException(String message) {
        super(message);
    }

    public AstException(String message, Throwable cause) {
        super(message, cause);
    }
}
