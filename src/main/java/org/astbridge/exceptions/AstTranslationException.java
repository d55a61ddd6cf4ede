package org.astbridge.exceptions;

/**
 * 将表达式图翻译为求解器表达式失败。
 * 翻译失败对当前 translate 调用是致命的：不返回部分结果，也不修改节点所有权状态。
 */
public class AstTranslationException extends AstException {

    public AstTranslationException(String message) {
        super(message);
    }

    public AstTranslationException(String message, Throwable cause) {
        super(message, cause);
    }
}
