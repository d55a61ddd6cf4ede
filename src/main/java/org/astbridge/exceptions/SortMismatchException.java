package org.astbridge.exceptions;

/**
 * 操作数的 sort 与运算要求不符，例如对位向量做逻辑与，或对非数值表达式做数值回读。
 */
public class SortMismatchException extends AstTranslationException {

    public SortMismatchException(String message) {
        super(message);
    }
}
