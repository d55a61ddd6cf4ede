package org.astbridge.exceptions;

import lombok.Getter;

/**
 * STRING 叶子引用了一个从未被 LET 绑定的名字。
 */
@Getter
public class UnresolvedSymbolException extends AstTranslationException {

    private final String symbol;

    public UnresolvedSymbolException(String symbol) {
        super("Symbol not found: " + symbol);
        this.symbol = symbol;
    }
}
