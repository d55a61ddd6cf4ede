package org.astbridge.exceptions;

public class NullInputException extends AstTranslationException {

    public NullInputException(String message) {
        super(message);
    }
}
