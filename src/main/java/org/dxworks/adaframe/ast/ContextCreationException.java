package org.dxworks.adaframe.ast;

public class ContextCreationException extends AdaframeException {

    public ContextCreationException(String message) {
        super(message);
    }

    public ContextCreationException(String message, Throwable cause) {
        super(message, cause);
    }
}
