package org.dxworks.adaframe.ast;

/**
 * Base class of the errors raised by the syntax tree facade.
 */
public class AdaframeException extends RuntimeException {

    public AdaframeException(String message) {
        super(message);
    }

    public AdaframeException(String message, Throwable cause) {
        super(message, cause);
    }
}
