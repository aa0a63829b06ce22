package org.dxworks.adaframe.ast;

/**
 * Raised when a token or text is read after its analysis context was destroyed
 * or its unit was replaced.
 */
public class ContextDestroyedException extends AdaframeException {

    public ContextDestroyedException(String message) {
        super(message);
    }
}
