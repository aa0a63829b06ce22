package org.dxworks.adaframe.ast;

/**
 * Raised when an operation is invoked on the null node or on a node whose
 * unit has been released or whose context has been destroyed.
 */
public class InvalidNodeException extends AdaframeException {

    public InvalidNodeException(String message) {
        super(message);
    }
}
