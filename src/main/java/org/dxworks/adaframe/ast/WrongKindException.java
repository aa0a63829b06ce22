package org.dxworks.adaframe.ast;

public class WrongKindException extends AdaframeException {

    public WrongKindException(String message) {
        super(message);
    }
}
