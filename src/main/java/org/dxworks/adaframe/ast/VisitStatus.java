package org.dxworks.adaframe.ast;

public enum VisitStatus {
    /** Visit the children of the current node. */
    INTO,
    /** Skip the children of the current node and continue with its siblings. */
    OVER,
    /** Abort the whole traversal. */
    STOP
}
