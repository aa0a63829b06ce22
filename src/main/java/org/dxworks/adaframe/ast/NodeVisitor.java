package org.dxworks.adaframe.ast;

@FunctionalInterface
public interface NodeVisitor {
    VisitStatus visit(Node node);
}
