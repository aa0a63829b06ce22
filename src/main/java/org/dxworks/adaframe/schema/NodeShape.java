package org.dxworks.adaframe.schema;

public enum NodeShape {
    /** Fixed arity: the generic children are exactly the declared fields, in offset order. */
    FIELDS,
    /** Variable number of children of one element type. */
    LIST,
    /** No children; the node spans exactly one token. */
    TOKEN
}
