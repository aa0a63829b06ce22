package org.dxworks.adaframe.schema;

/**
 * Common view of concrete node kinds and abstract node families.
 * Types form a single-inheritance hierarchy rooted at {@link NodeFamily#ADA_NODE}.
 */
public interface NodeType {

    /**
     * Human-readable label, e.g. {@code "WithClause"} or {@code "BasicDecl"}.
     */
    String kindName();

    /**
     * Direct parent family, or {@code null} for the root family.
     */
    NodeFamily parent();

    /**
     * Whether this type is {@code other} or one of its descendants.
     */
    default boolean isA(NodeType other) {
        if (other == null) return false;
        for (NodeType t = this; t != null; t = t.parent()) {
            if (t == other) return true;
        }
        return false;
    }
}
