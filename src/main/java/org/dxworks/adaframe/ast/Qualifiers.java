package org.dxworks.adaframe.ast;

import org.dxworks.adaframe.schema.NodeFamily;
import org.dxworks.adaframe.schema.NodeKind;

/**
 * Boolean projection of qualifier nodes ({@code limited}, {@code private},
 * {@code aliased}, {@code constant}): each qualifier family has a "present"
 * kind that projects to {@code true} and an "absent" kind that projects to
 * {@code false}.
 */
public final class Qualifiers {

    private Qualifiers() {
        // utility class
    }

    /**
     * @throws WrongKindException if {@code node} is {@link Node#NULL} or not a qualifier
     */
    public static boolean asBool(Node node) {
        NodeKind kind = qualifierKind(node);
        return kind.qualifierValue();
    }

    /**
     * Same as {@link #asBool(Node)}, also requiring the node to belong to {@code family}.
     */
    public static boolean asBool(Node node, NodeFamily family) {
        if (!family.isQualifier()) {
            throw new IllegalArgumentException(family.kindName() + " is not a qualifier family");
        }
        NodeKind kind = qualifierKind(node);
        if (!kind.isA(family)) {
            throw new WrongKindException("expected a " + family.kindName() + " qualifier, got " + kind.kindName());
        }
        return kind.qualifierValue();
    }

    private static NodeKind qualifierKind(Node node) {
        if (node.isNull()) {
            throw new WrongKindException("expected a qualifier, got the null node");
        }
        NodeKind kind = node.kind();
        if (!kind.isQualifier()) {
            throw new WrongKindException("expected a qualifier, got " + kind.kindName());
        }
        return kind;
    }
}
