package org.dxworks.adaframe.parser;

import org.dxworks.adaframe.schema.NodeKind;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

public class SyntaxTreeTest {

    @Test
    void linksChildrenToParents() {
        SyntaxTree.Builder builder = SyntaxTree.builder();
        int a = builder.add(NodeKind.IDENTIFIER, 0, 0);
        int b = builder.add(NodeKind.IDENTIFIER, 2, 2);
        int list = builder.add(NodeKind.NAME_LIST, 0, 2, a, b);
        SyntaxTree tree = builder.build(list);

        assertEquals(3, tree.size());
        assertEquals(list, tree.root());
        assertEquals(2, tree.childCount(list));
        assertEquals(b, tree.child(list, 1));
        assertEquals(list, tree.parent(a));
        assertEquals(SyntaxTree.NO_NODE, tree.parent(list));
    }

    @Test
    void ghostNodesEndJustBeforeTheirAnchor() {
        SyntaxTree.Builder builder = SyntaxTree.builder();
        int ghost = builder.add(NodeKind.STMT_LIST, 5, 1);
        SyntaxTree tree = builder.build(ghost);

        assertEquals(5, tree.tokenStart(ghost));
        assertEquals(4, tree.tokenEnd(ghost));
    }

    @Test
    void optionalFieldsMayBeEmpty() {
        SyntaxTree.Builder builder = SyntaxTree.builder();
        int stmt = builder.add(NodeKind.RETURN_STMT, 0, 1, SyntaxTree.NO_NODE);
        SyntaxTree tree = builder.build(stmt);

        assertEquals(SyntaxTree.NO_NODE, tree.child(stmt, 0));
    }

    @Test
    void rejectsMalformedNodes() {
        SyntaxTree.Builder builder = SyntaxTree.builder();
        int id = builder.add(NodeKind.IDENTIFIER, 0, 0);
        int stmt = builder.add(NodeKind.NULL_STMT, 1, 2);

        // list element of the wrong type
        assertThrows(IllegalStateException.class, () -> builder.add(NodeKind.NAME_LIST, 1, 2, stmt));
        // wrong arity
        assertThrows(IllegalStateException.class, () -> builder.add(NodeKind.PAREN_EXPR, 0, 0));
        // mandatory field left empty
        assertThrows(IllegalStateException.class, () -> builder.add(NodeKind.PAREN_EXPR, 0, 0, SyntaxTree.NO_NODE));

        builder.add(NodeKind.PAREN_EXPR, 0, 0, id);
        // a node has at most one parent
        assertThrows(IllegalStateException.class, () -> builder.add(NodeKind.NAME_LIST, 0, 0, id));
    }

    @Test
    void rejectsUnknownRoot() {
        SyntaxTree.Builder builder = SyntaxTree.builder();
        assertThrows(IllegalArgumentException.class, () -> builder.build(3));
    }
}
