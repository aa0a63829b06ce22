package org.dxworks.adaframe.ast;

import org.dxworks.adaframe.model.SourceLocation;
import org.dxworks.adaframe.schema.NodeKind;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class NodeNavigationTest {

    private static final String FOO = "limited private with Ada.Text_IO;\n\nprocedure Foo is\nbegin\n   null;\nend Foo;\n";

    private AnalysisContext context;
    private Node root;

    @BeforeEach
    void setUp() {
        context = AnalysisContext.create();
        root = context.getUnitFromBuffer("src/foo.adb", FOO).rootOrThrow();
    }

    @AfterEach
    void tearDown() {
        context.destroy();
    }

    private Node withClause() {
        return root.childAt(0).get().childAt(0).get();
    }

    @Test
    void handlesToTheSameNodeAreEqual() {
        assertEquals(withClause(), withClause());
        assertEquals(withClause().hashCode(), withClause().hashCode());
        assertNotEquals(root, withClause());
        assertNotEquals(Node.NULL, root);
        assertEquals(Node.NULL, Node.NULL);
    }

    @Test
    void nodesFromDifferentUnitsDiffer() {
        Node other = context.getUnitFromBuffer("other.adb", FOO).rootOrThrow();
        assertNotEquals(root, other);
        assertEquals(root.kind(), other.kind());
    }

    @Test
    void parentLinks() {
        Node with = withClause();
        assertEquals(NodeKind.ADA_NODE_LIST, with.parent().kind());
        assertEquals(root, with.parent().parent());
        assertTrue(root.parent().isNull());
    }

    @Test
    void childrenKeepEmptySlots() {
        Node spec = Fields.subpBodySubpSpec(Fields.libraryItemItem(root.childAt(1).get()).get()).get();
        List<Node> children = spec.children();

        assertEquals(4, children.size());
        assertEquals(NodeKind.SUBP_KIND_PROCEDURE, children.get(0).kind());
        assertEquals(NodeKind.IDENTIFIER, children.get(1).kind());
        assertTrue(children.get(2).isNull());
        assertTrue(children.get(3).isNull());
    }

    @Test
    void sourceRangeAndText() {
        Node with = withClause();
        assertEquals("1:1-1:34", with.sourceRange().toString());
        assertEquals("limited private with Ada.Text_IO;", with.text().toString());
        assertEquals("1:1-6:9", root.sourceRange().toString());
    }

    @Test
    void ghostNodeIsAnchoredOnTheFollowingToken() {
        Node hasPrivate = Fields.libraryItemHasPrivate(root.childAt(1).get()).get();

        assertTrue(hasPrivate.isGhost());
        assertEquals("procedure", hasPrivate.tokenStart().text().toString());
        assertEquals(hasPrivate.tokenStart(), hasPrivate.tokenEnd());
        assertEquals("3:1-3:1", hasPrivate.sourceRange().toString());
        assertTrue(hasPrivate.text().isEmpty());
        assertFalse(withClause().isGhost());
    }

    @Test
    void shapePredicates() {
        assertTrue(root.childAt(0).get().isListNode());
        assertFalse(root.isListNode());
        Node ada = withClause().lookup(new SourceLocation(1, 23));
        assertTrue(ada.isTokenNode());
    }

    @Test
    void lookupFindsTheDeepestNode() {
        Node found = root.lookup(new SourceLocation(1, 23));
        assertEquals(NodeKind.IDENTIFIER, found.kind());
        assertEquals("Ada", found.text().toString());

        Node stmt = root.lookup(new SourceLocation(5, 5));
        assertEquals(NodeKind.NULL_STMT, stmt.kind());

        assertTrue(root.lookup(new SourceLocation(10, 1)).isNull());
    }

    @Test
    void traverseVisitsInPreOrder() {
        List<String> identifiers = new ArrayList<>();
        root.traverse(node -> {
            if (node.kind() == NodeKind.IDENTIFIER) {
                identifiers.add(node.text().toString());
            }
            return VisitStatus.INTO;
        });
        assertEquals(List.of("Ada", "Text_IO", "Foo", "Foo"), identifiers);
    }

    @Test
    void traverseCanSkipAndStop() {
        List<NodeKind> visited = new ArrayList<>();
        VisitStatus status = root.traverse(node -> {
            visited.add(node.kind());
            if (node.kind() == NodeKind.WITH_CLAUSE) {
                return VisitStatus.OVER;
            }
            return node.kind() == NodeKind.SUBP_SPEC ? VisitStatus.STOP : VisitStatus.INTO;
        });

        assertEquals(VisitStatus.STOP, status);
        assertFalse(visited.contains(NodeKind.LIMITED_PRESENT));
        assertEquals(NodeKind.SUBP_SPEC, visited.get(visited.size() - 1));
        assertFalse(visited.contains(NodeKind.NULL_STMT));
    }

    @Test
    void imageShowsKindFileAndRange() {
        assertEquals("<CompilationUnit foo.adb:1:1-6:9>", root.toString());
        assertEquals("<WithClause foo.adb:1:1-1:34>", withClause().toString());
        assertEquals("None", Node.NULL.toString());
    }
}
