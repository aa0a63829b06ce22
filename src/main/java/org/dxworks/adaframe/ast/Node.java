package org.dxworks.adaframe.ast;

import org.dxworks.adaframe.model.SourceLocation;
import org.dxworks.adaframe.model.SourceLocationRange;
import org.dxworks.adaframe.parser.SyntaxTree;
import org.dxworks.adaframe.schema.NodeKind;
import org.dxworks.adaframe.schema.NodeType;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Opaque, kind-tagged reference to a node of a unit's syntax tree.
 * <p>
 * A handle is either {@link #NULL} or points at a live node. Two handles are
 * equal when they designate the same node of the same unit. Handles do not
 * own anything: once the unit is released or its context destroyed, every
 * operation except {@link #isNull}, {@link #equals} and {@link #toString}
 * raises {@link InvalidNodeException}.
 */
public final class Node {

    public static final Node NULL = new Node(null, SyntaxTree.NO_NODE);

    private final AnalysisUnit unit;
    private final int index;

    Node(AnalysisUnit unit, int index) {
        this.unit = unit;
        this.index = index;
    }

    public boolean isNull() {
        return unit == null;
    }

    /**
     * @throws InvalidNodeException for the null node or a node whose context is gone
     */
    public NodeKind kind() {
        return tree().kind(index);
    }

    public String kindName() {
        return kind().kindName();
    }

    public boolean isA(NodeType type) {
        return kind().isA(type);
    }

    public boolean isListNode() {
        return kind().isList();
    }

    public boolean isTokenNode() {
        return kind().isTokenNode();
    }

    public AnalysisUnit unit() {
        tree();
        return unit;
    }

    public int childCount() {
        return tree().childCount(index);
    }

    /**
     * Generic child access. An index outside {@code [0, childCount)} yields an
     * unavailable slot; an in-range empty slot yields {@link Node#NULL}.
     */
    public Slot<Node> childAt(int position) {
        SyntaxTree tree = tree();
        if (position < 0 || position >= tree.childCount(index)) {
            return Slot.unavailable(SlotError.INDEX_OUT_OF_RANGE);
        }
        int child = tree.child(index, position);
        return child == SyntaxTree.NO_NODE ? Slot.empty() : Slot.present(new Node(unit, child));
    }

    /**
     * All generic children, {@link #NULL} standing for empty slots.
     */
    public List<Node> children() {
        SyntaxTree tree = tree();
        int count = tree.childCount(index);
        List<Node> result = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            result.add(wrap(tree.child(index, i)));
        }
        return Collections.unmodifiableList(result);
    }

    /**
     * @return the parent, or {@link #NULL} for the root
     */
    public Node parent() {
        return wrap(tree().parent(index));
    }

    /**
     * @return the first token of this node; for a ghost node, the token it is anchored on
     */
    public Token tokenStart() {
        int start = tree().tokenStart(index);
        return unit.tokenAt(start);
    }

    /**
     * @return the last token of this node; for a ghost node, the token it is anchored on
     */
    public Token tokenEnd() {
        SyntaxTree tree = tree();
        return isGhost() ? tokenStart() : unit.tokenAt(tree.tokenEnd(index));
    }

    /**
     * Ghost nodes span no token: absent qualifiers, empty lists and other implicit nodes.
     */
    public boolean isGhost() {
        SyntaxTree tree = tree();
        return tree.tokenEnd(index) < tree.tokenStart(index);
    }

    public SourceLocationRange sourceRange() {
        Token first = tokenStart();
        if (isGhost()) {
            return SourceLocationRange.at(first.sourceRange().getStart());
        }
        return new SourceLocationRange(first.sourceRange().getStart(), tokenEnd().sourceRange().getEnd());
    }

    /**
     * Source text covered by this node, trivia between its tokens included.
     */
    public Text text() {
        SyntaxTree tree = tree();
        if (isGhost()) {
            return unit.textSpan(0, 0);
        }
        return unit.textSpan(unit.tokenStartOffset(tree.tokenStart(index)), unit.tokenEndOffset(tree.tokenEnd(index)));
    }

    /**
     * Deepest non-ghost node under this one whose source range contains {@code location}.
     *
     * @return {@link #NULL} if this node does not contain the location
     */
    public Node lookup(SourceLocation location) {
        if (isGhost() || !sourceRange().contains(location)) {
            return NULL;
        }
        Node current = this;
        boolean descended = true;
        while (descended) {
            descended = false;
            for (Node child : current.children()) {
                if (!child.isNull() && !child.isGhost() && child.sourceRange().contains(location)) {
                    current = child;
                    descended = true;
                    break;
                }
            }
        }
        return current;
    }

    /**
     * Pre-order traversal of this node and its non-null descendants.
     *
     * @return {@link VisitStatus#STOP} if the visitor stopped the traversal, {@link VisitStatus#INTO} otherwise
     */
    public VisitStatus traverse(NodeVisitor visitor) {
        VisitStatus status = visitor.visit(this);
        if (status == VisitStatus.STOP) {
            return VisitStatus.STOP;
        }
        if (status == VisitStatus.INTO) {
            for (Node child : children()) {
                if (!child.isNull() && child.traverse(visitor) == VisitStatus.STOP) {
                    return VisitStatus.STOP;
                }
            }
        }
        return VisitStatus.INTO;
    }

    private SyntaxTree tree() {
        if (unit == null) {
            throw new InvalidNodeException("operation on the null node");
        }
        if (!unit.isAlive()) {
            throw new InvalidNodeException("node of " + unit.getFilename() + " used after its context was destroyed");
        }
        return unit.tree();
    }

    private Node wrap(int node) {
        return node == SyntaxTree.NO_NODE ? NULL : new Node(unit, node);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Node)) return false;
        Node that = (Node) o;
        return unit == that.unit && index == that.index;
    }

    @Override
    public int hashCode() {
        return 31 * System.identityHashCode(unit) + index;
    }

    /**
     * Image such as {@code <WithClause foo.adb:1:1-1:34>}.
     */
    @Override
    public String toString() {
        if (isNull()) {
            return "None";
        }
        if (!unit.isAlive()) {
            return "<Node #" + index + " (released)>";
        }
        return "<" + kindName() + " " + unit.getBaseName() + ":" + sourceRange() + ">";
    }
}
