package org.dxworks.adaframe.parser;

import org.dxworks.adaframe.schema.Field;
import org.dxworks.adaframe.schema.NodeKind;
import org.dxworks.adaframe.schema.NodeShape;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Arena holding the nodes of one parsed tree. Nodes are addressed by index;
 * {@link #NO_NODE} stands for an empty child slot. The tree is immutable once built.
 */
public final class SyntaxTree {

    public static final int NO_NODE = -1;

    private static final int[] NO_CHILDREN = new int[0];

    private final NodeKind[] kinds;
    private final int[] parents;
    private final int[][] children;
    private final int[] tokenStarts;
    private final int[] tokenEnds;
    private final int root;

    private SyntaxTree(Builder builder, int root) {
        int size = builder.kinds.size();
        this.kinds = builder.kinds.toArray(new NodeKind[0]);
        this.parents = Arrays.copyOf(builder.parents, size);
        this.children = builder.children.toArray(new int[0][]);
        this.tokenStarts = Arrays.copyOf(builder.tokenStarts, size);
        this.tokenEnds = Arrays.copyOf(builder.tokenEnds, size);
        this.root = root;
    }

    public static Builder builder() {
        return new Builder();
    }

    public int size() {
        return kinds.length;
    }

    public int root() {
        return root;
    }

    public NodeKind kind(int node) {
        return kinds[node];
    }

    public int parent(int node) {
        return parents[node];
    }

    public int childCount(int node) {
        return children[node].length;
    }

    /**
     * @return the child index, or {@link #NO_NODE} for an empty slot
     */
    public int child(int node, int position) {
        return children[node][position];
    }

    public int tokenStart(int node) {
        return tokenStarts[node];
    }

    /**
     * Index of the last token of the node, inclusive. Lower than {@link #tokenStart} for ghost nodes.
     */
    public int tokenEnd(int node) {
        return tokenEnds[node];
    }

    /**
     * Appends nodes bottom-up: children must be added before their parent.
     */
    public static final class Builder {
        private final List<NodeKind> kinds = new ArrayList<>();
        private final List<int[]> children = new ArrayList<>();
        private int[] parents = new int[64];
        private int[] tokenStarts = new int[64];
        private int[] tokenEnds = new int[64];

        private Builder() {
        }

        public int add(NodeKind kind, int tokenStart, int tokenEnd, int... childNodes) {
            checkShape(kind, childNodes);
            int index = kinds.size();
            ensureCapacity(index + 1);
            kinds.add(kind);
            children.add(childNodes.length == 0 ? NO_CHILDREN : childNodes.clone());
            parents[index] = NO_NODE;
            tokenStarts[index] = tokenStart;
            tokenEnds[index] = tokenEnd < tokenStart ? tokenStart - 1 : tokenEnd;
            for (int child : childNodes) {
                if (child == NO_NODE) continue;
                if (parents[child] != NO_NODE) {
                    throw new IllegalStateException("node " + child + " already has a parent");
                }
                parents[child] = index;
            }
            return index;
        }

        public int tokenStart(int node) {
            return tokenStarts[node];
        }

        public int tokenEnd(int node) {
            return tokenEnds[node];
        }

        public SyntaxTree build(int root) {
            if (root != NO_NODE && (root < 0 || root >= kinds.size())) {
                throw new IllegalArgumentException("unknown root " + root);
            }
            return new SyntaxTree(this, root);
        }

        private void checkShape(NodeKind kind, int[] childNodes) {
            if (kind.shape() == NodeShape.LIST) {
                for (int child : childNodes) {
                    if (child == NO_NODE || !kinds.get(child).isA(kind.elementType())) {
                        throw new IllegalStateException(kind.kindName() + " cannot hold " + describe(child));
                    }
                }
                return;
            }
            List<Field> fields = kind.fields();
            if (childNodes.length != fields.size()) {
                throw new IllegalStateException(kind.kindName() + " expects " + fields.size()
                        + " children, got " + childNodes.length);
            }
            for (Field field : fields) {
                int child = childNodes[field.index()];
                boolean ok = child == NO_NODE
                        ? field.isOptional()
                        : kinds.get(child).isA(field.valueType());
                if (!ok) {
                    throw new IllegalStateException(kind.kindName() + "." + field.fieldName()
                            + " cannot hold " + describe(child));
                }
            }
        }

        private String describe(int child) {
            return child == NO_NODE ? "an empty slot" : kinds.get(child).kindName();
        }

        private void ensureCapacity(int capacity) {
            if (capacity > parents.length) {
                int grown = Math.max(capacity, parents.length * 2);
                parents = Arrays.copyOf(parents, grown);
                tokenStarts = Arrays.copyOf(tokenStarts, grown);
                tokenEnds = Arrays.copyOf(tokenEnds, grown);
            }
        }
    }
}
