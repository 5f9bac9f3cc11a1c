package org.Aayush.arbor.tree;

import it.unimi.dsi.fastutil.ints.IntList;
import it.unimi.dsi.fastutil.ints.IntLists;
import org.Aayush.arbor.core.id.IDMapper;

import java.util.List;
import java.util.Objects;

/**
 * Immutable rooted-tree view of one layout call, indexed by dense node index.
 *
 * <p>Parent links are back-references used for traversal only; ownership flows
 * parent to children. Nodes not reachable from the root keep level 0, have no
 * parent and appear in no level registry.</p>
 */
public final class LayoutTree {
    public static final int NO_NODE = -1;

    private final IDMapper ids;
    private final int root;
    private final int[] parent;
    private final IntList[] children;
    private final int[] level;
    private final boolean[] reachable;
    private final List<IntList> levels;
    private final int droppedEdgeCount;
    private final int reachableCount;

    LayoutTree(
            IDMapper ids,
            int root,
            int[] parent,
            IntList[] children,
            int[] level,
            boolean[] reachable,
            List<IntList> levels,
            int droppedEdgeCount
    ) {
        this.ids = Objects.requireNonNull(ids, "ids");
        this.root = root;
        this.parent = parent;
        this.children = new IntList[children.length];
        for (int i = 0; i < children.length; i++) {
            this.children[i] = IntLists.unmodifiable(children[i]);
        }
        this.level = level;
        this.reachable = reachable;
        IntList[] frozenLevels = new IntList[levels.size()];
        for (int i = 0; i < frozenLevels.length; i++) {
            frozenLevels[i] = IntLists.unmodifiable(levels.get(i));
        }
        this.levels = List.of(frozenLevels);
        this.droppedEdgeCount = droppedEdgeCount;
        int count = 0;
        for (boolean r : reachable) {
            if (r) {
                count++;
            }
        }
        this.reachableCount = count;
    }

    /**
     * Id translation for this call.
     */
    public IDMapper ids() {
        return ids;
    }

    /**
     * Number of distinct nodes.
     */
    public int nodeCount() {
        return ids.size();
    }

    public boolean isEmpty() {
        return ids.size() == 0;
    }

    /**
     * Root index, or {@link #NO_NODE} for an empty tree.
     */
    public int root() {
        return root;
    }

    /**
     * Parent index, or {@link #NO_NODE} for the root and unreachable nodes.
     */
    public int parent(int node) {
        return parent[node];
    }

    /**
     * Ordered children of a node (unmodifiable).
     */
    public IntList children(int node) {
        return children[node];
    }

    public boolean isLeaf(int node) {
        return children[node].isEmpty();
    }

    /**
     * Depth below the root; 0 for the root and unreachable nodes.
     */
    public int level(int node) {
        return level[node];
    }

    public boolean isReachable(int node) {
        return reachable[node];
    }

    /**
     * Number of populated levels; 0 for an empty tree.
     */
    public int levelCount() {
        return levels.size();
    }

    /**
     * Deepest populated level, or -1 for an empty tree.
     */
    public int maxLevel() {
        return levels.size() - 1;
    }

    /**
     * Reachable nodes of one level in breadth-first order (unmodifiable).
     */
    public IntList levelMembers(int depth) {
        return levels.get(depth);
    }

    /**
     * Edges skipped because an endpoint id is unknown.
     */
    public int droppedEdgeCount() {
        return droppedEdgeCount;
    }

    public int reachableCount() {
        return reachableCount;
    }

    public int unreachableCount() {
        return nodeCount() - reachableCount;
    }
}
