package org.Aayush.arbor.strategy;

import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntArrays;
import it.unimi.dsi.fastutil.ints.IntList;
import org.Aayush.arbor.tree.LayoutTree;

/**
 * Working fields of one enhanced-tree run.
 *
 * <p>Holds its own re-ordered child lists so the shared {@link LayoutTree} stays untouched.
 * Parents are centred on their children's placed x, not on the offsets at which the
 * child subtrees started.</p>
 */
final class EnhancedState {
    private final LayoutTree tree;
    private final double separation;
    private final int[] subtreeWidth;
    private final IntArrayList[] orderedChildren;
    private final double[] x;

    EnhancedState(LayoutTree tree, double separation) {
        this.tree = tree;
        this.separation = separation;
        int n = tree.nodeCount();
        this.subtreeWidth = new int[n];
        this.orderedChildren = new IntArrayList[n];
        this.x = new double[n];
        for (int v = 0; v < n; v++) {
            orderedChildren[v] = new IntArrayList(tree.children(v));
        }
    }

    /**
     * Computes leaf-count widths bottom-up, then stably sorts every child list by
     * descending width.
     */
    void sortChildrenBySubtreeWidth() {
        for (int depth = tree.maxLevel(); depth >= 0; depth--) {
            IntList members = tree.levelMembers(depth);
            for (int i = 0; i < members.size(); i++) {
                int v = members.getInt(i);
                IntArrayList children = orderedChildren[v];
                int width = 0;
                for (int c = 0; c < children.size(); c++) {
                    width += subtreeWidth[children.getInt(c)];
                }
                subtreeWidth[v] = Math.max(width, 1);
                int[] sorted = children.toIntArray();
                IntArrays.mergeSort(sorted, (a, b) -> Integer.compare(subtreeWidth[b], subtreeWidth[a]));
                orderedChildren[v] = IntArrayList.wrap(sorted);
            }
        }
    }

    /**
     * Provisional left-to-right placement: leaves take consecutive slots in depth-first
     * order and every parent sits at the midpoint of its first and last child's placed x.
     *
     * @param v subtree root.
     * @param startX first free coordinate.
     * @return next free coordinate after this subtree.
     */
    double placeSubtree(int v, double startX) {
        double next = startX;
        int[] cursor = new int[tree.nodeCount()];
        IntArrayList stack = new IntArrayList();
        stack.push(v);
        while (!stack.isEmpty()) {
            int node = stack.topInt();
            IntArrayList children = orderedChildren[node];
            if (cursor[node] < children.size()) {
                stack.push(children.getInt(cursor[node]++));
                continue;
            }
            stack.popInt();
            if (children.isEmpty()) {
                x[node] = next;
                next += separation;
            } else {
                x[node] = 0.5d * (x[children.getInt(0)] + x[children.getInt(children.size() - 1)]);
            }
        }
        return next;
    }

    /**
     * Sweeps each level left to right and pushes any node closer than one separation
     * to its left neighbour, together with its whole subtree.
     */
    void resolveConflicts() {
        for (int depth = 0; depth <= tree.maxLevel(); depth++) {
            int[] members = tree.levelMembers(depth).toIntArray();
            if (members.length <= 1) {
                continue;
            }
            IntArrays.mergeSort(members, (a, b) -> Double.compare(x[a], x[b]));
            for (int i = 1; i < members.length; i++) {
                double required = x[members[i - 1]] + separation;
                int current = members[i];
                if (x[current] < required) {
                    shiftSubtree(current, required - x[current]);
                }
            }
        }
    }

    /**
     * Translates all reachable nodes so the drawing's extent is centred on 0.
     */
    void center() {
        double minX = Double.POSITIVE_INFINITY;
        double maxX = Double.NEGATIVE_INFINITY;
        for (int depth = 0; depth <= tree.maxLevel(); depth++) {
            IntList members = tree.levelMembers(depth);
            for (int i = 0; i < members.size(); i++) {
                double value = x[members.getInt(i)];
                minX = Math.min(minX, value);
                maxX = Math.max(maxX, value);
            }
        }
        double offset = -0.5d * (minX + maxX);
        for (int depth = 0; depth <= tree.maxLevel(); depth++) {
            IntList members = tree.levelMembers(depth);
            for (int i = 0; i < members.size(); i++) {
                x[members.getInt(i)] += offset;
            }
        }
    }

    /**
     * Primary-axis coordinate per node index.
     */
    double[] positions() {
        return x;
    }

    int subtreeWidth(int v) {
        return subtreeWidth[v];
    }

    IntList orderedChildren(int v) {
        return orderedChildren[v];
    }

    private void shiftSubtree(int v, double amount) {
        IntArrayList stack = new IntArrayList();
        stack.push(v);
        while (!stack.isEmpty()) {
            int node = stack.popInt();
            x[node] += amount;
            stack.addAll(orderedChildren[node]);
        }
    }
}
