package org.Aayush.arbor.strategy;

import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntList;
import org.Aayush.arbor.tree.LayoutTree;

import java.util.Arrays;

/**
 * Working fields of one Reingold–Tilford run, indexed by dense node index.
 *
 * <p>{@code thread} and {@code ancestor} hold node indices ({@link LayoutTree#NO_NODE}
 * when unset). One instance serves exactly one layout call.</p>
 */
final class ReingoldTilfordState {
    private final LayoutTree tree;
    private final double separation;

    private final double[] prelim;
    private final double[] mod;
    private final double[] change;
    private final double[] shift;
    private final int[] thread;
    private final int[] ancestor;
    private final int[] siblingNumber;
    private final IntArrayList preorder;

    ReingoldTilfordState(LayoutTree tree, double separation) {
        this.tree = tree;
        this.separation = separation;
        int n = tree.nodeCount();
        this.prelim = new double[n];
        this.mod = new double[n];
        this.change = new double[n];
        this.shift = new double[n];
        this.thread = new int[n];
        this.ancestor = new int[n];
        this.siblingNumber = new int[n];
        this.preorder = new IntArrayList(tree.reachableCount());
        Arrays.fill(thread, LayoutTree.NO_NODE);
        Arrays.fill(ancestor, LayoutTree.NO_NODE);
    }

    /**
     * Numbers reachable nodes in preorder, points every ancestor at itself and
     * records each node's position among its siblings.
     */
    void initialize() {
        IntArrayList stack = new IntArrayList();
        stack.push(tree.root());
        while (!stack.isEmpty()) {
            int v = stack.popInt();
            preorder.add(v);
            ancestor[v] = v;
            IntList children = tree.children(v);
            for (int i = children.size() - 1; i >= 0; i--) {
                int child = children.getInt(i);
                siblingNumber[child] = i;
                stack.push(child);
            }
        }
    }

    /**
     * Post-order pass computing preliminary coordinates and subtree modifiers.
     *
     * <p>Runs on an explicit stack with one child cursor per node, so depth is bounded
     * by heap rather than thread stack. Each child is apportioned against its left
     * siblings as soon as its own subtree is finished.</p>
     */
    void firstWalk(int root) {
        int n = tree.nodeCount();
        int[] cursor = new int[n];
        int[] defaultAncestor = new int[n];
        IntArrayList stack = new IntArrayList();
        stack.push(root);
        while (!stack.isEmpty()) {
            int v = stack.topInt();
            IntList children = tree.children(v);
            if (cursor[v] < children.size()) {
                if (cursor[v] == 0) {
                    defaultAncestor[v] = children.getInt(0);
                }
                stack.push(children.getInt(cursor[v]++));
                continue;
            }
            stack.popInt();
            finishNode(v);
            int p = tree.parent(v);
            if (v != root && p != LayoutTree.NO_NODE) {
                defaultAncestor[p] = apportion(v, defaultAncestor[p]);
            }
        }
    }

    private void finishNode(int v) {
        IntList children = tree.children(v);
        int left = leftSibling(v);
        if (children.isEmpty()) {
            prelim[v] = left == LayoutTree.NO_NODE ? 0.0d : prelim[left] + separation;
            return;
        }
        executeShifts(v);
        double midpoint = 0.5d * (prelim[children.getInt(0)] + prelim[children.getInt(children.size() - 1)]);
        if (left != LayoutTree.NO_NODE) {
            prelim[v] = prelim[left] + separation;
            mod[v] = prelim[v] - midpoint;
        } else {
            prelim[v] = midpoint;
        }
    }

    /**
     * Pre-order pass adding the ancestors' modifier sum to every preliminary coordinate.
     *
     * @return final primary-axis coordinate per node index; unreachable nodes stay 0.
     */
    double[] secondWalk() {
        int n = tree.nodeCount();
        double[] modSum = new double[n];
        double[] primary = new double[n];
        for (int i = 0; i < preorder.size(); i++) {
            int v = preorder.getInt(i);
            int p = tree.parent(v);
            if (p != LayoutTree.NO_NODE) {
                modSum[v] = modSum[p] + mod[p];
            }
            primary[v] = prelim[v] + modSum[v];
        }
        return primary;
    }

    /**
     * Pushes subtree {@code v} right until its left contour clears the right contour
     * of the subtrees of its left siblings.
     *
     * <p>Walks the inside contours of both sides and the outside contours in lock-step
     * via child and thread links. {@code sip/sop/sim/som} accumulate the modifiers of the
     * inside-right, outside-right, inside-left and outside-left contour nodes.</p>
     *
     * @return the default ancestor for the next sibling.
     */
    private int apportion(int v, int defaultAncestor) {
        int w = leftSibling(v);
        if (w == LayoutTree.NO_NODE) {
            return defaultAncestor;
        }
        int vip = v;
        int vop = v;
        int vim = w;
        int vom = tree.children(tree.parent(v)).getInt(0);
        double sip = mod[vip];
        double sop = mod[vop];
        double sim = mod[vim];
        double som = mod[vom];

        while (nextRight(vim) != LayoutTree.NO_NODE && nextLeft(vip) != LayoutTree.NO_NODE) {
            vim = nextRight(vim);
            vip = nextLeft(vip);
            vom = nextLeft(vom);
            vop = nextRight(vop);
            ancestor[vop] = v;
            double overlap = (prelim[vim] + sim) - (prelim[vip] + sip) + separation;
            if (overlap > 0.0d) {
                moveSubtree(greatestUncommonAncestor(vim, v, defaultAncestor), v, overlap);
                sip += overlap;
                sop += overlap;
            }
            sim += mod[vim];
            sip += mod[vip];
            som += mod[vom];
            sop += mod[vop];
        }

        if (nextRight(vim) != LayoutTree.NO_NODE && nextRight(vop) == LayoutTree.NO_NODE) {
            thread[vop] = nextRight(vim);
            mod[vop] += sim - sop;
        }
        if (nextLeft(vip) != LayoutTree.NO_NODE && nextLeft(vom) == LayoutTree.NO_NODE) {
            thread[vom] = nextLeft(vip);
            mod[vom] += sip - som;
            defaultAncestor = v;
        }
        return defaultAncestor;
    }

    /**
     * Shifts subtree {@code wr} right and spreads the same shift over the siblings
     * between {@code wl} and {@code wr} through the change/shift accumulators.
     */
    private void moveSubtree(int wl, int wr, double amount) {
        int subtrees = siblingNumber[wr] - siblingNumber[wl];
        double perSubtree = amount / subtrees;
        change[wr] -= perSubtree;
        shift[wr] += amount;
        change[wl] += perSubtree;
        prelim[wr] += amount;
        mod[wr] += amount;
    }

    /**
     * Applies the shifts recorded by {@link #moveSubtree} to the children of {@code v}.
     */
    private void executeShifts(int v) {
        IntList children = tree.children(v);
        double pendingShift = 0.0d;
        double pendingChange = 0.0d;
        for (int i = children.size() - 1; i >= 0; i--) {
            int w = children.getInt(i);
            prelim[w] += pendingShift;
            mod[w] += pendingShift;
            pendingChange += change[w];
            pendingShift += shift[w] + pendingChange;
        }
    }

    /**
     * Left one of the greatest distinct ancestors of {@code vim} and its right neighbour {@code v}.
     */
    private int greatestUncommonAncestor(int vim, int v, int defaultAncestor) {
        int candidate = ancestor[vim];
        if (tree.parent(candidate) == tree.parent(v)) {
            return candidate;
        }
        return defaultAncestor;
    }

    private int leftSibling(int v) {
        int p = tree.parent(v);
        if (p == LayoutTree.NO_NODE || siblingNumber[v] == 0) {
            return LayoutTree.NO_NODE;
        }
        return tree.children(p).getInt(siblingNumber[v] - 1);
    }

    private int nextLeft(int v) {
        IntList children = tree.children(v);
        return children.isEmpty() ? thread[v] : children.getInt(0);
    }

    private int nextRight(int v) {
        IntList children = tree.children(v);
        return children.isEmpty() ? thread[v] : children.getInt(children.size() - 1);
    }
}
