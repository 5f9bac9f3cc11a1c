package org.Aayush.arbor.strategy;

import org.Aayush.arbor.model.LayoutConfig;
import org.Aayush.arbor.tree.LayoutTree;

/**
 * Strategy contract for placing an assembled tree.
 *
 * <p>Implementations must keep all working state local to one {@link #place} call
 * so a single instance can be shared by concurrent callers.</p>
 */
public interface TreeLayoutStrategy {

    /**
     * Stable strategy identifier (for example {@code reingold-tilford}).
     */
    String id();

    /**
     * Computes coordinates for every node of the tree.
     *
     * @param tree call-scoped assembled tree.
     * @param config geometry settings.
     * @return placement covering exactly {@code tree.nodeCount()} nodes.
     */
    Placement place(LayoutTree tree, LayoutConfig config);
}
