package org.Aayush.arbor.strategy;

import org.Aayush.arbor.model.LayoutConfig;
import org.Aayush.arbor.tree.LayoutTree;

/**
 * Subtree-size-aware placement with an explicit per-level conflict sweep.
 *
 * <p>Children are ordered by descending subtree width (largest subtree leftmost, ties in
 * edge order), leaves are packed left to right, parents are centred over their first
 * and last child, then every level is swept for nodes closer than one separation.
 * The finished drawing is centred on 0.</p>
 */
public final class EnhancedTreeLayoutStrategy implements TreeLayoutStrategy {

    @Override
    public String id() {
        return LayoutStrategyRegistry.STRATEGY_ENHANCED_TREE;
    }

    @Override
    public Placement place(LayoutTree tree, LayoutConfig config) {
        if (tree.isEmpty()) {
            return Placement.fromPrimary(tree, config, new double[0]);
        }
        EnhancedState state = new EnhancedState(tree, config.separation());
        state.sortChildrenBySubtreeWidth();
        state.placeSubtree(tree.root(), 0.0d);
        state.resolveConflicts();
        state.center();
        return Placement.fromPrimary(tree, config, state.positions());
    }
}
