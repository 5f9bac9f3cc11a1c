package org.Aayush.arbor.strategy;

import org.Aayush.arbor.model.LayoutConfig;
import org.Aayush.arbor.tree.LayoutTree;

/**
 * Reingold–Tilford tree drawing in the linear-time form of Buchheim, Jünger and Leipert.
 *
 * <p>Guarantees that same-level nodes are at least one separation apart, that parents
 * sit centred over their first and last child, and that isomorphic subtrees are drawn
 * identically. The root keeps its preliminary coordinate; no global re-centring.</p>
 */
public final class ReingoldTilfordLayoutStrategy implements TreeLayoutStrategy {

    @Override
    public String id() {
        return LayoutStrategyRegistry.STRATEGY_REINGOLD_TILFORD;
    }

    @Override
    public Placement place(LayoutTree tree, LayoutConfig config) {
        if (tree.isEmpty()) {
            return Placement.fromPrimary(tree, config, new double[0]);
        }
        ReingoldTilfordState state = new ReingoldTilfordState(tree, config.separation());
        state.initialize();
        state.firstWalk(tree.root());
        return Placement.fromPrimary(tree, config, state.secondWalk());
    }
}
