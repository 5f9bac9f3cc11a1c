package org.Aayush.arbor.strategy;

import it.unimi.dsi.fastutil.ints.IntArrayFIFOQueue;
import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntList;
import org.Aayush.arbor.model.LayoutConfig;
import org.Aayush.arbor.tree.LayoutTree;

/**
 * Fast level-based placement used as the fallback strategy.
 *
 * <p>Each level is centred on 0 with nodes one separation apart in breadth-first
 * order. Unrelated branches on the same level are not kept apart, so skewed trees
 * can produce crossing edges.</p>
 */
public final class HierarchicalLayoutStrategy implements TreeLayoutStrategy {

    @Override
    public String id() {
        return LayoutStrategyRegistry.STRATEGY_HIERARCHICAL;
    }

    @Override
    public Placement place(LayoutTree tree, LayoutConfig config) {
        double[] primary = new double[tree.nodeCount()];
        if (tree.isEmpty()) {
            return Placement.fromPrimary(tree, config, primary);
        }

        IntArrayList levelWidth = new IntArrayList();
        breadthFirst(tree, (node, level) -> {
            if (level == levelWidth.size()) {
                levelWidth.add(0);
            }
            levelWidth.set(level, levelWidth.getInt(level) + 1);
        });

        int[] levelIndex = new int[levelWidth.size()];
        double separation = config.separation();
        breadthFirst(tree, (node, level) -> {
            int indexInLevel = levelIndex[level]++;
            double center = (levelWidth.getInt(level) - 1) / 2.0d;
            primary[node] = (indexInLevel - center) * separation;
        });
        return Placement.fromPrimary(tree, config, primary);
    }

    private static void breadthFirst(LayoutTree tree, LevelVisitor visitor) {
        IntArrayFIFOQueue queue = new IntArrayFIFOQueue();
        IntArrayFIFOQueue levels = new IntArrayFIFOQueue();
        boolean[] visited = new boolean[tree.nodeCount()];
        queue.enqueue(tree.root());
        levels.enqueue(0);
        while (!queue.isEmpty()) {
            int node = queue.dequeueInt();
            int level = levels.dequeueInt();
            if (visited[node]) {
                continue;
            }
            visited[node] = true;
            visitor.visit(node, level);
            IntList children = tree.children(node);
            for (int i = 0; i < children.size(); i++) {
                int child = children.getInt(i);
                if (!visited[child]) {
                    queue.enqueue(child);
                    levels.enqueue(level + 1);
                }
            }
        }
    }

    @FunctionalInterface
    private interface LevelVisitor {
        void visit(int node, int level);
    }
}
