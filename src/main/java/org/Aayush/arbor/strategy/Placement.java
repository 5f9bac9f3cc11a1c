package org.Aayush.arbor.strategy;

import org.Aayush.arbor.model.LayoutConfig;
import org.Aayush.arbor.tree.LayoutTree;

import java.util.Objects;

/**
 * Final (x, y) coordinates indexed by dense node index.
 */
public final class Placement {
    private final double[] x;
    private final double[] y;

    /**
     * Wraps coordinate arrays of equal length.
     */
    public Placement(double[] x, double[] y) {
        this.x = Objects.requireNonNull(x, "x");
        this.y = Objects.requireNonNull(y, "y");
        if (x.length != y.length) {
            throw new IllegalArgumentException("x and y must have equal length: " + x.length + " != " + y.length);
        }
    }

    /**
     * Maps primary-axis offsets and tree levels to (x, y) for the configured direction.
     *
     * <p>The depth coordinate is {@code level * levelStep}. Unreachable nodes land on (0, 0).</p>
     *
     * @param tree assembled tree.
     * @param config geometry settings.
     * @param primary sibling-axis coordinate per node index.
     */
    public static Placement fromPrimary(LayoutTree tree, LayoutConfig config, double[] primary) {
        int n = tree.nodeCount();
        double[] x = new double[n];
        double[] y = new double[n];
        boolean horizontal = config.getDirection().isHorizontal();
        double levelStep = config.levelStep();
        for (int v = 0; v < n; v++) {
            if (!tree.isReachable(v)) {
                continue;
            }
            double depth = tree.level(v) * levelStep;
            if (horizontal) {
                x[v] = depth;
                y[v] = primary[v];
            } else {
                x[v] = primary[v];
                y[v] = depth;
            }
        }
        return new Placement(x, y);
    }

    public int size() {
        return x.length;
    }

    public double x(int node) {
        return x[node];
    }

    public double y(int node) {
        return y[node];
    }
}
