package org.Aayush.arbor.model;

import lombok.Builder;
import lombok.Value;

/**
 * Geometry settings for one layout engine.
 *
 * <p>Defaults match the resource viewer's card size and spacing.</p>
 */
@Value
@Builder(toBuilder = true)
public class LayoutConfig {
    public static final double DEFAULT_NODE_WIDTH = 280.0d;
    public static final double DEFAULT_NODE_HEIGHT = 140.0d;
    public static final double DEFAULT_HORIZONTAL_SPACING = 80.0d;
    public static final double DEFAULT_VERTICAL_SPACING = 180.0d;

    /** Node extent along the sibling axis. */
    @Builder.Default
    double nodeWidth = DEFAULT_NODE_WIDTH;

    /** Node extent along the depth axis. */
    @Builder.Default
    double nodeHeight = DEFAULT_NODE_HEIGHT;

    /** Gap between neighbouring nodes on the same level. */
    @Builder.Default
    double horizontalSpacing = DEFAULT_HORIZONTAL_SPACING;

    /** Gap between consecutive levels. */
    @Builder.Default
    double verticalSpacing = DEFAULT_VERTICAL_SPACING;

    @Builder.Default
    LayoutDirection direction = LayoutDirection.TOP_TO_BOTTOM;

    /**
     * Minimum distance between the centres of two same-level neighbours.
     */
    public double separation() {
        return nodeWidth + horizontalSpacing;
    }

    /**
     * Distance between two consecutive levels on the depth axis.
     */
    public double levelStep() {
        return nodeHeight + verticalSpacing;
    }

    /**
     * Returns the default top-to-bottom config.
     */
    public static LayoutConfig defaults() {
        return LayoutConfig.builder().build();
    }

    public static LayoutConfig topToBottom() {
        return defaults();
    }

    public static LayoutConfig leftToRight() {
        return LayoutConfig.builder()
                .direction(LayoutDirection.LEFT_TO_RIGHT)
                .build();
    }
}
