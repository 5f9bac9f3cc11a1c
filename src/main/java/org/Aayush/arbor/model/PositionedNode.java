package org.Aayush.arbor.model;

import lombok.Builder;
import lombok.Value;

import java.util.Map;

/**
 * Layout output for one input node.
 *
 * <p>{@code data} is the original payload merged with {@code level},
 * {@code isRoot} and {@code layoutDirection} so renderers need no further geometry.</p>
 */
@Value
@Builder
public class PositionedNode {
    public static final String DATA_LEVEL = "level";
    public static final String DATA_IS_ROOT = "isRoot";
    public static final String DATA_LAYOUT_DIRECTION = "layoutDirection";

    String id;
    String type;
    double x;
    double y;
    int level;
    boolean root;
    Map<String, Object> data;
}
