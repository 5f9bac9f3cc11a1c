package org.Aayush.arbor.style;

import lombok.Builder;
import lombok.Value;
import org.Aayush.arbor.model.LayoutNode;

/**
 * Resolved endpoints of one edge as seen by an {@link EdgeStylePolicy}.
 */
@Value
@Builder
public class EdgeEndpoints {
    /** Owning node, null when the source id is unknown. */
    LayoutNode source;

    /** Owned node, null when the target id is unknown. */
    LayoutNode target;

    /** Position of the target among the source's laid-out children, -1 when the edge is not a tree edge. */
    @Builder.Default
    int childIndex = -1;

    /** Number of laid-out children of the source. */
    int childCount;

    public boolean isTreeEdge() {
        return childIndex >= 0;
    }
}
