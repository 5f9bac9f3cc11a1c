package org.Aayush.arbor.model;

import lombok.Builder;
import lombok.Value;

/**
 * Layout output for one input edge.
 */
@Value
@Builder
public class StyledEdge {
    String id;
    String source;
    String target;
    /** Renderer edge type, for example {@code smoothstep}. */
    String type;
    EdgeStyle style;
    boolean animated;
    /** Display label, empty when the edge carries none. */
    String label;
    LabelStyle labelStyle;
}
