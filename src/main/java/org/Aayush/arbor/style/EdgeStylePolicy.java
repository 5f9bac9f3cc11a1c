package org.Aayush.arbor.style;

import org.Aayush.arbor.model.LayoutEdge;
import org.Aayush.arbor.model.StyledEdge;

/**
 * Presentational styling applied to every output edge so renderers do no geometry work.
 */
public interface EdgeStylePolicy {

    /**
     * Stable policy identifier.
     */
    String id();

    /**
     * Styles one input edge.
     *
     * @param edge caller edge.
     * @param endpoints resolved endpoint context.
     * @return styled copy carrying the edge's id, source and target.
     */
    StyledEdge style(LayoutEdge edge, EdgeEndpoints endpoints);

    /**
     * Edge label or empty string.
     */
    static String labelOrEmpty(LayoutEdge edge) {
        return edge.getLabel() == null ? "" : edge.getLabel();
    }
}
