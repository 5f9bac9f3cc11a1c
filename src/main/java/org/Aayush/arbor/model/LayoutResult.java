package org.Aayush.arbor.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * Positioned nodes and styled edges, both in input order.
 */
@Value
@Builder
public class LayoutResult {
    @Singular
    List<PositionedNode> nodes;

    @Singular
    List<StyledEdge> edges;

    LayoutTelemetry telemetry;

    /**
     * Looks up a positioned node by id, or null when absent.
     */
    public PositionedNode node(String id) {
        for (PositionedNode node : nodes) {
            if (node.getId().equals(id)) {
                return node;
            }
        }
        return null;
    }
}
