package org.Aayush.arbor.style;

import org.Aayush.arbor.model.EdgeStyle;
import org.Aayush.arbor.model.LabelStyle;
import org.Aayush.arbor.model.LayoutEdge;
import org.Aayush.arbor.model.StyledEdge;

/**
 * Default policy: every edge is a light-grey solid smoothstep line.
 */
public final class UniformEdgeStylePolicy implements EdgeStylePolicy {
    public static final String POLICY_ID = "uniform";
    public static final String EDGE_TYPE = "smoothstep";

    static final EdgeStyle DEFAULT_STYLE = EdgeStyle.builder()
            .stroke("#bbb")
            .strokeWidth(2)
            .build();

    private static final LabelStyle LABEL_STYLE = LabelStyle.builder()
            .fontSize("11px")
            .fill("#666")
            .backgroundFill("white")
            .backgroundFillOpacity(0.8d)
            .build();

    @Override
    public String id() {
        return POLICY_ID;
    }

    @Override
    public StyledEdge style(LayoutEdge edge, EdgeEndpoints endpoints) {
        return StyledEdge.builder()
                .id(edge.getId())
                .source(edge.getSource())
                .target(edge.getTarget())
                .type(EDGE_TYPE)
                .style(DEFAULT_STYLE)
                .animated(false)
                .label(EdgeStylePolicy.labelOrEmpty(edge))
                .labelStyle(LABEL_STYLE)
                .build();
    }
}
