package org.Aayush.arbor.style;

import org.Aayush.arbor.model.EdgeStyle;
import org.Aayush.arbor.model.LabelStyle;
import org.Aayush.arbor.model.LayoutEdge;
import org.Aayush.arbor.model.LayoutNode;
import org.Aayush.arbor.model.StyledEdge;

import java.util.Locale;
import java.util.Set;

/**
 * Styles edges by the resource kinds of their endpoints.
 *
 * <p>Reads the {@code kind} payload entry. Strong ownership pairs are drawn darker and
 * thicker, service edges dashed, config edges dotted. The first tree edge of each
 * parent is labelled with the parent's child count unless the edge has its own label.</p>
 */
public final class ResourceKindEdgeStylePolicy implements EdgeStylePolicy {
    public static final String POLICY_ID = "resource-kind";

    private static final Set<String> STRONG_OWNERSHIP = Set.of(
            "cluster>component",
            "component>instance",
            "deployment>replicaset",
            "replicaset>pod"
    );
    private static final Set<String> CONFIG_KINDS = Set.of("configmap", "secret");
    private static final String SERVICE_KIND = "service";

    static final EdgeStyle OWNERSHIP_STYLE = EdgeStyle.builder().stroke("#999").strokeWidth(3).build();
    static final EdgeStyle SERVICE_STYLE = EdgeStyle.builder().stroke("#aaa").strokeWidth(2).strokeDasharray("5,5").build();
    static final EdgeStyle CONFIG_STYLE = EdgeStyle.builder().stroke("#ccc").strokeWidth(2).strokeDasharray("3,3").build();

    private static final LabelStyle LABEL_STYLE = LabelStyle.builder()
            .fontSize("12px")
            .fontWeight("bold")
            .backgroundFill("white")
            .backgroundFillOpacity(0.8d)
            .build();

    @Override
    public String id() {
        return POLICY_ID;
    }

    @Override
    public StyledEdge style(LayoutEdge edge, EdgeEndpoints endpoints) {
        String parentKind = kindOf(endpoints.getSource());
        String childKind = kindOf(endpoints.getTarget());
        return StyledEdge.builder()
                .id(edge.getId())
                .source(edge.getSource())
                .target(edge.getTarget())
                .type(UniformEdgeStylePolicy.EDGE_TYPE)
                .style(styleFor(parentKind, childKind))
                .animated(false)
                .label(labelFor(edge, endpoints))
                .labelStyle(LABEL_STYLE)
                .build();
    }

    static EdgeStyle styleFor(String parentKind, String childKind) {
        if (STRONG_OWNERSHIP.contains(parentKind + ">" + childKind)) {
            return OWNERSHIP_STYLE;
        }
        if (SERVICE_KIND.equals(parentKind) || SERVICE_KIND.equals(childKind)) {
            return SERVICE_STYLE;
        }
        if (CONFIG_KINDS.contains(parentKind) || CONFIG_KINDS.contains(childKind)) {
            return CONFIG_STYLE;
        }
        return UniformEdgeStylePolicy.DEFAULT_STYLE;
    }

    private static String labelFor(LayoutEdge edge, EdgeEndpoints endpoints) {
        if (edge.getLabel() != null && !edge.getLabel().isEmpty()) {
            return edge.getLabel();
        }
        if (endpoints.getChildIndex() == 0) {
            return Integer.toString(endpoints.getChildCount());
        }
        return "";
    }

    private static String kindOf(LayoutNode node) {
        if (node == null) {
            return "";
        }
        Object kind = node.getData().get(LayoutNode.DATA_KIND);
        return kind == null ? "" : kind.toString().toLowerCase(Locale.ROOT);
    }
}
