package org.Aayush.arbor.core;

import lombok.Builder;
import lombok.extern.slf4j.Slf4j;
import org.Aayush.arbor.model.LayoutConfig;
import org.Aayush.arbor.model.LayoutEdge;
import org.Aayush.arbor.model.LayoutNode;
import org.Aayush.arbor.model.LayoutResult;
import org.Aayush.arbor.model.LayoutTelemetry;
import org.Aayush.arbor.model.PositionedNode;
import org.Aayush.arbor.strategy.LayoutStrategyRegistry;
import org.Aayush.arbor.strategy.Placement;
import org.Aayush.arbor.strategy.TreeLayoutStrategy;
import org.Aayush.arbor.style.EdgeEndpoints;
import org.Aayush.arbor.style.EdgeStylePolicy;
import org.Aayush.arbor.style.UniformEdgeStylePolicy;
import org.Aayush.arbor.tree.LayoutTree;
import org.Aayush.arbor.tree.TreeAssembler;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Layout entry point: one strategy and one config bound at construction.
 *
 * <p>Execution flow per {@link #layout} call:</p>
 * <ul>
 * <li>Assemble a call-scoped {@link LayoutTree} from the flat node/edge lists.</li>
 * <li>Delegate placement to the bound {@link TreeLayoutStrategy}.</li>
 * <li>Merge coordinates, level and root flag into each node payload in input order.</li>
 * <li>Style every edge with the bound {@link EdgeStylePolicy}.</li>
 * </ul>
 *
 * <p>The engine holds no per-call state and can be shared across threads.</p>
 */
@Slf4j
public final class LayoutEngine {
    public static final String REASON_NODES_REQUIRED = "ARBOR_NODES_REQUIRED";
    public static final String REASON_NODE_REQUIRED = "ARBOR_NODE_REQUIRED";
    public static final String REASON_NODE_ID_REQUIRED = "ARBOR_NODE_ID_REQUIRED";
    public static final String REASON_EDGE_REQUIRED = "ARBOR_EDGE_REQUIRED";
    public static final String REASON_CONFIG_REQUIRED = "ARBOR_CONFIG_REQUIRED";
    public static final String REASON_INVALID_CONFIG = "ARBOR_INVALID_CONFIG";
    public static final String REASON_STRATEGY_CONTRACT = "ARBOR_STRATEGY_CONTRACT";

    private final String requestedStrategyId;
    private final TreeLayoutStrategy strategy;
    private final boolean fallbackApplied;
    private final LayoutConfig config;
    private final EdgeStylePolicy edgeStylePolicy;

    /**
     * Creates an engine; unknown or blank strategy names fall back to hierarchical.
     *
     * @param strategyName requested strategy id.
     * @param config geometry settings.
     * @param strategyRegistry optional registry override (defaults to built-ins).
     * @param edgeStylePolicy optional styling override (defaults to uniform styling).
     * @throws LayoutException when the config is missing or invalid.
     */
    @Builder
    public LayoutEngine(
            String strategyName,
            LayoutConfig config,
            LayoutStrategyRegistry strategyRegistry,
            EdgeStylePolicy edgeStylePolicy
    ) {
        this.config = validateConfig(config);
        LayoutStrategyRegistry registry = strategyRegistry == null
                ? LayoutStrategyRegistry.defaultRegistry()
                : strategyRegistry;
        this.requestedStrategyId = strategyName;
        TreeLayoutStrategy resolved = registry.strategy(strategyName);
        this.fallbackApplied = resolved == null;
        if (fallbackApplied) {
            resolved = registry.strategy(LayoutStrategyRegistry.STRATEGY_HIERARCHICAL);
            log.warn("Unknown layout strategy '{}', falling back to {}", strategyName, resolved.id());
        }
        this.strategy = resolved;
        this.edgeStylePolicy = edgeStylePolicy == null ? new UniformEdgeStylePolicy() : edgeStylePolicy;
    }

    /**
     * Creates an engine with built-in strategies and uniform edge styling.
     */
    public static LayoutEngine create(String strategyName, LayoutConfig config) {
        return LayoutEngine.builder()
                .strategyName(strategyName)
                .config(config)
                .build();
    }

    /**
     * Lays out one tree.
     *
     * @param nodes caller nodes; output keeps their order and count.
     * @param edges ownership edges; null is treated as empty.
     * @return positioned nodes, styled edges and telemetry.
     * @throws LayoutException on null elements, blank ids or a malformed strategy placement.
     */
    public LayoutResult layout(List<LayoutNode> nodes, List<LayoutEdge> edges) {
        LayoutTree tree = TreeAssembler.assemble(nodes, edges);
        List<LayoutEdge> edgeList = edges == null ? List.of() : edges;
        Placement placement = place(tree);

        LayoutNode[] nodeByIndex = new LayoutNode[tree.nodeCount()];
        LayoutResult.LayoutResultBuilder builder = LayoutResult.builder();
        for (LayoutNode node : nodes) {
            int index = tree.ids().toInternal(node.getId());
            if (nodeByIndex[index] == null) {
                nodeByIndex[index] = node;
            }
            builder.node(position(node, index, tree, placement));
        }
        for (LayoutEdge edge : edgeList) {
            builder.edge(edgeStylePolicy.style(edge, endpoints(edge, tree, nodeByIndex)));
        }

        LayoutTelemetry telemetry = LayoutTelemetry.builder()
                .requestedStrategyId(requestedStrategyId)
                .strategyId(strategy.id())
                .fallbackApplied(fallbackApplied)
                .nodeCount(nodes.size())
                .edgeCount(edgeList.size())
                .droppedEdgeCount(tree.droppedEdgeCount())
                .unreachableNodeCount(tree.unreachableCount())
                .maxLevel(tree.maxLevel())
                .rootId(tree.isEmpty() ? null : tree.ids().toExternal(tree.root()))
                .build();
        log.debug("Laid out {} nodes / {} edges with {} (root={}, levels={}, dropped={}, unreachable={})",
                telemetry.getNodeCount(), telemetry.getEdgeCount(), telemetry.getStrategyId(),
                telemetry.getRootId(), tree.levelCount(), telemetry.getDroppedEdgeCount(),
                telemetry.getUnreachableNodeCount());
        return builder.telemetry(telemetry).build();
    }

    /**
     * Id of the strategy actually used.
     */
    public String strategyId() {
        return strategy.id();
    }

    /**
     * True when the requested strategy name was unknown.
     */
    public boolean fallbackApplied() {
        return fallbackApplied;
    }

    public LayoutConfig config() {
        return config;
    }

    public EdgeStylePolicy edgeStylePolicy() {
        return edgeStylePolicy;
    }

    private Placement place(LayoutTree tree) {
        Placement placement;
        try {
            placement = strategy.place(tree, config);
        } catch (LayoutException ex) {
            throw ex;
        } catch (RuntimeException ex) {
            throw new LayoutException(
                    REASON_STRATEGY_CONTRACT,
                    "strategy " + strategy.id() + " failed to place " + tree.nodeCount() + " nodes",
                    ex
            );
        }
        if (placement == null || placement.size() != tree.nodeCount()) {
            throw new LayoutException(
                    REASON_STRATEGY_CONTRACT,
                    "strategy " + strategy.id() + " returned placement of size "
                            + (placement == null ? "null" : placement.size())
                            + ", expected " + tree.nodeCount()
            );
        }
        return placement;
    }

    private PositionedNode position(LayoutNode node, int index, LayoutTree tree, Placement placement) {
        int level = tree.level(index);
        boolean root = index == tree.root();
        Map<String, Object> data = new LinkedHashMap<>(node.getData());
        data.put(PositionedNode.DATA_LEVEL, level);
        data.put(PositionedNode.DATA_IS_ROOT, root);
        data.put(PositionedNode.DATA_LAYOUT_DIRECTION, config.getDirection().wireName());
        return PositionedNode.builder()
                .id(node.getId())
                .type(node.getType())
                .x(placement.x(index))
                .y(placement.y(index))
                .level(level)
                .root(root)
                .data(Collections.unmodifiableMap(data))
                .build();
    }

    private static EdgeEndpoints endpoints(LayoutEdge edge, LayoutTree tree, LayoutNode[] nodeByIndex) {
        int source = tree.ids().indexOf(edge.getSource());
        int target = tree.ids().indexOf(edge.getTarget());
        EdgeEndpoints.EdgeEndpointsBuilder builder = EdgeEndpoints.builder()
                .source(source < 0 ? null : nodeByIndex[source])
                .target(target < 0 ? null : nodeByIndex[target]);
        if (source >= 0 && target >= 0 && tree.parent(target) == source) {
            builder.childIndex(tree.children(source).indexOf(target))
                    .childCount(tree.children(source).size());
        }
        return builder.build();
    }

    private static LayoutConfig validateConfig(LayoutConfig config) {
        if (config == null) {
            throw new LayoutException(REASON_CONFIG_REQUIRED, "layout config must be provided");
        }
        requireDimension(config.getNodeWidth(), "nodeWidth");
        requireDimension(config.getNodeHeight(), "nodeHeight");
        requireDimension(config.getHorizontalSpacing(), "horizontalSpacing");
        requireDimension(config.getVerticalSpacing(), "verticalSpacing");
        if (config.getDirection() == null) {
            throw new LayoutException(REASON_INVALID_CONFIG, "direction must be provided");
        }
        return config;
    }

    private static void requireDimension(double value, String fieldName) {
        if (!Double.isFinite(value) || value < 0.0d) {
            throw new LayoutException(REASON_INVALID_CONFIG, fieldName + " must be finite and >= 0, got " + value);
        }
    }
}
