package org.Aayush.arbor.model;

import lombok.Builder;
import lombok.Value;

/**
 * Immutable per-call layout telemetry snapshot.
 *
 * <p>Contains only input-derived values so equal inputs produce equal snapshots.</p>
 */
@Value
@Builder
public class LayoutTelemetry {

    /** Strategy name the engine was created with. */
    String requestedStrategyId;

    /** Strategy id that actually produced coordinates. */
    String strategyId;

    /** True when the requested name was unknown and the hierarchical fallback was used. */
    boolean fallbackApplied;

    int nodeCount;

    int edgeCount;

    /** Edges excluded from geometry because an endpoint id is unknown. */
    int droppedEdgeCount;

    /** Nodes not reachable from the selected root. */
    int unreachableNodeCount;

    /** Deepest level reached from the root, or -1 for empty input. */
    int maxLevel;

    /** Selected root id, null for empty input. */
    String rootId;
}
