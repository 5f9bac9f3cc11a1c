package org.Aayush.arbor.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.Map;

/**
 * Caller-supplied tree node.
 *
 * <p>The payload is opaque to the engine except for the optional {@code kind}
 * entry read by kind-aware edge styling.</p>
 */
@Value
@Builder
public class LayoutNode {
    public static final String DATA_KIND = "kind";

    /** Unique node identifier. */
    String id;

    /** Renderer node type, carried through untouched. */
    String type;

    /** Arbitrary caller payload. */
    @Singular("dataEntry")
    Map<String, Object> data;

    /**
     * Creates a node with no payload.
     */
    public static LayoutNode of(String id) {
        return LayoutNode.builder().id(id).build();
    }

    /**
     * Creates a node whose payload only carries a resource kind.
     */
    public static LayoutNode ofKind(String id, String kind) {
        return LayoutNode.builder().id(id).dataEntry(DATA_KIND, kind).build();
    }
}
