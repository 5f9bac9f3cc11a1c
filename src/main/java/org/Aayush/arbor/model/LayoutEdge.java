package org.Aayush.arbor.model;

import lombok.Builder;
import lombok.Value;

/**
 * Ownership link: {@code source} owns (parents) {@code target}.
 */
@Value
@Builder
public class LayoutEdge {
    /** Optional edge identifier. */
    String id;
    /** Owning node id. */
    String source;
    /** Owned node id. */
    String target;
    /** Optional display label. */
    String label;

    /**
     * Creates an unlabelled edge with a {@code source-target} id.
     */
    public static LayoutEdge of(String source, String target) {
        return LayoutEdge.builder()
                .id(source + "-" + target)
                .source(source)
                .target(target)
                .build();
    }
}
