package org.Aayush.arbor.model;

import lombok.Builder;
import lombok.Value;

/**
 * Stroke styling hints for one rendered edge.
 */
@Value
@Builder
public class EdgeStyle {
    /** Hex stroke colour. */
    String stroke;
    /** Stroke width in pixels. */
    int strokeWidth;
    /** SVG dash pattern, null for a solid line. */
    String strokeDasharray;
}
