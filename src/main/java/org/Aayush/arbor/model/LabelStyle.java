package org.Aayush.arbor.model;

import lombok.Builder;
import lombok.Value;

/**
 * Label text and label background styling for one rendered edge.
 */
@Value
@Builder
public class LabelStyle {
    String fontSize;
    String fontWeight;
    String fill;
    String backgroundFill;
    double backgroundFillOpacity;
}
