package org.Aayush.arbor.model;

/**
 * Orientation of the depth axis.
 *
 * <p>{@code TOP_TO_BOTTOM} grows levels along y and spreads siblings along x.
 * {@code LEFT_TO_RIGHT} swaps the two axes.</p>
 */
public enum LayoutDirection {
    TOP_TO_BOTTOM("TB"),
    LEFT_TO_RIGHT("LR");

    private final String wireName;

    LayoutDirection(String wireName) {
        this.wireName = wireName;
    }

    /**
     * Short name used by rendering payloads ({@code TB} or {@code LR}).
     */
    public String wireName() {
        return wireName;
    }

    /**
     * True when the primary (sibling) axis is y.
     */
    public boolean isHorizontal() {
        return this == LEFT_TO_RIGHT;
    }
}
