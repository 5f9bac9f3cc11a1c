package org.Aayush.arbor.core;

import lombok.Getter;

import java.util.Objects;

/**
 * Unchecked failure of one layout call, tagged with a stable {@code ARBOR_*} reason code.
 *
 * <p>Thrown for broken caller input, invalid configuration and malformed strategy output.
 * When one element of the node or edge list is at fault its position is kept in
 * {@link #getElementIndex()}.</p>
 */
@Getter
public final class LayoutException extends RuntimeException {
    public static final int NO_ELEMENT = -1;

    private final String reasonCode;

    /** Position in the offending node or edge list, or {@link #NO_ELEMENT}. */
    private final int elementIndex;

    public LayoutException(String reasonCode, String message) {
        this(reasonCode, NO_ELEMENT, message, null);
    }

    /**
     * Failure tied to a single list element, for example {@code nodes[3]}.
     */
    public LayoutException(String reasonCode, int elementIndex, String message) {
        this(reasonCode, elementIndex, message, null);
    }

    public LayoutException(String reasonCode, String message, Throwable cause) {
        this(reasonCode, NO_ELEMENT, message, cause);
    }

    private LayoutException(String reasonCode, int elementIndex, String message, Throwable cause) {
        super(tagged(reasonCode, message), cause);
        this.reasonCode = reasonCode;
        this.elementIndex = elementIndex;
    }

    public boolean hasElementIndex() {
        return elementIndex != NO_ELEMENT;
    }

    private static String tagged(String reasonCode, String message) {
        Objects.requireNonNull(reasonCode, "reasonCode");
        if (reasonCode.isBlank()) {
            throw new IllegalArgumentException("reasonCode must be non-blank");
        }
        return "[" + reasonCode + "] " + Objects.requireNonNull(message, "message");
    }
}
