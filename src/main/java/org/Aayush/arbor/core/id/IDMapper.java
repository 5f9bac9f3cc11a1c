package org.Aayush.arbor.core.id;

import lombok.experimental.StandardException;

import java.util.List;

/**
 * Bidirectional mapping between caller node ids and dense internal node indices.
 *
 * <p>Indices follow first-occurrence input order, so index 0 is always the first
 * distinct id the caller supplied.</p>
 */
public interface IDMapper {

    /**
     * Sentinel returned by {@link #indexOf(String)} for unknown ids.
     */
    int UNKNOWN = -1;

    /**
     * Converts an external node id to its internal index.
     *
     * @param externalId caller node id.
     * @return dense internal index.
     * @throws UnknownIDException if the id was never registered.
     */
    int toInternal(String externalId) throws UnknownIDException;

    /**
     * Lenient lookup used for edge endpoints that may dangle.
     *
     * @param externalId caller node id, may be null.
     * @return internal index or {@link #UNKNOWN}.
     */
    int indexOf(String externalId);

    /**
     * Converts an internal index back to the caller node id.
     *
     * @throws IndexOutOfBoundsException if the index is out of range.
     */
    String toExternal(int internalId);

    boolean containsExternal(String externalId);

    boolean containsInternal(int internalId);

    /**
     * Returns number of distinct ids.
     */
    int size();

    /**
     * Thrown when an external id has no internal index.
     */
    @StandardException
    class UnknownIDException extends RuntimeException {
    }

    /**
     * Builds the default immutable mapper from ids in input order.
     *
     * @param orderedIds node ids; duplicates keep their first index.
     */
    static IDMapper fromOrderedIds(List<String> orderedIds) {
        return new FastUtilIDMapper(orderedIds);
    }
}
