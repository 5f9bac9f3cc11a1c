package org.Aayush.arbor.core.id;

import it.unimi.dsi.fastutil.objects.Object2IntOpenHashMap;

import java.util.ArrayList;
import java.util.List;

/**
 * fastutil-backed {@link IDMapper}.
 *
 * <p>Immutable after construction and safe for concurrent reads.</p>
 */
public final class FastUtilIDMapper implements IDMapper {

    private final Object2IntOpenHashMap<String> forward;
    private final String[] reverse;

    /**
     * Registers ids in order, skipping repeats.
     *
     * @param orderedIds non-null ids in input order.
     */
    public FastUtilIDMapper(List<String> orderedIds) {
        if (orderedIds == null) {
            throw new IllegalArgumentException("orderedIds cannot be null");
        }
        this.forward = new Object2IntOpenHashMap<>(orderedIds.size());
        this.forward.defaultReturnValue(UNKNOWN);

        List<String> distinct = new ArrayList<>(orderedIds.size());
        for (String id : orderedIds) {
            if (id == null) {
                throw new IllegalArgumentException("node id cannot be null");
            }
            if (!forward.containsKey(id)) {
                forward.put(id, distinct.size());
                distinct.add(id);
            }
        }
        this.reverse = distinct.toArray(new String[0]);
        this.forward.trim();
    }

    @Override
    public int toInternal(String externalId) throws UnknownIDException {
        if (externalId == null) {
            throw new IllegalArgumentException("externalId cannot be null");
        }
        int id = forward.getInt(externalId);
        if (id == UNKNOWN) {
            throw new UnknownIDException("External ID not found: " + externalId);
        }
        return id;
    }

    @Override
    public int indexOf(String externalId) {
        if (externalId == null) {
            return UNKNOWN;
        }
        return forward.getInt(externalId);
    }

    @Override
    public String toExternal(int internalId) {
        if (!containsInternal(internalId)) {
            throw new IndexOutOfBoundsException("Internal ID out of bounds: " + internalId);
        }
        return reverse[internalId];
    }

    @Override
    public boolean containsExternal(String externalId) {
        return externalId != null && forward.containsKey(externalId);
    }

    @Override
    public boolean containsInternal(int internalId) {
        return internalId >= 0 && internalId < reverse.length;
    }

    @Override
    public int size() {
        return reverse.length;
    }
}
