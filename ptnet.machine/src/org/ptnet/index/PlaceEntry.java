package org.ptnet.index;

import java.util.Objects;

/**
 * Position of a place in the marking vector and its initial token count.
 */
public final class PlaceEntry {

    private final String placeId;
    private final int offset;
    private final int initial;

    public PlaceEntry(String placeId, int offset, int initial) {
        this.placeId = Objects.requireNonNull(placeId, "placeId cannot be null");
        this.offset = offset;
        this.initial = initial;
    }

    public String getPlaceId() {
        return placeId;
    }

    public int getOffset() {
        return offset;
    }

    public int getInitial() {
        return initial;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        PlaceEntry that = (PlaceEntry) o;
        return offset == that.offset && initial == that.initial && placeId.equals(that.placeId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(placeId, offset, initial);
    }

    @Override
    public String toString() {
        return String.format("PlaceEntry{id=%s, offset=%d, initial=%d}", placeId, offset, initial);
    }
}
