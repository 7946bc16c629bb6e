package org.ptnet.index;

import java.util.Map;

/**
 * P/T-net index of one net: place offsets and the enriched transition table.
 *
 * Vectors returned by {@link #emptyVector()} and {@link #initialVector()} are
 * new allocations on every call. The transition map is one shared read-only
 * view; engines that need to change a marking copy the vector they were given
 * and leave the transitions alone.
 */
public final class NetIndex {

    private final String netName;
    private final Map<String, PlaceEntry> places;
    private final Map<String, TransitionEntry> transitions;

    NetIndex(String netName, Map<String, PlaceEntry> places, Map<String, TransitionEntry> transitions) {
        this.netName = netName;
        this.places = places;
        this.transitions = transitions;
    }

    public String getNetName() {
        return netName;
    }

    public Map<String, PlaceEntry> getPlaceIndex() {
        return places;
    }

    public Map<String, TransitionEntry> getTransitionIndex() {
        return transitions;
    }

    public int getPlaceCount() {
        return places.size();
    }

    /**
     * Vector offset of a place.
     *
     * @throws IllegalArgumentException for an unknown place id
     */
    public int offsetOf(String placeId) {
        PlaceEntry entry = places.get(placeId);
        if (entry == null) {
            throw new IllegalArgumentException("net " + netName + " has no place " + placeId);
        }
        return entry.getOffset();
    }

    public int[] emptyVector() {
        return new int[places.size()];
    }

    public int[] initialVector() {
        int[] vector = emptyVector();
        for (PlaceEntry entry : places.values()) {
            vector[entry.getOffset()] = entry.getInitial();
        }
        return vector;
    }

    public Snapshot snapshot() {
        return new Snapshot(initialVector(), transitions);
    }
}
