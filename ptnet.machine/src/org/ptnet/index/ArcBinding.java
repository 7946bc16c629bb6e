package org.ptnet.index;

import java.util.Objects;

/**
 * Resolved arc data attached to a transition entry: which place it touches,
 * where that place sits in the vector, and how the arc acts on it.
 */
public final class ArcBinding {

    public enum Direction {
        /** place to transition */
        INPUT,
        /** transition to place */
        OUTPUT
    }

    private final String arcId;
    private final String placeId;
    private final int offset;
    private final Direction direction;
    private final int weight;
    private final boolean inhibitor;
    private final String role;

    public ArcBinding(String arcId, String placeId, int offset, Direction direction, int weight,
                      boolean inhibitor, String role) {
        this.arcId = Objects.requireNonNull(arcId, "arcId cannot be null");
        this.placeId = Objects.requireNonNull(placeId, "placeId cannot be null");
        this.offset = offset;
        this.direction = Objects.requireNonNull(direction, "direction cannot be null");
        this.weight = weight;
        this.inhibitor = inhibitor;
        this.role = role; // Can be null
    }

    public String getArcId() {
        return arcId;
    }

    public String getPlaceId() {
        return placeId;
    }

    public int getOffset() {
        return offset;
    }

    public Direction getDirection() {
        return direction;
    }

    public int getWeight() {
        return weight;
    }

    public boolean isInhibitor() {
        return inhibitor;
    }

    public String getRole() {
        return role;
    }

    @Override
    public String toString() {
        return String.format("ArcBinding{arc=%s, place=%s@%d, %s, weight=%d%s%s}", arcId, placeId, offset,
                direction, weight, inhibitor ? ", inhibitor" : "", role != null ? ", role=" + role : "");
    }
}
