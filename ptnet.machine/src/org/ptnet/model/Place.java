package org.ptnet.model;

import org.ptnet.constants.PnmlConstants;

/**
 * A labelled place. Holds a resource; its marking is the number of tokens it contains.
 */
public class Place extends Node {

    public static final String DEFAULT_LABEL = "Place";

    private int marking;

    public Place(String id) {
        super(id, DEFAULT_LABEL);
    }

    public Place(IdGenerator ids) {
        this(ids.nextPlaceId());
    }

    public int getMarking() {
        return marking;
    }

    public void setMarking(int marking) {
        if (marking < 0) {
            throw new IllegalArgumentException("marking of place " + getId() + " cannot be negative: " + marking);
        }
        this.marking = marking;
    }

    @Override
    public String getKind() {
        return PnmlConstants.PLACE;
    }
}
