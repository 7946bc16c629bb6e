package org.ptnet.model;

import org.ptnet.constants.PnmlConstants;

/**
 * A labelled transition. Represents an activity.
 */
public class Transition extends Node {

    public static final String DEFAULT_LABEL = "Transition";

    public Transition(String id) {
        super(id, DEFAULT_LABEL);
    }

    public Transition(IdGenerator ids) {
        this(ids.nextTransitionId());
    }

    @Override
    public String getKind() {
        return PnmlConstants.TRANSITION;
    }
}
