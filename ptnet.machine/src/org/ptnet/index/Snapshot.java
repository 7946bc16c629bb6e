package org.ptnet.index;

import java.util.Map;

/**
 * The flattened form of a net handed to a simulation engine.
 *
 * {@link #getState()} is a fresh array owned by the receiver and may be
 * mutated freely. {@link #getTransitions()} is shared by every snapshot of
 * the same index and must be treated as read-only.
 */
public final class Snapshot {

    private final int[] state;
    private final Map<String, TransitionEntry> transitions;

    Snapshot(int[] state, Map<String, TransitionEntry> transitions) {
        this.state = state;
        this.transitions = transitions;
    }

    public int[] getState() {
        return state;
    }

    public Map<String, TransitionEntry> getTransitions() {
        return transitions;
    }
}
