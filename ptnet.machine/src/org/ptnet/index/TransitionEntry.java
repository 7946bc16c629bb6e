package org.ptnet.index;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A transition in the index, enriched with the arcs an arc pass attached to it.
 *
 * Entries accept bindings only while the index is being built; once the index
 * is published they are sealed and read-only.
 */
public final class TransitionEntry {

    private final String transitionId;
    private final String label;
    private final List<ArcBinding> arcs = new ArrayList<>();
    private boolean sealed;

    public TransitionEntry(String transitionId, String label) {
        this.transitionId = Objects.requireNonNull(transitionId, "transitionId cannot be null");
        this.label = Objects.requireNonNull(label, "label cannot be null");
    }

    public String getTransitionId() {
        return transitionId;
    }

    public String getLabel() {
        return label;
    }

    public void attach(ArcBinding binding) {
        if (sealed) {
            throw new IllegalStateException("transition entry " + transitionId + " is read-only");
        }
        arcs.add(Objects.requireNonNull(binding, "binding cannot be null"));
    }

    public List<ArcBinding> getArcs() {
        return Collections.unmodifiableList(arcs);
    }

    public List<ArcBinding> getArcs(ArcBinding.Direction direction) {
        List<ArcBinding> result = new ArrayList<>();
        for (ArcBinding binding : arcs) {
            if (binding.getDirection() == direction) {
                result.add(binding);
            }
        }
        return result;
    }

    public boolean isSealed() {
        return sealed;
    }

    void seal() {
        sealed = true;
    }

    @Override
    public String toString() {
        return "TransitionEntry{id=" + transitionId + ", arcs=" + arcs + "}";
    }
}
