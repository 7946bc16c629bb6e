package org.ptnet.index;

import java.util.Map;

import org.ptnet.exceptions.PetriNetException;
import org.ptnet.model.Net;

/**
 * Attaches resolved arc data to transition entries once both indices exist.
 * Called exactly once per index build.
 */
public interface ArcPass {

    /**
     * @param places read-only place index, in vector order
     * @param transitions transition index; entries accept {@link TransitionEntry#attach(ArcBinding)}
     */
    void applyArcs(Net net, Map<String, PlaceEntry> places, Map<String, TransitionEntry> transitions)
            throws PetriNetException;
}
