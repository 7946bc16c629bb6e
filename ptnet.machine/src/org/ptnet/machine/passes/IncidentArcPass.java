package org.ptnet.machine.passes;

import java.util.Map;

import org.ptnet.exceptions.IndexingException;
import org.ptnet.exceptions.PetriNetException;
import org.ptnet.index.ArcBinding;
import org.ptnet.index.ArcPass;
import org.ptnet.index.PlaceEntry;
import org.ptnet.index.TransitionEntry;
import org.ptnet.model.Arc;
import org.ptnet.model.Net;
import org.ptnet.model.Node;
import org.ptnet.model.Place;

/**
 * Attaches every arc to the transition it touches. Place to transition arcs
 * are inputs, transition to place arcs are outputs.
 */
public class IncidentArcPass implements ArcPass {

    @Override
    public void applyArcs(Net net, Map<String, PlaceEntry> places, Map<String, TransitionEntry> transitions)
            throws PetriNetException {
        for (Arc arc : net.getArcs()) {
            Node source = arc.findSource();
            Node target = arc.findTarget();

            ArcBinding.Direction direction;
            Node place;
            Node transition;
            if (source instanceof Place) {
                direction = ArcBinding.Direction.INPUT;
                place = source;
                transition = target;
            } else {
                direction = ArcBinding.Direction.OUTPUT;
                place = target;
                transition = source;
            }

            PlaceEntry placeEntry = places.get(place.getId());
            TransitionEntry transitionEntry = transitions.get(transition.getId());
            if (placeEntry == null || transitionEntry == null) {
                throw new IndexingException("arc " + arc.getId() + " joins " + source.getId() + " and "
                        + target.getId() + ", which are not a place and a transition of the index", net.getName());
            }

            int weight;
            try {
                weight = arc.getWeight();
            } catch (NumberFormatException e) {
                throw new IndexingException("arc " + arc.getId() + " has a non-integer inscription '"
                        + arc.getInscription() + "'", e, net.getName());
            }

            transitionEntry.attach(new ArcBinding(arc.getId(), place.getId(), placeEntry.getOffset(), direction,
                    weight, arc.isInhibitor(), arc.getRole()));
        }
    }
}
