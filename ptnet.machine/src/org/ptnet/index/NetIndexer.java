package org.ptnet.index;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

import org.apache.log4j.Logger;
import org.ptnet.exceptions.PetriNetException;
import org.ptnet.model.Net;
import org.ptnet.model.Place;
import org.ptnet.model.Transition;

/**
 * Builds the {@link NetIndex} of a net.
 *
 * Order of work: the role pass, place offsets (document order, from 0), the
 * transition table, then the arc pass. Place offsets are assigned here and
 * nowhere else. Failures from either pass propagate as thrown and no index is
 * returned.
 */
public class NetIndexer {

    private static final Logger logger = Logger.getLogger(NetIndexer.class);

    private final RolePass rolePass;
    private final ArcPass arcPass;

    public NetIndexer(RolePass rolePass, ArcPass arcPass) {
        this.rolePass = Objects.requireNonNull(rolePass, "rolePass cannot be null");
        this.arcPass = Objects.requireNonNull(arcPass, "arcPass cannot be null");
    }

    public NetIndex buildIndex(Net net) throws PetriNetException {
        rolePass.assignRoles(net);

        Map<String, PlaceEntry> places = new LinkedHashMap<>();
        int offset = 0;
        for (Place place : net.getPlaces().values()) {
            places.put(place.getId(), new PlaceEntry(place.getId(), offset++, place.getMarking()));
        }
        Map<String, PlaceEntry> placeView = Collections.unmodifiableMap(places);

        Map<String, TransitionEntry> transitions = new LinkedHashMap<>();
        for (Transition transition : net.getTransitions().values()) {
            transitions.put(transition.getId(), new TransitionEntry(transition.getId(), transition.getLabel()));
        }
        Map<String, TransitionEntry> transitionView = Collections.unmodifiableMap(transitions);

        arcPass.applyArcs(net, placeView, transitionView);

        for (TransitionEntry entry : transitions.values()) {
            entry.seal();
        }
        logger.info("Indexed net " + net.getName() + ": vector length " + places.size() + ", "
                + transitions.size() + " transitions, roles " + net.getRoles());
        return new NetIndex(net.getName(), placeView, transitionView);
    }
}
