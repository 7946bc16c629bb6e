package org.ptnet.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import org.ptnet.exceptions.SchemaViolationException;

/**
 * A Petri net: places, transitions and the arcs between them.
 *
 * The net owns its entities. Places and transitions keep insertion order,
 * which for decoded nets is document order; node ids are unique across both
 * kinds so that every arc endpoint resolves to exactly one node.
 */
public class Net {

    private final String name;
    private final Map<String, Place> places = new LinkedHashMap<>();
    private final Map<String, Transition> transitions = new LinkedHashMap<>();
    private final List<Arc> arcs = new ArrayList<>();
    // roles model inhibitor arc actors
    private final List<String> roles = new ArrayList<>();

    public Net(String name) {
        this.name = Objects.requireNonNull(name, "name cannot be null");
    }

    public String getName() {
        return name;
    }

    // === PLACES ===

    public void addPlace(Place place) throws SchemaViolationException {
        checkUnique(place);
        places.put(place.getId(), place);
        place.setNet(this);
    }

    public Map<String, Place> getPlaces() {
        return Collections.unmodifiableMap(places);
    }

    public Place getPlace(String id) {
        return places.get(id);
    }

    // === TRANSITIONS ===

    public void addTransition(Transition transition) throws SchemaViolationException {
        checkUnique(transition);
        transitions.put(transition.getId(), transition);
        transition.setNet(this);
    }

    public Map<String, Transition> getTransitions() {
        return Collections.unmodifiableMap(transitions);
    }

    public Transition getTransition(String id) {
        return transitions.get(id);
    }

    // === ARCS ===

    public void addArc(Arc arc) {
        arcs.add(Objects.requireNonNull(arc, "arc cannot be null"));
        arc.setNet(this);
    }

    public List<Arc> getArcs() {
        return Collections.unmodifiableList(arcs);
    }

    // === ROLES ===

    /**
     * Record a role identifier. Returns false if it was already recorded.
     */
    public boolean addRole(String role) {
        Objects.requireNonNull(role, "role cannot be null");
        if (roles.contains(role)) {
            return false;
        }
        return roles.add(role);
    }

    public List<String> getRoles() {
        return Collections.unmodifiableList(roles);
    }

    public boolean containsNode(String id) {
        return places.containsKey(id) || transitions.containsKey(id);
    }

    private void checkUnique(Node node) throws SchemaViolationException {
        if (containsNode(node.getId())) {
            throw new SchemaViolationException(name, node.getKind(), node.getId(), "unique id", node.getId());
        }
    }

    @Override
    public String toString() {
        StringBuilder text = new StringBuilder();
        text.append("--- Net: ").append(name).append("\nTransitions: ");
        for (Transition transition : transitions.values()) {
            text.append(transition).append(' ');
        }
        text.append("\nPlaces: ");
        for (Place place : places.values()) {
            text.append(place).append(' ');
        }
        text.append('\n');
        for (Arc arc : arcs) {
            text.append(arc).append('\n');
        }
        text.append("---");
        return text.toString();
    }
}
