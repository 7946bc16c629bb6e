package org.ptnet.model;

import org.ptnet.exceptions.DanglingReferenceException;
import org.ptnet.exceptions.SchemaViolationException;

/**
 * Resolves node ids to places or transitions within one net.
 *
 * Transitions are looked up before places.
 */
public final class ReferenceResolver {

    private ReferenceResolver() {
    }

    public static Node resolve(Net net, String id) throws DanglingReferenceException {
        return resolve(net, null, id);
    }

    private static Node resolve(Net net, String arcId, String id) throws DanglingReferenceException {
        Transition transition = net.getTransition(id);
        if (transition != null) {
            return transition;
        }
        Place place = net.getPlace(id);
        if (place != null) {
            return place;
        }
        throw new DanglingReferenceException(net.getName(), arcId, id);
    }

    public static Node resolveSource(Arc arc) throws DanglingReferenceException {
        return resolve(owner(arc), arc.getId(), arc.getSource());
    }

    public static Node resolveTarget(Arc arc) throws DanglingReferenceException {
        return resolve(owner(arc), arc.getId(), arc.getTarget());
    }

    /**
     * Check that both endpoints resolve and that the arc joins a place and a transition.
     *
     * @throws DanglingReferenceException when an endpoint is unknown
     * @throws SchemaViolationException when both endpoints are of the same kind
     */
    public static void validateArc(Arc arc) throws DanglingReferenceException, SchemaViolationException {
        Node source = resolveSource(arc);
        Node target = resolveTarget(arc);
        if (source.getClass() == target.getClass()) {
            throw new SchemaViolationException(arc.getNet().getName(), "arc", arc.getId(), "endpoints",
                    source.getKind() + " " + source.getId() + " -> " + target.getKind() + " " + target.getId());
        }
    }

    private static Net owner(Arc arc) {
        Net net = arc.getNet();
        if (net == null) {
            throw new IllegalStateException("arc " + arc.getId() + " does not belong to a net");
        }
        return net;
    }
}
