package org.ptnet.model;

import java.util.Objects;

import org.ptnet.constants.PnmlConstants;
import org.ptnet.exceptions.DanglingReferenceException;

/**
 * A directed arc between a place and a transition (either way round).
 *
 * Endpoints are held as ids and resolved through the owning net, which the
 * arc references but does not own.
 */
public class Arc {

    private final String id;
    private final String source;
    private final String target;
    private String inscription = PnmlConstants.DEFAULT_INSCRIPTION;
    private boolean inhibitor;
    private String role;
    private Net net;

    public Arc(String id, String source, String target) {
        this.id = Objects.requireNonNull(id, "id cannot be null");
        this.source = Objects.requireNonNull(source, "source cannot be null");
        this.target = Objects.requireNonNull(target, "target cannot be null");
    }

    public Arc(IdGenerator ids, String source, String target) {
        this(ids.nextArcId(), source, target);
    }

    public String getId() {
        return id;
    }

    public String getSource() {
        return source;
    }

    public String getTarget() {
        return target;
    }

    public String getInscription() {
        return inscription;
    }

    public void setInscription(String inscription) {
        this.inscription = Objects.requireNonNull(inscription, "inscription cannot be null");
    }

    /**
     * Inscription read as an integer weight.
     *
     * @throws NumberFormatException when the inscription is not an integer
     */
    public int getWeight() {
        return Integer.parseInt(inscription.trim());
    }

    public boolean isInhibitor() {
        return inhibitor;
    }

    public void setInhibitor(boolean inhibitor) {
        this.inhibitor = inhibitor;
    }

    /** Role attributed to this arc by a role pass, or null. */
    public String getRole() {
        return role;
    }

    public void setRole(String role) {
        this.role = role;
    }

    public Net getNet() {
        return net;
    }

    void setNet(Net net) {
        this.net = net;
    }

    public Node findSource() throws DanglingReferenceException {
        return ReferenceResolver.resolveSource(this);
    }

    public Node findTarget() throws DanglingReferenceException {
        return ReferenceResolver.resolveTarget(this);
    }

    @Override
    public String toString() {
        if (net == null) {
            return source + "-->" + target;
        }
        try {
            return findSource() + "-->" + findTarget();
        } catch (DanglingReferenceException e) {
            return source + "-->" + target + " (unresolved " + e.getUnresolvedId() + ")";
        }
    }
}
