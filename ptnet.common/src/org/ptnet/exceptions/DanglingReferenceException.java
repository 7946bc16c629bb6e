package org.ptnet.exceptions;

/**
 * An arc endpoint id resolves to neither a place nor a transition of its net.
 */
public class DanglingReferenceException extends PetriNetException {

    private static final long serialVersionUID = 1L;

    public static final String ERROR_CODE = "DANGLING_REFERENCE";

    private final String arcId;
    private final String unresolvedId;

    public DanglingReferenceException(String netId, String unresolvedId) {
        this(netId, null, unresolvedId);
    }

    public DanglingReferenceException(String netId, String arcId, String unresolvedId) {
        super(buildMessage(netId, arcId, unresolvedId), netId, ERROR_CODE);
        this.arcId = arcId;
        this.unresolvedId = unresolvedId;
    }

    private static String buildMessage(String netId, String arcId, String unresolvedId) {
        if (arcId == null) {
            return "net '" + netId + "': no place or transition with id '" + unresolvedId + "'";
        }
        return "net '" + netId + "': arc '" + arcId + "' references unknown node '" + unresolvedId + "'";
    }

    /** The arc whose endpoint failed to resolve, or null for a direct lookup. */
    public String getArcId() {
        return arcId;
    }

    public String getUnresolvedId() {
        return unresolvedId;
    }
}
