package org.ptnet.exceptions;

/**
 * Base exception for all P/T net loading and indexing errors.
 * Carries the net the failure belongs to (when known) and a stable error code.
 */
public class PetriNetException extends Exception {

    private static final long serialVersionUID = 1L;

    private final String netId;
    private final String errorCode;

    public PetriNetException(String message, String netId, String errorCode) {
        super(message);
        this.netId = netId;
        this.errorCode = errorCode;
    }

    public PetriNetException(String message, Throwable cause, String netId, String errorCode) {
        super(message, cause);
        this.netId = netId;
        this.errorCode = errorCode;
    }

    public PetriNetException(String message) {
        this(message, null, "GENERAL_ERROR");
    }

    public PetriNetException(String message, Throwable cause) {
        this(message, cause, null, "GENERAL_ERROR");
    }

    public String getNetId() {
        return netId;
    }

    public String getErrorCode() {
        return errorCode;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append(getClass().getSimpleName());
        if (netId != null || errorCode != null) {
            sb.append(" [");
            if (netId != null) {
                sb.append(netId);
            }
            if (errorCode != null) {
                if (netId != null) {
                    sb.append(" - ");
                }
                sb.append(errorCode);
            }
            sb.append("]");
        }
        sb.append(": ").append(getMessage());
        return sb.toString();
    }
}
