package org.ptnet.exceptions;

/**
 * Raised by a role or arc pass while a net index is being built.
 * The indexer rethrows it as-is.
 */
public class IndexingException extends PetriNetException {

    private static final long serialVersionUID = 1L;

    public static final String ERROR_CODE = "INDEXING_FAILURE";

    public IndexingException(String message, String netId) {
        super(message, netId, ERROR_CODE);
    }

    public IndexingException(String message, Throwable cause, String netId) {
        super(message, cause, netId, ERROR_CODE);
    }
}
