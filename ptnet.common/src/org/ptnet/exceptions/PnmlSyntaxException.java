package org.ptnet.exceptions;

/**
 * The input is not well-formed XML.
 */
public class PnmlSyntaxException extends PetriNetException {

    private static final long serialVersionUID = 1L;

    public static final String ERROR_CODE = "PNML_SYNTAX";

    private final int lineNumber;
    private final int columnNumber;

    public PnmlSyntaxException(String message, Throwable cause) {
        this(message, cause, -1, -1);
    }

    public PnmlSyntaxException(String message, Throwable cause, int lineNumber, int columnNumber) {
        super(message, cause, null, ERROR_CODE);
        this.lineNumber = lineNumber;
        this.columnNumber = columnNumber;
    }

    /** Line of the offending input, or -1 when the parser did not report one. */
    public int getLineNumber() {
        return lineNumber;
    }

    public int getColumnNumber() {
        return columnNumber;
    }
}
