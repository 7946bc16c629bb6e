package org.ptnet.exceptions;

/**
 * A required node or attribute is missing or cannot be parsed.
 *
 * The message always names the net, the element kind and id, and the field;
 * when the field was present but unparsable the offending text is included too.
 */
public class SchemaViolationException extends PetriNetException {

    private static final long serialVersionUID = 1L;

    public static final String ERROR_CODE = "SCHEMA_VIOLATION";

    private final String elementKind;
    private final String elementId;
    private final String field;
    private final String offendingText;

    public SchemaViolationException(String netId, String elementKind, String elementId, String field) {
        this(netId, elementKind, elementId, field, null, null);
    }

    public SchemaViolationException(String netId, String elementKind, String elementId, String field,
                                    String offendingText) {
        this(netId, elementKind, elementId, field, offendingText, null);
    }

    public SchemaViolationException(String netId, String elementKind, String elementId, String field,
                                    String offendingText, Throwable cause) {
        super(buildMessage(netId, elementKind, elementId, field, offendingText), cause, netId, ERROR_CODE);
        this.elementKind = elementKind;
        this.elementId = elementId;
        this.field = field;
        this.offendingText = offendingText;
    }

    private static String buildMessage(String netId, String elementKind, String elementId, String field,
                                       String offendingText) {
        StringBuilder sb = new StringBuilder();
        sb.append("net '").append(netId).append("': ")
          .append(elementKind).append(" '").append(elementId).append("' ");
        if (offendingText == null) {
            sb.append("is missing required ").append(field);
        } else {
            sb.append("has invalid ").append(field).append(": '").append(offendingText).append("'");
        }
        return sb.toString();
    }

    public String getElementKind() {
        return elementKind;
    }

    public String getElementId() {
        return elementId;
    }

    public String getField() {
        return field;
    }

    /** The unparsable text, or null when the field was absent. */
    public String getOffendingText() {
        return offendingText;
    }
}
