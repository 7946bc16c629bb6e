package org.ptnet.pnml;

import org.ptnet.constants.PnmlConstants;
import org.ptnet.exceptions.SchemaViolationException;

/**
 * Reads the {@code TYPE,COUNT} initial marking encoding.
 *
 * Absent or empty text means no tokens; whitespace-only text is not empty.
 * Otherwise the text must have exactly two comma-separated fields and the
 * second must be a non-negative integer.
 */
final class MarkingParser {

    static final String FIELD = "initialMarking/value";

    private MarkingParser() {
    }

    static int parse(String text, String netId, String placeId) throws SchemaViolationException {
        if (text == null || text.isEmpty()) {
            return 0;
        }
        String[] fields = text.split(String.valueOf(PnmlConstants.MARKING_SEPARATOR), -1);
        if (fields.length != 2) {
            throw new SchemaViolationException(netId, PnmlConstants.PLACE, placeId, FIELD, text);
        }
        int count;
        try {
            count = Integer.parseInt(fields[1].trim());
        } catch (NumberFormatException e) {
            throw new SchemaViolationException(netId, PnmlConstants.PLACE, placeId, FIELD, text, e);
        }
        if (count < 0) {
            throw new SchemaViolationException(netId, PnmlConstants.PLACE, placeId, FIELD, text);
        }
        return count;
    }
}
