package org.ptnet.constants;

/**
 * Element and attribute vocabulary of the PNML dialect read by the decoder.
 *
 * Names are local names; the decoder matches them regardless of namespace.
 */
public final class PnmlConstants {

    // =============================================================================
    // ELEMENTS
    // =============================================================================
    public static final String PNML = "pnml";
    public static final String NET = "net";
    public static final String PLACE = "place";
    public static final String TRANSITION = "transition";
    public static final String ARC = "arc";
    public static final String NAME = "name";
    public static final String TEXT = "text";
    public static final String GRAPHICS = "graphics";
    public static final String OFFSET = "offset";
    public static final String POSITION = "position";
    public static final String INITIAL_MARKING = "initialMarking";
    public static final String VALUE = "value";
    public static final String TYPE = "type";

    // =============================================================================
    // ATTRIBUTES
    // =============================================================================
    public static final String ATTR_ID = "id";
    public static final String ATTR_SOURCE = "source";
    public static final String ATTR_TARGET = "target";
    public static final String ATTR_X = "x";
    public static final String ATTR_Y = "y";
    public static final String ATTR_VALUE = "value";

    // =============================================================================
    // VALUES
    // =============================================================================
    public static final String ARC_TYPE_INHIBITOR = "inhibitor";

    /** Arc weight used for every decoded arc; inscription text is not read. */
    public static final String DEFAULT_INSCRIPTION = "1";

    /** Marking values are encoded as {@code TYPE,COUNT}. */
    public static final char MARKING_SEPARATOR = ',';

    /** Schema files are named {@code <name>.xml} below the base directory. */
    public static final String SCHEMA_FILE_EXTENSION = ".xml";

    private PnmlConstants() {
    }
}
