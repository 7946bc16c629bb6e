package org.ptnet.pnml;

/**
 * Switches for {@link PnmlDecoder}.
 */
public final class DecoderOptions {

    /** Labels are replaced by element ids. */
    public static final DecoderOptions DEFAULT = new DecoderOptions(false);

    private final boolean preserveSourceLabel;

    private DecoderOptions(boolean preserveSourceLabel) {
        this.preserveSourceLabel = preserveSourceLabel;
    }

    /**
     * @param preserveSourceLabel take labels from {@code name/text} instead of the element id
     */
    public static DecoderOptions of(boolean preserveSourceLabel) {
        return preserveSourceLabel ? new DecoderOptions(true) : DEFAULT;
    }

    public boolean isPreserveSourceLabel() {
        return preserveSourceLabel;
    }

    @Override
    public String toString() {
        return "DecoderOptions{preserveSourceLabel=" + preserveSourceLabel + "}";
    }
}
