package org.dissync.data;

/**
 * The stack offset conventions of the supported host tools.
 * <p>
 * Conventions in the same {@link Family} number frame slots identically, so an offset can be
 * passed between them unchanged. Conversions across families are not implemented.
 */
public enum StackOffsetType {
    BINJA(0, Family.FRAME_POINTER),
    IDA(1, Family.FRAME_POINTER),
    GHIDRA(2, Family.GHIDRA),
    ANGR(3, Family.ANGR);

    public enum Family {
        FRAME_POINTER,
        GHIDRA,
        ANGR
    }

    private final int code;
    private final Family family;

    StackOffsetType(int code, Family family) {
        this.code = code;
        this.family = family;
    }

    /**
     * Returns the integer stored in serialized stack variables.
     */
    public int code() {
        return code;
    }

    public Family family() {
        return family;
    }

    public static StackOffsetType fromCode(int code) {
        for (StackOffsetType type : values()) {
            if (type.code == code) {
                return type;
            }
        }
        throw new ArtifactFormatException("Unknown stack offset type code: " + code);
    }

    /**
     * Translates an offset expressed in this convention into {@code target}.
     *
     * @param offset The offset in this convention.
     * @param target The convention to translate to.
     * @return The offset in {@code target}.
     * @throws UnsupportedOffsetConversionException if the conventions are in different families.
     */
    public long convert(long offset, StackOffsetType target) {
        if (target == this || target.family == family) {
            return offset;
        }
        throw new UnsupportedOffsetConversionException(this, target);
    }
}
