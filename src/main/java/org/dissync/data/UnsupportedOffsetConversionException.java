package org.dissync.data;

/**
 * Thrown when a stack offset would have to be translated between two offset conventions that do
 * not share a family. The translation is not implemented; a guessed offset would rename the wrong
 * variable.
 */
public class UnsupportedOffsetConversionException extends UnsupportedOperationException {

    private final StackOffsetType from;
    private final StackOffsetType to;

    public UnsupportedOffsetConversionException(StackOffsetType from, StackOffsetType to) {
        super(String.format("Cannot convert stack offsets from %s to %s", from, to));
        this.from = from;
        this.to = to;
    }

    public StackOffsetType getFrom() {
        return from;
    }

    public StackOffsetType getTo() {
        return to;
    }
}
