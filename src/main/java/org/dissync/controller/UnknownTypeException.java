package org.dissync.controller;

/**
 * The host tool cannot map a type string to one of its types.
 */
public class UnknownTypeException extends HostToolException {

    private final String type;

    public UnknownTypeException(String type) {
        super("Unknown type '" + type + "'");
        this.type = type;
    }

    public String getType() {
        return type;
    }
}
