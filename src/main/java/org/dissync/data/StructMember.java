package org.dissync.data;

/**
 * One member of a {@link Struct}, keyed inside the struct by its byte offset.
 *
 * @param name   The member name.
 * @param offset The byte offset from the start of the struct.
 * @param type   The type string as the host tool prints it, empty when untyped.
 * @param size   The member size in bytes.
 */
public record StructMember(String name, long offset, String type, int size) {

    public StructMember {
        name = name == null ? "" : name;
        type = type == null ? "" : type;
    }
}
