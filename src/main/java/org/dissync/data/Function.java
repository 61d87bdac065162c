package org.dissync.data;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.Objects;

/**
 * A function and the name an analyst gave it.
 */
public final class Function implements Artifact {

    private final long addr;
    private final String name;
    private final long lastChange;

    public Function(long addr, String name) {
        this(addr, name, NEVER_CHANGED);
    }

    public Function(long addr, String name, long lastChange) {
        this.addr = addr;
        this.name = name == null ? "" : name;
        this.lastChange = lastChange;
    }

    public long getAddr() {
        return addr;
    }

    public String getName() {
        return name;
    }

    public boolean hasName() {
        return !name.isEmpty();
    }

    @Override
    public long getLastChange() {
        return lastChange;
    }

    public Function withLastChange(long newLastChange) {
        return new Function(addr, name, newLastChange);
    }

    @Override
    public String key() {
        return HexKeys.format(addr);
    }

    @Override
    public ObjectNode toNode() {
        ObjectNode node = JsonNodeFactory.instance.objectNode();
        node.put("addr", addr);
        node.put("name", name);
        node.put("last_change", lastChange);
        return node;
    }

    public static Function fromNode(JsonNode node) {
        return new Function(
                ArtifactCodec.requireLong(node, "addr"),
                ArtifactCodec.optionalText(node, "name"),
                ArtifactCodec.optionalLong(node, "last_change", NEVER_CHANGED));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Function)) return false;
        Function other = (Function) o;
        return addr == other.addr && name.equals(other.name);
    }

    @Override
    public int hashCode() {
        return Objects.hash(addr, name);
    }

    @Override
    public String toString() {
        return String.format("Function{addr=0x%x, name='%s', lastChange=%d}", addr, name, lastChange);
    }
}
