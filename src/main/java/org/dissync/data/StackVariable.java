package org.dissync.data;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.Objects;

/**
 * A stack variable of a function.
 * <p>
 * The offset is stored in the convention of the tool that produced it ({@link #getOffsetType()}).
 * Equality ignores both the convention and the timestamp.
 */
public final class StackVariable implements Artifact {

    private final long stackOffset;
    private final StackOffsetType offsetType;
    private final String name;
    private final String type;
    private final int size;
    private final long funcAddr;
    private final long lastChange;

    public StackVariable(long stackOffset, StackOffsetType offsetType, String name, String type, int size,
                         long funcAddr) {
        this(stackOffset, offsetType, name, type, size, funcAddr, NEVER_CHANGED);
    }

    public StackVariable(long stackOffset, StackOffsetType offsetType, String name, String type, int size,
                         long funcAddr, long lastChange) {
        this.stackOffset = stackOffset;
        this.offsetType = Objects.requireNonNull(offsetType, "offsetType");
        this.name = name == null ? "" : name;
        this.type = type == null ? "" : type;
        this.size = size;
        this.funcAddr = funcAddr;
        this.lastChange = lastChange;
    }

    public long getStackOffset() {
        return stackOffset;
    }

    public StackOffsetType getOffsetType() {
        return offsetType;
    }

    /**
     * Returns the offset of this variable in another tool's convention.
     *
     * @param target The convention the caller works in.
     * @return The translated offset.
     * @throws UnsupportedOffsetConversionException if the conventions are not in the same family.
     */
    public long getOffset(StackOffsetType target) {
        return offsetType.convert(stackOffset, target);
    }

    public String getName() {
        return name;
    }

    public String getType() {
        return type;
    }

    public int getSize() {
        return size;
    }

    public long getFuncAddr() {
        return funcAddr;
    }

    @Override
    public long getLastChange() {
        return lastChange;
    }

    public StackVariable withLastChange(long newLastChange) {
        return new StackVariable(stackOffset, offsetType, name, type, size, funcAddr, newLastChange);
    }

    @Override
    public String key() {
        return HexKeys.format(stackOffset);
    }

    @Override
    public ObjectNode toNode() {
        ObjectNode node = JsonNodeFactory.instance.objectNode();
        node.put("func_addr", funcAddr);
        node.put("name", name);
        node.put("stack_offset", stackOffset);
        node.put("stack_offset_type", offsetType.code());
        node.put("size", size);
        node.put("type", type);
        node.put("last_change", lastChange);
        return node;
    }

    public static StackVariable fromNode(JsonNode node) {
        return new StackVariable(
                ArtifactCodec.requireLong(node, "stack_offset"),
                StackOffsetType.fromCode((int) ArtifactCodec.requireLong(node, "stack_offset_type")),
                ArtifactCodec.optionalText(node, "name"),
                ArtifactCodec.optionalText(node, "type"),
                (int) ArtifactCodec.optionalLong(node, "size", 0),
                ArtifactCodec.requireLong(node, "func_addr"),
                ArtifactCodec.optionalLong(node, "last_change", NEVER_CHANGED));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof StackVariable)) return false;
        StackVariable other = (StackVariable) o;
        return stackOffset == other.stackOffset
                && size == other.size
                && funcAddr == other.funcAddr
                && name.equals(other.name)
                && type.equals(other.type);
    }

    @Override
    public int hashCode() {
        return Objects.hash(stackOffset, name, type, size, funcAddr);
    }

    @Override
    public String toString() {
        return String.format("StackVariable{func=0x%x, offset=%s (%s), name='%s', type='%s', size=%d}",
                funcAddr, HexKeys.format(stackOffset), offsetType, name, type, size);
    }
}
