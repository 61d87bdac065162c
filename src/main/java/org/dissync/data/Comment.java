package org.dissync.data;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.Objects;

/**
 * A comment at an address inside a function, either in the disassembly or in the decompiled view.
 */
public final class Comment implements Artifact {

    private final long funcAddr;
    private final long addr;
    private final String comment;
    private final boolean decompiled;
    private final long lastChange;

    public Comment(long funcAddr, long addr, String comment, boolean decompiled) {
        this(funcAddr, addr, comment, decompiled, NEVER_CHANGED);
    }

    public Comment(long funcAddr, long addr, String comment, boolean decompiled, long lastChange) {
        this.funcAddr = funcAddr;
        this.addr = addr;
        this.comment = comment == null ? "" : comment;
        this.decompiled = decompiled;
        this.lastChange = lastChange;
    }

    public long getFuncAddr() {
        return funcAddr;
    }

    public long getAddr() {
        return addr;
    }

    public String getComment() {
        return comment;
    }

    public boolean isDecompiled() {
        return decompiled;
    }

    @Override
    public long getLastChange() {
        return lastChange;
    }

    public Comment withLastChange(long newLastChange) {
        return new Comment(funcAddr, addr, comment, decompiled, newLastChange);
    }

    @Override
    public String key() {
        return HexKeys.format(addr);
    }

    @Override
    public ObjectNode toNode() {
        ObjectNode node = JsonNodeFactory.instance.objectNode();
        node.put("func_addr", funcAddr);
        node.put("addr", addr);
        node.put("comment", comment);
        node.put("decompiled", decompiled);
        node.put("last_change", lastChange);
        return node;
    }

    public static Comment fromNode(JsonNode node) {
        return new Comment(
                ArtifactCodec.requireLong(node, "func_addr"),
                ArtifactCodec.requireLong(node, "addr"),
                ArtifactCodec.optionalText(node, "comment"),
                node.path("decompiled").asBoolean(false),
                ArtifactCodec.optionalLong(node, "last_change", NEVER_CHANGED));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Comment)) return false;
        Comment other = (Comment) o;
        return funcAddr == other.funcAddr
                && addr == other.addr
                && decompiled == other.decompiled
                && comment.equals(other.comment);
    }

    @Override
    public int hashCode() {
        return Objects.hash(funcAddr, addr, comment, decompiled);
    }

    @Override
    public String toString() {
        return String.format("Comment{func=0x%x, addr=0x%x, decompiled=%s, text='%s'}",
                funcAddr, addr, decompiled, comment);
    }
}
