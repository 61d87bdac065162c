package org.dissync.data;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.Collection;
import java.util.Collections;
import java.util.Iterator;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Objects;
import java.util.TreeMap;

/**
 * A struct definition: a name, a total size and members ordered by byte offset.
 * <p>
 * A struct is always replaced as a whole. A rename produces a new struct under the new name and
 * the old one is dropped in the same state update; members are never patched one by one.
 */
public final class Struct implements Artifact {

    private final String name;
    private final int size;
    private final NavigableMap<Long, StructMember> members;
    private final long lastChange;

    public Struct(String name, int size, Collection<StructMember> members) {
        this(name, size, members, NEVER_CHANGED);
    }

    public Struct(String name, int size, Collection<StructMember> members, long lastChange) {
        if (name == null || name.isEmpty()) {
            throw new IllegalArgumentException("Struct name must not be empty");
        }
        this.name = name;
        this.size = size;
        TreeMap<Long, StructMember> byOffset = new TreeMap<>();
        for (StructMember member : members) {
            byOffset.put(member.offset(), member);
        }
        this.members = Collections.unmodifiableNavigableMap(byOffset);
        this.lastChange = lastChange;
    }

    public String getName() {
        return name;
    }

    public int getSize() {
        return size;
    }

    /**
     * Returns the members keyed by byte offset, in ascending offset order.
     */
    public NavigableMap<Long, StructMember> getMembers() {
        return members;
    }

    /**
     * Returns a copy of this struct with one more member; a member at the same offset is replaced.
     */
    public Struct withMember(String memberName, long offset, String type, int memberSize) {
        TreeMap<Long, StructMember> copy = new TreeMap<>(members);
        copy.put(offset, new StructMember(memberName, offset, type, memberSize));
        return new Struct(name, size, copy.values(), lastChange);
    }

    @Override
    public long getLastChange() {
        return lastChange;
    }

    public Struct withLastChange(long newLastChange) {
        return new Struct(name, size, members.values(), newLastChange);
    }

    @Override
    public String key() {
        return name;
    }

    @Override
    public ObjectNode toNode() {
        ObjectNode node = JsonNodeFactory.instance.objectNode();
        node.put("name", name);
        node.put("size", size);
        node.put("last_change", lastChange);
        if (members.isEmpty()) {
            return node;
        }
        ObjectNode membersNode = node.putObject("members");
        for (StructMember member : members.values()) {
            ObjectNode memberNode = membersNode.putObject(HexKeys.format(member.offset()));
            memberNode.put("name", member.name());
            memberNode.put("offset", member.offset());
            memberNode.put("type", member.type());
            memberNode.put("size", member.size());
        }
        return node;
    }

    public static Struct fromNode(JsonNode node) {
        String name = ArtifactCodec.optionalText(node, "name");
        if (name.isEmpty()) {
            throw new ArtifactFormatException("Struct without a name");
        }
        TreeMap<Long, StructMember> members = new TreeMap<>();
        JsonNode membersNode = node.path("members");
        Iterator<Map.Entry<String, JsonNode>> fields = membersNode.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> entry = fields.next();
            JsonNode memberNode = entry.getValue();
            long offset = memberNode.has("offset")
                    ? ArtifactCodec.requireLong(memberNode, "offset")
                    : HexKeys.parse(entry.getKey());
            members.put(offset, new StructMember(
                    ArtifactCodec.optionalText(memberNode, "name"),
                    offset,
                    ArtifactCodec.optionalText(memberNode, "type"),
                    (int) ArtifactCodec.optionalLong(memberNode, "size", 0)));
        }
        return new Struct(name,
                (int) ArtifactCodec.optionalLong(node, "size", 0),
                members.values(),
                ArtifactCodec.optionalLong(node, "last_change", NEVER_CHANGED));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Struct)) return false;
        Struct other = (Struct) o;
        return size == other.size && name.equals(other.name) && members.equals(other.members);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, size, members);
    }

    @Override
    public String toString() {
        return "Struct{name='" + name + "', size=" + size + ", members=" + members.size() + "}";
    }
}
