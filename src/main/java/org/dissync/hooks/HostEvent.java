package org.dissync.hooks;

import org.dissync.controller.HostTool.FrameMember;
import org.dissync.data.Struct;

import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * A notification from the host tool. Host adapters translate their callbacks into these records
 * and hand them to {@link HookDispatcher#onEvent(HostEvent)}.
 */
public sealed interface HostEvent {

    HostEventKind kind();

    record FunctionRenamed(long addr, String name) implements HostEvent {
        @Override
        public HostEventKind kind() {
            return HostEventKind.FUNCTION_RENAMED;
        }
    }

    /**
     * A stack member was renamed or retyped. {@code member} is the member after the change.
     */
    record StackMemberChanged(HostEventKind kind, long funcAddr, FrameMember member) implements HostEvent {
        public StackMemberChanged {
            if (kind != HostEventKind.STACK_MEMBER_RENAMED && kind != HostEventKind.STACK_MEMBER_TYPE_CHANGED) {
                throw new IllegalArgumentException("Not a stack member event: " + kind);
            }
            Objects.requireNonNull(member, "member");
        }
    }

    /**
     * A struct was created, renamed or had a member changed. {@code struct} is the complete new
     * definition; {@code oldName} is set for renames.
     */
    record StructChanged(HostEventKind kind, Struct struct, String oldName) implements HostEvent {
        public StructChanged {
            if (kind != HostEventKind.STRUCT_CREATED && kind != HostEventKind.STRUCT_RENAMED
                    && kind != HostEventKind.STRUCT_MEMBER_CHANGED) {
                throw new IllegalArgumentException("Not a struct event: " + kind);
            }
            Objects.requireNonNull(struct, "struct");
        }
    }

    record StructDeleted(String name) implements HostEvent {
        @Override
        public HostEventKind kind() {
            return HostEventKind.STRUCT_DELETED;
        }
    }

    record CommentChanged(long funcAddr, long addr, String comment) implements HostEvent {
        @Override
        public HostEventKind kind() {
            return HostEventKind.DISASSEMBLY_COMMENT_CHANGED;
        }
    }

    /**
     * The decompiler comments of a function changed. Hosts report them as a whole set.
     */
    record DecompiledCommentsChanged(long funcAddr, Map<Long, String> comments) implements HostEvent {
        public DecompiledCommentsChanged {
            comments = new TreeMap<>(comments);
        }

        @Override
        public HostEventKind kind() {
            return HostEventKind.DECOMPILED_COMMENT_CHANGED;
        }
    }

    record ViewRefreshed(long funcAddr) implements HostEvent {
        @Override
        public HostEventKind kind() {
            return HostEventKind.VIEW_REFRESHED;
        }
    }
}
