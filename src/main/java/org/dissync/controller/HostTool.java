package org.dissync.controller;

import org.dissync.data.StackOffsetType;
import org.dissync.data.Struct;

import java.util.Map;
import java.util.Optional;

/**
 * The disassembler or decompiler the sync engine reads from and writes into.
 * <p>
 * Implementations wrap the host's own API. Any call may fail with {@link HostToolException};
 * the engine then skips the affected artifact and carries on.
 */
public interface HostTool {

    /**
     * A function as the host knows it.
     */
    record HostFunction(long addr, String name) {
    }

    /**
     * One member of a stack frame.
     */
    record FrameMember(long offset, String name, String type, int size) {
    }

    /**
     * The stack frame of a function, members keyed by offset in the host's own convention.
     */
    record StackFrame(long funcAddr, Map<Long, FrameMember> members) {
        public StackFrame {
            members = Map.copyOf(members);
        }
    }

    Optional<HostFunction> getFunctionAt(long addr) throws HostToolException;

    void setFunctionName(long addr, String name) throws HostToolException;

    Optional<StackFrame> getStackFrame(long funcAddr) throws HostToolException;

    void renameStackMember(long funcAddr, long offset, String name) throws HostToolException;

    /**
     * @throws UnknownTypeException if the host cannot map {@code type}.
     */
    void setMemberType(long funcAddr, long offset, String type) throws HostToolException;

    /**
     * @return The comment at {@code addr}, empty if there is none.
     */
    Optional<String> getComment(long addr, boolean decompiled) throws HostToolException;

    void setComment(long addr, String text, boolean decompiled) throws HostToolException;

    String currentBinaryHash() throws HostToolException;

    void refreshView(long funcAddr) throws HostToolException;

    /**
     * The convention the host uses for stack offsets.
     */
    StackOffsetType offsetType();

    Optional<Struct> getStruct(String name) throws HostToolException;

    /**
     * Creates or replaces a struct with the given name, size and member names. Member types are
     * set separately, once every struct exists.
     */
    void createStruct(Struct struct) throws HostToolException;

    /**
     * @throws UnknownTypeException if a member type cannot be mapped.
     */
    void setStructMemberTypes(Struct struct) throws HostToolException;
}
