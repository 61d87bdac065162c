package org.dissync.hooks;

/**
 * Kinds of host tool notifications the sync engine reacts to.
 */
public enum HostEventKind {
    FUNCTION_RENAMED,
    STACK_MEMBER_RENAMED,
    STACK_MEMBER_TYPE_CHANGED,
    STRUCT_CREATED,
    STRUCT_RENAMED,
    STRUCT_MEMBER_CHANGED,
    STRUCT_DELETED,
    DISASSEMBLY_COMMENT_CHANGED,
    DECOMPILED_COMMENT_CHANGED,
    VIEW_REFRESHED
}
