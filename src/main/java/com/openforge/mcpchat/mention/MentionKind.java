package com.openforge.mcpchat.mention;

public enum MentionKind {

    /** Pin every tool of one server. */
    SERVER,

    /** Pin one tool by name. */
    TOOL
}
