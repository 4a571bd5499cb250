package com.openforge.mcpchat.conversation;

public enum MessageRole {
    USER,
    ASSISTANT,
    TOOL,
    SYSTEM
}
