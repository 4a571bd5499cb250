package com.openforge.mcpchat.selection;

/** Which server a selected tool was taken from. */
public record ToolAttribution(String toolName, String serverId) {}
