package com.openforge.mcpchat.selection;

public record ScoredTool(String toolName, double score) {}
