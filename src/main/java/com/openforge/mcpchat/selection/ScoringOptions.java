package com.openforge.mcpchat.selection;

public record ScoringOptions(int topK, double minScore) {}
