package com.openforge.mcpchat.catalog;

/**
 * Published after every catalog mutation. Carries the post-change snapshot so
 * listeners (the semantic tool index) can rebuild without re-reading the catalog.
 */
public record CatalogChangedEvent(CatalogSnapshot snapshot) {}
