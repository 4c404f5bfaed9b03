package com.flaretrack.api.analytics;

/**
 * A body region ranked by how many flares started there within a window.
 * {@code percentage} is relative to the flares of all reported regions.
 */
public record ProblemArea(String bodyRegionId, long flareCount, double percentage) {}
