package com.flaretrack.core.domain;

import java.util.Optional;

/**
 * Stages of a flare's medical progression.
 *
 * Flow: ONSET → GROWTH → RUPTURE → DRAINING → HEALING → RESOLVED.
 * RESOLVED is terminal and can be entered early from any other stage.
 * Backward moves and skips are never valid.
 */
public enum LifecycleStage {

    ONSET("Onset", "🔴", "Initial appearance of flare"),
    GROWTH("Growth", "📈", "Flare is growing/increasing in size"),
    RUPTURE("Rupture", "💥", "Flare has ruptured/broken open"),
    DRAINING("Draining", "💧", "Flare is draining fluid"),
    HEALING("Healing", "🩹", "Flare is healing/closing up"),
    RESOLVED("Resolved", "✅", "Flare is fully resolved");

    private final String displayName;
    private final String icon;
    private final String description;

    LifecycleStage(String displayName, String icon, String description) {
        this.displayName = displayName;
        this.icon = icon;
        this.description = description;
    }

    /**
     * Checks whether moving from this stage to the target is allowed.
     */
    public boolean canTransitionTo(LifecycleStage target) {
        if (target == null || this == RESOLVED) {
            return false;
        }
        return target == RESOLVED || target.ordinal() == this.ordinal() + 1;
    }

    /**
     * Immediate successor, empty for the terminal stage.
     */
    public Optional<LifecycleStage> next() {
        if (isTerminal()) {
            return Optional.empty();
        }
        return Optional.of(values()[ordinal() + 1]);
    }

    public boolean isTerminal() {
        return this == RESOLVED;
    }

    public String displayName() { return displayName; }
    public String icon() { return icon; }
    public String description() { return description; }
}
