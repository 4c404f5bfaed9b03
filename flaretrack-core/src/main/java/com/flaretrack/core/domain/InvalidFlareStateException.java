package com.flaretrack.core.domain;

import java.util.UUID;

/**
 * Thrown when an operation is incompatible with the flare's current state,
 * e.g. appending to a resolved flare or resolving it twice.
 */
public class InvalidFlareStateException extends RuntimeException {

    private final UUID flareId;

    public InvalidFlareStateException(UUID flareId, String message) {
        super(message);
        this.flareId = flareId;
    }

    public UUID getFlareId() {
        return flareId;
    }
}
