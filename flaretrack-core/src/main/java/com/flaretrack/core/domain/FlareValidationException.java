package com.flaretrack.core.domain;

/**
 * Thrown when input to a flare operation is malformed: severity outside the
 * scale, a resolution date outside the flare's span, an illegal stage transition.
 * Always raised before anything is written.
 */
public class FlareValidationException extends RuntimeException {

    public FlareValidationException(String message) {
        super(message);
    }
}
