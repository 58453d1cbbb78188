package com.delta.acquisition.acquire.model;

/**
 * Which structured paths exist for a target. Kept separate from the request so strategy selection
 * stays a function of its arguments.
 */
public record SourceAvailability(
    boolean directApiKnown,
    boolean feedKnown
) {
    public static SourceAvailability none() {
        return new SourceAvailability(false, false);
    }
}
