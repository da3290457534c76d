package com.bridge.model;

/**
 * A capability that could not be turned into an operation.
 *
 * @param capabilityName The descriptor's name.
 * @param message        Why generation failed.
 */
public record GenerationFailure(String capabilityName, String message) {
}
