package com.example.chatfunctions.model;

/**
 * Ordinal likelihood scale reported by the image classifier, least to most likely.
 */
public enum Likelihood {
    UNKNOWN,
    VERY_UNLIKELY,
    UNLIKELY,
    POSSIBLE,
    LIKELY,
    VERY_LIKELY;

    public boolean isAtLeast(Likelihood other) {
        return compareTo(other) >= 0;
    }
}
