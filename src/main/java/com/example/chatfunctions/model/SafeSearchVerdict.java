package com.example.chatfunctions.model;

import lombok.Value;

@Value
public class SafeSearchVerdict {
    Likelihood adult;
    Likelihood violence;

    /**
     * True when either category reaches {@code threshold}.
     */
    public boolean isUnsafe(Likelihood threshold) {
        return adult.isAtLeast(threshold) || violence.isAtLeast(threshold);
    }
}
