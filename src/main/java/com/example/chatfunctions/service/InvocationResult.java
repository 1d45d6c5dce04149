package com.example.chatfunctions.service;

import java.util.Map;

/**
 * What an event handler reports back for one invocation.
 */
public interface InvocationResult {
    boolean isSuccess();

    /** True when the failure came from bad input rather than a failing service. */
    default boolean isMalformedInput() {
        return false;
    }

    Map<String, Object> toMap();
}
