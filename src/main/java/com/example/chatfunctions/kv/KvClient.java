package com.example.chatfunctions.kv;

import java.time.Duration;

public interface KvClient {
    /** Sets the key only if it is absent. Returns true when this call created it. */
    boolean setIfAbsent(String key, String value, Duration ttl);
    void del(String key);
    boolean exists(String key);
}
