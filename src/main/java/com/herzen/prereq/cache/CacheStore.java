package com.herzen.prereq.cache;

import java.time.Duration;
import java.util.Optional;

public interface CacheStore<V> {
    Optional<V> get(String key);

    void put(String key, V value, Duration ttl);

    void forget(String key);
}
