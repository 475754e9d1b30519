package com.herzen.prereq.cache;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Expiry;
import com.github.benmanes.caffeine.cache.Policy;
import com.github.benmanes.caffeine.cache.Ticker;

import java.time.Duration;
import java.util.Optional;

public class CaffeineCacheStore<V> implements CacheStore<V> {
    private final Cache<String, V> cache;
    private final Policy.VarExpiration<String, V> expiration;

    public CaffeineCacheStore(long maximumSize, Duration defaultTtl) {
        this(maximumSize, defaultTtl, Ticker.systemTicker());
    }

    public CaffeineCacheStore(long maximumSize, Duration defaultTtl, Ticker ticker) {
        long defaultNanos = defaultTtl.toNanos();
        this.cache = Caffeine.newBuilder()
                .maximumSize(maximumSize)
                .ticker(ticker)
                .expireAfter(new Expiry<String, V>() {
                    @Override
                    public long expireAfterCreate(String key, V value, long currentTime) {
                        return defaultNanos;
                    }

                    @Override
                    public long expireAfterUpdate(String key, V value, long currentTime, long currentDuration) {
                        return currentDuration;
                    }

                    @Override
                    public long expireAfterRead(String key, V value, long currentTime, long currentDuration) {
                        return currentDuration;
                    }
                })
                .build();
        this.expiration = cache.policy().expireVariably()
                .orElseThrow(() -> new IllegalStateException("Variable expiration is not enabled"));
    }

    @Override
    public Optional<V> get(String key) {
        return Optional.ofNullable(cache.getIfPresent(key));
    }

    @Override
    public void put(String key, V value, Duration ttl) {
        expiration.put(key, value, ttl);
    }

    @Override
    public void forget(String key) {
        cache.invalidate(key);
    }
}
