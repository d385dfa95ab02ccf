package com.acme.werp.config;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/** Serves the last loaded configuration until its TTL elapses. */
public final class CachingConfigSource implements ConfigSource {
    private final ConfigSource delegate;
    private final Duration ttl;
    private final Clock clock;

    private EngineConfig cached;
    private Instant loadedAt;

    public CachingConfigSource(ConfigSource delegate, Duration ttl, Clock clock) {
        this.delegate = delegate;
        this.ttl = ttl;
        this.clock = clock;
    }

    @Override
    public synchronized EngineConfig load() {
        Instant now = clock.instant();
        if (cached == null || !now.isBefore(loadedAt.plus(ttl))) {
            cached = delegate.load();
            loadedAt = now;
        }
        return cached;
    }
}
