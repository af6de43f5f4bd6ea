package com.example.channelinsight.cache;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Expiry;
import com.github.benmanes.caffeine.cache.Ticker;
import java.time.Duration;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class CaffeineFastCache implements FastCache {

    private static final Logger log = LoggerFactory.getLogger(CaffeineFastCache.class);

    private final Cache<String, Entry> cache;

    public CaffeineFastCache(long maximumSize) {
        this(maximumSize, Ticker.systemTicker());
    }

    CaffeineFastCache(long maximumSize, Ticker ticker) {
        this.cache = Caffeine.newBuilder()
                .maximumSize(maximumSize)
                .ticker(ticker)
                .expireAfter(new EntryExpiry())
                .build();
    }

    @Override
    public <T> Optional<T> get(CacheNamespace namespace, String identifier, Class<T> type) {
        if (identifier == null) {
            return Optional.empty();
        }
        String key = namespace.key(identifier);
        Entry entry = cache.getIfPresent(key);
        if (entry == null) {
            return Optional.empty();
        }
        if (!type.isInstance(entry.value())) {
            log.warn("Cache entry {} holds {} rather than {}; dropping it", key,
                    entry.value().getClass().getSimpleName(), type.getSimpleName());
            cache.invalidate(key);
            return Optional.empty();
        }
        log.debug("Cache hit for {}", key);
        return Optional.of(type.cast(entry.value()));
    }

    @Override
    public void put(CacheNamespace namespace, String identifier, Object value, Duration ttl) {
        if (identifier == null || value == null || ttl == null || ttl.isZero() || ttl.isNegative()) {
            return;
        }
        cache.put(namespace.key(identifier), new Entry(value, ttl.toNanos()));
    }

    @Override
    public void delete(CacheNamespace namespace, String identifier) {
        if (identifier != null) {
            cache.invalidate(namespace.key(identifier));
        }
    }

    long estimatedSize() {
        cache.cleanUp();
        return cache.estimatedSize();
    }

    private record Entry(Object value, long ttlNanos) {
    }

    private static final class EntryExpiry implements Expiry<String, Entry> {

        @Override
        public long expireAfterCreate(String key, Entry value, long currentTime) {
            return value.ttlNanos();
        }

        @Override
        public long expireAfterUpdate(String key, Entry value, long currentTime,
                                      long currentDuration) {
            return value.ttlNanos();
        }

        @Override
        public long expireAfterRead(String key, Entry value, long currentTime,
                                    long currentDuration) {
            return currentDuration;
        }
    }
}
