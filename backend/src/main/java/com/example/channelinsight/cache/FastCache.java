package com.example.channelinsight.cache;

import java.time.Duration;
import java.util.Optional;

public interface FastCache {

    <T> Optional<T> get(CacheNamespace namespace, String identifier, Class<T> type);

    void put(CacheNamespace namespace, String identifier, Object value, Duration ttl);

    void delete(CacheNamespace namespace, String identifier);
}
