package com.jreinhal.insight.execution;

import com.github.benmanes.caffeine.cache.Cache;
import java.util.Optional;
import org.springframework.stereotype.Component;

/**
 * Tool results keyed by {@code (userId, accessVersion, fingerprint)}. A grant change bumps the
 * version, so older entries simply stop matching; nothing is evicted on grant change.
 */
@Component
public class AccessResultCache {
    private final Cache<CacheKey, ToolResult> cache;

    public AccessResultCache(Cache<CacheKey, ToolResult> toolResultCache) {
        this.cache = toolResultCache;
    }

    public Optional<ToolResult> get(CacheKey key) {
        return Optional.ofNullable(this.cache.getIfPresent(key));
    }

    public void put(CacheKey key, ToolResult result) {
        this.cache.put(key, result);
    }

    public long estimatedSize() {
        return this.cache.estimatedSize();
    }

    public record CacheKey(String userId, long accessVersion, String fingerprint) {
    }
}
