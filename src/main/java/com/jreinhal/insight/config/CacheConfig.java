package com.jreinhal.insight.config;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.jreinhal.insight.execution.AccessResultCache;
import com.jreinhal.insight.execution.ToolResult;
import java.time.Duration;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class CacheConfig {
    @Bean
    public Cache<AccessResultCache.CacheKey, ToolResult> toolResultCache(
            @Value("${insight.cache.maximum-size:10000}") long maximumSize,
            @Value("${insight.cache.expire-after-write-minutes:60}") long expireMinutes) {
        return Caffeine.newBuilder()
            .maximumSize(maximumSize)
            .expireAfterWrite(Duration.ofMinutes(expireMinutes))
            .build();
    }
}
