package com.seat.exchange.config;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.seat.exchange.dto.StoredSuggestions;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.UUID;
import java.util.concurrent.TimeUnit;

@Configuration
public class CacheConfig {

    @Bean(name = "suggestionCache")
    @ConditionalOnProperty(name = "exchange.suggestions.store", havingValue = "memory")
    public Cache<UUID, StoredSuggestions> suggestionCache(
            @Value("${exchange.suggestions.memory.ttl-minutes:720}") long ttlMinutes,
            @Value("${exchange.suggestions.memory.max-size:50000}") long maxSize
    ) {
        return Caffeine.newBuilder()
                .expireAfterWrite(ttlMinutes, TimeUnit.MINUTES)
                .maximumSize(maxSize)
                .build();
    }
}
