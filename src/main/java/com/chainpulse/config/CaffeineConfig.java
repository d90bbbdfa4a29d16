package com.chainpulse.config;

import com.github.benmanes.caffeine.cache.Caffeine;
import org.springframework.cache.CacheManager;
import org.springframework.cache.annotation.EnableCaching;
import org.springframework.cache.caffeine.CaffeineCacheManager;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.TimeUnit;

/**
 * Caffeine in-process caches for immutable chain data (transactions, receipts, block timestamps).
 */
@Configuration
@EnableCaching
public class CaffeineConfig {

    public static final String TRANSACTION_CACHE = "transactionCache";
    public static final String RECEIPT_CACHE = "receiptCache";
    public static final String BLOCK_TIMESTAMP_CACHE = "blockTimestampCache";

    @Bean
    public CacheManager caffeineCacheManager() {
        CaffeineCacheManager manager = new CaffeineCacheManager();
        manager.registerCustomCache(TRANSACTION_CACHE, Caffeine.newBuilder()
                .expireAfterWrite(6, TimeUnit.HOURS)
                .maximumSize(20_000)
                .build());
        manager.registerCustomCache(RECEIPT_CACHE, Caffeine.newBuilder()
                .expireAfterWrite(6, TimeUnit.HOURS)
                .maximumSize(20_000)
                .build());
        manager.registerCustomCache(BLOCK_TIMESTAMP_CACHE, Caffeine.newBuilder()
                .expireAfterWrite(24, TimeUnit.HOURS)
                .maximumSize(50_000)
                .build());
        return manager;
    }
}
