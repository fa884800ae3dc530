package com.archvalidation.config;

import com.archvalidation.application.RuleService;
import com.github.benmanes.caffeine.cache.Caffeine;
import lombok.extern.slf4j.Slf4j;
import org.springframework.cache.CacheManager;
import org.springframework.cache.annotation.EnableCaching;
import org.springframework.cache.caffeine.CaffeineCacheManager;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Caffeine caching configuration.
 *
 * Only the global rule listing is cached. Tenant data is never cached, so
 * there is no cross-tenant cache key to get wrong.
 */
@Configuration
@EnableCaching
@Slf4j
public class CacheConfiguration {

    @Bean
    public CacheManager cacheManager() {
        log.info("Configuring Caffeine cache");

        CaffeineCacheManager cacheManager = new CaffeineCacheManager();

        cacheManager.setCaffeine(Caffeine.newBuilder()
            .maximumSize(100)
            .expireAfterWrite(10, TimeUnit.MINUTES)
            .recordStats()
        );

        cacheManager.setCacheNames(List.of(
            RuleService.RULES_CACHE   // Rule listings, evicted on every rule write
        ));

        return cacheManager;
    }
}
