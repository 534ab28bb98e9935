package com.example.timesheet.config;

import org.springframework.cache.CacheManager;
import org.springframework.cache.annotation.EnableCaching;
import org.springframework.cache.concurrent.ConcurrentMapCacheManager;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Profile;

import java.util.List;

@Configuration
@EnableCaching
public class CacheConfig {

    public static final String ACTIVE_CLIENTS = "active-clients";
    public static final String WORK_CALENDAR = "work-calendar";

    /**
     * In-memory caches. The test profile falls back to Spring Boot's {@code spring.cache.type}
     * so tests that write through repositories never see stale entries.
     */
    @Bean
    @Profile("!test")
    public CacheManager cacheManager() {
        ConcurrentMapCacheManager cacheManager = new ConcurrentMapCacheManager();
        cacheManager.setCacheNames(List.of(ACTIVE_CLIENTS, WORK_CALENDAR));
        return cacheManager;
    }
}
