package com.architecture.memory.flowgrade.scheduler;

import com.architecture.memory.flowgrade.service.cache.AiResponseCacheService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Scheduled task to remove expired AI cache entries.
 * Runs hourly by default, see ai-cache.cleanup-interval-ms.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class CacheCleanupScheduler {

    private final AiResponseCacheService cacheService;

    @Scheduled(fixedRateString = "${ai-cache.cleanup-interval-ms:3600000}",
            initialDelayString = "${ai-cache.cleanup-initial-delay-ms:60000}")
    public void cleanupExpiredEntries() {
        log.debug("Running AI cache cleanup...");
        try {
            int removed = cacheService.cleanupExpired();
            if (removed > 0) {
                log.info("AI cache cleanup completed: {} expired entries removed", removed);
            }
        } catch (Exception e) {
            log.error("AI cache cleanup failed: {}", e.getMessage(), e);
        }
    }
}
