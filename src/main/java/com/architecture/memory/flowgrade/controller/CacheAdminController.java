package com.architecture.memory.flowgrade.controller;

import com.architecture.memory.flowgrade.dto.cache.CacheStatsResponse;
import com.architecture.memory.flowgrade.service.cache.AiResponseCacheService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

/**
 * Administrative inspection and maintenance of the AI response cache.
 */
@RestController
@RequestMapping("/api/cache")
@RequiredArgsConstructor
@Slf4j
public class CacheAdminController {

    private final AiResponseCacheService cacheService;

    @GetMapping("/stats")
    public ResponseEntity<CacheStatsResponse> getStats() {
        log.info("Fetching AI cache statistics");
        return ResponseEntity.ok(cacheService.getStats());
    }

    /**
     * Remove expired entries now instead of waiting for the scheduled sweep.
     */
    @DeleteMapping("/expired")
    public ResponseEntity<Map<String, Integer>> cleanupExpired() {
        log.info("Manual AI cache cleanup requested");
        int removed = cacheService.cleanupExpired();
        return ResponseEntity.ok(Map.of("removed", removed));
    }
}
