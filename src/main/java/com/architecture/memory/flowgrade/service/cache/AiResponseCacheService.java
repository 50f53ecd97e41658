package com.architecture.memory.flowgrade.service.cache;

import com.architecture.memory.flowgrade.dto.cache.CacheStatsResponse;
import com.architecture.memory.flowgrade.dto.cache.CallTypeStats;
import com.architecture.memory.flowgrade.model.AiCacheEntry;
import com.architecture.memory.flowgrade.repository.AiCacheEntryRepository;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

/**
 * Persistent, TTL-bounded store for inference results.
 *
 * Lifecycle of a key: absent -> live -> expired -> absent (via {@link #cleanupExpired()}).
 * Reads never delete; an expired row is simply not returned.
 *
 * Every operation runs in its own transaction and relies on the database for atomicity,
 * since other processes may write the same table. None of the operations throws on a
 * storage failure: lookups degrade to a miss, writes and sweeps become no-ops.
 */
@Service
@Slf4j
public class AiResponseCacheService {

    private final AiCacheEntryRepository cacheEntryRepository;
    private final TransactionTemplate transactionTemplate;
    private final Clock clock;
    private final long ttlHours;
    private final ObjectMapper objectMapper = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    public AiResponseCacheService(AiCacheEntryRepository cacheEntryRepository,
                                  PlatformTransactionManager transactionManager,
                                  Clock clock,
                                  @Value("${ai-cache.ttl-hours:24}") long ttlHours) {
        if (ttlHours <= 0) {
            throw new IllegalArgumentException("ai-cache.ttl-hours must be positive, got " + ttlHours);
        }
        this.cacheEntryRepository = cacheEntryRepository;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
        this.clock = clock;
        this.ttlHours = ttlHours;
        log.info("[AI Cache] Initialized with TTL of {}h", ttlHours);
    }

    /**
     * Look up a live entry, decode it as {@code type} and count the hit.
     * The increment and the decode share one transaction, so an entry that cannot be
     * decoded as {@code type} is rolled back and does not count as a hit.
     *
     * @return the stored record, or empty when the key is absent, expired, unreadable
     *         or the store is unavailable
     */
    public <T> Optional<T> get(String callType, String contentHash, Class<T> type) {
        try {
            T record = transactionTemplate.execute(status -> {
                LocalDateTime now = LocalDateTime.now(clock);
                if (cacheEntryRepository.incrementHitCount(callType, contentHash, now) == 0) {
                    return null;
                }
                return cacheEntryRepository.findByCallTypeAndContentHash(callType, contentHash)
                        .map(entry -> decode(entry.getResponse(), type))
                        .orElse(null);
            });

            if (record == null) {
                log.debug("[AI Cache] MISS {} (hash: {}...)", callType, abbreviate(contentHash));
                return Optional.empty();
            }

            log.info("[AI Cache] HIT {} (hash: {}...)", callType, abbreviate(contentHash));
            return Optional.of(record);
        } catch (UnreadableEntryException e) {
            log.warn("[AI Cache] Unreadable {} entry (hash: {}...), treating as miss: {}",
                    callType, abbreviate(contentHash), e.getMessage());
            return Optional.empty();
        } catch (Exception e) {
            log.error("[AI Cache] Lookup failed for {} (hash: {}...): {}",
                    callType, abbreviate(contentHash), e.getMessage(), e);
            return Optional.empty();
        }
    }

    /**
     * Store or replace the entry for a key with a fresh expiry and a zero hit count.
     * Concurrent writers for the same key are allowed; the last one wins.
     */
    public void set(String callType, String contentHash, Object record) {
        try {
            String response = objectMapper.writeValueAsString(record);
            LocalDateTime now = LocalDateTime.now(clock);
            LocalDateTime expiresAt = now.plusHours(ttlHours);

            try {
                upsert(callType, contentHash, response, now, expiresAt);
            } catch (DataIntegrityViolationException e) {
                // Another writer inserted the same key between our update and insert
                log.debug("[AI Cache] Concurrent insert for {} (hash: {}...), replacing",
                        callType, abbreviate(contentHash));
                transactionTemplate.executeWithoutResult(status ->
                        cacheEntryRepository.replaceResponse(callType, contentHash, response, now, expiresAt));
            }

            log.info("[AI Cache] STORE {} (hash: {}..., TTL: {}h)", callType, abbreviate(contentHash), ttlHours);
        } catch (Exception e) {
            log.error("[AI Cache] Store failed for {} (hash: {}...): {}",
                    callType, abbreviate(contentHash), e.getMessage(), e);
        }
    }

    /**
     * Entry counts and hit totals. Hits and the per-call-type breakdown cover live entries only.
     */
    public CacheStatsResponse getStats() {
        try {
            return transactionTemplate.execute(status -> {
                LocalDateTime now = LocalDateTime.now(clock);
                long total = cacheEntryRepository.count();
                long active = cacheEntryRepository.countByExpiresAtAfter(now);
                Long hits = cacheEntryRepository.sumLiveHits(now);

                List<CallTypeStats> byCallType = cacheEntryRepository.summarizeLiveByCallType(now).stream()
                        .map(usage -> CallTypeStats.builder()
                                .callType(usage.getCallType())
                                .entries(usage.getEntries() != null ? usage.getEntries() : 0L)
                                .hits(usage.getHits() != null ? usage.getHits() : 0L)
                                .build())
                        .toList();

                return CacheStatsResponse.builder()
                        .totalEntries(total)
                        .activeEntries(active)
                        .expiredEntries(total - active)
                        .totalCacheHits(hits != null ? hits : 0L)
                        .ttlHours(ttlHours)
                        .byCallType(byCallType)
                        .build();
            });
        } catch (Exception e) {
            log.error("[AI Cache] Stats query failed: {}", e.getMessage(), e);
            return CacheStatsResponse.builder()
                    .ttlHours(ttlHours)
                    .byCallType(List.of())
                    .error(e.getMessage())
                    .build();
        }
    }

    /**
     * Delete every entry whose expiry is at or before now.
     *
     * @return number of rows removed, 0 on failure
     */
    public int cleanupExpired() {
        try {
            Integer removed = transactionTemplate.execute(status ->
                    cacheEntryRepository.deleteExpired(LocalDateTime.now(clock)));
            int count = removed != null ? removed : 0;
            if (count > 0) {
                log.info("[AI Cache] CLEANUP removed {} expired entries", count);
            }
            return count;
        } catch (Exception e) {
            log.error("[AI Cache] Cleanup failed: {}", e.getMessage(), e);
            return 0;
        }
    }

    public long getTtlHours() {
        return ttlHours;
    }

    private void upsert(String callType, String contentHash, String response,
                        LocalDateTime now, LocalDateTime expiresAt) {
        transactionTemplate.executeWithoutResult(status -> {
            int replaced = cacheEntryRepository.replaceResponse(callType, contentHash, response, now, expiresAt);
            if (replaced == 0) {
                cacheEntryRepository.saveAndFlush(AiCacheEntry.builder()
                        .callType(callType)
                        .contentHash(contentHash)
                        .response(response)
                        .createdAt(now)
                        .expiresAt(expiresAt)
                        .hitCount(0)
                        .build());
            }
        });
    }

    private <T> T decode(String response, Class<T> type) {
        try {
            T record = objectMapper.readValue(response, type);
            if (record == null) {
                throw new UnreadableEntryException("stored response is null", null);
            }
            return record;
        } catch (JsonProcessingException e) {
            throw new UnreadableEntryException(e.getOriginalMessage(), e);
        }
    }

    private static String abbreviate(String contentHash) {
        if (contentHash == null) {
            return "null";
        }
        return contentHash.length() > 12 ? contentHash.substring(0, 12) : contentHash;
    }

    private static class UnreadableEntryException extends RuntimeException {
        UnreadableEntryException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
