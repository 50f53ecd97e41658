package com.architecture.memory.flowgrade.repository;

import com.architecture.memory.flowgrade.model.AiCacheEntry;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

@Repository
public interface AiCacheEntryRepository extends JpaRepository<AiCacheEntry, Long> {

    Optional<AiCacheEntry> findByCallTypeAndContentHash(String callType, String contentHash);

    long countByExpiresAtAfter(LocalDateTime now);

    /**
     * Bumps the hit counter of the live entry for a key. Returns 0 when the key is absent or expired.
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("""
            UPDATE AiCacheEntry e SET e.hitCount = e.hitCount + 1
            WHERE e.callType = :callType AND e.contentHash = :contentHash AND e.expiresAt > :now
            """)
    int incrementHitCount(@Param("callType") String callType,
                          @Param("contentHash") String contentHash,
                          @Param("now") LocalDateTime now);

    /**
     * Overwrites an existing row in place and resets its hit counter. Returns 0 when no row exists yet.
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("""
            UPDATE AiCacheEntry e
            SET e.response = :response, e.createdAt = :createdAt, e.expiresAt = :expiresAt, e.hitCount = 0
            WHERE e.callType = :callType AND e.contentHash = :contentHash
            """)
    int replaceResponse(@Param("callType") String callType,
                        @Param("contentHash") String contentHash,
                        @Param("response") String response,
                        @Param("createdAt") LocalDateTime createdAt,
                        @Param("expiresAt") LocalDateTime expiresAt);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("DELETE FROM AiCacheEntry e WHERE e.expiresAt <= :now")
    int deleteExpired(@Param("now") LocalDateTime now);

    /**
     * Null when there are no live entries.
     */
    @Query("SELECT SUM(e.hitCount) FROM AiCacheEntry e WHERE e.expiresAt > :now")
    Long sumLiveHits(@Param("now") LocalDateTime now);

    @Query("""
            SELECT e.callType AS callType, COUNT(e) AS entries, SUM(e.hitCount) AS hits
            FROM AiCacheEntry e
            WHERE e.expiresAt > :now
            GROUP BY e.callType
            ORDER BY SUM(e.hitCount) DESC, e.callType
            """)
    List<CallTypeUsage> summarizeLiveByCallType(@Param("now") LocalDateTime now);

    interface CallTypeUsage {
        String getCallType();

        Long getEntries();

        Long getHits();
    }
}
