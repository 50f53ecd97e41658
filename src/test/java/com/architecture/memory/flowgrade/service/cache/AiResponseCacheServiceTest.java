package com.architecture.memory.flowgrade.service.cache;

import com.architecture.memory.flowgrade.dto.cache.CacheStatsResponse;
import com.architecture.memory.flowgrade.dto.cache.CallTypeStats;
import com.architecture.memory.flowgrade.dto.cfg.CfgRecord;
import com.architecture.memory.flowgrade.model.AiCacheEntry;
import com.architecture.memory.flowgrade.repository.AiCacheEntryRepository;
import com.architecture.memory.flowgrade.support.MutableClock;
import com.architecture.memory.flowgrade.support.TestClockConfig;
import com.fasterxml.jackson.databind.JsonNode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.context.annotation.Import;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Runs the cache against a real (embedded) table. Each store operation commits its own
 * transaction, as it does in production, so tests clean the table themselves.
 */
@DataJpaTest
@Import({AiResponseCacheService.class, TestClockConfig.class})
@Transactional(propagation = Propagation.NOT_SUPPORTED)
class AiResponseCacheServiceTest {

    @Autowired
    private AiResponseCacheService cacheService;

    @Autowired
    private AiCacheEntryRepository repository;

    @Autowired
    private MutableClock clock;

    private final CacheKeyGenerator keyGenerator = new CacheKeyGenerator();

    @BeforeEach
    void setUp() {
        repository.deleteAll();
        clock.reset();
    }

    @Test
    void missOnUnknownKey() {
        String key = keyGenerator.generate("test_miss", "nonexistent_content_12345");

        assertThat(cacheService.get("test_miss", key, JsonNode.class)).isEmpty();
    }

    @Test
    void storedRecordIsReturnedAndEachHitCounted() {
        String key = keyGenerator.generate("test_store", "test_content_for_caching");
        cacheService.set("test_store", key, Map.of(
                "total_score", 85,
                "breakdown", List.of(Map.of("criterion", "Correctness", "score", 42))));

        Optional<JsonNode> cached = cacheService.get("test_store", key, JsonNode.class);

        assertThat(cached).isPresent();
        assertThat(cached.get().get("total_score").asInt()).isEqualTo(85);
        assertThat(cached.get().get("breakdown").get(0).get("criterion").asText()).isEqualTo("Correctness");
        assertThat(hitCount("test_store", key)).isEqualTo(1);

        cacheService.get("test_store", key, JsonNode.class);
        assertThat(hitCount("test_store", key)).isEqualTo(2);
    }

    @Test
    void setStampsCreationAndExpiryFromClock() {
        String key = keyGenerator.generate("test_store", "stamped");
        cacheService.set("test_store", key, Map.of("ok", true));

        AiCacheEntry entry = repository.findByCallTypeAndContentHash("test_store", key).orElseThrow();
        LocalDateTime now = LocalDateTime.now(clock);
        assertThat(entry.getCreatedAt()).isEqualTo(now);
        assertThat(entry.getExpiresAt()).isEqualTo(now.plusHours(24));
        assertThat(entry.getHitCount()).isZero();
    }

    @Test
    void sameContentUnderDifferentCallTypesIsIsolated() {
        String keyA = keyGenerator.generate("type_a", "shared_test_content");
        String keyB = keyGenerator.generate("type_b", "shared_test_content");

        cacheService.set("type_a", keyA, Map.of("type", "A", "score", 90));
        cacheService.set("type_b", keyB, Map.of("type", "B", "score", 70));

        assertThat(cacheService.get("type_a", keyA, JsonNode.class).orElseThrow().get("score").asInt()).isEqualTo(90);
        assertThat(cacheService.get("type_b", keyB, JsonNode.class).orElseThrow().get("score").asInt()).isEqualTo(70);
        assertThat(cacheService.get("type_b", keyA, JsonNode.class)).isEmpty();
    }

    @Test
    void writingExistingKeyReplacesRowAndResetsHits() {
        String key = keyGenerator.generate("pseudocode_to_cfg", "x = 1");
        cacheService.set("pseudocode_to_cfg", key, Map.of("complexity", 1));
        cacheService.get("pseudocode_to_cfg", key, JsonNode.class);
        cacheService.get("pseudocode_to_cfg", key, JsonNode.class);

        clock.advance(Duration.ofHours(3));
        cacheService.set("pseudocode_to_cfg", key, Map.of("complexity", 2));

        assertThat(repository.count()).isEqualTo(1);
        AiCacheEntry entry = repository.findByCallTypeAndContentHash("pseudocode_to_cfg", key).orElseThrow();
        assertThat(entry.getHitCount()).isZero();
        assertThat(entry.getExpiresAt()).isEqualTo(LocalDateTime.now(clock).plusHours(24));
        assertThat(cacheService.get("pseudocode_to_cfg", key, JsonNode.class).orElseThrow().get("complexity").asInt()).isEqualTo(2);
    }

    @Test
    void expiredEntryIsAMissButStaysUntilCleanup() {
        String key = keyGenerator.generate("pseudocode_to_cfg", "while true do skip");
        cacheService.set("pseudocode_to_cfg", key, Map.of("complexity", 2));

        clock.advance(Duration.ofHours(24));

        assertThat(cacheService.get("pseudocode_to_cfg", key, JsonNode.class)).isEmpty();
        assertThat(repository.count()).isEqualTo(1);
        assertThat(hitCount("pseudocode_to_cfg", key)).isZero();
    }

    @Test
    void entryIsLiveUntilJustBeforeExpiry() {
        String key = keyGenerator.generate("pseudocode_to_cfg", "print 1");
        cacheService.set("pseudocode_to_cfg", key, Map.of("complexity", 1));

        clock.advance(Duration.ofHours(24).minusSeconds(1));

        assertThat(cacheService.get("pseudocode_to_cfg", key, JsonNode.class)).isPresent();
    }

    @Test
    void setRevivesExpiredKey() {
        String key = keyGenerator.generate("analyze_problem", "two sum");
        cacheService.set("analyze_problem", key, Map.of("v", 1));
        clock.advance(Duration.ofHours(30));
        assertThat(cacheService.get("analyze_problem", key, JsonNode.class)).isEmpty();

        cacheService.set("analyze_problem", key, Map.of("v", 2));

        assertThat(cacheService.get("analyze_problem", key, JsonNode.class).orElseThrow().get("v").asInt()).isEqualTo(2);
        assertThat(repository.count()).isEqualTo(1);
    }

    @Test
    void cleanupRemovesExactlyTheExpiredEntries() {
        String old = keyGenerator.generate("pseudocode_to_cfg", "old");
        cacheService.set("pseudocode_to_cfg", old, Map.of("n", 1));
        clock.advance(Duration.ofHours(12));
        String fresh = keyGenerator.generate("pseudocode_to_cfg", "fresh");
        cacheService.set("pseudocode_to_cfg", fresh, Map.of("n", 2));
        clock.advance(Duration.ofHours(12));

        assertThat(cacheService.cleanupExpired()).isEqualTo(1);
        assertThat(cacheService.cleanupExpired()).isZero();

        assertThat(repository.findByCallTypeAndContentHash("pseudocode_to_cfg", old)).isEmpty();
        assertThat(cacheService.get("pseudocode_to_cfg", fresh, JsonNode.class)).isPresent();
    }

    @Test
    void statsCountLiveEntriesAndHitsPerCallType() {
        cacheService.set("analyze_problem", keyGenerator.generate("analyze_problem", "stale"), Map.of("n", 0));
        clock.advance(Duration.ofHours(25));

        String p1 = keyGenerator.generate("pseudocode_to_cfg", "p1");
        String p2 = keyGenerator.generate("pseudocode_to_cfg", "p2");
        String c1 = keyGenerator.generate("compare_cfgs", "c1");
        cacheService.set("pseudocode_to_cfg", p1, Map.of("n", 1));
        cacheService.set("pseudocode_to_cfg", p2, Map.of("n", 2));
        cacheService.set("compare_cfgs", c1, Map.of("n", 3));
        cacheService.get("pseudocode_to_cfg", p1, JsonNode.class);
        cacheService.get("pseudocode_to_cfg", p1, JsonNode.class);
        cacheService.get("compare_cfgs", c1, JsonNode.class);

        CacheStatsResponse stats = cacheService.getStats();

        assertThat(stats.getError()).isNull();
        assertThat(stats.getTotalEntries()).isEqualTo(4);
        assertThat(stats.getActiveEntries()).isEqualTo(3);
        assertThat(stats.getExpiredEntries()).isEqualTo(1);
        assertThat(stats.getTotalCacheHits()).isEqualTo(3);
        assertThat(stats.getTtlHours()).isEqualTo(24);
        assertThat(stats.getByCallType()).containsExactly(
                new CallTypeStats("pseudocode_to_cfg", 2, 2),
                new CallTypeStats("compare_cfgs", 1, 1));
    }

    @Test
    void undecodableEntryIsAMissAndNotCountedAsHit() {
        String key = keyGenerator.generate("pseudocode_to_cfg", "corrupted");
        repository.saveAndFlush(liveEntry("pseudocode_to_cfg", key, "{not json"));

        assertThat(cacheService.get("pseudocode_to_cfg", key, JsonNode.class)).isEmpty();

        assertThat(hitCount("pseudocode_to_cfg", key)).isZero();
        assertThat(cacheService.getStats().getTotalCacheHits()).isZero();
    }

    @Test
    void entryOfWrongShapeIsAMissAndNotCountedAsHit() {
        String key = keyGenerator.generate("pseudocode_to_cfg", "wrong shape");
        cacheService.set("pseudocode_to_cfg", key, Map.of("nodes", "not a list"));

        assertThat(cacheService.get("pseudocode_to_cfg", key, CfgRecord.class)).isEmpty();

        assertThat(hitCount("pseudocode_to_cfg", key)).isZero();
    }

    @Test
    void storedGraphRecordDecodesAsRecord() {
        String key = keyGenerator.generate("pseudocode_to_cfg", "typed");
        cacheService.set("pseudocode_to_cfg", key, CfgRecord.builder().complexity(3).numPaths(2).build());

        CfgRecord record = cacheService.get("pseudocode_to_cfg", key, CfgRecord.class).orElseThrow();

        assertThat(record.getComplexity()).isEqualTo(3);
        assertThat(record.getNumPaths()).isEqualTo(2);
        assertThat(hitCount("pseudocode_to_cfg", key)).isEqualTo(1);
    }

    @Test
    void statsOnEmptyStore() {
        CacheStatsResponse stats = cacheService.getStats();

        assertThat(stats.getTotalEntries()).isZero();
        assertThat(stats.getTotalCacheHits()).isZero();
        assertThat(stats.getByCallType()).isEmpty();
    }

    private AiCacheEntry liveEntry(String callType, String key, String response) {
        LocalDateTime now = LocalDateTime.now(clock);
        return AiCacheEntry.builder()
                .callType(callType)
                .contentHash(key)
                .response(response)
                .createdAt(now)
                .expiresAt(now.plusHours(24))
                .hitCount(0)
                .build();
    }

    private int hitCount(String callType, String key) {
        return repository.findByCallTypeAndContentHash(callType, key).orElseThrow().getHitCount();
    }
}
