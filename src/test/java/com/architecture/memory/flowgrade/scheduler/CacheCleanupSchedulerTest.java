package com.architecture.memory.flowgrade.scheduler;

import com.architecture.memory.flowgrade.service.cache.AiResponseCacheService;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class CacheCleanupSchedulerTest {

    @Mock
    private AiResponseCacheService cacheService;

    @InjectMocks
    private CacheCleanupScheduler scheduler;

    @Test
    void sweepsExpiredEntries() {
        when(cacheService.cleanupExpired()).thenReturn(5);

        scheduler.cleanupExpiredEntries();

        verify(cacheService).cleanupExpired();
    }

    @Test
    void failureDoesNotEscapeScheduledRun() {
        when(cacheService.cleanupExpired()).thenThrow(new IllegalStateException("pool closed"));

        assertThatCode(() -> scheduler.cleanupExpiredEntries()).doesNotThrowAnyException();
    }
}
