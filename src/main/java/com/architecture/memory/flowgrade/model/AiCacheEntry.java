package com.architecture.memory.flowgrade.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * Cached result of one inference call, keyed by call type and content hash.
 * The response column holds the validated record as JSON, never the raw model text.
 */
@Entity
@Table(
        name = "ai_cache",
        uniqueConstraints = @UniqueConstraint(
                name = "uk_ai_cache_call_type_hash",
                columnNames = {"call_type", "content_hash"}),
        indexes = @Index(name = "idx_ai_cache_expires_at", columnList = "expires_at")
)
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AiCacheEntry {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    /**
     * Logical operation name (e.g., "pseudocode_to_cfg", "compare_cfgs")
     */
    @Column(name = "call_type", nullable = false, length = 100)
    private String callType;

    /**
     * SHA-256 hex digest of the call type and canonical content
     */
    @Column(name = "content_hash", nullable = false, length = 64)
    private String contentHash;

    @Column(name = "response", nullable = false, length = 1048576)
    private String response;

    @Column(name = "created_at", nullable = false)
    private LocalDateTime createdAt;

    @Column(name = "expires_at", nullable = false)
    private LocalDateTime expiresAt;

    @Column(name = "hit_count", nullable = false)
    @Builder.Default
    private Integer hitCount = 0;
}
