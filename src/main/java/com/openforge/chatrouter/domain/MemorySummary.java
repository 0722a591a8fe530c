package com.openforge.chatrouter.domain;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;

/**
 * Compressed digest of an owner's memory records over one week or month.
 * Pulled into "comprehensive" memory context after the individual records.
 */
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Entity
@Table(
    name = "memory_summaries",
    uniqueConstraints = @UniqueConstraint(name = "uq_summary_period",
            columnNames = {"owner_id", "period", "period_start"}),
    indexes = @Index(name = "idx_summary_owner_expiry", columnList = "owner_id, expires_at")
)
public class MemorySummary extends BaseEntity {

    public enum Period {
        WEEKLY,
        MONTHLY
    }

    @Column(name = "owner_id", nullable = false, length = 64)
    private String ownerId;

    @Enumerated(EnumType.STRING)
    @Column(name = "period", nullable = false, length = 16)
    private Period period;

    @Column(name = "period_start", nullable = false)
    private Instant periodStart;

    @Column(name = "summary_text", nullable = false, columnDefinition = "TEXT")
    private String summaryText;

    @Builder.Default
    @Column(name = "source_count", nullable = false)
    private Integer sourceCount = 0;

    @Column(name = "expires_at", nullable = false)
    private Instant expiresAt;
}
