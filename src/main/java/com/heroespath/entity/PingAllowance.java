package com.heroespath.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.time.LocalDateTime;

/**
 * 사용자별 ping 사용량 (쿨다운 기준 시각, 남은 크레딧)
 */
@Entity
@Table(name = "ping_allowances")
@Data
@NoArgsConstructor
@AllArgsConstructor
public class PingAllowance {
    @Id
    @Column(name = "user_id", nullable = false)
    private String userId;

    @Column(name = "last_ping_at")
    private Instant lastPingAt;

    @Column(name = "credits_remaining", nullable = false)
    private int creditsRemaining;

    @Column(name = "last_credit_reset", nullable = false)
    private Instant lastCreditReset;

    @Column(name = "total_pings_used", nullable = false)
    private long totalPingsUsed;

    @Column(nullable = false)
    private LocalDateTime updatedAt;

    @PrePersist
    @PreUpdate
    protected void touch() {
        updatedAt = LocalDateTime.now();
    }
}
