package com.heroespath.entity;

import com.heroespath.model.DiscoveryStatus;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.time.LocalDateTime;

/**
 * 원격 저장소의 discovery 문서
 * (user_id, route_id, place_id)당 한 행, 장소 스냅샷은 place_data에 JSON으로 저장
 */
@Entity
@Table(name = "discoveries",
        uniqueConstraints = {
                @UniqueConstraint(name = "uk_discoveries_user_route_place", columnNames = {"user_id", "route_id", "place_id"}),
                @UniqueConstraint(name = "uk_discoveries_discovery_id", columnNames = {"discovery_id"})
        },
        indexes = {
                @Index(name = "idx_discoveries_user_route", columnList = "user_id, route_id"),
                @Index(name = "idx_discoveries_user_status", columnList = "user_id, status")
        })
@Data
@NoArgsConstructor
@AllArgsConstructor
public class DiscoveryEntity {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "discovery_id", nullable = false, length = 64)
    private String discoveryId;

    @Column(name = "user_id", nullable = false)
    private String userId;

    @Column(name = "route_id", nullable = false)
    private String routeId;

    @Column(name = "place_id", nullable = false)
    private String placeId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 32)
    private DiscoveryStatus status;

    @Column(name = "place_data", columnDefinition = "TEXT")
    private String placeData; // StandardPlace JSON

    @Column(name = "discovered_at", nullable = false)
    private Instant discoveredAt;

    @Column(name = "decided_at")
    private Instant decidedAt;

    @Column(name = "dismiss_expires_at")
    private Instant dismissExpiresAt;

    @Column(name = "summary_requested_at")
    private Instant summaryRequestedAt;

    @Column(name = "summary_data", columnDefinition = "TEXT")
    private String summaryData;

    @Column(length = 64)
    private String sources; // 쉼표 구분 DiscoverySource, null이면 ROUTE

    @Column(nullable = false)
    private LocalDateTime createdAt;

    @Column(nullable = false)
    private LocalDateTime updatedAt;

    @PrePersist
    protected void onCreate() {
        createdAt = LocalDateTime.now();
        updatedAt = LocalDateTime.now();
    }

    @PreUpdate
    protected void onUpdate() {
        updatedAt = LocalDateTime.now();
    }
}
