package com.heroespath.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.time.LocalDateTime;

/**
 * 산책 중 ping 한 번의 결과. 경로 최초 탐색 때 경로 검색 결과와 합쳐진 뒤 삭제된다
 */
@Entity
@Table(name = "ping_results",
        uniqueConstraints = {
                @UniqueConstraint(name = "uk_ping_results_ping_id", columnNames = {"ping_id"})
        },
        indexes = {
                @Index(name = "idx_ping_results_user_route", columnList = "user_id, route_id")
        })
@Data
@NoArgsConstructor
@AllArgsConstructor
public class PingResultEntity {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "ping_id", nullable = false, length = 64)
    private String pingId;

    @Column(name = "user_id", nullable = false)
    private String userId;

    @Column(name = "route_id", nullable = false)
    private String routeId;

    @Column(nullable = false)
    private Double latitude;

    @Column(nullable = false)
    private Double longitude;

    @Column(name = "pinged_at", nullable = false)
    private Instant pingedAt;

    @Column(name = "places_data", columnDefinition = "TEXT")
    private String placesData; // StandardPlace 배열 JSON

    @Column(name = "place_count", nullable = false)
    private int placeCount;

    @Column(nullable = false)
    private LocalDateTime createdAt;

    @PrePersist
    protected void onCreate() {
        createdAt = LocalDateTime.now();
    }
}
