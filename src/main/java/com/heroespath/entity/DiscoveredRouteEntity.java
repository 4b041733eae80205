package com.heroespath.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.time.LocalDateTime;

/**
 * 최초 탐색을 마친 (user, route). discovery가 0건인 경로도 기록된다
 */
@Entity
@Table(name = "discovered_routes",
        uniqueConstraints = {
                @UniqueConstraint(name = "uk_discovered_routes_user_route", columnNames = {"user_id", "route_id"})
        })
@Data
@NoArgsConstructor
@AllArgsConstructor
public class DiscoveredRouteEntity {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "user_id", nullable = false)
    private String userId;

    @Column(name = "route_id", nullable = false)
    private String routeId;

    @Column(name = "discovered_at", nullable = false)
    private Instant discoveredAt;

    @Column(name = "discovery_count", nullable = false)
    private int discoveryCount;

    @Column(nullable = false)
    private LocalDateTime createdAt;

    @PrePersist
    protected void onCreate() {
        createdAt = LocalDateTime.now();
    }
}
