package com.heroespath.entity;

import com.heroespath.model.DismissalPolicy;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * 사용자별 탐색 설정 (기본 숨김 정책, 탐색할 장소 타입, ping 최소 평점)
 */
@Entity
@Table(name = "user_discovery_settings")
@Data
@NoArgsConstructor
@AllArgsConstructor
public class UserDiscoverySettings {
    @Id
    @Column(name = "user_id", nullable = false)
    private String userId;

    @Enumerated(EnumType.STRING)
    @Column(name = "dismissal_policy", nullable = false, length = 32)
    private DismissalPolicy dismissalPolicy = DismissalPolicy.ASK;

    @Column(name = "enabled_types", columnDefinition = "TEXT")
    private String enabledTypes; // 쉼표 구분, null이면 기본 타입 목록, 빈 문자열이면 모두 끔

    @Column(name = "min_rating")
    private Double minRating; // ping 결과 최소 평점

    @Column(nullable = false)
    private LocalDateTime updatedAt;

    @PrePersist
    @PreUpdate
    protected void touch() {
        updatedAt = LocalDateTime.now();
    }
}
