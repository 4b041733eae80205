package com.heroespath.service.settings;

import com.heroespath.entity.UserDiscoverySettings;
import com.heroespath.model.DiscoveryContext;
import com.heroespath.model.DismissalPolicy;
import com.heroespath.model.PingPolicy;
import com.heroespath.repository.UserDiscoverySettingsRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Duration;
import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

/**
 * 사용자 설정을 요청 단위 DiscoveryContext로 변환
 */
@Slf4j
@Service
public class UserSettingsService {

    /**
     * 설정이 없는 사용자의 기본 탐색 타입
     */
    public static final List<String> DEFAULT_ENABLED_TYPES = List.of(
            "restaurant", "cafe", "bar", "bakery", "park", "museum", "art_gallery", "night_club",
            "tourist_attraction", "zoo", "shopping_mall", "stadium", "concert_hall", "movie_theater");

    private final UserDiscoverySettingsRepository settingsRepository;
    private final PingPolicy basePingPolicy;

    public UserSettingsService(UserDiscoverySettingsRepository settingsRepository,
                               @Value("${discovery.ping.cooldown-seconds:10}") long cooldownSeconds,
                               @Value("${discovery.ping.credits-per-period:50}") int creditsPerPeriod,
                               @Value("${discovery.ping.credit-period-days:30}") int creditPeriodDays,
                               @Value("${discovery.ping.radius-meters:500}") int radiusMeters,
                               @Value("${discovery.ping.max-results:10}") int maxResults) {
        this.settingsRepository = settingsRepository;
        this.basePingPolicy = PingPolicy.builder()
                .cooldown(Duration.ofSeconds(cooldownSeconds))
                .creditsPerPeriod(creditsPerPeriod)
                .creditPeriod(Duration.ofDays(creditPeriodDays))
                .radiusMeters(radiusMeters)
                .maxResults(maxResults)
                .build();
    }

    @Transactional(readOnly = true)
    public DiscoveryContext contextFor(String userId) {
        return settingsRepository.findById(userId)
                .map(settings -> DiscoveryContext.builder()
                        .userId(userId)
                        .dismissalPolicy(settings.getDismissalPolicy())
                        .enabledTypes(parseTypes(settings.getEnabledTypes()))
                        .pingPolicy(basePingPolicy.toBuilder().minRating(settings.getMinRating()).build())
                        .build())
                .orElseGet(() -> DiscoveryContext.builder()
                        .userId(userId)
                        .enabledTypes(DEFAULT_ENABLED_TYPES)
                        .pingPolicy(basePingPolicy)
                        .build());
    }

    @Transactional
    public DiscoveryContext updateDismissalPolicy(String userId, DismissalPolicy policy) {
        UserDiscoverySettings settings = load(userId);
        settings.setDismissalPolicy(policy);
        settingsRepository.save(settings);
        log.info("[UserSettingsService] dismissal policy updated - userId: {}, policy: {}", userId, policy);
        return contextFor(userId);
    }

    @Transactional
    public DiscoveryContext updateEnabledTypes(String userId, List<String> types) {
        UserDiscoverySettings settings = load(userId);
        settings.setEnabledTypes(types == null ? null : String.join(",", types));
        settingsRepository.save(settings);
        log.info("[UserSettingsService] enabled types updated - userId: {}, types: {}", userId, types);
        return contextFor(userId);
    }

    /**
     * ping 결과의 최소 평점. null이면 거르지 않음
     */
    @Transactional
    public DiscoveryContext updateMinRating(String userId, Double minRating) {
        if (minRating != null && (minRating < 0 || minRating > 5)) {
            throw new IllegalArgumentException("minRating must be between 0 and 5");
        }
        UserDiscoverySettings settings = load(userId);
        settings.setMinRating(minRating);
        settingsRepository.save(settings);
        log.info("[UserSettingsService] min rating updated - userId: {}, minRating: {}", userId, minRating);
        return contextFor(userId);
    }

    private UserDiscoverySettings load(String userId) {
        return settingsRepository.findById(userId).orElseGet(() -> {
            UserDiscoverySettings created = new UserDiscoverySettings();
            created.setUserId(userId);
            created.setDismissalPolicy(DismissalPolicy.ASK);
            return created;
        });
    }

    /**
     * null은 기본 타입 목록, 빈 문자열은 모든 타입을 끈 상태
     */
    private List<String> parseTypes(String stored) {
        if (stored == null) {
            return DEFAULT_ENABLED_TYPES;
        }
        return Arrays.stream(stored.split(","))
                .map(String::trim)
                .filter(type -> !type.isEmpty())
                .collect(Collectors.toList());
    }
}
