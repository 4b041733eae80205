package com.heroespath.service.ping;

import com.heroespath.exception.PlacesUnavailableException;
import com.heroespath.model.DiscoveryContext;
import com.heroespath.model.GeoPoint;
import com.heroespath.model.PingPolicy;
import com.heroespath.model.StandardPlace;
import com.heroespath.repository.PingResultRepository;
import com.heroespath.service.discovery.PlaceMerger;
import com.heroespath.service.places.NearbyQuery;
import com.heroespath.service.places.PlacesResolver;
import com.heroespath.service.taxonomy.TaxonomyClassifier;
import com.heroespath.support.MutableClock;
import com.heroespath.support.Places;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Import;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@DataJpaTest
@Import({PingService.class, TaxonomyClassifier.class, PlaceMerger.class, PingServiceTest.ClockConfig.class})
class PingServiceTest {

    private static final Instant T0 = Instant.parse("2026-03-01T09:00:00Z");
    private static final GeoPoint HERE = new GeoPoint(37.5665, 126.9780);

    @TestConfiguration
    static class ClockConfig {
        @Bean
        MutableClock clock() {
            return new MutableClock(T0);
        }
    }

    @Autowired
    private PingService pingService;

    @Autowired
    private PingResultRepository pingResultRepository;

    @Autowired
    private MutableClock clock;

    @MockBean
    private PlacesResolver placesResolver;

    private final DiscoveryContext cafeLover = DiscoveryContext.builder()
            .userId("u1")
            .enabledTypes(List.of("cafe"))
            .build();

    @BeforeEach
    void resetClock() {
        clock.set(T0);
    }

    @Test
    void pingKeepsMatchingPlacesAndUsesOneCredit() {
        when(placesResolver.resolveNearby(any(NearbyQuery.class))).thenReturn(List.of(
                Places.place("C1", "cafe"),
                Places.place("R1", "restaurant")));

        PingResult result = pingService.ping(cafeLover, "route-1", HERE, "ko");

        assertThat(result.getOutcome()).isEqualTo(PingOutcome.FOUND);
        assertThat(result.getPingId()).startsWith("ping_");
        assertThat(result.getPlaces()).extracting(StandardPlace::getPlaceId).containsExactly("C1");
        assertThat(result.getCreditsRemaining()).isEqualTo(49);
        assertThat(pingService.placesForRoute("u1", "route-1")).extracting(StandardPlace::getPlaceId).containsExactly("C1");

        ArgumentCaptor<NearbyQuery> captor = ArgumentCaptor.forClass(NearbyQuery.class);
        verify(placesResolver).resolveNearby(captor.capture());
        assertThat(captor.getValue().getType()).isEqualTo("cafe");
        assertThat(captor.getValue().getRadiusMeters()).isEqualTo(500);
        assertThat(captor.getValue().getCenter()).isEqualTo(HERE);
    }

    @Test
    void secondPingWithinCooldownIsBlocked() {
        when(placesResolver.resolveNearby(any(NearbyQuery.class))).thenReturn(List.of(Places.place("C1", "cafe")));
        pingService.ping(cafeLover, "route-1", HERE, "en");

        clock.advance(Duration.ofSeconds(3));
        PingResult blocked = pingService.ping(cafeLover, "route-1", HERE, "en");

        assertThat(blocked.getOutcome()).isEqualTo(PingOutcome.COOLDOWN);
        assertThat(blocked.getCooldownRemainingSeconds()).isEqualTo(7);
        assertThat(blocked.getCreditsRemaining()).isEqualTo(49);
        verify(placesResolver, times(1)).resolveNearby(any(NearbyQuery.class));

        clock.advance(Duration.ofSeconds(7));
        assertThat(pingService.checkEligibility(cafeLover).isCanPing()).isTrue();
    }

    @Test
    void creditsRunOutAndRefillAfterPeriod() {
        when(placesResolver.resolveNearby(any(NearbyQuery.class))).thenReturn(List.of(Places.place("C1", "cafe")));
        DiscoveryContext ctx = cafeLover.toBuilder()
                .pingPolicy(PingPolicy.builder().cooldown(Duration.ZERO).creditsPerPeriod(2).build())
                .build();

        pingService.ping(ctx, "route-1", HERE, "en");
        pingService.ping(ctx, "route-1", HERE, "en");
        PingResult exhausted = pingService.ping(ctx, "route-1", HERE, "en");

        assertThat(exhausted.getOutcome()).isEqualTo(PingOutcome.NO_CREDITS);
        assertThat(pingService.stats(ctx).getTotalPingsUsed()).isEqualTo(2);

        clock.advance(Duration.ofDays(30));
        PingResult refilled = pingService.ping(ctx, "route-1", HERE, "en");

        assertThat(refilled.getOutcome()).isEqualTo(PingOutcome.FOUND);
        assertThat(refilled.getCreditsRemaining()).isEqualTo(1);
    }

    @Test
    void allTypesDisabledSkipsSearchAndKeepsCredit() {
        DiscoveryContext nothingEnabled = DiscoveryContext.builder().userId("u2").enabledTypes(List.of()).build();

        PingResult result = pingService.ping(nothingEnabled, "route-1", HERE, "en");

        assertThat(result.getOutcome()).isEqualTo(PingOutcome.NO_ENABLED_TYPES);
        assertThat(result.getCreditsRemaining()).isEqualTo(50);
        verify(placesResolver, never()).resolveNearby(any(NearbyQuery.class));
    }

    @Test
    void placesOutageDoesNotUseCredit() {
        when(placesResolver.resolveNearby(any(NearbyQuery.class)))
                .thenThrow(new PlacesUnavailableException("nearby", List.of("current: status 503", "legacy: transport")));

        PingResult result = pingService.ping(cafeLover, "route-1", HERE, "en");

        assertThat(result.getOutcome()).isEqualTo(PingOutcome.PLACES_UNAVAILABLE);
        assertThat(pingService.stats(cafeLover).getCreditsRemaining()).isEqualTo(50);
        assertThat(pingResultRepository.count()).isZero();
    }

    @Test
    void minRatingDropsLowRatedPlaces() {
        StandardPlace lowRated = Places.place("C2", "cafe");
        lowRated.setRating(3.1);
        StandardPlace unrated = Places.place("C3", "cafe");
        unrated.setRating(null);
        when(placesResolver.resolveNearby(any(NearbyQuery.class))).thenReturn(List.of(
                Places.place("C1", "cafe"), lowRated, unrated));
        DiscoveryContext picky = cafeLover.toBuilder()
                .pingPolicy(PingPolicy.builder().minRating(4.0).build())
                .build();

        PingResult result = pingService.ping(picky, "route-1", HERE, "en");

        assertThat(result.getPlaces()).extracting(StandardPlace::getPlaceId).containsExactly("C1", "C3");
    }

    @Test
    void archiveRemovesStoredResultsForRoute() {
        when(placesResolver.resolveNearby(any(NearbyQuery.class))).thenReturn(List.of(Places.place("C1", "cafe")));
        pingService.ping(cafeLover, "route-1", HERE, "en");
        clock.advance(Duration.ofSeconds(10));
        pingService.ping(cafeLover, "route-2", HERE, "en");

        long archived = pingService.archive("u1", "route-1");

        assertThat(archived).isEqualTo(1);
        assertThat(pingService.placesForRoute("u1", "route-1")).isEmpty();
        assertThat(pingService.placesForRoute("u1", "route-2")).hasSize(1);
    }

    @Test
    void pingNeedsRouteAndLocation() {
        assertThatThrownBy(() -> pingService.ping(cafeLover, " ", HERE, "en"))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> pingService.ping(cafeLover, "route-1", new GeoPoint(null, 126.9), "en"))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
