package com.heroespath.controller;

import com.heroespath.exception.DiscoveryNotFoundException;
import com.heroespath.exception.IllegalReviewTransitionException;
import com.heroespath.model.ConsolidationStats;
import com.heroespath.model.Discovery;
import com.heroespath.model.DiscoveryContext;
import com.heroespath.model.DiscoveryStatus;
import com.heroespath.model.DismissDuration;
import com.heroespath.service.discovery.DiscoveryOrchestrator;
import com.heroespath.service.discovery.DiscoveryResult;
import com.heroespath.service.review.DiscoveryLibraryService;
import com.heroespath.service.review.ReviewOutcome;
import com.heroespath.service.review.ReviewStateMachine;
import com.heroespath.service.settings.UserSettingsService;
import com.heroespath.service.store.DegradedPersistence;
import com.heroespath.service.store.DiscoveryStoreAdapter;
import com.heroespath.service.store.StoreResult;
import com.heroespath.support.Places;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Instant;
import java.util.List;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(DiscoveryController.class)
class DiscoveryControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private DiscoveryOrchestrator discoveryOrchestrator;

    @MockBean
    private ReviewStateMachine reviewStateMachine;

    @MockBean
    private DiscoveryLibraryService libraryService;

    @MockBean
    private DiscoveryStoreAdapter storeAdapter;

    @MockBean
    private UserSettingsService settingsService;

    private final DiscoveryContext ctx = DiscoveryContext.forUser("u1");

    @BeforeEach
    void setUp() {
        when(settingsService.contextFor("u1")).thenReturn(ctx);
    }

    private Discovery discovery(DiscoveryStatus status) {
        return Discovery.builder()
                .discoveryId(Discovery.idFor("u1", "R1", "P1"))
                .userId("u1")
                .routeId("R1")
                .placeId("P1")
                .snapshot(Places.place("P1", "cafe"))
                .status(status)
                .discoveredAt(Instant.parse("2026-03-01T09:00:00Z"))
                .build();
    }

    @Test
    void discoverReturnsUnreviewedPlacesWithWarnings() throws Exception {
        when(discoveryOrchestrator.discoverForRoute(eq(ctx), eq("R1"), anyList(), eq(List.of("cafe")), eq("ko")))
                .thenReturn(DiscoveryResult.builder()
                        .routeId("R1")
                        .places(List.of(Places.place("P1", "cafe")))
                        .resolverCalled(true)
                        .warnings(List.of(new DegradedPersistence("createDiscovery", "connection refused", true)))
                        .build());

        mockMvc.perform(post("/api/discoveries/routes/R1/discover")
                        .header("X-User-Id", "u1")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"coords\":[{\"lat\":37.5665,\"lng\":126.978,\"timestamp\":1700000000000}],"
                                + "\"typeFilters\":[\"cafe\"],\"language\":\"ko\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.places[0].placeId").value("P1"))
                .andExpect(jsonPath("$.places[0].location.lat").value(37.5665))
                .andExpect(jsonPath("$.firstDiscovery").value(true))
                .andExpect(jsonPath("$.warnings[0]").value("DegradedPersistence: createDiscovery (connection refused)"));
    }

    @Test
    void dismissWithoutDurationUnderAskPolicy() throws Exception {
        when(reviewStateMachine.dismiss(ctx, "R1", "P1", null))
                .thenReturn(ReviewOutcome.durationRequired(discovery(DiscoveryStatus.UNREVIEWED)));

        mockMvc.perform(post("/api/discoveries/routes/R1/places/P1/dismiss").header("X-User-Id", "u1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.outcome").value("DURATION_REQUIRED"))
                .andExpect(jsonPath("$.discovery.status").value("UNREVIEWED"));
    }

    @Test
    void dismissWithDuration() throws Exception {
        when(reviewStateMachine.dismiss(ctx, "R1", "P1", DismissDuration.FOREVER))
                .thenReturn(ReviewOutcome.applied(discovery(DiscoveryStatus.DISMISSED_FOREVER), null));

        mockMvc.perform(post("/api/discoveries/routes/R1/places/P1/dismiss")
                        .header("X-User-Id", "u1")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"duration\":\"FOREVER\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.outcome").value("APPLIED"))
                .andExpect(jsonPath("$.discovery.status").value("DISMISSED_FOREVER"))
                .andExpect(jsonPath("$.warning").doesNotExist());
    }

    @Test
    void illegalTransitionIsConflict() throws Exception {
        when(reviewStateMachine.undoDismiss(ctx, "R1", "P1"))
                .thenThrow(new IllegalReviewTransitionException(DiscoveryStatus.SAVED, DiscoveryStatus.UNREVIEWED));

        mockMvc.perform(post("/api/discoveries/routes/R1/places/P1/undo-dismiss").header("X-User-Id", "u1"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.error").value("IllegalReviewTransitionException"));
    }

    @Test
    void unknownDiscoveryIsNotFound() throws Exception {
        when(reviewStateMachine.save(any(DiscoveryContext.class), eq("R1"), eq("P404")))
                .thenThrow(new DiscoveryNotFoundException("No discovery for route R1 and place P404"));

        mockMvc.perform(post("/api/discoveries/routes/R1/places/P404/save").header("X-User-Id", "u1"))
                .andExpect(status().isNotFound());
    }

    @Test
    void missingUserHeaderIsBadRequest() throws Exception {
        mockMvc.perform(get("/api/discoveries/stats"))
                .andExpect(status().isBadRequest());
    }

    @Test
    void listsSavedByDefault() throws Exception {
        when(libraryService.listByStatus("u1", DiscoveryStatus.SAVED))
                .thenReturn(StoreResult.ok(List.of(discovery(DiscoveryStatus.SAVED))));

        mockMvc.perform(get("/api/discoveries").header("X-User-Id", "u1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].status").value("SAVED"))
                .andExpect(jsonPath("$[0].place.name").value("Place P1"));
    }

    @Test
    void summaryAttachRejectsBlankData() throws Exception {
        when(libraryService.attachSummary(eq("u1"), eq("d1"), isNull()))
                .thenThrow(new IllegalArgumentException("summaryData must not be empty"));

        mockMvc.perform(put("/api/discoveries/d1/summary")
                        .header("X-User-Id", "u1")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value("summaryData must not be empty"));
    }

    @Test
    void consolidationStatsPerRoute() throws Exception {
        when(libraryService.consolidationStats("u1", "R1")).thenReturn(new ConsolidationStats("R1", 5, 3, 1, 1));

        mockMvc.perform(get("/api/discoveries/routes/R1/consolidation").header("X-User-Id", "u1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.totalDiscoveries").value(5))
                .andExpect(jsonPath("$.pingDiscoveries").value(1))
                .andExpect(jsonPath("$.mixedSourceDiscoveries").value(1));
    }
}
