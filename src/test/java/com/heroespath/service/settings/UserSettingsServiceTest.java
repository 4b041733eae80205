package com.heroespath.service.settings;

import com.heroespath.model.DiscoveryContext;
import com.heroespath.model.DismissalPolicy;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.context.annotation.Import;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DataJpaTest
@Import(UserSettingsService.class)
class UserSettingsServiceTest {

    @Autowired
    private UserSettingsService userSettingsService;

    @Test
    void newUserGetsDefaults() {
        DiscoveryContext ctx = userSettingsService.contextFor("fresh-user");

        assertThat(ctx.getDismissalPolicy()).isEqualTo(DismissalPolicy.ASK);
        assertThat(ctx.getEnabledTypes()).isEqualTo(UserSettingsService.DEFAULT_ENABLED_TYPES);
    }

    @Test
    void updatesArePersisted() {
        userSettingsService.updateDismissalPolicy("u1", DismissalPolicy.ALWAYS_FOREVER);
        userSettingsService.updateEnabledTypes("u1", List.of("cafe", " park "));

        DiscoveryContext ctx = userSettingsService.contextFor("u1");

        assertThat(ctx.getDismissalPolicy()).isEqualTo(DismissalPolicy.ALWAYS_FOREVER);
        assertThat(ctx.getEnabledTypes()).containsExactly("cafe", "park");
    }

    @Test
    void emptyTypeListMeansEverythingDisabled() {
        userSettingsService.updateEnabledTypes("u2", List.of());

        DiscoveryContext ctx = userSettingsService.contextFor("u2");

        assertThat(ctx.getEnabledTypes()).isEmpty();
        assertThat(ctx.allTypesDisabled()).isTrue();
    }

    @Test
    void nullTypeListRestoresDefaults() {
        userSettingsService.updateEnabledTypes("u3", List.of("cafe"));
        userSettingsService.updateEnabledTypes("u3", null);

        assertThat(userSettingsService.contextFor("u3").getEnabledTypes())
                .isEqualTo(UserSettingsService.DEFAULT_ENABLED_TYPES);
    }

    @Test
    void minRatingFlowsIntoPingPolicy() {
        userSettingsService.updateMinRating("u4", 4.0);

        DiscoveryContext ctx = userSettingsService.contextFor("u4");

        assertThat(ctx.getPingPolicy().getMinRating()).isEqualTo(4.0);
        assertThat(ctx.getPingPolicy().getCooldown()).hasSeconds(10);
        assertThat(ctx.getPingPolicy().getCreditsPerPeriod()).isEqualTo(50);
    }

    @Test
    void minRatingOutOfRangeIsRejected() {
        assertThatThrownBy(() -> userSettingsService.updateMinRating("u4", 6.0))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
