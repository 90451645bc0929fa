package com.phillippitts.providerrouter.service.routing;

import com.phillippitts.providerrouter.domain.FeatureConfig;
import com.phillippitts.providerrouter.domain.FeatureConfigUpdate;
import com.phillippitts.providerrouter.exception.ConfigException;
import com.phillippitts.providerrouter.service.catalog.ProviderCatalog;
import com.phillippitts.providerrouter.testutil.RoutingFixtures;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static com.phillippitts.providerrouter.testutil.RoutingFixtures.CHAT;
import static com.phillippitts.providerrouter.testutil.RoutingFixtures.P1;
import static com.phillippitts.providerrouter.testutil.RoutingFixtures.P2;
import static com.phillippitts.providerrouter.testutil.RoutingFixtures.P3;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class FeatureRoutingTableTest {

    private final ProviderCatalog catalog = RoutingFixtures.catalog();

    private FeatureRoutingTable table(boolean allowCreation) {
        return new FeatureRoutingTable(catalog, List.of(RoutingFixtures.narration(), RoutingFixtures.chat()),
                allowCreation);
    }

    @Test
    void getReturnsConfiguredChain() {
        FeatureConfig config = table(false).get("narration");

        assertThat(config.primaryProviderId()).isEqualTo(P1);
        assertThat(config.fallbackProviderIds()).containsExactly(P2, P3);
    }

    @Test
    void getThrowsForUnknownFeature() {
        assertThatThrownBy(() -> table(false).get("karaoke"))
                .isInstanceOf(ConfigException.class)
                .satisfies(e -> assertThat(((ConfigException) e).getKind())
                        .isEqualTo(ConfigException.Kind.UNKNOWN_FEATURE));
    }

    @Test
    void rejectsStartupConfigReferencingUnknownProvider() {
        FeatureConfig broken = new FeatureConfig("narration", P1, List.of("ghost"), 3, null);

        assertThatThrownBy(() -> new FeatureRoutingTable(catalog, List.of(broken), false))
                .isInstanceOf(ConfigException.class)
                .hasMessageContaining("ghost");
    }

    @Test
    void updateMergesIntoExistingConfigOnly() {
        FeatureRoutingTable table = table(false);

        FeatureConfig updated = table.update("narration",
                new FeatureConfigUpdate(P2, List.of(P3), null, 0.5, false));

        assertThat(updated.primaryProviderId()).isEqualTo(P2);
        assertThat(updated.fallbackProviderIds()).containsExactly(P3);
        assertThat(updated.maxRetries()).isEqualTo(2);
        assertThat(updated.costCeiling()).isEqualTo(0.5);
        assertThat(table.get("narration")).isEqualTo(updated);
        assertThat(table.get("general-chat")).isEqualTo(RoutingFixtures.chat());
    }

    @Test
    void invalidUpdateLeavesPreviousConfigInPlace() {
        FeatureRoutingTable table = table(false);
        FeatureConfig before = table.get("narration");

        assertThatThrownBy(() -> table.update("narration", FeatureConfigUpdate.primary("ghost")))
                .isInstanceOf(ConfigException.class)
                .satisfies(e -> assertThat(((ConfigException) e).getKind())
                        .isEqualTo(ConfigException.Kind.INVALID_CONFIG));
        assertThatThrownBy(() -> table.update("narration", new FeatureConfigUpdate(null, null, -1, null, false)))
                .isInstanceOf(ConfigException.class);

        assertThat(table.get("narration")).isEqualTo(before);
    }

    @Test
    void nullOrBlankFallbackIdIsRejectedAsInvalidConfig() {
        FeatureRoutingTable table = table(false);
        FeatureConfig before = table.get("narration");

        assertThatThrownBy(() -> table.update("narration", FeatureConfigUpdate.fallbacks(Arrays.asList(P2, null))))
                .isInstanceOf(ConfigException.class)
                .satisfies(e -> assertThat(((ConfigException) e).getKind())
                        .isEqualTo(ConfigException.Kind.INVALID_CONFIG));
        assertThatThrownBy(() -> table.update("narration", FeatureConfigUpdate.fallbacks(List.of(" "))))
                .isInstanceOf(ConfigException.class);

        assertThat(table.get("narration")).isEqualTo(before);
    }

    @Test
    void unknownFeatureIsNotCreatedByDefault() {
        FeatureRoutingTable table = table(false);

        assertThatThrownBy(() -> table.update("karaoke", FeatureConfigUpdate.primary(CHAT)))
                .isInstanceOf(ConfigException.class);
        assertThat(table.find("karaoke")).isEmpty();
    }

    @Test
    void unknownFeatureIsCreatedWhenAllowedAndPrimaryGiven() {
        FeatureRoutingTable table = table(true);

        FeatureConfig created = table.update("karaoke", FeatureConfigUpdate.primary(P3));

        assertThat(created.primaryProviderId()).isEqualTo(P3);
        assertThat(created.maxRetries()).isEqualTo(FeatureConfig.DEFAULT_MAX_RETRIES);
        assertThat(table.features()).containsExactly("general-chat", "karaoke", "narration");
    }

    @Test
    void creationRequiresPrimary() {
        FeatureRoutingTable table = table(true);

        assertThatThrownBy(() -> table.update("karaoke", FeatureConfigUpdate.fallbacks(List.of(P3))))
                .isInstanceOf(ConfigException.class)
                .hasMessageContaining("primary");
    }
}
