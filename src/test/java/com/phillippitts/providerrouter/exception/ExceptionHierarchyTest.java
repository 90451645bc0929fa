package com.phillippitts.providerrouter.exception;

import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class ExceptionHierarchyTest {

    @Test
    void providerRouterExceptionShouldIncludeMessageAndCause() {
        IOException cause = new IOException("IO failure");
        ProviderRouterException ex = new ProviderRouterException("wrapper error", cause);

        assertThat(ex).isInstanceOf(RuntimeException.class);
        assertThat(ex.getMessage()).isEqualTo("wrapper error");
        assertThat(ex.getCause()).isEqualTo(cause);
    }

    @Test
    void configExceptionFactoriesCarryKindAndKey() {
        assertThat(ConfigException.unknownFeature("narration").getKind())
                .isEqualTo(ConfigException.Kind.UNKNOWN_FEATURE);
        assertThat(ConfigException.unknownProvider("p9").getKey()).isEqualTo("p9");

        ConfigException invalid = ConfigException.invalid("narration", "unknown provider p9");
        assertThat(invalid.getKind()).isEqualTo(ConfigException.Kind.INVALID_CONFIG);
        assertThat(invalid.getMessage()).contains("narration").contains("unknown provider p9");
        assertThat(invalid).isInstanceOf(ProviderRouterException.class);
    }

    @Test
    void routingExhaustedShouldIncludeFeatureAndCandidates() {
        RoutingExhaustedException ex = new RoutingExhaustedException("narration", List.of("p1", "p2"));

        assertThat(ex.getFeature()).isEqualTo("narration");
        assertThat(ex.getCandidates()).containsExactly("p1", "p2");
        assertThat(ex.getMessage()).contains("narration").contains("p1");
        assertThat(ex).isInstanceOf(ProviderRouterException.class);
    }

    @Test
    void providerCallExceptionShouldKeepLastFailure() {
        IOException cause = new IOException("timeout");
        ProviderCallException ex = new ProviderCallException("narration", List.of("p1", "p2"), cause);

        assertThat(ex.getAttemptedProviders()).containsExactly("p1", "p2");
        assertThat(ex.getFeature()).isEqualTo("narration");
        assertThat(ex.getCause()).isSameAs(cause);
    }
}
