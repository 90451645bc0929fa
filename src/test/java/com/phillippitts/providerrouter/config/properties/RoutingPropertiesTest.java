package com.phillippitts.providerrouter.config.properties;

import com.phillippitts.providerrouter.domain.FeatureConfig;
import com.phillippitts.providerrouter.domain.Provider;
import com.phillippitts.providerrouter.domain.ProviderCategory;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validation;
import jakarta.validation.Validator;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

class RoutingPropertiesTest {

    private Validator validator;

    @BeforeEach
    void setup() {
        validator = Validation.buildDefaultValidatorFactory().getValidator();
    }

    @Test
    void shouldUseDefaultValues() {
        RoutingProperties props = new RoutingProperties();

        assertThat(props.getHealth().getFailureThreshold()).isEqualTo(3);
        assertThat(props.getHealth().getShortRecovery()).isEqualTo(Duration.ofMinutes(10));
        assertThat(props.getHealth().getLongRecovery()).isEqualTo(Duration.ofMinutes(30));
        assertThat(props.getSweeper().isEnabled()).isTrue();
        assertThat(props.getSweeper().getInterval()).isEqualTo(Duration.ofMinutes(5));
        assertThat(props.isAllowFeatureCreation()).isFalse();
    }

    @Test
    void shouldConvertDefinitionsToDomainTypes() {
        RoutingProperties props = new RoutingProperties();
        RoutingProperties.ProviderDefinition def = new RoutingProperties.ProviderDefinition();
        def.setId("gemma2-9b-it");
        def.setCategory(ProviderCategory.TRANSLATION);
        def.setVendor("Groq");
        props.setProviders(List.of(def));

        RoutingProperties.FeatureDefinition feature = new RoutingProperties.FeatureDefinition();
        feature.setPrimary("gemma2-9b-it");
        feature.setCostCeiling(0.0);
        props.getFeatures().put("translator", feature);

        List<Provider> providers = props.toProviders();
        List<FeatureConfig> configs = props.toFeatureConfigs();

        assertThat(providers).singleElement().satisfies(p -> {
            assertThat(p.id()).isEqualTo("gemma2-9b-it");
            assertThat(p.capacityLimit()).isEqualTo(8192);
            assertThat(p.active()).isTrue();
        });
        assertThat(configs).singleElement().satisfies(c -> {
            assertThat(c.feature()).isEqualTo("translator");
            assertThat(c.maxRetries()).isEqualTo(FeatureConfig.DEFAULT_MAX_RETRIES);
            assertThat(c.costCeiling()).isEqualTo(0.0);
        });
    }

    @Test
    void shouldRejectNonPositiveFailureThreshold() {
        RoutingProperties props = new RoutingProperties();
        props.getHealth().setFailureThreshold(0);

        Set<ConstraintViolation<RoutingProperties>> violations = validator.validate(props);

        assertThat(violations).hasSize(1);
        assertThat(violations.iterator().next().getMessage()).contains("Failure threshold must be positive");
    }

    @Test
    void shouldRejectProviderWithoutIdOrCategory() {
        RoutingProperties props = new RoutingProperties();
        props.setProviders(List.of(new RoutingProperties.ProviderDefinition()));

        Set<ConstraintViolation<RoutingProperties>> violations = validator.validate(props);

        assertThat(violations).extracting(ConstraintViolation::getMessage)
                .containsExactlyInAnyOrder("Provider id must not be blank", "Provider category is required");
    }

    @Test
    void shouldRejectNegativeCostCeiling() {
        RoutingProperties props = new RoutingProperties();
        RoutingProperties.FeatureDefinition feature = new RoutingProperties.FeatureDefinition();
        feature.setPrimary("p1");
        feature.setCostCeiling(-1.0);
        props.getFeatures().put("narration", feature);

        Set<ConstraintViolation<RoutingProperties>> violations = validator.validate(props);

        assertThat(violations).hasSize(1);
        assertThat(violations.iterator().next().getMessage()).contains("Cost ceiling must not be negative");
    }
}
