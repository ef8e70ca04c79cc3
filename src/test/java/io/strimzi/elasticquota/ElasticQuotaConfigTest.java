/*
 * Copyright Strimzi authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */

package io.strimzi.elasticquota;

import java.time.Duration;
import java.util.Map;

import io.strimzi.elasticquota.resource.ResourceVector;
import org.apache.kafka.common.config.ConfigException;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ElasticQuotaConfigTest {

    @Test
    void shouldApplyDefaults() {
        //When
        ElasticQuotaConfig config = new ElasticQuotaConfig(Map.of(), true);

        //Then
        assertThat(config.getClusterTotalResource()).isEqualTo(ResourceVector.empty());
        assertThat(config.getSystemQuotaMax()).isEqualTo(ResourceVector.empty());
        assertThat(config.getRecalculateInterval()).isEqualTo(Duration.ofSeconds(1));
        assertThat(config.getRefreshMaxAttempts()).isEqualTo(ElasticQuotaConfig.REFRESH_MAX_ATTEMPTS_DEFAULT);
    }

    @Test
    void shouldParseResourceVectors() {
        //Given
        Map<String, String> props = Map.of(
                ElasticQuotaConfig.CLUSTER_TOTAL_RESOURCE_PROP, "cpu=64000,memory=256Gi",
                ElasticQuotaConfig.SYSTEM_QUOTA_MAX_PROP, "cpu=2000");

        //When
        ElasticQuotaConfig config = new ElasticQuotaConfig(props, true);

        //Then
        assertThat(config.getClusterTotalResource()).isEqualTo(ResourceVector.of("cpu", 64000L, "memory", 256L << 30));
        assertThat(config.getSystemQuotaMax()).isEqualTo(ResourceVector.of("cpu", 2000L));
    }

    @Test
    void shouldAllowDisablingPeriodicRecalculation() {
        //When
        ElasticQuotaConfig config = new ElasticQuotaConfig(Map.of(ElasticQuotaConfig.RECALCULATE_INTERVAL_PROP, "PT0S"), true);

        //Then
        assertThat(config.getRecalculateInterval()).isZero();
    }

    @Test
    void negativeResourceQuantityNotAllowed() {
        assertThatThrownBy(() -> new ElasticQuotaConfig(Map.of(ElasticQuotaConfig.CLUSTER_TOTAL_RESOURCE_PROP, "cpu=-1"), true))
                .isInstanceOf(ConfigException.class)
                .hasMessageContaining("Invalid value cpu=-1");
    }

    @Test
    void malformedResourceVectorNotAllowed() {
        assertThatThrownBy(() -> new ElasticQuotaConfig(Map.of(ElasticQuotaConfig.SYSTEM_QUOTA_MAX_PROP, "cpu:4"), true))
                .isInstanceOf(ConfigException.class)
                .hasMessageContaining("Invalid value cpu:4");
    }

    @Test
    void invalidRecalculateIntervalNotAllowed() {
        assertThatThrownBy(() -> new ElasticQuotaConfig(Map.of(ElasticQuotaConfig.RECALCULATE_INTERVAL_PROP, "NOT 8601 FRIENDLY"), true))
                .isInstanceOf(ConfigException.class)
                .hasMessageContaining("Invalid value NOT 8601 FRIENDLY");
    }

    @Test
    void negativeRecalculateIntervalNotAllowed() {
        assertThatThrownBy(() -> new ElasticQuotaConfig(Map.of(ElasticQuotaConfig.RECALCULATE_INTERVAL_PROP, "-PT1S"), true))
                .isInstanceOf(ConfigException.class)
                .hasMessageContaining("Invalid value -PT1S");
    }

    @Test
    void zeroRefreshAttemptsNotAllowed() {
        assertThatThrownBy(() -> new ElasticQuotaConfig(Map.of(ElasticQuotaConfig.REFRESH_MAX_ATTEMPTS_PROP, "0"), true))
                .isInstanceOf(ConfigException.class)
                .hasMessageContaining("Invalid value 0");
    }
}
