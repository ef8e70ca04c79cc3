/*
 * Copyright Strimzi authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.strimzi.elasticquota;

import java.time.Duration;
import java.time.format.DateTimeParseException;
import java.util.Map;

import io.strimzi.elasticquota.resource.ResourceVector;
import org.apache.kafka.common.config.AbstractConfig;
import org.apache.kafka.common.config.ConfigDef;
import org.apache.kafka.common.config.ConfigException;

import static org.apache.kafka.common.config.ConfigDef.Importance.HIGH;
import static org.apache.kafka.common.config.ConfigDef.Importance.LOW;
import static org.apache.kafka.common.config.ConfigDef.Importance.MEDIUM;
import static org.apache.kafka.common.config.ConfigDef.Range.atLeast;
import static org.apache.kafka.common.config.ConfigDef.Type.INT;
import static org.apache.kafka.common.config.ConfigDef.Type.STRING;

/**
 * Configuration for the elastic quota core.
 */
public class ElasticQuotaConfig extends AbstractConfig {
    private static final String ELASTIC_QUOTA_PREFIX = "elastic.quota";
    static final String CLUSTER_TOTAL_RESOURCE_PROP = ELASTIC_QUOTA_PREFIX + ".cluster.total.resource";
    static final String SYSTEM_QUOTA_MAX_PROP = ELASTIC_QUOTA_PREFIX + ".system.quota.max";
    static final String RECALCULATE_INTERVAL_PROP = ELASTIC_QUOTA_PREFIX + ".recalculate.interval";
    static final String REFRESH_MAX_ATTEMPTS_PROP = ELASTIC_QUOTA_PREFIX + ".refresh.max.attempts";
    static final String RECALCULATE_INTERVAL_DEFAULT = "PT1S";
    static final int REFRESH_MAX_ATTEMPTS_DEFAULT = 3;

    /**
     * Construct a configuration for the elastic quota core.
     *
     * @param props the configuration properties
     * @param doLog whether the configurations should be logged
     */
    public ElasticQuotaConfig(Map<String, ?> props, boolean doLog) {
        super(new ConfigDef()
                        .define(CLUSTER_TOTAL_RESOURCE_PROP, STRING, "", resourceVectorValidator(), HIGH, "Total resources of the cluster shared by the top level quota groups, e.g. cpu=64000,memory=256Gi")
                        .define(SYSTEM_QUOTA_MAX_PROP, STRING, "", resourceVectorValidator(), MEDIUM, "Max of the reserved system quota group")
                        .define(RECALCULATE_INTERVAL_PROP, STRING, RECALCULATE_INTERVAL_DEFAULT, iso8601DurationValidator(), MEDIUM, "Interval between runtime recalculations (iso8601 duration, zero disables periodic recalculation)")
                        .define(REFRESH_MAX_ATTEMPTS_PROP, INT, REFRESH_MAX_ATTEMPTS_DEFAULT, atLeast(1), LOW, "How many times a recalculation superseded by a topology change is restarted"),
                props,
                doLog);
    }

    ResourceVector getClusterTotalResource() {
        return ResourceVector.parse(getString(CLUSTER_TOTAL_RESOURCE_PROP));
    }

    ResourceVector getSystemQuotaMax() {
        return ResourceVector.parse(getString(SYSTEM_QUOTA_MAX_PROP));
    }

    Duration getRecalculateInterval() {
        return Duration.parse(getString(RECALCULATE_INTERVAL_PROP));
    }

    int getRefreshMaxAttempts() {
        return getInt(REFRESH_MAX_ATTEMPTS_PROP);
    }

    private static ConfigDef.LambdaValidator resourceVectorValidator() {
        return ConfigDef.LambdaValidator.with((name, value) -> {
            try {
                ResourceVector parsed = ResourceVector.parse((String) value);
                if (!parsed.isNegative().isEmpty()) {
                    throw new ConfigException(name, value, "Negative quantity for " + parsed.isNegative());
                }
            } catch (IllegalArgumentException ex) {
                throw new ConfigException(name, value, ex.getMessage());
            }
        }, () -> "Comma separated name=quantity pairs like cpu=4000,memory=8Gi");
    }

    private static ConfigDef.LambdaValidator iso8601DurationValidator() {
        return ConfigDef.LambdaValidator.with((name, value) -> {
            String duration = (String) value;
            try {
                if (Duration.parse(duration).isNegative()) {
                    throw new ConfigException(name, value, "Duration must not be negative");
                }
            } catch (DateTimeParseException ex) {
                throw new ConfigException(name, value, "Failed to parse iso8601 duration");
            }
        }, () -> "Should be a valid iso8601 duration string like PT5M");
    }
}
