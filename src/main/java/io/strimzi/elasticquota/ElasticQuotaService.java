/*
 * Copyright Strimzi authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.strimzi.elasticquota;

import java.io.Closeable;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;

import com.yammer.metrics.Metrics;
import com.yammer.metrics.core.MetricName;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Wires the elastic quota core together: builds the {@link GroupQuotaManager} from configuration and keeps the
 * runtime of every quota group fresh by recalculating it in the background.
 */
public class ElasticQuotaService implements Closeable {
    private static final Logger log = LoggerFactory.getLogger(ElasticQuotaService.class);
    private final static String SCOPE = "io.strimzi.elasticquota.ElasticQuotaService";

    private final ScheduledExecutorService backgroundScheduler;
    private volatile GroupQuotaManager groupQuotaManager;

    /**
     * Default constructor for production use.
     * <p>
     * It provides a scheduled executor for running the recalculation on a named daemon thread.
     */
    public ElasticQuotaService() {
        this(Executors.newSingleThreadScheduledExecutor(r -> {
            final Thread thread = new Thread(r, ElasticQuotaService.class.getSimpleName() + "-recalculator");
            thread.setDaemon(true);
            return thread;
        }));
    }

    /**
     * Secondary constructor visible for testing purposes
     *
     * @param backgroundScheduler the scheduler for executing background tasks.
     */
    /*test*/ ElasticQuotaService(ScheduledExecutorService backgroundScheduler) {
        this.backgroundScheduler = backgroundScheduler;
    }

    /**
     * Creates the quota manager and schedules the periodic recalculation.
     *
     * @param configs the configuration properties
     */
    public void configure(Map<String, ?> configs) {
        ElasticQuotaConfig config = new ElasticQuotaConfig(configs, true);
        GroupQuotaManager manager = new GroupQuotaManager(config);
        groupQuotaManager = manager;
        Duration interval = config.getRecalculateInterval();
        if (!interval.isZero()) {
            backgroundScheduler.scheduleWithFixedDelay(() -> refresh(manager), 0, interval.toMillis(), TimeUnit.MILLISECONDS);
            log.info("Configured elastic quota with cluster total {}. Recalculation interval: {}", manager.getClusterTotalResource(), interval);
        } else {
            log.info("Elastic quota configured to never recalculate in the background: set {} to a positive duration to enable", ElasticQuotaConfig.RECALCULATE_INTERVAL_PROP);
        }
    }

    // an exception escaping a scheduled task would cancel every later run
    private static void refresh(GroupQuotaManager manager) {
        try {
            manager.refreshRuntime();
        } catch (Exception e) {
            log.warn("Failed to recalculate quota runtime: {}", e.getMessage(), e);
        }
    }

    /**
     * @return the quota manager
     * @throws IllegalStateException if the service has not been configured
     */
    public GroupQuotaManager getGroupQuotaManager() {
        GroupQuotaManager manager = groupQuotaManager;
        if (manager == null) {
            throw new IllegalStateException("Elastic quota service has not been configured");
        }
        return manager;
    }

    @Override
    public void close() {
        try {
            closeExecutorService();
        } finally {
            Metrics.defaultRegistry().allMetrics().keySet().stream().filter(m -> SCOPE.equals(m.getScope())).forEach(Metrics.defaultRegistry()::removeMetric);
        }
    }

    private void closeExecutorService() {
        try {
            backgroundScheduler.shutdownNow();
        } catch (Exception e) {
            log.warn("Encountered problem shutting down background executor: {}", e.getMessage(), e);
        }
    }

    static MetricName metricName(Class<?> clazz, String name, LinkedHashMap<String, String> tags) {
        String group = clazz.getPackageName();
        String type = clazz.getSimpleName();
        return metricName(name, type, group, tags);
    }

    static MetricName metricName(Class<?> clazz, String name) {
        return metricName(clazz, name, new LinkedHashMap<>());
    }

    /**
     * Generate a Yammer metric name
     *
     * @param name  the name of the Metric.
     * @param type  the type to which the Metric belongs.
     * @param group the group to which the Metric belongs type
     * @param tags  an ordered set of key value mappings
     * @return the MetricName object derived from the arguments.
     */
    public static MetricName metricName(String name, String type, String group, LinkedHashMap<String, String> tags) {
        final String tagValues = tags.entrySet().stream().map(entry -> String.format("%s=%s", sanitise(entry.getKey()), sanitise(entry.getValue()))).collect(Collectors.joining(","));
        String mBeanName;
        final String sanitisedGroup = sanitise(group);
        final String sanitisedType = sanitise(type);
        final String sanitisedName = sanitise(name);
        if (!tagValues.isBlank()) {
            mBeanName = String.format("%s:type=%s,name=%s,%s", sanitisedGroup, sanitisedType, sanitisedName, tagValues);
        } else {
            mBeanName = String.format("%s:type=%s,name=%s", sanitisedGroup, sanitisedType, sanitisedName);
        }
        return new MetricName(sanitisedGroup, sanitisedType, sanitisedName, SCOPE, mBeanName);
    }

    private static String sanitise(String name) {
        return name.replaceAll(":", "")
                .replaceAll("\\?", "")
                .replaceAll("\\*", "")
                .replaceAll("//", "")
                .replaceAll("\\$$", "");
    }
}
