/*
 * Copyright Strimzi authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.strimzi.elasticquota;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.stream.Collectors;

import com.yammer.metrics.Metrics;
import com.yammer.metrics.core.Counter;
import com.yammer.metrics.core.Gauge;
import com.yammer.metrics.core.MetricName;
import io.strimzi.elasticquota.resource.ResourceVector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static io.strimzi.elasticquota.ElasticQuotaService.metricName;

/**
 * Keeps every quota group known to the scheduler, the tree they form and the capacity of the cluster, and
 * recomputes the groups' runtime on demand.
 * <p>
 * The table of groups and the active topology are guarded by a read/write lock. Recalculation only takes the read
 * lock long enough to pick up the topology, the pass itself runs against the per-group locks. Definition changes
 * bump the topology generation, which makes a pass that is still running give up and start again.
 * </p>
 */
public class GroupQuotaManager {
    private static final Logger log = LoggerFactory.getLogger(GroupQuotaManager.class);

    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
    private final Map<String, QuotaInfo> quotaInfoMap = new HashMap<>();
    private final QuotaTreeRecalculator recalculator;
    private final int refreshMaxAttempts;
    private final Object refreshLock = new Object();
    private volatile QuotaTopology topology;
    private volatile ResourceVector clusterTotalResource;

    private final Counter runtimeRecalculations;
    private final Counter supersededRecalculations;
    private final Counter rejectedTopologies;
    private final Counter droppedDeltas;

    /**
     * @param config the configuration to take the cluster total, system quota max and retry limit from
     */
    public GroupQuotaManager(ElasticQuotaConfig config) {
        this(config.getClusterTotalResource(), config.getSystemQuotaMax(), config.getRefreshMaxAttempts(), new QuotaTreeRecalculator());
    }

    /* test */ GroupQuotaManager(ResourceVector clusterTotalResource, ResourceVector systemQuotaMax, int refreshMaxAttempts, QuotaTreeRecalculator recalculator) {
        this.clusterTotalResource = clusterTotalResource;
        this.refreshMaxAttempts = refreshMaxAttempts;
        this.recalculator = recalculator;

        QuotaInfo systemQuota = QuotaInfo.fromQuota(ElasticQuota.builder(QuotaInfo.SYSTEM_QUOTA_NAME).withMax(systemQuotaMax).build());
        quotaInfoMap.put(systemQuota.getName(), systemQuota);
        try {
            topology = QuotaTopology.build(quotaInfoMap.values(), 1L);
        } catch (QuotaTopologyException e) {
            throw new IllegalStateException("Failed to build the initial quota topology", e);
        }

        runtimeRecalculations = Metrics.newCounter(metricName(GroupQuotaManager.class, "RuntimeRecalculations"));
        supersededRecalculations = Metrics.newCounter(metricName(GroupQuotaManager.class, "SupersededRecalculations"));
        rejectedTopologies = Metrics.newCounter(metricName(GroupQuotaManager.class, "RejectedTopologies"));
        droppedDeltas = Metrics.newCounter(metricName(GroupQuotaManager.class, "DroppedDeltas"));
        MetricName quotaGroups = metricName(GroupQuotaManager.class, "QuotaGroups");
        // replaces the gauge of a previously configured manager
        Metrics.defaultRegistry().removeMetric(quotaGroups);
        Metrics.newGauge(quotaGroups, new Gauge<Integer>() {
            @Override
            public Integer value() {
                return getQuotaNames().size();
            }
        });
    }

    /**
     * Registers a new quota group or applies a changed definition to a known one. The topology is rebuilt when the
     * group is new or its position in the tree changed.
     *
     * @param quota the observed definition
     * @throws QuotaTopologyException if the change would leave the groups without a well-formed tree, in which
     *                                case it is not applied
     */
    public void updateQuota(ElasticQuota quota) throws QuotaTopologyException {
        String name = quota.getName();
        if (QuotaInfo.SYSTEM_QUOTA_NAME.equals(name)) {
            log.debug("Ignoring definition of reserved quota group {}", name);
            return;
        }
        if (QuotaInfo.ROOT_QUOTA_NAME.equals(name)) {
            throw new QuotaTopologyException(name, "name is reserved for the root of the tree");
        }

        QuotaInfo incoming = QuotaInfo.fromQuota(quota);
        lock.writeLock().lock();
        try {
            QuotaInfo existing = quotaInfoMap.get(name);
            if (existing == null) {
                quotaInfoMap.put(name, incoming);
                try {
                    rebuildTopologyLocked();
                } catch (QuotaTopologyException e) {
                    quotaInfoMap.remove(name);
                    throw e;
                }
                log.info("Added quota group {} under '{}'", name, quota.getParentName());
                return;
            }

            QuotaInfo previous = existing.deepCopy();
            existing.updateQuotaInfoFromRemote(incoming);
            boolean moved = !previous.getParentName().equals(quota.getParentName()) || previous.isParent() != quota.isParent();
            if (moved) {
                try {
                    rebuildTopologyLocked();
                } catch (QuotaTopologyException e) {
                    existing.updateQuotaInfoFromRemote(previous);
                    throw e;
                }
                log.info("Moved quota group {} from '{}' to '{}'", name, previous.getParentName(), quota.getParentName());
            } else if (log.isDebugEnabled()) {
                log.debug("Updated definition of quota group {}: {}", name, quota);
            }
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Removes a quota group.
     *
     * @param name the group to remove
     * @return false if the group is not known
     * @throws QuotaTopologyException if other groups still name this group as their parent
     */
    public boolean deleteQuota(String name) throws QuotaTopologyException {
        if (QuotaInfo.SYSTEM_QUOTA_NAME.equals(name)) {
            throw new IllegalArgumentException("The system quota group cannot be deleted");
        }
        lock.writeLock().lock();
        try {
            QuotaInfo removed = quotaInfoMap.get(name);
            if (removed == null) {
                return false;
            }
            List<String> children = quotaInfoMap.values().stream()
                    .filter(quotaInfo -> name.equals(quotaInfo.getParentName()))
                    .map(QuotaInfo::getName)
                    .sorted()
                    .collect(Collectors.toList());
            if (!children.isEmpty()) {
                rejectedTopologies.inc();
                throw new QuotaTopologyException(name, "still has child groups " + children);
            }
            quotaInfoMap.remove(name);
            try {
                rebuildTopologyLocked();
            } catch (QuotaTopologyException e) {
                quotaInfoMap.put(name, removed);
                throw e;
            }
            log.info("Deleted quota group {}", name);
            return true;
        } finally {
            lock.writeLock().unlock();
        }
    }

    private void rebuildTopologyLocked() throws QuotaTopologyException {
        QuotaTopology rebuilt;
        try {
            rebuilt = QuotaTopology.build(quotaInfoMap.values(), topology.getGeneration() + 1);
        } catch (QuotaTopologyException e) {
            rejectedTopologies.inc();
            log.warn("Rejected quota topology: {}", e.getMessage());
            throw e;
        }
        // aggregates of parents are stale once the tree changed
        for (QuotaTopoNode node : rebuilt.topDown()) {
            QuotaInfo quotaInfo = node.getQuotaInfo();
            if (node.getParent() != null && (node.hasChildren() || quotaInfo.isParent())) {
                quotaInfo.clearForReset();
            }
        }
        topology = rebuilt;
        log.debug("Activated quota topology generation {}", rebuilt.getGeneration());
    }

    /**
     * Applies a workload admission or removal.
     *
     * @param delta the change
     */
    public void applyDelta(QuotaDelta delta) {
        switch (delta.getKind()) {
            case REQUEST:
                updateRequest(delta.getQuotaName(), delta.getDelta());
                break;
            case USED:
                updateUsed(delta.getQuotaName(), delta.getDelta());
                break;
            default:
                throw new IllegalArgumentException("Unknown delta kind " + delta.getKind());
        }
    }

    /**
     * @param name  the quota group
     * @param delta signed request change, the request never drops below zero
     */
    public void updateRequest(String name, ResourceVector delta) {
        findQuotaInfo(name, delta).ifPresent(quotaInfo -> quotaInfo.addRequestNonNegative(delta));
    }

    /**
     * @param name  the quota group
     * @param delta signed used change, the used figure never drops below zero
     */
    public void updateUsed(String name, ResourceVector delta) {
        findQuotaInfo(name, delta).ifPresent(quotaInfo -> quotaInfo.addUsedNonNegative(delta));
    }

    private Optional<QuotaInfo> findQuotaInfo(String name, ResourceVector delta) {
        QuotaInfo quotaInfo;
        lock.readLock().lock();
        try {
            quotaInfo = quotaInfoMap.get(name);
        } finally {
            lock.readLock().unlock();
        }
        if (quotaInfo == null) {
            droppedDeltas.inc();
            log.warn("Dropping delta {} for unknown quota group {}", delta, name);
        }
        return Optional.ofNullable(quotaInfo);
    }

    /**
     * Recomputes the runtime of every quota group. A pass superseded by a topology change is restarted, at most as
     * often as configured.
     *
     * @return true if a pass completed
     */
    public boolean refreshRuntime() {
        synchronized (refreshLock) {
            for (int attempt = 1; attempt <= refreshMaxAttempts; attempt++) {
                QuotaTopology current = topology;
                ResourceVector total = clusterTotalResource;
                long generation = current.getGeneration();
                if (recalculator.recalculate(current, total, () -> topology.getGeneration() != generation)) {
                    runtimeRecalculations.inc();
                    return true;
                }
                supersededRecalculations.inc();
                log.info("Runtime recalculation of topology generation {} superseded (attempt {} of {})", generation, attempt, refreshMaxAttempts);
            }
            log.warn("Runtime recalculation superseded {} times in a row, giving up until the next refresh", refreshMaxAttempts);
            return false;
        }
    }

    /**
     * @param clusterTotalResource the capacity shared by the top level groups from the next recalculation on
     */
    public void setClusterTotalResource(ResourceVector clusterTotalResource) {
        log.info("Cluster total resource changed from {} to {}", this.clusterTotalResource, clusterTotalResource);
        this.clusterTotalResource = clusterTotalResource;
    }

    public ResourceVector getClusterTotalResource() {
        return clusterTotalResource;
    }

    /**
     * @param name the quota group
     * @return the group's runtime, empty for an unknown group
     */
    public ResourceVector getRuntime(String name) {
        return lookup(name).map(QuotaInfo::getRuntime).orElse(ResourceVector.empty());
    }

    /**
     * @param name the quota group
     * @return the version of the group's runtime, zero for an unknown group or one never recalculated
     */
    public long getRuntimeVersion(String name) {
        return lookup(name).map(QuotaInfo::getRuntimeVersion).orElse(0L);
    }

    /**
     * @param name the quota group
     * @return a snapshot of the group
     */
    public Optional<QuotaInfo> getQuotaInfo(String name) {
        return lookup(name).map(QuotaInfo::deepCopy);
    }

    /**
     * @return the names of all registered quota groups
     */
    public Set<String> getQuotaNames() {
        lock.readLock().lock();
        try {
            return new TreeSet<>(quotaInfoMap.keySet());
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * @return the generation of the active topology
     */
    public long getTopologyGeneration() {
        return topology.getGeneration();
    }

    private Optional<QuotaInfo> lookup(String name) {
        lock.readLock().lock();
        try {
            return Optional.ofNullable(quotaInfoMap.get(name));
        } finally {
            lock.readLock().unlock();
        }
    }
}
