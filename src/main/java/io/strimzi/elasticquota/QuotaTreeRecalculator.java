/*
 * Copyright Strimzi authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.strimzi.elasticquota;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.function.BooleanSupplier;

import io.strimzi.elasticquota.resource.ResourceVector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Recomputes the runtime of every quota group of a topology.
 * <p>
 * A pass first aggregates request and used bottom-up, then walks the tree top-down: for each parent it scales the
 * children's minimums to fit the parent's capacity, water-fills the capacity between the children per resource,
 * masks each child's runtime to the resources it declares a max for and commits it. A child's committed runtime is
 * the capacity for its own children.
 * </p>
 * <p>
 * A group that does not lend its guarantee asks its parent for at least its min, so the guarantee survives every
 * level up to the root. Sums saturate at {@link Long#MAX_VALUE}.
 * </p>
 * <p>
 * Only one quota group's monitor is held at any time, figures are read from one group and written to another in
 * separate steps.
 * </p>
 */
public class QuotaTreeRecalculator {
    private static final Logger log = LoggerFactory.getLogger(QuotaTreeRecalculator.class);
    private static final Comparator<QuotaTopoNode> BY_NAME = Comparator.comparing(QuotaTopoNode::getName);

    /**
     * Runs a full pass.
     *
     * @param topology      the tree to recalculate
     * @param clusterTotal  the capacity handed to the top level groups
     * @param superseded    polled between parents, a pass stops as soon as it returns true
     * @return true if the pass completed, false if it was superseded and has to be re-run from scratch
     */
    public boolean recalculate(QuotaTopology topology, ResourceVector clusterTotal, BooleanSupplier superseded) {
        List<QuotaTopoNode> topDown = topology.topDown();
        aggregate(topDown);

        ResourceVector capacity = clusterTotal.clampNonNegative();
        QuotaInfo rootInfo = topology.getRoot().getQuotaInfo();
        synchronized (rootInfo) {
            rootInfo.setMaxQuotaNoLock(capacity);
            rootInfo.setRuntimeNoLock(capacity);
        }

        for (QuotaTopoNode parent : topDown) {
            if (superseded.getAsBoolean()) {
                log.debug("Recalculation of topology generation {} superseded at {}", topology.getGeneration(), parent.getName());
                return false;
            }
            if (parent.hasChildren()) {
                distributeToChildren(parent);
            }
        }
        log.debug("Recalculated runtime of {} quota groups for topology generation {}", topology.size(), topology.getGeneration());
        return true;
    }

    private void aggregate(List<QuotaTopoNode> topDown) {
        for (int i = topDown.size() - 1; i >= 0; i--) {
            QuotaTopoNode node = topDown.get(i);
            QuotaInfo quotaInfo = node.getQuotaInfo();
            if (!node.hasChildren()) {
                synchronized (quotaInfo) {
                    quotaInfo.markAggregatedNoLock();
                }
                continue;
            }
            ResourceVector request = ResourceVector.empty();
            ResourceVector used = ResourceVector.empty();
            for (QuotaTopoNode child : node.getChildGroupQuotaInfos().values()) {
                QuotaInfo childInfo = child.getQuotaInfo();
                synchronized (childInfo) {
                    request = request.addSaturating(childInfo.getDemandNoLock());
                    used = used.addSaturating(childInfo.getCalculateInfoNoLock().getUsed());
                }
            }
            synchronized (quotaInfo) {
                quotaInfo.setAggregatedNoLock(request, used);
            }
        }
    }

    private void distributeToChildren(QuotaTopoNode parent) {
        ResourceVector capacity = parent.getQuotaInfo().getRuntime();

        List<QuotaTopoNode> children = new ArrayList<>(parent.getChildGroupQuotaInfos().values());
        children.sort(BY_NAME);
        List<QuotaCalculateInfo> snapshots = new ArrayList<>(children.size());
        List<Boolean> allowLent = new ArrayList<>(children.size());
        for (QuotaTopoNode child : children) {
            QuotaInfo childInfo = child.getQuotaInfo();
            synchronized (childInfo) {
                QuotaCalculateInfo snapshot = childInfo.getCalculateInfoNoLock();
                snapshot.setRequest(childInfo.getLimitRequestNoLock());
                snapshots.add(snapshot);
                allowLent.add(childInfo.isAllowLentResourceNoLock());
            }
        }

        List<TreeMap<String, Long>> autoScaleMins = autoScaleMins(snapshots, capacity);
        for (int i = 0; i < children.size(); i++) {
            QuotaInfo childInfo = children.get(i).getQuotaInfo();
            ResourceVector autoScaleMin = ResourceVector.of(autoScaleMins.get(i));
            synchronized (childInfo) {
                childInfo.setAutoScaleMinQuotaNoLock(autoScaleMin);
            }
        }

        List<TreeMap<String, Long>> runtimes = new ArrayList<>(children.size());
        children.forEach(child -> runtimes.add(new TreeMap<>()));
        for (String resourceName : capacity.resourceNames()) {
            List<RuntimeDistributor.Claim> claims = new ArrayList<>(children.size());
            for (int i = 0; i < children.size(); i++) {
                QuotaCalculateInfo snapshot = snapshots.get(i);
                claims.add(new RuntimeDistributor.Claim(
                        autoScaleMins.get(i).getOrDefault(resourceName, 0L),
                        snapshot.getRequest().get(resourceName),
                        snapshot.getSharedWeight().get(resourceName),
                        allowLent.get(i)));
            }
            long[] distributed = RuntimeDistributor.distribute(claims, capacity.get(resourceName));
            for (int i = 0; i < children.size(); i++) {
                runtimes.get(i).put(resourceName, distributed[i]);
            }
        }

        for (int i = 0; i < children.size(); i++) {
            QuotaInfo childInfo = children.get(i).getQuotaInfo();
            ResourceVector runtime = ResourceVector.of(runtimes.get(i)).limitedBy(snapshots.get(i).getMax());
            synchronized (childInfo) {
                childInfo.setDistributedRuntimeNoLock(runtime);
            }
        }
        for (QuotaTopoNode child : children) {
            QuotaInfo childInfo = child.getQuotaInfo();
            synchronized (childInfo) {
                childInfo.commitRuntimeNoLock();
            }
            if (log.isDebugEnabled()) {
                log.debug("Quota group {} under {}: runtime {} (version {})", child.getName(), parent.getName(),
                        childInfo.getRuntime(), childInfo.getRuntimeVersion());
            }
        }
    }

    private static List<TreeMap<String, Long>> autoScaleMins(List<QuotaCalculateInfo> snapshots, ResourceVector capacity) {
        Set<String> resourceNames = new TreeSet<>();
        snapshots.forEach(snapshot -> resourceNames.addAll(snapshot.getOriginalMin().resourceNames()));

        List<TreeMap<String, Long>> scaled = new ArrayList<>(snapshots.size());
        snapshots.forEach(snapshot -> scaled.add(new TreeMap<>()));
        for (String resourceName : resourceNames) {
            long[] originalMins = new long[snapshots.size()];
            for (int i = 0; i < snapshots.size(); i++) {
                originalMins[i] = snapshots.get(i).getOriginalMin().get(resourceName);
            }
            long[] autoScaled = RuntimeDistributor.autoScaleMin(originalMins, capacity.get(resourceName));
            for (int i = 0; i < snapshots.size(); i++) {
                if (snapshots.get(i).getOriginalMin().contains(resourceName)) {
                    scaled.get(i).put(resourceName, autoScaled[i]);
                }
            }
        }
        return scaled;
    }
}
