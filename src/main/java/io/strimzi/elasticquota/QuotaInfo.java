/*
 * Copyright Strimzi authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.strimzi.elasticquota;

import io.strimzi.elasticquota.resource.ResourceVector;

/**
 * The mutable record of a single quota group.
 * <p>
 * All reads and writes of the record are serialised by the instance's own monitor. Public methods acquire it, the
 * package private {@code *NoLock} methods expect the caller to hold it already ({@code synchronized (quotaInfo)}).
 * Callers never hold the monitors of two quota groups at the same time.
 * </p>
 */
public class QuotaInfo {
    /**
     * Name of the reserved quota group for system workloads, its definition cannot be overridden remotely.
     */
    public static final String SYSTEM_QUOTA_NAME = "system-quota";
    /**
     * Name of the implicit group at the top of the quota tree, its capacity is the cluster's total resource.
     */
    public static final String ROOT_QUOTA_NAME = "root-quota";

    private final String name;
    private String parentName;
    private boolean isParent;
    private boolean allowLentResource;
    // differs from the tree's version once runtime has been recomputed
    private long runtimeVersion;
    private CalculationState calculationState = CalculationState.RESET;
    private final QuotaCalculateInfo calculateInfo;

    private QuotaInfo(String name, String parentName, boolean isParent, boolean allowLentResource, long runtimeVersion,
                      CalculationState calculationState, QuotaCalculateInfo calculateInfo) {
        this.name = name;
        this.parentName = parentName;
        this.isParent = isParent;
        this.allowLentResource = allowLentResource;
        this.runtimeVersion = runtimeVersion;
        this.calculationState = calculationState;
        this.calculateInfo = calculateInfo;
    }

    /**
     * Creates a record with empty resources.
     *
     * @param isParent          whether the group may have children
     * @param allowLentResource whether the group's unused guarantee may be borrowed by others
     * @param name              the group name
     * @param parentName        the parent group name, empty for a top level group
     * @return the new record
     */
    public static QuotaInfo newQuotaInfo(boolean isParent, boolean allowLentResource, String name, String parentName) {
        return new QuotaInfo(name, parentName == null ? "" : parentName, isParent, allowLentResource, 0L,
                CalculationState.RESET, new QuotaCalculateInfo());
    }

    /**
     * Creates the record for a newly observed quota group.
     *
     * @param quota the observed definition
     * @return the new record
     */
    public static QuotaInfo fromQuota(ElasticQuota quota) {
        QuotaInfo quotaInfo = newQuotaInfo(quota.isParent(), quota.isAllowLentResource(), quota.getName(), quota.getParentName());
        quotaInfo.setOriginalMinQuotaNoLock(quota.getMin());
        quotaInfo.setMaxQuotaNoLock(quota.getMax());
        quotaInfo.setSharedWeightNoLock(quota.getEffectiveSharedWeight());
        return quotaInfo;
    }

    /**
     * @return a consistent snapshot that shares no mutable state with this record
     */
    public synchronized QuotaInfo deepCopy() {
        return new QuotaInfo(name, parentName, isParent, allowLentResource, runtimeVersion, calculationState,
                new QuotaCalculateInfo(calculateInfo));
    }

    /**
     * Applies a changed definition (max, min, shared weight, lending, parent flag and parent name) observed remotely.
     * Request, used and runtime are left alone. Definitions of the system quota are ignored.
     *
     * @param quotaInfo the record built from the observed definition
     */
    public void updateQuotaInfoFromRemote(QuotaInfo quotaInfo) {
        if (SYSTEM_QUOTA_NAME.equals(name) || SYSTEM_QUOTA_NAME.equals(quotaInfo.getName())) {
            return;
        }
        // snapshot first, the remote's monitor must be released before this one is taken
        QuotaInfo remote = quotaInfo.deepCopy();
        synchronized (this) {
            setMaxQuotaNoLock(remote.calculateInfo.getMax());
            setOriginalMinQuotaNoLock(remote.calculateInfo.getOriginalMin());
            ResourceVector sharedWeight = remote.calculateInfo.getSharedWeight();
            if (sharedWeight.isZero()) {
                sharedWeight = remote.calculateInfo.getMax();
            }
            setSharedWeightNoLock(sharedWeight);
            allowLentResource = remote.allowLentResource;
            isParent = remote.isParent;
            parentName = remote.parentName;
        }
    }

    public String getName() {
        return name;
    }

    public synchronized String getParentName() {
        return parentName;
    }

    public synchronized boolean isParent() {
        return isParent;
    }

    public synchronized boolean isAllowLentResource() {
        return allowLentResource;
    }

    public synchronized long getRuntimeVersion() {
        return runtimeVersion;
    }

    public synchronized CalculationState getCalculationState() {
        return calculationState;
    }

    public synchronized ResourceVector getRequest() {
        return calculateInfo.getRequest();
    }

    public synchronized ResourceVector getUsed() {
        return calculateInfo.getUsed();
    }

    public synchronized ResourceVector getRuntime() {
        return calculateInfo.getRuntime();
    }

    public synchronized ResourceVector getMax() {
        return calculateInfo.getMax();
    }

    public synchronized ResourceVector getOriginalMin() {
        return calculateInfo.getOriginalMin();
    }

    public synchronized ResourceVector getAutoScaleMin() {
        return calculateInfo.getAutoScaleMin();
    }

    public synchronized ResourceVector getSharedWeight() {
        return calculateInfo.getSharedWeight();
    }

    /**
     * @return a copy of the quantitative state
     */
    public synchronized QuotaCalculateInfo getCalculateInfo() {
        return new QuotaCalculateInfo(calculateInfo);
    }

    /**
     * Adds a signed request delta, clamping any resource that would turn negative to zero.
     *
     * @param delta positive when a workload is added, negative when removed
     */
    public synchronized void addRequestNonNegative(ResourceVector delta) {
        addRequestNonNegativeNoLock(delta);
    }

    /**
     * Adds a signed used delta, clamping any resource that would turn negative to zero.
     *
     * @param delta positive when a workload is admitted, negative when removed
     */
    public synchronized void addUsedNonNegative(ResourceVector delta) {
        addUsedNonNegativeNoLock(delta);
    }

    /**
     * Discards request, used and runtime so the next pass starts a fresh aggregation.
     */
    public synchronized void clearForReset() {
        clearForResetNoLock();
    }

    QuotaCalculateInfo getCalculateInfoNoLock() {
        return new QuotaCalculateInfo(calculateInfo);
    }

    boolean isAllowLentResourceNoLock() {
        return allowLentResource;
    }

    void addRequestNonNegativeNoLock(ResourceVector delta) {
        calculateInfo.setRequest(calculateInfo.getRequest().addSaturating(delta).clampNonNegative());
    }

    void addUsedNonNegativeNoLock(ResourceVector delta) {
        calculateInfo.setUsed(calculateInfo.getUsed().addSaturating(delta).clampNonNegative());
    }

    // request capped at max: a child with max 10 and request 30 can never use more than 10 of its parent's runtime
    ResourceVector getLimitRequestNoLock() {
        return calculateInfo.getRequest().limitedBy(calculateInfo.getMax());
    }

    /**
     * What the group asks of its parent: the limited request, raised to the whole min when the group does not lend
     * its guarantee so the parent keeps that guarantee for it.
     */
    ResourceVector getDemandNoLock() {
        ResourceVector limitRequest = getLimitRequestNoLock();
        if (allowLentResource) {
            return limitRequest;
        }
        return limitRequest.atLeast(calculateInfo.getOriginalMin()).limitedBy(calculateInfo.getMax());
    }

    ResourceVector getMaskedRuntimeNoLock() {
        return calculateInfo.getRuntime().mask(calculateInfo.getMax().resourceNames());
    }

    void clearForResetNoLock() {
        calculateInfo.setRequest(ResourceVector.empty());
        calculateInfo.setUsed(ResourceVector.empty());
        calculateInfo.setRuntime(ResourceVector.empty());
        runtimeVersion = 0L;
        calculationState = CalculationState.RESET;
    }

    void setMaxQuotaNoLock(ResourceVector max) {
        calculateInfo.setMax(max.clampNonNegative());
    }

    void setOriginalMinQuotaNoLock(ResourceVector originalMin) {
        calculateInfo.setOriginalMin(originalMin.clampNonNegative());
    }

    void setAutoScaleMinQuotaNoLock(ResourceVector autoScaleMin) {
        calculateInfo.setAutoScaleMin(autoScaleMin);
        calculationState = CalculationState.MIN_SCALED;
    }

    void setSharedWeightNoLock(ResourceVector sharedWeight) {
        calculateInfo.setSharedWeight(sharedWeight.clampNonNegative());
    }

    void setAggregatedNoLock(ResourceVector request, ResourceVector used) {
        calculateInfo.setRequest(request);
        calculateInfo.setUsed(used);
        calculationState = CalculationState.AGGREGATED;
    }

    void markAggregatedNoLock() {
        calculationState = CalculationState.AGGREGATED;
    }

    void setDistributedRuntimeNoLock(ResourceVector runtime) {
        calculateInfo.setRuntime(runtime);
        calculationState = CalculationState.DISTRIBUTED;
    }

    /**
     * Masks the distributed runtime to the declared resources and publishes it under a new version.
     */
    void commitRuntimeNoLock() {
        calculateInfo.setRuntime(getMaskedRuntimeNoLock());
        runtimeVersion++;
        calculationState = CalculationState.COMMITTED;
    }

    /**
     * Publishes a runtime that is not the result of a distribution, used for the root of the tree.
     */
    void setRuntimeNoLock(ResourceVector runtime) {
        calculateInfo.setRuntime(runtime);
        runtimeVersion++;
        calculationState = CalculationState.COMMITTED;
    }

    @Override
    public synchronized String toString() {
        return "QuotaInfo{" +
                "name='" + name + '\'' +
                ", parentName='" + parentName + '\'' +
                ", isParent=" + isParent +
                ", allowLentResource=" + allowLentResource +
                ", runtimeVersion=" + runtimeVersion +
                ", calculationState=" + calculationState +
                ", calculateInfo=" + calculateInfo +
                '}';
    }
}
