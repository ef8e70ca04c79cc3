/*
 * Copyright Strimzi authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.strimzi.elasticquota;

import io.strimzi.elasticquota.resource.ResourceVector;

/**
 * The quantitative state of a single quota group. Instances are owned by a {@link QuotaInfo} and only mutated while
 * holding its lock.
 */
public class QuotaCalculateInfo {
    // the quota group's upper limit of resources
    private ResourceVector max = ResourceVector.empty();
    // guaranteed resources as declared
    private ResourceVector originalMin = ResourceVector.empty();
    // originalMin scaled in equal proportion with the siblings when their sum exceeds the parent's capacity
    private ResourceVector autoScaleMin = ResourceVector.empty();
    private ResourceVector used = ResourceVector.empty();
    private ResourceVector request = ResourceVector.empty();
    // ability to compete for resources beyond the guarantees
    private ResourceVector sharedWeight = ResourceVector.empty();
    // what the quota group may currently consume
    private ResourceVector runtime = ResourceVector.empty();

    QuotaCalculateInfo() {
    }

    QuotaCalculateInfo(QuotaCalculateInfo other) {
        this.max = other.max;
        this.originalMin = other.originalMin;
        this.autoScaleMin = other.autoScaleMin;
        this.used = other.used;
        this.request = other.request;
        this.sharedWeight = other.sharedWeight;
        this.runtime = other.runtime;
    }

    public ResourceVector getMax() {
        return max;
    }

    void setMax(ResourceVector max) {
        this.max = max;
    }

    public ResourceVector getOriginalMin() {
        return originalMin;
    }

    void setOriginalMin(ResourceVector originalMin) {
        this.originalMin = originalMin;
    }

    public ResourceVector getAutoScaleMin() {
        return autoScaleMin;
    }

    void setAutoScaleMin(ResourceVector autoScaleMin) {
        this.autoScaleMin = autoScaleMin;
    }

    public ResourceVector getUsed() {
        return used;
    }

    void setUsed(ResourceVector used) {
        this.used = used;
    }

    public ResourceVector getRequest() {
        return request;
    }

    void setRequest(ResourceVector request) {
        this.request = request;
    }

    public ResourceVector getSharedWeight() {
        return sharedWeight;
    }

    void setSharedWeight(ResourceVector sharedWeight) {
        this.sharedWeight = sharedWeight;
    }

    public ResourceVector getRuntime() {
        return runtime;
    }

    void setRuntime(ResourceVector runtime) {
        this.runtime = runtime;
    }

    @Override
    public String toString() {
        return "QuotaCalculateInfo{" +
                "max=" + max +
                ", originalMin=" + originalMin +
                ", autoScaleMin=" + autoScaleMin +
                ", used=" + used +
                ", request=" + request +
                ", sharedWeight=" + sharedWeight +
                ", runtime=" + runtime +
                '}';
    }
}
