/*
 * Copyright Strimzi authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.strimzi.elasticquota;

import java.util.Objects;

import io.strimzi.elasticquota.resource.ResourceVector;

/**
 * An observed quota group definition, as delivered by whatever watches the cluster for quota changes.
 */
public class ElasticQuota {
    private final String name;
    private final String parentName;
    private final boolean isParent;
    private final boolean allowLentResource;
    private final ResourceVector max;
    private final ResourceVector min;
    private final ResourceVector sharedWeight;

    private ElasticQuota(Builder builder) {
        this.name = Objects.requireNonNull(builder.name, "name");
        this.parentName = builder.parentName == null ? "" : builder.parentName;
        this.isParent = builder.isParent;
        this.allowLentResource = builder.allowLentResource;
        this.max = builder.max;
        this.min = builder.min;
        this.sharedWeight = builder.sharedWeight;
    }

    /**
     * @param name the quota group name
     * @return a builder for a quota group definition
     */
    public static Builder builder(String name) {
        return new Builder(name);
    }

    public String getName() {
        return name;
    }

    /**
     * @return the parent group name, empty for a top level group
     */
    public String getParentName() {
        return parentName;
    }

    public boolean isParent() {
        return isParent;
    }

    public boolean isAllowLentResource() {
        return allowLentResource;
    }

    public ResourceVector getMax() {
        return max;
    }

    public ResourceVector getMin() {
        return min;
    }

    /**
     * @return the shared weight as declared, empty when not declared
     */
    public ResourceVector getSharedWeight() {
        return sharedWeight;
    }

    /**
     * @return the weight the group competes with, its Max when no weight is declared
     */
    public ResourceVector getEffectiveSharedWeight() {
        return sharedWeight.isZero() ? max : sharedWeight;
    }

    @Override
    public String toString() {
        return "ElasticQuota{" +
                "name='" + name + '\'' +
                ", parentName='" + parentName + '\'' +
                ", isParent=" + isParent +
                ", allowLentResource=" + allowLentResource +
                ", max=" + max +
                ", min=" + min +
                ", sharedWeight=" + sharedWeight +
                '}';
    }

    /**
     * Builds {@link ElasticQuota} instances, resources default to empty and lending defaults to allowed.
     */
    public static class Builder {
        private final String name;
        private String parentName = "";
        private boolean isParent;
        private boolean allowLentResource = true;
        private ResourceVector max = ResourceVector.empty();
        private ResourceVector min = ResourceVector.empty();
        private ResourceVector sharedWeight = ResourceVector.empty();

        private Builder(String name) {
            this.name = name;
        }

        public Builder withParentName(String parentName) {
            this.parentName = parentName;
            return this;
        }

        public Builder withIsParent(boolean isParent) {
            this.isParent = isParent;
            return this;
        }

        public Builder withAllowLentResource(boolean allowLentResource) {
            this.allowLentResource = allowLentResource;
            return this;
        }

        public Builder withMax(ResourceVector max) {
            this.max = Objects.requireNonNull(max, "max");
            return this;
        }

        public Builder withMin(ResourceVector min) {
            this.min = Objects.requireNonNull(min, "min");
            return this;
        }

        public Builder withSharedWeight(ResourceVector sharedWeight) {
            this.sharedWeight = Objects.requireNonNull(sharedWeight, "sharedWeight");
            return this;
        }

        public ElasticQuota build() {
            return new ElasticQuota(this);
        }
    }
}
