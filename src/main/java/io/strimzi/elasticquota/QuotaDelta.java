/*
 * Copyright Strimzi authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.strimzi.elasticquota;

import java.util.Objects;

import io.strimzi.elasticquota.resource.ResourceVector;

/**
 * A signed change to the request or usage of a quota group, produced when a workload is admitted or removed.
 */
public class QuotaDelta {

    /**
     * Which figure of the quota group the delta applies to.
     */
    public enum Kind {
        /**
         * resources demanded by pending and running workloads
         */
        REQUEST,
        /**
         * resources consumed by admitted workloads
         */
        USED
    }

    private final String quotaName;
    private final ResourceVector delta;
    private final Kind kind;

    /**
     * @param quotaName the quota group the delta belongs to
     * @param delta     positive when a workload is added, negative when removed
     * @param kind      the figure the delta applies to
     */
    public QuotaDelta(String quotaName, ResourceVector delta, Kind kind) {
        this.quotaName = Objects.requireNonNull(quotaName, "quotaName");
        this.delta = Objects.requireNonNull(delta, "delta");
        this.kind = Objects.requireNonNull(kind, "kind");
    }

    public static QuotaDelta request(String quotaName, ResourceVector delta) {
        return new QuotaDelta(quotaName, delta, Kind.REQUEST);
    }

    public static QuotaDelta used(String quotaName, ResourceVector delta) {
        return new QuotaDelta(quotaName, delta, Kind.USED);
    }

    public String getQuotaName() {
        return quotaName;
    }

    public ResourceVector getDelta() {
        return delta;
    }

    public Kind getKind() {
        return kind;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        QuotaDelta that = (QuotaDelta) o;
        return quotaName.equals(that.quotaName) && delta.equals(that.delta) && kind == that.kind;
    }

    @Override
    public int hashCode() {
        return Objects.hash(quotaName, delta, kind);
    }

    @Override
    public String toString() {
        return "QuotaDelta{" +
                "quotaName='" + quotaName + '\'' +
                ", delta=" + delta +
                ", kind=" + kind +
                '}';
    }
}
