/*
 * Copyright Strimzi authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.strimzi.elasticquota;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;

/**
 * Splits one resource of a parent's capacity between its children. Every quantity is for a single resource name,
 * different resources never influence each other.
 */
final class RuntimeDistributor {

    /**
     * Static utilities DO NOT instantiate.
     */
    private RuntimeDistributor() {
    }

    /**
     * What a child asks of a single resource.
     */
    static final class Claim {
        private final long min;
        private final long limitRequest;
        private final long sharedWeight;
        private final boolean allowLentResource;

        /**
         * @param min               the auto-scaled guarantee
         * @param limitRequest      the request capped at max
         * @param sharedWeight      weight for competing over what is left after guarantees
         * @param allowLentResource false to keep the whole guarantee even when requesting less
         */
        Claim(long min, long limitRequest, long sharedWeight, boolean allowLentResource) {
            this.min = Math.max(min, 0L);
            this.limitRequest = Math.max(limitRequest, 0L);
            this.sharedWeight = Math.max(sharedWeight, 0L);
            this.allowLentResource = allowLentResource;
        }
    }

    /**
     * Scales the minimums down in equal proportion when their sum exceeds the capacity, rounding down so the scaled
     * sum never exceeds it.
     *
     * @param originalMins the declared minimums, index aligned with the children
     * @param capacity     what the parent can hand out
     * @return the minimums to honour
     */
    static long[] autoScaleMin(long[] originalMins, long capacity) {
        long[] scaled = new long[originalMins.length];
        long available = Math.max(capacity, 0L);
        BigInteger sumMin = BigInteger.ZERO;
        for (long min : originalMins) {
            sumMin = sumMin.add(BigInteger.valueOf(Math.max(min, 0L)));
        }
        boolean oversubscribed = sumMin.compareTo(BigInteger.valueOf(available)) > 0;
        for (int i = 0; i < originalMins.length; i++) {
            long min = Math.max(originalMins[i], 0L);
            scaled[i] = oversubscribed ? proportion(min, available, sumMin) : min;
        }
        return scaled;
    }

    /**
     * Water-fills the capacity. Each child first gets its guarantee, limited by its request unless it refuses to lend.
     * The rest is shared in proportion to the weights among the children still asking for more; a child whose share
     * would overshoot its request is capped there and the surplus goes round again to the others. Each round either
     * caps a child or exhausts the pool, so there are at most as many rounds as children. What rounding down leaves
     * over goes one unit at a time to the children still short of their request, in claim order.
     *
     * @param claims   the children's claims
     * @param capacity what the parent can hand out, at least the sum of the guarantees
     * @return the runtime per child, index aligned with the claims
     */
    static long[] distribute(List<Claim> claims, long capacity) {
        int size = claims.size();
        long[] runtime = new long[size];
        long pool = Math.max(capacity, 0L);
        List<Integer> eligible = new ArrayList<>();
        for (int i = 0; i < size; i++) {
            Claim claim = claims.get(i);
            long guarantee = claim.allowLentResource ? Math.min(claim.min, claim.limitRequest) : claim.min;
            guarantee = Math.min(guarantee, pool);
            runtime[i] = guarantee;
            pool -= guarantee;
            if (claim.limitRequest > guarantee && claim.sharedWeight > 0L) {
                eligible.add(i);
            }
        }

        for (int round = 0; round < size && pool > 0L && !eligible.isEmpty(); round++) {
            BigInteger totalWeight = BigInteger.ZERO;
            for (int i : eligible) {
                totalWeight = totalWeight.add(BigInteger.valueOf(claims.get(i).sharedWeight));
            }
            List<Integer> uncapped = new ArrayList<>();
            long granted = 0L;
            for (int i : eligible) {
                Claim claim = claims.get(i);
                long share = proportion(pool, claim.sharedWeight, totalWeight);
                long wanted = claim.limitRequest - runtime[i];
                if (share >= wanted) {
                    runtime[i] = claim.limitRequest;
                    granted += wanted;
                } else {
                    runtime[i] += share;
                    granted += share;
                    uncapped.add(i);
                }
            }
            pool -= granted;
            boolean capped = uncapped.size() < eligible.size();
            eligible = uncapped;
            if (!capped) {
                // nobody was capped so the pool is spread, anything left is rounding
                break;
            }
        }

        // fewer units than children are left here, each short child can take one
        for (int i : eligible) {
            if (pool == 0L) {
                break;
            }
            if (runtime[i] < claims.get(i).limitRequest) {
                runtime[i]++;
                pool--;
            }
        }
        return runtime;
    }

    // quantity * numerator / denominator, the result never exceeds quantity as numerator <= denominator
    private static long proportion(long quantity, long numerator, BigInteger denominator) {
        return BigInteger.valueOf(quantity)
                .multiply(BigInteger.valueOf(numerator))
                .divide(denominator)
                .longValueExact();
    }
}
