/*
 * Copyright Strimzi authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.strimzi.elasticquota.resource;

import java.math.BigInteger;
import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * An immutable mapping from resource name (e.g. {@code cpu}, {@code memory}) to a quantity expressed in the
 * smallest unit of that resource.
 * <p>
 * A missing name counts as zero for arithmetic. For a Max vector a missing name means the resource is not
 * constrained.
 * </p>
 */
public final class ResourceVector {

    private static final ResourceVector EMPTY = new ResourceVector(new TreeMap<>());
    private static final Pattern QUANTITY = Pattern.compile("^(-?\\d+)(Ki|Mi|Gi|Ti|Pi|k|M|G|T|P)?$");

    private final TreeMap<String, Long> quantities;

    private ResourceVector(TreeMap<String, Long> quantities) {
        this.quantities = quantities;
    }

    /**
     * @return the vector without any resource
     */
    public static ResourceVector empty() {
        return EMPTY;
    }

    /**
     * @param quantities the quantities keyed by resource name
     * @return a vector holding a copy of the quantities
     */
    public static ResourceVector of(Map<String, Long> quantities) {
        Objects.requireNonNull(quantities, "quantities");
        return new ResourceVector(new TreeMap<>(quantities));
    }

    /**
     * @param name     resource name
     * @param quantity resource quantity
     * @return a vector with a single resource
     */
    public static ResourceVector of(String name, long quantity) {
        return empty().with(name, quantity);
    }

    /**
     * @param name1     first resource name
     * @param quantity1 first resource quantity
     * @param name2     second resource name
     * @param quantity2 second resource quantity
     * @return a vector with two resources
     */
    public static ResourceVector of(String name1, long quantity1, String name2, long quantity2) {
        return of(name1, quantity1).with(name2, quantity2);
    }

    /**
     * Parses a comma separated list of {@code name=quantity} pairs, e.g. {@code cpu=4000,memory=8Gi}.
     *
     * @param value the text to parse, blank means empty
     * @return the parsed vector
     * @throws IllegalArgumentException if the text is malformed
     */
    public static ResourceVector parse(String value) {
        if (value == null || value.isBlank()) {
            return empty();
        }
        TreeMap<String, Long> parsed = new TreeMap<>();
        for (String entry : value.split(",")) {
            String trimmed = entry.trim();
            if (trimmed.isEmpty()) {
                continue;
            }
            int separator = trimmed.indexOf('=');
            if (separator <= 0 || separator == trimmed.length() - 1) {
                throw new IllegalArgumentException("Expected name=quantity but found '" + trimmed + "'");
            }
            String name = trimmed.substring(0, separator).trim();
            if (parsed.containsKey(name)) {
                throw new IllegalArgumentException("Resource '" + name + "' declared more than once");
            }
            parsed.put(name, parseQuantity(trimmed.substring(separator + 1).trim()));
        }
        return new ResourceVector(parsed);
    }

    static long parseQuantity(String quantity) {
        Matcher matcher = QUANTITY.matcher(quantity);
        if (!matcher.matches()) {
            throw new IllegalArgumentException("Invalid quantity '" + quantity + "'");
        }
        long multiplier = multiplier(matcher.group(2));
        try {
            return Math.multiplyExact(Long.parseLong(matcher.group(1)), multiplier);
        } catch (ArithmeticException | NumberFormatException e) {
            throw new IllegalArgumentException("Quantity '" + quantity + "' is out of range", e);
        }
    }

    private static long multiplier(String suffix) {
        if (suffix == null) {
            return 1L;
        }
        switch (suffix) {
            case "Ki":
                return 1L << 10;
            case "Mi":
                return 1L << 20;
            case "Gi":
                return 1L << 30;
            case "Ti":
                return 1L << 40;
            case "Pi":
                return 1L << 50;
            case "k":
                return 1_000L;
            case "M":
                return 1_000_000L;
            case "G":
                return 1_000_000_000L;
            case "T":
                return 1_000_000_000_000L;
            case "P":
                return 1_000_000_000_000_000L;
            default:
                throw new IllegalArgumentException("Unknown quantity suffix " + suffix);
        }
    }

    /**
     * @param name resource name
     * @return the quantity of the resource, zero when absent
     */
    public long get(String name) {
        return quantities.getOrDefault(name, 0L);
    }

    /**
     * @param name resource name
     * @return whether the resource is declared in this vector
     */
    public boolean contains(String name) {
        return quantities.containsKey(name);
    }

    /**
     * @return the declared resource names in natural order
     */
    public Set<String> resourceNames() {
        return Collections.unmodifiableSet(quantities.keySet());
    }

    /**
     * @return an unmodifiable view of the quantities
     */
    public Map<String, Long> asMap() {
        return Collections.unmodifiableMap(quantities);
    }

    /**
     * @return true if there are no resources or every quantity is zero
     */
    public boolean isZero() {
        return quantities.values().stream().allMatch(q -> q == 0L);
    }

    /**
     * @param name     resource name
     * @param quantity resource quantity
     * @return a copy of this vector with the resource set to the quantity
     */
    public ResourceVector with(String name, long quantity) {
        Objects.requireNonNull(name, "name");
        TreeMap<String, Long> copy = new TreeMap<>(quantities);
        copy.put(name, quantity);
        return new ResourceVector(copy);
    }

    /**
     * @param other the vector to add
     * @return the sum over the union of both vectors' resources
     */
    public ResourceVector add(ResourceVector other) {
        TreeMap<String, Long> sum = new TreeMap<>(quantities);
        other.quantities.forEach((name, quantity) -> sum.merge(name, quantity, Math::addExact));
        return new ResourceVector(sum);
    }

    /**
     * Adds like {@link #add(ResourceVector)} but sticks at {@link Long#MAX_VALUE} or {@link Long#MIN_VALUE}
     * instead of overflowing.
     *
     * @param other the vector to add
     * @return the saturated sum over the union of both vectors' resources
     */
    public ResourceVector addSaturating(ResourceVector other) {
        TreeMap<String, Long> sum = new TreeMap<>(quantities);
        other.quantities.forEach((name, quantity) -> sum.merge(name, quantity, ResourceVector::saturatedAdd));
        return new ResourceVector(sum);
    }

    private static long saturatedAdd(long a, long b) {
        long sum = a + b;
        // overflow only when both operands share a sign the result does not have
        if (((a ^ sum) & (b ^ sum)) < 0L) {
            return a < 0L ? Long.MIN_VALUE : Long.MAX_VALUE;
        }
        return sum;
    }

    /**
     * @param floor the lower bounds
     * @return the componentwise maximum over the union of both vectors' resources
     */
    public ResourceVector atLeast(ResourceVector floor) {
        TreeMap<String, Long> raised = new TreeMap<>(quantities);
        floor.quantities.forEach((name, quantity) -> raised.merge(name, quantity, Math::max));
        return new ResourceVector(raised);
    }

    /**
     * @param other the vector to subtract
     * @return the difference over the union of both vectors' resources
     */
    public ResourceVector subtract(ResourceVector other) {
        TreeMap<String, Long> difference = new TreeMap<>(quantities);
        other.quantities.forEach((name, quantity) -> difference.merge(name, Math.negateExact(quantity), Math::addExact));
        return new ResourceVector(difference);
    }

    /**
     * @return the names of resources with a quantity below zero
     */
    public Set<String> isNegative() {
        Set<String> negative = new TreeSet<>();
        quantities.forEach((name, quantity) -> {
            if (quantity < 0L) {
                negative.add(name);
            }
        });
        return negative;
    }

    /**
     * @return a copy where every negative quantity is replaced by zero
     */
    public ResourceVector clampNonNegative() {
        Set<String> negative = isNegative();
        if (negative.isEmpty()) {
            return this;
        }
        TreeMap<String, Long> clamped = new TreeMap<>(quantities);
        negative.forEach(name -> clamped.put(name, 0L));
        return new ResourceVector(clamped);
    }

    /**
     * Compares a single resource of both vectors, a missing resource counts as zero.
     *
     * @param other the vector to compare with
     * @param name  the resource to compare
     * @return -1, 0 or 1 as this quantity is less than, equal to or greater than the other
     */
    public int cmp(ResourceVector other, String name) {
        return Long.compare(get(name), other.get(name));
    }

    /**
     * @param names the resources to keep
     * @return the vector restricted to the given resources
     */
    public ResourceVector mask(Collection<String> names) {
        Set<String> keep = names instanceof Set ? (Set<String>) names : new HashSet<>(names);
        TreeMap<String, Long> masked = new TreeMap<>();
        quantities.forEach((name, quantity) -> {
            if (keep.contains(name)) {
                masked.put(name, quantity);
            }
        });
        return new ResourceVector(masked);
    }

    /**
     * Caps every resource at the quantity declared in {@code max}. Resources {@code max} does not declare are left
     * untouched.
     *
     * @param max the upper bounds
     * @return the capped vector
     */
    public ResourceVector limitedBy(ResourceVector max) {
        TreeMap<String, Long> limited = new TreeMap<>(quantities);
        limited.replaceAll((name, quantity) -> max.contains(name) ? Math.min(quantity, max.get(name)) : quantity);
        return new ResourceVector(limited);
    }

    /**
     * Scales every quantity by {@code numerator / denominator}, rounding towards zero.
     *
     * @param numerator   ratio numerator, not negative
     * @param denominator ratio denominator, positive
     * @return the scaled vector
     */
    public ResourceVector scaleProportional(long numerator, long denominator) {
        if (numerator < 0L || denominator <= 0L) {
            throw new IllegalArgumentException("Invalid ratio " + numerator + "/" + denominator);
        }
        TreeMap<String, Long> scaled = new TreeMap<>(quantities);
        scaled.replaceAll((name, quantity) -> scale(quantity, numerator, denominator));
        return new ResourceVector(scaled);
    }

    /**
     * Computes {@code quantity * numerator / denominator} without intermediate overflow.
     *
     * @param quantity    the value to scale
     * @param numerator   ratio numerator
     * @param denominator ratio denominator, positive
     * @return the scaled value rounded towards zero
     */
    public static long scale(long quantity, long numerator, long denominator) {
        return BigInteger.valueOf(quantity)
                .multiply(BigInteger.valueOf(numerator))
                .divide(BigInteger.valueOf(denominator))
                .longValueExact();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ResourceVector that = (ResourceVector) o;
        return quantities.equals(that.quantities);
    }

    @Override
    public int hashCode() {
        return quantities.hashCode();
    }

    @Override
    public String toString() {
        return quantities.toString();
    }
}
