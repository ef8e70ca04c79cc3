/*
 * Copyright Strimzi authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.strimzi.elasticquota;

import java.util.List;
import java.util.stream.LongStream;

import io.strimzi.elasticquota.RuntimeDistributor.Claim;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.assertj.core.api.Assertions.assertThat;

class RuntimeDistributorTest {

    @Test
    void shouldShareSurplusByWeightAfterGuarantees() {
        //Given
        List<Claim> claims = List.of(
                new Claim(20, 20, 1, true),
                new Claim(0, 100, 1, true),
                new Claim(0, 100, 3, true));

        //When
        long[] runtime = RuntimeDistributor.distribute(claims, 100);

        //Then
        assertThat(runtime).containsExactly(20, 20, 60);
    }

    @Test
    void shouldRedistributeWhatCappedChildrenDoNotNeed() {
        //Given
        List<Claim> claims = List.of(
                new Claim(0, 10, 1, true),
                new Claim(0, 100, 1, true));

        //When
        long[] runtime = RuntimeDistributor.distribute(claims, 100);

        //Then
        assertThat(runtime).containsExactly(10, 90);
    }

    @Test
    void shouldCascadeRedistributionOverSeveralRounds() {
        //Given
        List<Claim> claims = List.of(
                new Claim(0, 5, 1, true),
                new Claim(0, 30, 1, true),
                new Claim(0, 1000, 1, true));

        //When
        long[] runtime = RuntimeDistributor.distribute(claims, 90);

        //Then
        assertThat(runtime).containsExactly(5, 30, 55);
    }

    @Test
    void shouldLendUnusedGuaranteeWhenAllowed() {
        //Given
        List<Claim> claims = List.of(
                new Claim(30, 0, 1, true),
                new Claim(0, 100, 1, true));

        //When
        long[] runtime = RuntimeDistributor.distribute(claims, 100);

        //Then
        assertThat(runtime).containsExactly(0, 100);
    }

    @Test
    void shouldKeepWholeGuaranteeWhenLendingRefused() {
        //Given
        List<Claim> claims = List.of(
                new Claim(30, 0, 1, false),
                new Claim(0, 100, 1, true));

        //When
        long[] runtime = RuntimeDistributor.distribute(claims, 100);

        //Then
        assertThat(runtime).containsExactly(30, 70);
    }

    @Test
    void shouldGiveZeroWeightOnlyItsGuarantee() {
        //Given
        List<Claim> claims = List.of(
                new Claim(10, 50, 0, true),
                new Claim(0, 100, 1, true));

        //When
        long[] runtime = RuntimeDistributor.distribute(claims, 100);

        //Then
        assertThat(runtime).containsExactly(10, 90);
    }

    @Test
    void shouldHandOutRoundingRemainderInClaimOrder() {
        //Given
        List<Claim> claims = List.of(
                new Claim(0, 100, 1, true),
                new Claim(0, 100, 1, true),
                new Claim(0, 100, 1, true));

        //When
        long[] runtime = RuntimeDistributor.distribute(claims, 11);

        //Then
        assertThat(runtime).containsExactly(4, 4, 3);
    }

    @Test
    void shouldHandRemainderOnlyToChildrenStillShort() {
        //Given
        List<Claim> claims = List.of(
                new Claim(0, 1, 1, true),
                new Claim(0, 100, 1, true),
                new Claim(0, 100, 1, true));

        //When
        long[] runtime = RuntimeDistributor.distribute(claims, 8);

        //Then
        assertThat(runtime).containsExactly(1, 4, 3);
    }

    @Test
    void shouldShareBetweenWeightsSummingBeyondLongRange() {
        //Given
        List<Claim> claims = List.of(
                new Claim(0, 100, Long.MAX_VALUE, true),
                new Claim(0, 100, Long.MAX_VALUE, true));

        //When
        long[] runtime = RuntimeDistributor.distribute(claims, 100);

        //Then
        assertThat(runtime).containsExactly(50, 50);
    }

    @Test
    void shouldScaleMinimumsSummingBeyondLongRange() {
        //When
        long[] scaled = RuntimeDistributor.autoScaleMin(new long[]{Long.MAX_VALUE, Long.MAX_VALUE}, 100);

        //Then
        assertThat(scaled).containsExactly(50, 50);
    }

    @Test
    void shouldNotHandOutMoreThanRequestedWhenCapacityIsAmple() {
        //Given
        List<Claim> claims = List.of(
                new Claim(5, 10, 1, true),
                new Claim(0, 20, 2, true));

        //When
        long[] runtime = RuntimeDistributor.distribute(claims, 1000);

        //Then
        assertThat(runtime).containsExactly(10, 20);
    }

    @Test
    void shouldHandleNoCapacity() {
        //Given
        List<Claim> claims = List.of(new Claim(10, 10, 1, false), new Claim(0, 10, 1, true));

        //When
        long[] runtime = RuntimeDistributor.distribute(claims, 0);

        //Then
        assertThat(runtime).containsExactly(0, 0);
    }

    @Test
    void shouldGiveMoreToHeavierWeight() {
        long light = RuntimeDistributor.distribute(List.of(new Claim(0, 100, 1, true), new Claim(0, 100, 1, true)), 60)[0];
        long heavy = RuntimeDistributor.distribute(List.of(new Claim(0, 100, 2, true), new Claim(0, 100, 1, true)), 60)[0];

        assertThat(heavy).isGreaterThan(light);
    }

    @ParameterizedTest(name = "shouldAutoScaleMin: {0} + {1} within {2}")
    @CsvSource({
        "60, 60, 100, 50, 50",
        "30, 20, 100, 30, 20",
        "30, 10, 20, 15, 5",
        "1, 2, 2, 0, 1",
        "10, 10, 0, 0, 0"
    })
    void shouldAutoScaleMin(long firstMin, long secondMin, long capacity, long expectedFirst, long expectedSecond) {
        //When
        long[] scaled = RuntimeDistributor.autoScaleMin(new long[]{firstMin, secondMin}, capacity);

        //Then
        assertThat(scaled).containsExactly(expectedFirst, expectedSecond);
        assertThat(LongStream.of(scaled).sum()).isLessThanOrEqualTo(Math.max(capacity, firstMin + secondMin));
    }

    @Test
    void shouldNeverScaleAboveOriginalMin() {
        //When
        long[] scaled = RuntimeDistributor.autoScaleMin(new long[]{7, 11, 13}, 20);

        //Then
        assertThat(scaled[0]).isLessThanOrEqualTo(7);
        assertThat(scaled[1]).isLessThanOrEqualTo(11);
        assertThat(scaled[2]).isLessThanOrEqualTo(13);
        assertThat(LongStream.of(scaled).sum()).isLessThanOrEqualTo(20);
    }
}
