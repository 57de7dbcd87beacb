package com.accountdb.bancheck.check.service;

import com.accountdb.bancheck.check.model.CheckOptions;
import com.accountdb.bancheck.check.model.EffectiveOptions;
import com.accountdb.bancheck.config.BanCheckProperties;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

class ParameterBalancerTest {
    private final ParameterBalancer balancer = new ParameterBalancer(properties(50));

    @Test
    void manualOptionsWithinRangeAreReturnedUnchanged() {
        CheckOptions options = new CheckOptions(false, List.of(), 15, 4, 2, 0.25, 1, 3.0);

        EffectiveOptions effective = balancer.balance(100, options);

        assertThat(effective).isEqualTo(new EffectiveOptions(false, 15, 4, 2, 0.25, 1, 3.0));
        assertThat(balancer.balance(100, options)).isEqualTo(effective);
    }

    @Test
    void manualOptionsOutOfRangeAreClamped() {
        CheckOptions options = new CheckOptions(false, null, 500, 0, 11, 3.0, -1, 20.0);

        EffectiveOptions effective = balancer.balance(10, options);

        assertThat(effective.logicalBatchSize()).isEqualTo(50);
        assertThat(effective.maxConcurrentBatches()).isEqualTo(1);
        assertThat(effective.maxWorkersPerBatch()).isEqualTo(10);
        assertThat(effective.interRequestSubmitDelay()).isEqualTo(1.0);
        assertThat(effective.maxRetriesPerUrl()).isZero();
        assertThat(effective.retryDelaySeconds()).isEqualTo(10.0);
    }

    @Test
    void missingFieldsTakeDefaults() {
        EffectiveOptions effective = balancer.balance(10, null);

        assertThat(effective).isEqualTo(new EffectiveOptions(false, 20, 3, 3, 0.1, 2, 5.0));
    }

    @Test
    void nonFiniteNumbersAreRejected() {
        CheckOptions nan = new CheckOptions(false, null, null, null, null, Double.NaN, null, null);
        CheckOptions infinite = new CheckOptions(true, null, null, null, null, null, null, Double.POSITIVE_INFINITY);

        assertThrows(BanCheckValidationException.class, () -> balancer.balance(10, nan));
        assertThrows(BanCheckValidationException.class, () -> balancer.balance(10, infinite));
    }

    @Test
    void autoBalancingIgnoresCallerValuesAndIsDeterministic() {
        CheckOptions options = new CheckOptions(true, List.of(), 1, 1, 1, 0.0, 0, 0.0);

        EffectiveOptions first = balancer.balance(250, options);
        EffectiveOptions second = balancer.balance(250, CheckOptions.defaults());
        EffectiveOptions again = balancer.balance(250, options);

        assertThat(first.autoBalanced()).isTrue();
        assertThat(first).isEqualTo(again);
        assertThat(first.logicalBatchSize()).isEqualTo(30);
        assertThat(second.autoBalanced()).isFalse();
    }

    @Test
    void autoBalancingScalesMonotonicallyUnderTheCeiling() {
        CheckOptions auto = new CheckOptions(true, null, null, null, null, null, null, null);
        EffectiveOptions previous = null;
        for (int n : new int[] {1, 49, 50, 199, 200, 499, 500, 100_000}) {
            EffectiveOptions current = balancer.balance(n, auto);
            assertThat(current.maxInFlightRequests()).isLessThanOrEqualTo(50);
            if (previous != null) {
                assertThat(current.logicalBatchSize()).isGreaterThanOrEqualTo(previous.logicalBatchSize());
                assertThat(current.maxInFlightRequests()).isGreaterThanOrEqualTo(previous.maxInFlightRequests());
                assertThat(current.interRequestSubmitDelay()).isGreaterThanOrEqualTo(previous.interRequestSubmitDelay());
                assertThat(current.retryDelaySeconds()).isGreaterThanOrEqualTo(previous.retryDelaySeconds());
            }
            previous = current;
        }
    }

    @Test
    void autoBalancingRespectsLowerCeiling() {
        ParameterBalancer constrained = new ParameterBalancer(properties(12));

        EffectiveOptions effective = constrained.balance(1000, new CheckOptions(true, null, null, null, null, null, null, null));

        assertThat(effective.maxInFlightRequests()).isLessThanOrEqualTo(12);
        assertThat(effective.maxConcurrentBatches()).isGreaterThanOrEqualTo(1);
    }

    private static BanCheckProperties properties(int maxTotalConcurrency) {
        BanCheckProperties properties = new BanCheckProperties();
        properties.getBalancing().setMaxTotalConcurrency(maxTotalConcurrency);
        return properties;
    }
}
