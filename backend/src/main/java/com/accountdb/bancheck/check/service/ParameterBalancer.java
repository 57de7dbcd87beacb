package com.accountdb.bancheck.check.service;

import com.accountdb.bancheck.check.model.CheckOptions;
import com.accountdb.bancheck.check.model.EffectiveOptions;
import com.accountdb.bancheck.config.BanCheckProperties;
import org.springframework.stereotype.Component;

import java.util.List;

import static com.accountdb.bancheck.check.model.EffectiveOptions.MAX_BATCH_SIZE;
import static com.accountdb.bancheck.check.model.EffectiveOptions.MAX_CONCURRENT_BATCHES;
import static com.accountdb.bancheck.check.model.EffectiveOptions.MAX_RETRIES_PER_URL;
import static com.accountdb.bancheck.check.model.EffectiveOptions.MAX_RETRY_DELAY_SECONDS;
import static com.accountdb.bancheck.check.model.EffectiveOptions.MAX_SUBMIT_DELAY_SECONDS;
import static com.accountdb.bancheck.check.model.EffectiveOptions.MAX_WORKERS_PER_BATCH;
import static com.accountdb.bancheck.check.model.EffectiveOptions.MIN_BATCH_SIZE;
import static com.accountdb.bancheck.check.model.EffectiveOptions.MIN_CONCURRENT_BATCHES;
import static com.accountdb.bancheck.check.model.EffectiveOptions.MIN_WORKERS_PER_BATCH;

@Component
public class ParameterBalancer {
    static final int DEFAULT_BATCH_SIZE = 20;
    static final int DEFAULT_CONCURRENT_BATCHES = 3;
    static final int DEFAULT_WORKERS_PER_BATCH = 3;
    static final double DEFAULT_SUBMIT_DELAY_SECONDS = 0.1;
    static final int DEFAULT_RETRIES_PER_URL = 2;
    static final double DEFAULT_RETRY_DELAY_SECONDS = 5.0;

    // Ordered by ascending lower bound; every column is non-decreasing.
    private static final List<Tier> TIERS = List.of(
        new Tier(0, 10, 6, 3, 0.2, 3, 5.0),
        new Tier(50, 20, 6, 3, 0.2, 3, 5.0),
        new Tier(200, 30, 8, 4, 0.3, 3, 6.0),
        new Tier(500, 50, 10, 5, 0.5, 3, 8.0)
    );

    private final int maxTotalConcurrency;

    public ParameterBalancer(BanCheckProperties properties) {
        this.maxTotalConcurrency = properties.getBalancing().getMaxTotalConcurrency();
    }

    public EffectiveOptions balance(int identifierCount, CheckOptions options) {
        CheckOptions requested = options == null ? CheckOptions.defaults() : options;
        validate(requested);
        if (requested.autoBalancing()) {
            return autoBalance(Math.max(0, identifierCount));
        }
        return clamp(requested);
    }

    /**
     * @throws BanCheckValidationException when a numeric option is NaN or infinite
     */
    public void validate(CheckOptions options) {
        if (options == null) {
            return;
        }
        rejectNonFinite("interRequestSubmitDelay", options.interRequestSubmitDelay());
        rejectNonFinite("retryDelaySeconds", options.retryDelaySeconds());
    }

    public EffectiveOptions clamp(CheckOptions options) {
        return new EffectiveOptions(
            false,
            clampInt(options.logicalBatchSize(), DEFAULT_BATCH_SIZE, MIN_BATCH_SIZE, MAX_BATCH_SIZE),
            clampInt(options.maxConcurrentBatches(), DEFAULT_CONCURRENT_BATCHES, MIN_CONCURRENT_BATCHES, MAX_CONCURRENT_BATCHES),
            clampInt(options.maxWorkersPerBatch(), DEFAULT_WORKERS_PER_BATCH, MIN_WORKERS_PER_BATCH, MAX_WORKERS_PER_BATCH),
            clampDouble(options.interRequestSubmitDelay(), DEFAULT_SUBMIT_DELAY_SECONDS, MAX_SUBMIT_DELAY_SECONDS),
            clampInt(options.maxRetriesPerUrl(), DEFAULT_RETRIES_PER_URL, 0, MAX_RETRIES_PER_URL),
            clampDouble(options.retryDelaySeconds(), DEFAULT_RETRY_DELAY_SECONDS, MAX_RETRY_DELAY_SECONDS)
        );
    }

    EffectiveOptions autoBalance(int identifierCount) {
        Tier tier = TIERS.get(0);
        for (Tier candidate : TIERS) {
            if (identifierCount >= candidate.minIdentifiers()) {
                tier = candidate;
            }
        }
        int batches = tier.concurrentBatches();
        int workers = Math.min(tier.workersPerBatch(), maxTotalConcurrency);
        while (batches > MIN_CONCURRENT_BATCHES && batches * workers > maxTotalConcurrency) {
            batches--;
        }
        return new EffectiveOptions(
            true,
            tier.batchSize(),
            batches,
            workers,
            tier.submitDelaySeconds(),
            tier.retriesPerUrl(),
            tier.retryDelaySeconds()
        );
    }

    private static void rejectNonFinite(String field, Double value) {
        if (value != null && !Double.isFinite(value)) {
            throw new BanCheckValidationException(field + " must be a finite number");
        }
    }

    private static int clampInt(Integer value, int fallback, int min, int max) {
        int resolved = value == null ? fallback : value;
        return Math.max(min, Math.min(max, resolved));
    }

    private static double clampDouble(Double value, double fallback, double max) {
        double resolved = value == null ? fallback : value;
        return Math.max(0.0, Math.min(max, resolved));
    }

    private record Tier(
        int minIdentifiers,
        int batchSize,
        int concurrentBatches,
        int workersPerBatch,
        double submitDelaySeconds,
        int retriesPerUrl,
        double retryDelaySeconds
    ) {
    }
}
