package com.accountdb.bancheck.check.service;

import com.accountdb.bancheck.check.model.CheckResult;
import com.accountdb.bancheck.check.model.ProxyPoolStats;
import com.accountdb.bancheck.check.model.StatusSummary;
import com.accountdb.bancheck.check.model.TaskStatus;
import com.accountdb.bancheck.check.persistence.BanCheckTaskRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Supplier;

/**
 * Single writer for one running task. Every mutation goes through this monitor and is persisted as one
 * row update, so readers never see results and progress disagree.
 */
public class TaskResultAggregator {
    private static final Logger log = LoggerFactory.getLogger(TaskResultAggregator.class);

    private final String taskId;
    private final List<String> identifiers;
    private final Set<String> known;
    private final Map<String, CheckResult> results = new HashMap<>();
    private final BanCheckTaskRepository repository;
    private final Supplier<ProxyPoolStats> proxyStats;
    private final Clock clock;
    private final int maxWriteAttempts;
    private final long retryBaseDelayMs;
    private boolean sealed;
    private boolean completed;

    public TaskResultAggregator(
        String taskId,
        List<String> identifiers,
        BanCheckTaskRepository repository,
        Supplier<ProxyPoolStats> proxyStats,
        Clock clock,
        int maxWriteAttempts,
        long retryBaseDelayMs
    ) {
        this.taskId = taskId;
        this.known = new LinkedHashSet<>(identifiers);
        this.identifiers = List.copyOf(known);
        this.repository = repository;
        this.proxyStats = proxyStats == null ? ProxyPoolStats::empty : proxyStats;
        this.clock = clock == null ? Clock.systemUTC() : clock;
        this.maxWriteAttempts = Math.max(1, maxWriteAttempts);
        this.retryBaseDelayMs = Math.max(0, retryBaseDelayMs);
        this.completed = this.identifiers.isEmpty();
    }

    /**
     * Stores the terminal result of one identifier. The first result for an identifier wins.
     *
     * @return {@code true} when the result was accepted and persisted
     * @throws TaskPersistenceException when the write keeps failing
     */
    public synchronized boolean record(CheckResult result) {
        if (sealed || completed || !accept(result)) {
            return false;
        }
        persist(null);
        return true;
    }

    /**
     * Marks every listed identifier that has no result yet as ERROR, in one write.
     */
    public synchronized int resolveAll(Collection<String> steamIds, String reason, int batchId) {
        if (sealed || completed || steamIds == null) {
            return 0;
        }
        int resolved = 0;
        for (String steamId : steamIds) {
            if (accept(CheckResult.error(steamId, reason, null, batchId, 0))) {
                resolved++;
            }
        }
        if (resolved > 0) {
            persist(null);
        }
        return resolved;
    }

    /**
     * Stops accepting worker results. Used when the task deadline passes.
     */
    public synchronized void seal() {
        sealed = true;
    }

    /**
     * Resolves whatever is still outstanding as ERROR and completes the task, even when sealed.
     */
    public synchronized int forceComplete(String reason) {
        if (completed) {
            return 0;
        }
        int resolved = 0;
        for (String steamId : identifiers) {
            if (!results.containsKey(steamId)) {
                results.put(steamId, CheckResult.error(steamId, reason, null, 0, 0));
                resolved++;
            }
        }
        persist(reason);
        return resolved;
    }

    public synchronized boolean isComplete() {
        return completed;
    }

    public synchronized int resolvedCount() {
        return results.size();
    }

    public int totalCount() {
        return identifiers.size();
    }

    public synchronized List<CheckResult> orderedResults() {
        List<CheckResult> ordered = new ArrayList<>(results.size());
        for (String steamId : identifiers) {
            CheckResult result = results.get(steamId);
            if (result != null) {
                ordered.add(result);
            }
        }
        return ordered;
    }

    private boolean accept(CheckResult result) {
        if (result == null || result.steamId() == null) {
            return false;
        }
        if (results.containsKey(result.steamId()) || !known.contains(result.steamId())) {
            return false;
        }
        results.put(result.steamId(), result);
        return true;
    }

    private void persist(String completionNote) {
        int resolved = results.size();
        int total = identifiers.size();
        boolean done = resolved >= total;
        TaskStatus status = done ? TaskStatus.COMPLETED : TaskStatus.PROCESSING;
        double progress = done ? 100.0 : (resolved * 100.0) / total;
        String message = done ? summaryMessage(completionNote) : "Checked " + resolved + " of " + total + " identifiers";
        List<CheckResult> snapshot = orderedResults();

        DataAccessException lastError = null;
        for (int attempt = 1; attempt <= maxWriteAttempts; attempt++) {
            try {
                boolean updated = repository.updateTask(
                    taskId,
                    status,
                    message,
                    progress,
                    snapshot,
                    proxyStats.get(),
                    clock.instant()
                );
                if (!updated) {
                    log.warn("Task {} is already terminal; ignoring further results", taskId);
                    completed = true;
                    return;
                }
                if (done) {
                    completed = true;
                    log.info("Task {} completed: {}", taskId, message);
                }
                return;
            } catch (DataAccessException e) {
                lastError = e;
                log.warn("Task {} write attempt {}/{} failed: {}", taskId, attempt, maxWriteAttempts, e.getMessage());
                if (attempt < maxWriteAttempts && !backoff(attempt)) {
                    break;
                }
            }
        }
        throw new TaskPersistenceException("Unable to persist progress of task " + taskId, lastError);
    }

    private boolean backoff(int attempt) {
        long delayMs = retryBaseDelayMs * (1L << Math.min(attempt - 1, 10));
        if (delayMs <= 0) {
            return true;
        }
        try {
            Thread.sleep(delayMs);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private String summaryMessage(String completionNote) {
        Map<StatusSummary, Integer> counts = new EnumMap<>(StatusSummary.class);
        for (StatusSummary summary : StatusSummary.values()) {
            counts.put(summary, 0);
        }
        for (CheckResult result : results.values()) {
            counts.merge(result.statusSummary(), 1, Integer::sum);
        }
        String summary = "Checked " + identifiers.size() + " identifiers: "
            + counts.get(StatusSummary.BANNED) + " banned, "
            + counts.get(StatusSummary.CLEAN) + " clean, "
            + counts.get(StatusSummary.PRIVATE) + " private, "
            + counts.get(StatusSummary.ERROR) + " errors";
        return completionNote == null ? summary : summary + " (" + completionNote + ")";
    }
}
