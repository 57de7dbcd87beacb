package com.accountdb.bancheck.check.service;

import com.accountdb.bancheck.check.http.ProfileFetcher;
import com.accountdb.bancheck.check.model.EffectiveOptions;
import com.accountdb.bancheck.check.model.TaskStatus;
import com.accountdb.bancheck.check.persistence.BanCheckTaskRepository;
import com.accountdb.bancheck.check.proxy.ProxyEndpoint;
import com.accountdb.bancheck.check.proxy.ProxyListParser;
import com.accountdb.bancheck.check.proxy.ProxyPool;
import com.accountdb.bancheck.config.BanCheckProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;

@Service
public class BanCheckOrchestratorService {
    private static final Logger log = LoggerFactory.getLogger(BanCheckOrchestratorService.class);

    private final BanCheckTaskRepository repository;
    private final ProfileFetcher profileFetcher;
    private final BanCheckProperties properties;
    private final ExecutorService taskRunExecutor;
    private final Clock clock;

    public BanCheckOrchestratorService(
        BanCheckTaskRepository repository,
        ProfileFetcher profileFetcher,
        BanCheckProperties properties,
        @Qualifier("taskRunExecutor") ExecutorService taskRunExecutor,
        Clock clock
    ) {
        this.repository = repository;
        this.profileFetcher = profileFetcher;
        this.properties = properties;
        this.taskRunExecutor = taskRunExecutor;
        this.clock = clock;
    }

    public void startAsync(
        String taskId,
        List<String> identifiers,
        EffectiveOptions options,
        ProxyListParser.ParsedProxyList proxies
    ) {
        try {
            taskRunExecutor.submit(() -> run(taskId, identifiers, options, proxies));
        } catch (RejectedExecutionException e) {
            log.warn("Task {} rejected by the task executor", taskId, e);
            markFailed(taskId, "Task could not be scheduled");
        }
    }

    void run(String taskId, List<String> identifiers, EffectiveOptions options, ProxyListParser.ParsedProxyList proxies) {
        List<ProxyEndpoint> endpoints = proxies == null ? List.of() : proxies.proxies();
        ProxyPool proxyPool = new ProxyPool(
            endpoints,
            proxies == null ? 0 : proxies.rejected(),
            properties.getProxy().getFailureThreshold(),
            Duration.ofSeconds(properties.getProxy().getCooldownSeconds()),
            properties.getProxy().isAllowDirectFallback(),
            clock
        );
        TaskResultAggregator aggregator = new TaskResultAggregator(
            taskId,
            identifiers,
            repository,
            proxyPool::stats,
            clock,
            properties.getPersistence().getMaxAttempts(),
            properties.getPersistence().getRetryBaseDelayMs()
        );
        profileFetcher.retainProxies(endpoints);
        try {
            boolean started = repository.updateTask(
                taskId,
                TaskStatus.PROCESSING,
                "Checking " + aggregator.totalCount() + " identifiers",
                0.0,
                List.of(),
                proxyPool.stats(),
                clock.instant()
            );
            if (!started) {
                log.warn("Task {} is no longer pending; skipping run", taskId);
                return;
            }
            log.info(
                "Task {} started: {} identifiers, {} proxies, auto balancing {}",
                taskId,
                aggregator.totalCount(),
                proxyPool.size(),
                options.autoBalanced()
            );
            CheckWorker worker = new CheckWorker(
                profileFetcher,
                proxyPool,
                options,
                Duration.ofMillis(properties.getRateLimitPauseMs()),
                properties.getIdentifiers().isRequireSteamId64()
            );
            BatchScheduler scheduler = new BatchScheduler(
                taskId,
                worker,
                aggregator,
                options,
                new SubmitThrottle(options.submitDelay())
            );
            BatchScheduler.Outcome outcome = scheduler.run(
                identifiers,
                Duration.ofSeconds(properties.getTaskTimeoutSeconds())
            );
            if (outcome == BatchScheduler.Outcome.INTERRUPTED) {
                markFailed(taskId, "Task interrupted before completion");
            }
        } catch (TaskPersistenceException e) {
            log.warn("Task {} failed while storing results", taskId, e);
            markFailed(taskId, "Task failed: results could not be stored");
        } catch (Exception e) {
            log.warn("Task {} failed", taskId, e);
            markFailed(taskId, "Task failed: " + e.getClass().getSimpleName());
        } finally {
            profileFetcher.releaseProxies(endpoints);
        }
    }

    private void markFailed(String taskId, String message) {
        try {
            repository.updateStatus(taskId, TaskStatus.FAILED, message, 100.0, clock.instant());
        } catch (DataAccessException e) {
            log.error("Unable to mark task {} as failed", taskId, e);
        }
    }
}
