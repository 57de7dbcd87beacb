package com.accountdb.bancheck.check.service;

import com.accountdb.bancheck.check.model.BanCheckTask;
import com.accountdb.bancheck.check.model.CallerContext;
import com.accountdb.bancheck.check.model.CheckOptions;
import com.accountdb.bancheck.check.model.EffectiveOptions;
import com.accountdb.bancheck.check.model.ProxyPoolStats;
import com.accountdb.bancheck.check.model.TaskListResponse;
import com.accountdb.bancheck.check.model.TaskStatus;
import com.accountdb.bancheck.check.persistence.BanCheckTaskRepository;
import com.accountdb.bancheck.check.proxy.ProxyListParser;
import com.accountdb.bancheck.config.BanCheckProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.UUID;

@Service
public class BanCheckTaskService {
    private static final Logger log = LoggerFactory.getLogger(BanCheckTaskService.class);

    private final BanCheckTaskRepository repository;
    private final BanCheckOrchestratorService orchestrator;
    private final ParameterBalancer balancer;
    private final IdentifierCsvReader csvReader;
    private final TaskPollRateLimiter pollRateLimiter;
    private final BanCheckProperties properties;
    private final Clock clock;

    public BanCheckTaskService(
        BanCheckTaskRepository repository,
        BanCheckOrchestratorService orchestrator,
        ParameterBalancer balancer,
        IdentifierCsvReader csvReader,
        TaskPollRateLimiter pollRateLimiter,
        BanCheckProperties properties,
        Clock clock
    ) {
        this.repository = repository;
        this.orchestrator = orchestrator;
        this.balancer = balancer;
        this.csvReader = csvReader;
        this.pollRateLimiter = pollRateLimiter;
        this.properties = properties;
        this.clock = clock;
    }

    public BanCheckTask submitSteamIds(List<String> steamIds, CheckOptions options, CallerContext caller) {
        return submit(steamIds, options, null, caller);
    }

    public BanCheckTask submitCsv(
        InputStream csv,
        String steamIdColumn,
        CheckOptions options,
        String extraProxies,
        CallerContext caller
    ) {
        List<String> steamIds = csvReader.readIdentifiers(csv, steamIdColumn);
        return submit(steamIds, options, extraProxies, caller);
    }

    public BanCheckTask getTask(String taskId, CallerContext caller) {
        pollRateLimiter.acquire(caller);
        BanCheckTask task = repository.findTask(taskId);
        if (task == null || caller == null || !caller.canRead(task.ownerId())) {
            throw new TaskNotFoundException(taskId);
        }
        return task;
    }

    public TaskListResponse listTasks(CallerContext caller, Integer limit, Integer offset, String status) {
        int resolvedLimit = limit == null
            ? properties.getApi().getDefaultListLimit()
            : Math.max(1, Math.min(properties.getApi().getMaxListLimit(), limit));
        int resolvedOffset = offset == null ? 0 : Math.max(0, offset);
        TaskStatus statusFilter = parseStatus(status);
        Long ownerFilter = caller != null && caller.admin() ? null : (caller == null ? 0L : caller.ownerId());
        List<BanCheckTask> tasks = repository.findTasks(ownerFilter, statusFilter, resolvedLimit, resolvedOffset);
        long total = repository.countTasks(ownerFilter, statusFilter);
        return new TaskListResponse(tasks, total, resolvedLimit, resolvedOffset);
    }

    private BanCheckTask submit(List<String> rawSteamIds, CheckOptions options, String extraProxies, CallerContext caller) {
        CheckOptions requested = options == null ? CheckOptions.defaults() : options;
        balancer.validate(requested);
        List<String> steamIds = IdentifierNormalizer.normalize(rawSteamIds);
        if (steamIds.size() > properties.getMaxIdentifiersPerTask()) {
            throw new BanCheckValidationException(
                "Too many identifiers: " + steamIds.size() + " (limit " + properties.getMaxIdentifiersPerTask() + ")"
            );
        }
        ProxyListParser.ParsedProxyList proxies = resolveProxies(requested, extraProxies);
        long ownerId = caller == null ? 0L : caller.ownerId();
        Instant now = clock.instant();
        String taskId = UUID.randomUUID().toString();

        if (steamIds.isEmpty()) {
            BanCheckTask completed = new BanCheckTask(
                taskId,
                TaskStatus.COMPLETED,
                "No identifiers submitted",
                100.0,
                List.of(),
                ProxyPoolStats.empty(),
                now,
                now,
                ownerId
            );
            repository.insertTask(completed, 0);
            log.info("Task {} completed immediately: no identifiers", taskId);
            return completed;
        }

        EffectiveOptions effective = balancer.balance(steamIds.size(), requested);
        BanCheckTask pending = new BanCheckTask(
            taskId,
            TaskStatus.PENDING,
            "Queued " + steamIds.size() + " identifiers",
            0.0,
            List.of(),
            new ProxyPoolStats(proxies.proxies().size(), proxies.proxies().size(), proxies.rejected(), 0, List.of()),
            now,
            now,
            ownerId
        );
        repository.insertTask(pending, steamIds.size());
        log.info("Task {} queued for owner {} with {} identifiers", taskId, ownerId, steamIds.size());
        orchestrator.startAsync(taskId, steamIds, effective, proxies);
        return pending;
    }

    private ProxyListParser.ParsedProxyList resolveProxies(CheckOptions options, String extraProxies) {
        List<String> entries = new ArrayList<>(options.proxyListOrEmpty());
        if (extraProxies != null && !extraProxies.isBlank()) {
            entries.add(extraProxies);
        }
        ProxyListParser.ParsedProxyList parsed = ProxyListParser.parse(entries);
        if (parsed.isEmpty()) {
            ProxyListParser.ParsedProxyList fallback = loadDefaultProxies();
            if (!fallback.isEmpty()) {
                parsed = new ProxyListParser.ParsedProxyList(fallback.proxies(), parsed.rejected() + fallback.rejected());
            }
        }
        if (parsed.isEmpty() && properties.getProxy().isRequireProxies()) {
            throw new BanCheckValidationException("At least one valid proxy is required");
        }
        return parsed;
    }

    private ProxyListParser.ParsedProxyList loadDefaultProxies() {
        String configured = properties.getProxy().getDefaultProxyFile();
        if (configured == null || configured.isBlank()) {
            return new ProxyListParser.ParsedProxyList(List.of(), 0);
        }
        Path path = Paths.get(configured);
        if (!Files.isReadable(path)) {
            log.warn("Default proxy file {} is not readable", path);
            return new ProxyListParser.ParsedProxyList(List.of(), 0);
        }
        try {
            return ProxyListParser.parse(Files.readString(path, StandardCharsets.UTF_8));
        } catch (IOException e) {
            log.warn("Unable to read default proxy file {}", path, e);
            return new ProxyListParser.ParsedProxyList(List.of(), 0);
        }
    }

    private TaskStatus parseStatus(String status) {
        if (status == null || status.isBlank()) {
            return null;
        }
        try {
            return TaskStatus.valueOf(status.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new BanCheckValidationException("Unknown task status: " + status);
        }
    }
}
