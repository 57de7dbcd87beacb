package com.accountdb.bancheck.check.api;

import com.accountdb.bancheck.check.model.BanCheckTask;
import com.accountdb.bancheck.check.model.CallerContext;
import com.accountdb.bancheck.check.model.CheckOptions;
import com.accountdb.bancheck.check.model.TaskListResponse;
import com.accountdb.bancheck.check.service.BanCheckTaskService;
import com.accountdb.bancheck.check.service.BanCheckValidationException;
import com.accountdb.bancheck.check.service.IdentifierCsvReader;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RequestPart;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;

@RestController
@RequestMapping("/api/ban-check")
public class BanCheckController {
    static final String OWNER_HEADER = "X-Owner-Id";
    static final String ROLE_HEADER = "X-Owner-Role";

    private final BanCheckTaskService taskService;

    public BanCheckController(BanCheckTaskService taskService) {
        this.taskService = taskService;
    }

    @PostMapping(path = "/check/steamids", consumes = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<BanCheckTask> submitSteamIds(
        @RequestHeader(OWNER_HEADER) long ownerId,
        @RequestHeader(name = ROLE_HEADER, required = false) String role,
        @RequestBody SubmitSteamIdsRequest request
    ) {
        List<String> steamIds = request == null || request.steamIds() == null ? List.of() : request.steamIds();
        CheckOptions options = request == null ? null : request.options();
        BanCheckTask task = taskService.submitSteamIds(steamIds, options, CallerContext.of(ownerId, role));
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(task);
    }

    @PostMapping(path = "/check/csv", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<BanCheckTask> submitCsv(
        @RequestHeader(OWNER_HEADER) long ownerId,
        @RequestHeader(name = ROLE_HEADER, required = false) String role,
        @RequestPart(name = "csvFile", required = false) MultipartFile csvFile,
        @RequestParam(name = "steamIdColumn", required = false, defaultValue = IdentifierCsvReader.DEFAULT_COLUMN) String steamIdColumn,
        @RequestParam(name = "useAutoBalancing", required = false) Boolean useAutoBalancing,
        @RequestParam(name = "logicalBatchSize", required = false) Integer logicalBatchSize,
        @RequestParam(name = "maxConcurrentBatches", required = false) Integer maxConcurrentBatches,
        @RequestParam(name = "maxWorkersPerBatch", required = false) Integer maxWorkersPerBatch,
        @RequestParam(name = "interRequestSubmitDelay", required = false) Double interRequestSubmitDelay,
        @RequestParam(name = "maxRetriesPerUrl", required = false) Integer maxRetriesPerUrl,
        @RequestParam(name = "retryDelaySeconds", required = false) Double retryDelaySeconds,
        @RequestPart(name = "proxyFile", required = false) MultipartFile proxyFile,
        @RequestParam(name = "proxyListText", required = false) String proxyListText
    ) {
        if (csvFile == null || csvFile.isEmpty()) {
            throw new BanCheckValidationException("csvFile is required");
        }
        CheckOptions options = new CheckOptions(
            useAutoBalancing,
            List.of(),
            logicalBatchSize,
            maxConcurrentBatches,
            maxWorkersPerBatch,
            interRequestSubmitDelay,
            maxRetriesPerUrl,
            retryDelaySeconds
        );
        String extraProxies = joinProxySources(proxyFile, proxyListText);
        try (InputStream input = csvFile.getInputStream()) {
            BanCheckTask task = taskService.submitCsv(
                input,
                steamIdColumn,
                options,
                extraProxies,
                CallerContext.of(ownerId, role)
            );
            return ResponseEntity.status(HttpStatus.ACCEPTED).body(task);
        } catch (IOException e) {
            throw new BanCheckValidationException("Unable to read csvFile: " + e.getMessage());
        }
    }

    @GetMapping("/tasks/{taskId}")
    public BanCheckTask getTask(
        @RequestHeader(OWNER_HEADER) long ownerId,
        @RequestHeader(name = ROLE_HEADER, required = false) String role,
        @PathVariable("taskId") String taskId
    ) {
        return taskService.getTask(taskId, CallerContext.of(ownerId, role));
    }

    @GetMapping("/tasks")
    public TaskListResponse listTasks(
        @RequestHeader(OWNER_HEADER) long ownerId,
        @RequestHeader(name = ROLE_HEADER, required = false) String role,
        @RequestParam(name = "limit", required = false) Integer limit,
        @RequestParam(name = "offset", required = false) Integer offset,
        @RequestParam(name = "status", required = false) String status
    ) {
        return taskService.listTasks(CallerContext.of(ownerId, role), limit, offset, status);
    }

    private String joinProxySources(MultipartFile proxyFile, String proxyListText) {
        StringBuilder combined = new StringBuilder();
        if (proxyFile != null && !proxyFile.isEmpty()) {
            try {
                combined.append(new String(proxyFile.getBytes(), StandardCharsets.UTF_8));
            } catch (IOException e) {
                throw new BanCheckValidationException("Unable to read proxyFile: " + e.getMessage());
            }
        }
        if (proxyListText != null && !proxyListText.isBlank()) {
            if (combined.length() > 0) {
                combined.append('\n');
            }
            combined.append(proxyListText);
        }
        return combined.length() == 0 ? null : combined.toString();
    }
}
