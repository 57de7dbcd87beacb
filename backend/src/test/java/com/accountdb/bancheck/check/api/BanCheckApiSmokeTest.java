package com.accountdb.bancheck.check.api;

import com.accountdb.bancheck.check.http.ProfileFetcher;
import com.accountdb.bancheck.check.model.BanCheckTask;
import com.accountdb.bancheck.check.model.HttpFetchResult;
import com.accountdb.bancheck.check.model.StatusSummary;
import com.accountdb.bancheck.check.model.TaskStatus;
import com.accountdb.bancheck.check.persistence.BanCheckTaskRepository;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Import;
import org.springframework.context.annotation.Primary;
import org.springframework.http.MediaType;
import org.springframework.mock.web.MockMultipartFile;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;
import org.springframework.web.context.WebApplicationContext;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.ThreadLocalRandom;

import static org.assertj.core.api.Assertions.assertThat;
import static org.hamcrest.Matchers.hasSize;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.multipart;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@ActiveProfiles("test")
@Import(BanCheckApiSmokeTest.StubProfileConfig.class)
class BanCheckApiSmokeTest {
    private static final String CLEAN_PAGE = "<div class=\"profile_header_centered_persona\">player</div>";
    private static final String BANNED_PAGE = "<span class=\"profile_ban_info\">1 game ban on record</span>";

    @Autowired
    private WebApplicationContext context;

    @Autowired
    private BanCheckTaskRepository repository;

    @Autowired
    private ObjectMapper objectMapper;

    private MockMvc mockMvc;
    private long ownerId;

    @BeforeEach
    void setUp() {
        this.mockMvc = MockMvcBuilders.webAppContextSetup(context).build();
        this.ownerId = ThreadLocalRandom.current().nextLong(1_000_000, 1_000_000_000);
    }

    @Test
    void emptySubmissionCompletesImmediately() throws Exception {
        mockMvc.perform(post("/api/ban-check/check/steamids")
                .header("X-Owner-Id", ownerId)
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"steamIds\":[],\"options\":{\"useAutoBalancing\":true}}"))
            .andExpect(status().isAccepted())
            .andExpect(jsonPath("$.status").value("COMPLETED"))
            .andExpect(jsonPath("$.progress").value(100.0))
            .andExpect(jsonPath("$.results", hasSize(0)));
    }

    @Test
    void submittedIdentifiersAreCheckedInTheBackground() throws Exception {
        MvcResult submitted = mockMvc.perform(post("/api/ban-check/check/steamids")
                .header("X-Owner-Id", ownerId)
                .contentType(MediaType.APPLICATION_JSON)
                .content("""
                    {"steamIds":["76561198000000001","76561198000000666","76561198000000003","76561198000000001"],
                     "options":{"logicalBatchSize":2,"maxConcurrentBatches":2,"maxWorkersPerBatch":2,
                                "interRequestSubmitDelay":0,"retryDelaySeconds":0}}
                    """))
            .andExpect(status().isAccepted())
            .andExpect(jsonPath("$.status").value("PENDING"))
            .andReturn();
        String taskId = objectMapper.readTree(submitted.getResponse().getContentAsString()).get("taskId").asText();

        BanCheckTask task = awaitTerminal(taskId);

        assertThat(task.status()).isEqualTo(TaskStatus.COMPLETED);
        assertThat(task.progress()).isEqualTo(100.0);
        assertThat(task.results()).hasSize(3);
        assertThat(task.results().get(0).steamId()).isEqualTo("76561198000000001");
        assertThat(task.results().get(1).statusSummary()).isEqualTo(StatusSummary.BANNED);
        assertThat(task.results().get(2).statusSummary()).isEqualTo(StatusSummary.CLEAN);

        mockMvc.perform(get("/api/ban-check/tasks/" + taskId).header("X-Owner-Id", ownerId))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.taskId").value(taskId))
            .andExpect(jsonPath("$.results", hasSize(3)));
    }

    @Test
    void csvMissingColumnIsRejectedWithoutCreatingTask() throws Exception {
        MockMultipartFile csv = new MockMultipartFile(
            "csvFile",
            "accounts.csv",
            "text/csv",
            "account,owner\n76561198000000001,me\n".getBytes(StandardCharsets.UTF_8)
        );

        mockMvc.perform(multipart("/api/ban-check/check/csv").file(csv).header("X-Owner-Id", ownerId))
            .andExpect(status().isUnprocessableEntity())
            .andExpect(jsonPath("$.error").value("validation_failed"))
            .andExpect(jsonPath("$.message").value("Column 'steam64_id' not found in CSV headers: [account, owner]"));

        assertThat(repository.countTasks(ownerId, null)).isZero();
    }

    @Test
    void csvUploadCreatesTask() throws Exception {
        MockMultipartFile csv = new MockMultipartFile(
            "csvFile",
            "accounts.csv",
            "text/csv",
            "steam64_id\n76561198000000001\n76561198000000003\n".getBytes(StandardCharsets.UTF_8)
        );

        MvcResult submitted = mockMvc.perform(multipart("/api/ban-check/check/csv")
                .file(csv)
                .param("useAutoBalancing", "true")
                .header("X-Owner-Id", ownerId))
            .andExpect(status().isAccepted())
            .andReturn();
        String taskId = objectMapper.readTree(submitted.getResponse().getContentAsString()).get("taskId").asText();

        assertThat(awaitTerminal(taskId).results()).hasSize(2);
    }

    @Test
    void nonFiniteOptionIsRejected() throws Exception {
        MockMultipartFile csv = new MockMultipartFile(
            "csvFile",
            "accounts.csv",
            "text/csv",
            "steam64_id\n76561198000000001\n".getBytes(StandardCharsets.UTF_8)
        );

        mockMvc.perform(multipart("/api/ban-check/check/csv")
                .file(csv)
                .param("retryDelaySeconds", "NaN")
                .header("X-Owner-Id", ownerId))
            .andExpect(status().isUnprocessableEntity());

        assertThat(repository.countTasks(ownerId, null)).isZero();
    }

    @Test
    void wronglyTypedJsonOptionIsRejected() throws Exception {
        mockMvc.perform(post("/api/ban-check/check/steamids")
                .header("X-Owner-Id", ownerId)
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"steamIds\":[\"76561198000000001\"],\"options\":{\"logicalBatchSize\":\"abc\"}}"))
            .andExpect(status().isUnprocessableEntity())
            .andExpect(jsonPath("$.error").value("validation_failed"))
            .andExpect(jsonPath("$.message").value("Invalid value for options.logicalBatchSize"));

        assertThat(repository.countTasks(ownerId, null)).isZero();
    }

    @Test
    void wronglyTypedCsvOptionIsRejected() throws Exception {
        MockMultipartFile csv = new MockMultipartFile(
            "csvFile",
            "accounts.csv",
            "text/csv",
            "steam64_id\n76561198000000001\n".getBytes(StandardCharsets.UTF_8)
        );

        mockMvc.perform(multipart("/api/ban-check/check/csv")
                .file(csv)
                .param("logicalBatchSize", "abc")
                .header("X-Owner-Id", ownerId))
            .andExpect(status().isUnprocessableEntity())
            .andExpect(jsonPath("$.error").value("validation_failed"))
            .andExpect(jsonPath("$.message").value("Invalid value for logicalBatchSize: abc"));

        assertThat(repository.countTasks(ownerId, null)).isZero();
    }

    @Test
    void unknownTaskIsNotFound() throws Exception {
        mockMvc.perform(get("/api/ban-check/tasks/does-not-exist").header("X-Owner-Id", ownerId))
            .andExpect(status().isNotFound())
            .andExpect(jsonPath("$.error").value("task_not_found"));
    }

    @Test
    void tasksAreHiddenFromOtherOwnersButVisibleToAdmins() throws Exception {
        MvcResult submitted = mockMvc.perform(post("/api/ban-check/check/steamids")
                .header("X-Owner-Id", ownerId)
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"steamIds\":[]}"))
            .andExpect(status().isAccepted())
            .andReturn();
        String taskId = objectMapper.readTree(submitted.getResponse().getContentAsString()).get("taskId").asText();

        mockMvc.perform(get("/api/ban-check/tasks/" + taskId).header("X-Owner-Id", ownerId + 1))
            .andExpect(status().isNotFound());
        mockMvc.perform(get("/api/ban-check/tasks/" + taskId)
                .header("X-Owner-Id", ownerId + 1)
                .header("X-Owner-Role", "admin"))
            .andExpect(status().isOk());

        mockMvc.perform(get("/api/ban-check/tasks").header("X-Owner-Id", ownerId).param("limit", "500"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.limit").value(100))
            .andExpect(jsonPath("$.total").value(1))
            .andExpect(jsonPath("$.tasks[0].taskId").value(taskId));
        mockMvc.perform(get("/api/ban-check/tasks").header("X-Owner-Id", ownerId + 1))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.total").value(0));
    }

    @Test
    void unknownStatusFilterIsRejected() throws Exception {
        mockMvc.perform(get("/api/ban-check/tasks").header("X-Owner-Id", ownerId).param("status", "DONE"))
            .andExpect(status().isUnprocessableEntity())
            .andExpect(header().doesNotExist("Retry-After"));
    }

    private BanCheckTask awaitTerminal(String taskId) throws InterruptedException {
        Instant deadline = Instant.now().plus(Duration.ofSeconds(20));
        BanCheckTask task = repository.findTask(taskId);
        while (task != null && !task.isTerminal() && Instant.now().isBefore(deadline)) {
            Thread.sleep(50);
            task = repository.findTask(taskId);
        }
        assertThat(task).isNotNull();
        return task;
    }

    @TestConfiguration
    static class StubProfileConfig {
        @Bean
        @Primary
        ProfileFetcher stubProfileFetcher() {
            return (steamId, proxy) -> new HttpFetchResult(
                "http://stub/profiles/" + steamId,
                200,
                steamId.endsWith("666") ? BANNED_PAGE : CLEAN_PAGE,
                null,
                Instant.now(),
                Duration.ofMillis(1),
                null,
                null
            );
        }
    }
}
