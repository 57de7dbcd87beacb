package com.accountdb.bancheck.check.service;

import com.accountdb.bancheck.check.model.CheckResult;
import com.accountdb.bancheck.check.model.ProxyPoolStats;
import com.accountdb.bancheck.check.model.StatusSummary;
import com.accountdb.bancheck.check.model.TaskStatus;
import com.accountdb.bancheck.check.persistence.BanCheckTaskRepository;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;

import java.time.Clock;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyDouble;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class TaskResultAggregatorTest {

    @Mock
    private BanCheckTaskRepository repository;

    @Test
    void firstResultWinsAndProgressTracksResolvedShare() {
        stubWrites();
        TaskResultAggregator aggregator = aggregator(List.of("A", "B"), 3);

        assertThat(aggregator.record(clean("A"))).isTrue();
        assertThat(aggregator.record(new CheckResult("A", StatusSummary.BANNED, "vac", "direct", 1, 1))).isFalse();

        verify(repository).updateTask(eq("task-1"), eq(TaskStatus.PROCESSING), anyString(), eq(50.0), anyList(), any(), any());
        assertThat(aggregator.orderedResults()).extracting(CheckResult::statusSummary).containsExactly(StatusSummary.CLEAN);

        assertThat(aggregator.record(CheckResult.error("B", "HTTP_5XX: HTTP 503", "direct", 1, 3))).isTrue();
        ArgumentCaptor<String> message = ArgumentCaptor.forClass(String.class);
        verify(repository).updateTask(eq("task-1"), eq(TaskStatus.COMPLETED), message.capture(), eq(100.0), anyList(), any(), any());
        assertThat(message.getValue()).isEqualTo("Checked 2 identifiers: 0 banned, 1 clean, 0 private, 1 errors");
        assertThat(aggregator.isComplete()).isTrue();
        assertThat(aggregator.record(clean("B"))).isFalse();
    }

    @Test
    void resultsFollowInputOrderRegardlessOfArrival() {
        stubWrites();
        TaskResultAggregator aggregator = aggregator(List.of("A", "B", "C"), 3);

        aggregator.record(clean("C"));
        aggregator.record(clean("A"));
        aggregator.record(clean("B"));

        assertThat(aggregator.orderedResults()).extracting(CheckResult::steamId).containsExactly("A", "B", "C");
    }

    @Test
    void unknownIdentifiersAreIgnored() {
        TaskResultAggregator aggregator = aggregator(List.of("A"), 3);

        assertThat(aggregator.record(clean("Z"))).isFalse();
        assertThat(aggregator.resolvedCount()).isZero();
    }

    @Test
    void transientWriteFailureIsRetried() {
        when(repository.updateTask(anyString(), any(), anyString(), anyDouble(), anyList(), any(), any()))
            .thenThrow(new DataAccessResourceFailureException("connection reset"))
            .thenReturn(true);
        TaskResultAggregator aggregator = aggregator(List.of("A", "B"), 3);

        assertThat(aggregator.record(clean("A"))).isTrue();
        verify(repository, times(2)).updateTask(anyString(), any(), anyString(), anyDouble(), anyList(), any(), any());
    }

    @Test
    void persistentWriteFailureRaises() {
        when(repository.updateTask(anyString(), any(), anyString(), anyDouble(), anyList(), any(), any()))
            .thenThrow(new DataAccessResourceFailureException("database down"));
        TaskResultAggregator aggregator = aggregator(List.of("A", "B"), 2);

        assertThrows(TaskPersistenceException.class, () -> aggregator.record(clean("A")));
        verify(repository, times(2)).updateTask(anyString(), any(), anyString(), anyDouble(), anyList(), any(), any());
    }

    @Test
    void sealedAggregatorOnlyAcceptsForcedCompletion() {
        stubWrites();
        TaskResultAggregator aggregator = aggregator(List.of("A", "B", "C"), 3);
        aggregator.record(clean("A"));
        aggregator.seal();

        assertThat(aggregator.record(clean("B"))).isFalse();
        assertThat(aggregator.forceComplete("timed out")).isEqualTo(2);

        List<CheckResult> results = aggregator.orderedResults();
        assertThat(results).hasSize(3);
        assertThat(results.get(1).details()).isEqualTo("timed out");
        assertThat(results.get(2).statusSummary()).isEqualTo(StatusSummary.ERROR);
        assertThat(aggregator.isComplete()).isTrue();
    }

    @Test
    void resolveAllMarksOnlyUnresolvedIdentifiers() {
        stubWrites();
        TaskResultAggregator aggregator = aggregator(List.of("A", "B", "C"), 3);
        aggregator.record(clean("A"));

        int resolved = aggregator.resolveAll(List.of("A", "B"), "no usable proxy", 1);

        assertThat(resolved).isEqualTo(1);
        assertThat(aggregator.orderedResults()).extracting(CheckResult::statusSummary)
            .containsExactly(StatusSummary.CLEAN, StatusSummary.ERROR);
    }

    @Test
    void terminalRowStopsFurtherWrites() {
        when(repository.updateTask(anyString(), any(), anyString(), anyDouble(), anyList(), any(), any())).thenReturn(false);
        TaskResultAggregator aggregator = aggregator(List.of("A", "B"), 3);

        aggregator.record(clean("A"));

        assertThat(aggregator.isComplete()).isTrue();
        assertThat(aggregator.record(clean("B"))).isFalse();
    }

    private void stubWrites() {
        when(repository.updateTask(anyString(), any(), anyString(), anyDouble(), anyList(), any(), any())).thenReturn(true);
    }

    private TaskResultAggregator aggregator(List<String> identifiers, int attempts) {
        return new TaskResultAggregator("task-1", identifiers, repository, ProxyPoolStats::empty, Clock.systemUTC(), attempts, 0);
    }

    private static CheckResult clean(String steamId) {
        return new CheckResult(steamId, StatusSummary.CLEAN, "no bans on record", "direct", 1, 1);
    }
}
