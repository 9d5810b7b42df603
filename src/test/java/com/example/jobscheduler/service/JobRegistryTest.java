package com.example.jobscheduler.service;

import com.example.jobscheduler.domain.JobDefinition;
import com.example.jobscheduler.domain.JobSchedule;
import com.example.jobscheduler.repo.JobScheduleRepo;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;

import java.util.*;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class JobRegistryTest {

    @Mock
    private JobScheduleRepo repo;

    private JobRegistry registry;

    @BeforeEach
    void setUp() {
        registry = new JobRegistry(repo);
    }

    private static JobDefinition job(String name, String cron) {
        return JobDefinition.builder()
                .name(name)
                .displayName(name)
                .cronExpression(cron)
                .enabled(true)
                .jobType("cleanup")
                .service("user-service")
                .endpoint("/api/jobs/process-deletions")
                .build();
    }

    @Test
    void repeatedRegistrationKeepsOneEntryWithLatestValues() {
        when(repo.findById(anyString())).thenReturn(Optional.empty());

        registry.upsert(job("nightly-cleanup", "0 2 * * *"));
        registry.upsert(job("nightly-cleanup", "0 3 * * *"));

        assertThat(registry.size()).isEqualTo(1);
        assertThat(registry.require("nightly-cleanup").getCronExpression()).isEqualTo("0 3 * * *");
        verify(repo, times(2)).save(any(JobSchedule.class));
    }

    @Test
    void configIsDefensivelyCopied() {
        when(repo.findById(anyString())).thenReturn(Optional.empty());
        Map<String, Object> cfg = new HashMap<>();
        cfg.put("batchSize", 50);

        registry.upsert(job("digest", "0 8 * * *").toBuilder().config(cfg).build());
        cfg.put("batchSize", 999);

        assertThat(registry.require("digest").getConfig()).containsEntry("batchSize", 50);
        assertThatThrownBy(() -> registry.require("digest").getConfig().put("x", 1))
                .isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void invalidCronIsRejectedBeforeAnyWrite() {
        assertThatThrownBy(() -> registry.upsert(job("bad", "every day")))
                .isInstanceOf(InvalidScheduleException.class);

        assertThat(registry.contains("bad")).isFalse();
        verifyNoInteractions(repo);
    }

    @Test
    void rescheduleWithInvalidCronLeavesDefinitionUntouched() {
        when(repo.findById(anyString())).thenReturn(Optional.empty());
        registry.upsert(job("nightly-cleanup", "0 2 * * *"));

        assertThatThrownBy(() -> registry.reschedule("nightly-cleanup", "0 25 * * *"))
                .isInstanceOf(InvalidScheduleException.class);

        assertThat(registry.require("nightly-cleanup").getCronExpression()).isEqualTo("0 2 * * *");
        verify(repo, times(1)).save(any(JobSchedule.class));
    }

    @Test
    void failedPersistLeavesMemoryUnchanged() {
        when(repo.findById(anyString())).thenReturn(Optional.empty());
        registry.upsert(job("nightly-cleanup", "0 2 * * *"));
        when(repo.save(any(JobSchedule.class))).thenThrow(new DataAccessResourceFailureException("db down"));

        assertThatThrownBy(() -> registry.setEnabled("nightly-cleanup", false))
                .isInstanceOf(DataAccessResourceFailureException.class);

        assertThat(registry.require("nightly-cleanup").isEnabled()).isTrue();
    }

    @Test
    void unknownJobOperationsThrowNotFound() {
        assertThatThrownBy(() -> registry.require("missing")).isInstanceOf(JobNotFoundException.class);
        assertThatThrownBy(() -> registry.setEnabled("missing", true)).isInstanceOf(JobNotFoundException.class);
        assertThatThrownBy(() -> registry.reschedule("missing", "0 2 * * *")).isInstanceOf(JobNotFoundException.class);
        assertThatThrownBy(() -> registry.delete("missing")).isInstanceOf(JobNotFoundException.class);
        assertThat(registry.get(null)).isEmpty();
    }

    @Test
    void hydrateReplacesMemoryWithStoredRows() {
        JobSchedule row = new JobSchedule();
        job("stored", "0 4 * * *").applyTo(row);
        when(repo.findAll()).thenReturn(Collections.singletonList(row));
        when(repo.findById(anyString())).thenReturn(Optional.empty());
        registry.upsert(job("stale", "0 1 * * *"));

        int loaded = registry.hydrate();

        assertThat(loaded).isEqualTo(1);
        assertThat(registry.list()).extracting(JobDefinition::getName).containsExactly("stored");
    }

    @Test
    void deleteRemovesRowAndSnapshot() {
        JobSchedule row = new JobSchedule();
        when(repo.findById("nightly-cleanup")).thenReturn(Optional.empty(), Optional.of(row));
        registry.upsert(job("nightly-cleanup", "0 2 * * *"));

        registry.delete("nightly-cleanup");

        verify(repo).delete(row);
        assertThat(registry.contains("nightly-cleanup")).isFalse();
    }

    @Test
    void listIsSortedByName() {
        when(repo.findById(anyString())).thenReturn(Optional.empty());
        registry.upsert(job("zeta", "0 2 * * *"));
        registry.upsert(job("alpha", "0 2 * * *"));

        assertThat(registry.list()).extracting(JobDefinition::getName).containsExactly("alpha", "zeta");
    }

    @Test
    void nextRunWriteFailureIsNotPropagated() {
        doThrow(new DataAccessResourceFailureException("db down")).when(repo).updateNextRunAt(anyString(), any());

        registry.recordNextRun("nightly-cleanup", null);

        ArgumentCaptor<String> name = ArgumentCaptor.forClass(String.class);
        verify(repo).updateNextRunAt(name.capture(), any());
        assertThat(name.getValue()).isEqualTo("nightly-cleanup");
    }
}
