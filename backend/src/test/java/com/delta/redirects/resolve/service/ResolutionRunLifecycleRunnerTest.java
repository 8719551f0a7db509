package com.delta.redirects.resolve.service;

import com.delta.redirects.config.ResolverProperties;
import com.delta.redirects.resolve.model.ResolutionRunMeta;
import com.delta.redirects.resolve.persistence.RedirectJdbcRepository;
import org.junit.jupiter.api.Test;
import org.mockito.Mockito;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class ResolutionRunLifecycleRunnerTest {

    @Test
    void abortsOnlyStaleRuns() {
        RedirectJdbcRepository repository = Mockito.mock(RedirectJdbcRepository.class);
        Instant now = Instant.parse("2024-05-01T12:00:00Z");
        when(repository.isDbReachable()).thenReturn(true);
        when(repository.findRunningRuns()).thenReturn(List.of(
            new ResolutionRunMeta(1L, now.minus(5, ChronoUnit.HOURS), null, "RUNNING", null, 3, 1, 1, 0, 1, 2),
            new ResolutionRunMeta(2L, now.minus(10, ChronoUnit.MINUTES), null, "RUNNING", null, 0, 0, 0, 0, 0, 0)
        ));

        int aborted = new ResolutionRunLifecycleRunner(repository, new ResolverProperties()).abortStaleRuns(now);

        assertThat(aborted).isEqualTo(1);
        verify(repository).completeRun(1L, now, "ABORTED", "aborted_on_startup_stale", 3, 1, 1, 0, 1, 2);
        verify(repository, never()).completeRun(eq(2L), any(), anyString(), anyString(),
            anyInt(), anyInt(), anyInt(), anyInt(), anyInt(), anyInt());
    }

    @Test
    void unreachableDatabaseSkipsCleanup() {
        RedirectJdbcRepository repository = Mockito.mock(RedirectJdbcRepository.class);
        when(repository.isDbReachable()).thenThrow(new IllegalStateException("no connection"));

        int aborted = new ResolutionRunLifecycleRunner(repository, new ResolverProperties()).abortStaleRuns(Instant.now());

        assertThat(aborted).isZero();
        verify(repository, never()).findRunningRuns();
        verify(repository, never()).completeRun(anyLong(), any(), anyString(), anyString(),
            anyInt(), anyInt(), anyInt(), anyInt(), anyInt(), anyInt());
    }
}
