package com.delta.redirects.resolve.service;

import com.delta.redirects.config.ResolverProperties;
import com.delta.redirects.resolve.model.ProbeResult;
import com.delta.redirects.resolve.model.StatusSweepSummary;
import com.delta.redirects.resolve.persistence.RedirectJdbcRepository;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mockito;
import org.springframework.dao.DataAccessResourceFailureException;

import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class StatusSweepServiceTest {
    private ExecutorService executor;
    private RedirectJdbcRepository repository;
    private StatusProber prober;
    private ResolverProperties properties;

    @BeforeEach
    void setUp() {
        executor = Executors.newFixedThreadPool(3);
        repository = Mockito.mock(RedirectJdbcRepository.class);
        prober = Mockito.mock(StatusProber.class);
        properties = new ResolverProperties();
        properties.getPipeline().setBatchSize(3);
        properties.getPipeline().setBatchPauseMs(0);
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    void countsOutcomesAndPersistsOnlyObservedStatuses() {
        when(prober.probe(anyString())).thenAnswer(invocation -> {
            String url = invocation.getArgument(0);
            if (url.contains("fail")) {
                return ProbeResult.failed();
            }
            if (url.contains("moved")) {
                return new ProbeResult(404, "https://s/product/NEW");
            }
            return new ProbeResult(404, null);
        });
        List<String> urls = List.of(
            "https://s/product/1",
            "https://s/product/fail-1",
            "https://s/product/moved",
            "https://s/product/2",
            "https://s/product/fail-2",
            "https://s/product/3",
            "https://s/product/4"
        );

        StatusSweepSummary summary = service().sweep(urls);

        assertThat(summary).isEqualTo(new StatusSweepSummary(7, 3, 5, 2, 1));
        verify(repository).updateStatus("https://s/product/moved", 404, "https://s/product/NEW");
        verify(repository).updateStatus(eq("https://s/product/1"), eq(404), isNull());
        verify(repository, never()).updateStatus(eq("https://s/product/fail-1"), any(), any());
        verify(repository, never()).updateStatus(eq("https://s/product/fail-2"), any(), any());
    }

    @Test
    void batchesNeverOverlap() {
        AtomicInteger inFlight = new AtomicInteger();
        AtomicInteger maxInFlight = new AtomicInteger();
        when(prober.probe(anyString())).thenAnswer(invocation -> {
            int now = inFlight.incrementAndGet();
            maxInFlight.accumulateAndGet(now, Math::max);
            Thread.sleep(20);
            inFlight.decrementAndGet();
            return new ProbeResult(200, null);
        });
        ExecutorService wide = Executors.newFixedThreadPool(8);
        try {
            StatusSweepService service = new StatusSweepService(repository, prober, wide, properties);
            StatusSweepSummary summary = service.sweep(List.of("u1", "u2", "u3", "u4", "u5", "u6", "u7", "u8"));

            assertThat(summary.batches()).isEqualTo(3);
            assertThat(summary.succeeded()).isEqualTo(8);
            assertThat(maxInFlight.get()).isLessThanOrEqualTo(3);
        } finally {
            wide.shutdownNow();
        }
    }

    @Test
    void storeFailureAbortsTheSweep() {
        when(prober.probe(anyString())).thenReturn(new ProbeResult(500, null));
        Mockito.doThrow(new DataAccessResourceFailureException("store down"))
            .when(repository).updateStatus(anyString(), anyInt(), any());

        assertThatThrownBy(() -> service().sweep(List.of("https://s/product/1", "https://s/product/2")))
            .isInstanceOf(DataAccessResourceFailureException.class)
            .hasMessageContaining("store down");
    }

    @Test
    void sweepWithoutArgumentsProbesStoredUrls() {
        when(repository.findAllUrls()).thenReturn(List.of("https://s/catalog/a"));
        when(prober.probe("https://s/catalog/a")).thenReturn(new ProbeResult(410, null));

        StatusSweepSummary summary = service().sweep();

        assertThat(summary.total()).isEqualTo(1);
        verify(repository).updateStatus("https://s/catalog/a", 410, null);
    }

    @Test
    void emptyInputRunsNoBatches() {
        assertThat(service().sweep(List.of())).isEqualTo(new StatusSweepSummary(0, 0, 0, 0, 0));
    }

    private StatusSweepService service() {
        return new StatusSweepService(repository, prober, executor, properties);
    }

    @Test
    void interruptedPauseAbortsTheSweep() {
        properties.getPipeline().setBatchPauseMs(50);
        when(prober.probe(anyString())).thenReturn(new ProbeResult(404, null));
        List<String> urls = List.of("https://s/a", "https://s/b", "https://s/c", "https://s/d");

        Thread.currentThread().interrupt();
        try {
            assertThatThrownBy(() -> service().sweep(urls))
                .isInstanceOf(StatusSweepInterruptedException.class)
                .hasMessageContaining("3 of 4");
        } finally {
            Thread.interrupted();
        }
        verify(repository, never()).updateStatus(eq("https://s/d"), any(), any());
    }
}
