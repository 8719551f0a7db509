package com.delta.redirects.resolve.service;

import com.delta.redirects.config.ResolverProperties;
import com.delta.redirects.resolve.model.ProbeResult;
import com.delta.redirects.resolve.model.StatusSweepSummary;
import com.delta.redirects.resolve.persistence.RedirectJdbcRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Probes every stored URL in fixed-size batches and records the observed status.
 * A batch is fully drained before the next one starts.
 */
@Service
public class StatusSweepService {
    private static final Logger log = LoggerFactory.getLogger(StatusSweepService.class);

    private final RedirectJdbcRepository repository;
    private final StatusProber statusProber;
    private final ExecutorService probeExecutor;
    private final ResolverProperties properties;

    public StatusSweepService(
        RedirectJdbcRepository repository,
        StatusProber statusProber,
        @Qualifier("probeExecutor") ExecutorService probeExecutor,
        ResolverProperties properties
    ) {
        this.repository = repository;
        this.statusProber = statusProber;
        this.probeExecutor = probeExecutor;
        this.properties = properties;
    }

    public StatusSweepSummary sweep() {
        return sweep(repository.findAllUrls());
    }

    public StatusSweepSummary sweep(List<String> urls) {
        int batchSize = properties.getPipeline().getBatchSize();
        int pauseMs = properties.getPipeline().getBatchPauseMs();
        int logEvery = properties.getPipeline().getProgressLogEvery();
        int total = urls.size();
        AtomicInteger completed = new AtomicInteger();
        AtomicInteger succeeded = new AtomicInteger();
        AtomicInteger failed = new AtomicInteger();
        AtomicInteger redirected = new AtomicInteger();
        int batches = 0;

        log.info("Status sweep started: urls={} batchSize={}", total, batchSize);
        for (int start = 0; start < total; start += batchSize) {
            if (start > 0 && pauseMs > 0) {
                if (!pause(pauseMs)) {
                    log.warn("Status sweep interrupted after {} of {} urls", completed.get(), total);
                    throw new StatusSweepInterruptedException(
                        "Status sweep interrupted after " + completed.get() + " of " + total + " urls"
                    );
                }
            }
            List<String> batch = urls.subList(start, Math.min(total, start + batchSize));
            List<CompletableFuture<Void>> futures = new ArrayList<>(batch.size());
            for (String url : batch) {
                futures.add(CompletableFuture.runAsync(
                    () -> {
                        ProbeResult result = statusProber.probe(url);
                        if (result.hasStatus()) {
                            repository.updateStatus(url, result.status(), result.finalUrl());
                            succeeded.incrementAndGet();
                            if (result.redirected()) {
                                redirected.incrementAndGet();
                            }
                        } else {
                            failed.incrementAndGet();
                        }
                        int done = completed.incrementAndGet();
                        if (done % logEvery == 0) {
                            log.info("Status sweep progress: {}/{}", done, total);
                        }
                    },
                    probeExecutor
                ));
            }
            try {
                CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();
            } catch (CompletionException e) {
                if (e.getCause() instanceof DataAccessException dataAccessException) {
                    throw dataAccessException;
                }
                throw e;
            }
            batches++;
        }

        StatusSweepSummary summary = new StatusSweepSummary(
            total,
            batches,
            succeeded.get(),
            failed.get(),
            redirected.get()
        );
        log.info(
            "Status sweep finished: urls={} batches={} succeeded={} failed={} redirected={}",
            summary.total(),
            summary.batches(),
            summary.succeeded(),
            summary.failed(),
            summary.redirected()
        );
        return summary;
    }

    private boolean pause(int pauseMs) {
        try {
            Thread.sleep(pauseMs);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }
}
