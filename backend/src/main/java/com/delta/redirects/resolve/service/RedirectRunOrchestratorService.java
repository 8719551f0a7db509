package com.delta.redirects.resolve.service;

import com.delta.redirects.config.ResolverProperties;
import com.delta.redirects.resolve.model.ResolutionRunMeta;
import com.delta.redirects.resolve.model.ResolutionRunRequest;
import com.delta.redirects.resolve.model.ResolutionRunSummary;
import com.delta.redirects.resolve.model.ResolutionSummary;
import com.delta.redirects.resolve.model.StatusSweepSummary;
import com.delta.redirects.resolve.model.UrlCategory;
import com.delta.redirects.resolve.persistence.RedirectJdbcRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.ExecutorService;

@Service
public class RedirectRunOrchestratorService {
    private static final Logger log = LoggerFactory.getLogger(RedirectRunOrchestratorService.class);

    private final RedirectJdbcRepository repository;
    private final ErrorSourceLoader errorSourceLoader;
    private final ReferenceCatalogLoader referenceCatalogLoader;
    private final StatusSweepService statusSweepService;
    private final RedirectResolutionService resolutionService;
    private final ExecutorService runExecutor;
    private final ResolverProperties properties;

    public RedirectRunOrchestratorService(
        RedirectJdbcRepository repository,
        ErrorSourceLoader errorSourceLoader,
        ReferenceCatalogLoader referenceCatalogLoader,
        StatusSweepService statusSweepService,
        RedirectResolutionService resolutionService,
        @Qualifier("runExecutor") ExecutorService runExecutor,
        ResolverProperties properties
    ) {
        this.repository = repository;
        this.errorSourceLoader = errorSourceLoader;
        this.referenceCatalogLoader = referenceCatalogLoader;
        this.statusSweepService = statusSweepService;
        this.resolutionService = resolutionService;
        this.runExecutor = runExecutor;
        this.properties = properties;
    }

    public ResolutionRunSummary run(ResolutionRunRequest request) {
        ensureNoActiveRun();
        Instant startedAt = Instant.now();
        long runId = repository.insertRun(startedAt, "RUNNING", "resolution started");
        return runWithId(runId, startedAt, request == null ? ResolutionRunRequest.defaults() : request);
    }

    public long startAsync(ResolutionRunRequest request) {
        ensureNoActiveRun();
        Instant startedAt = Instant.now();
        long runId = repository.insertRun(startedAt, "RUNNING", "resolution started");
        ResolutionRunRequest effective = request == null ? ResolutionRunRequest.defaults() : request;
        runExecutor.submit(() -> runWithId(runId, startedAt, effective));
        return runId;
    }

    private ResolutionRunSummary runWithId(long runId, Instant startedAt, ResolutionRunRequest request) {
        String status = "FAILED";
        String notes = "resolution_failed";
        int errorsLoaded = 0;
        int productCodes = 0;
        int catalogCodes = 0;
        StatusSweepSummary sweep = null;
        ResolutionSummary resolution = null;
        Instant finishedAt;
        try {
            if (resolveFlag(request.resetStore(), properties.getCli().isResetStore())) {
                repository.resetWorkingTables();
            } else {
                int cleared = repository.clearRedirects();
                log.info("Run {}: {} redirects of the previous run cleared", runId, cleared);
            }
            List<String> urls = errorSourceLoader.load(pick(request.errorsFile(), properties.getData().getErrorsFile()));
            errorsLoaded = urls.size();
            int added = repository.upsertUrls(urls);
            log.info("Run {}: {} error urls loaded, {} new", runId, errorsLoaded, added);

            if (resolveFlag(request.skipStatusCheck(), properties.getCli().isSkipStatusCheck())) {
                log.info("Run {}: status sweep skipped, using stored statuses", runId);
            } else {
                sweep = statusSweepService.sweep();
            }

            productCodes = referenceCatalogLoader.load(
                UrlCategory.PRODUCT,
                pick(request.productsFile(), properties.getData().getProductsFile())
            );
            catalogCodes = referenceCatalogLoader.load(
                UrlCategory.CATALOG,
                pick(request.catalogFile(), properties.getData().getCatalogFile())
            );

            resolution = resolutionService.resolve(runId);
            status = "COMPLETED";
            notes = "redirects=" + resolution.redirectCount();
        } catch (StatusSweepInterruptedException e) {
            log.warn("Resolution run {} aborted: {}", runId, e.getMessage());
            status = "ABORTED";
            notes = "status_sweep_interrupted";
        } catch (Exception e) {
            log.warn("Resolution run {} failed", runId, e);
            status = "FAILED";
            notes = "exception=" + e.getClass().getSimpleName();
        } finally {
            finishedAt = Instant.now();
            repository.completeRun(
                runId,
                finishedAt,
                status,
                notes,
                resolution == null ? 0 : resolution.processed(),
                resolution == null ? 0 : resolution.productMatches(),
                resolution == null ? 0 : resolution.catalogMatches(),
                resolution == null ? 0 : resolution.redirectedTo404(),
                resolution == null ? 0 : resolution.skipped(),
                sweep == null ? 0 : sweep.failed()
            );
        }
        return new ResolutionRunSummary(
            runId,
            startedAt,
            finishedAt,
            status,
            notes,
            errorsLoaded,
            productCodes,
            catalogCodes,
            sweep,
            resolution
        );
    }

    private void ensureNoActiveRun() {
        Instant cutoff = Instant.now().minus(Duration.ofMinutes(properties.getActiveRunMinutes()));
        for (ResolutionRunMeta run : repository.findRunningRuns()) {
            if (run.startedAt().isAfter(cutoff)) {
                throw new ActiveResolutionRunException(
                    "Active resolution run in progress (id=" + run.runId() + ", startedAt=" + run.startedAt() + ")"
                );
            }
        }
    }

    private static boolean resolveFlag(Boolean requested, boolean fallback) {
        return requested != null ? requested : fallback;
    }

    private static String pick(String requested, String fallback) {
        return requested == null || requested.isBlank() ? fallback : requested.trim();
    }
}
