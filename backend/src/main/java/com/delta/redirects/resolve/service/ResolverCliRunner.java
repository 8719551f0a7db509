package com.delta.redirects.resolve.service;

import com.delta.redirects.config.ResolverProperties;
import com.delta.redirects.resolve.model.ExportSummary;
import com.delta.redirects.resolve.model.ResolutionRunRequest;
import com.delta.redirects.resolve.model.ResolutionRunSummary;
import com.delta.redirects.resolve.model.ResolutionSummary;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

@Component
@Order(10)
public class ResolverCliRunner implements ApplicationRunner {
    private static final Logger log = LoggerFactory.getLogger(ResolverCliRunner.class);

    private final ResolverProperties properties;
    private final RedirectRunOrchestratorService orchestratorService;
    private final RedirectExportService exportService;
    private final ConfigurableApplicationContext applicationContext;

    public ResolverCliRunner(
        ResolverProperties properties,
        RedirectRunOrchestratorService orchestratorService,
        RedirectExportService exportService,
        ConfigurableApplicationContext applicationContext
    ) {
        this.properties = properties;
        this.orchestratorService = orchestratorService;
        this.exportService = exportService;
        this.applicationContext = applicationContext;
    }

    @Override
    public void run(ApplicationArguments args) {
        if (!properties.getCli().isRun()) {
            return;
        }

        ResolutionRunSummary summary = orchestratorService.run(ResolutionRunRequest.defaults());
        log.info("Resolution run {} completed with status {} ({})", summary.runId(), summary.status(), summary.notes());
        ResolutionSummary resolution = summary.resolution();
        if (resolution != null) {
            log.info(
                "Summary: processed={} productMatches={} catalogMatches={} redirectedTo404={} skipped={} "
                    + "(unclassified={}, decodeFailures={}, noMatch={}, healthyRedirects={})",
                resolution.processed(),
                resolution.productMatches(),
                resolution.catalogMatches(),
                resolution.redirectedTo404(),
                resolution.skipped(),
                resolution.skippedUnclassified(),
                resolution.skippedDecodeFailure(),
                resolution.skippedNoMatch(),
                resolution.skippedHealthyRedirect()
            );
        }

        if (properties.getCli().isExportAfterRun() && "COMPLETED".equals(summary.status())) {
            ExportSummary export = exportService.export(null);
            log.info("Exported {} redirects to {}", export.exportedCount(), export.resultFile());
        }

        if (properties.getCli().isExitAfterRun()) {
            int exitCode = SpringApplication.exit(applicationContext, () -> "COMPLETED".equals(summary.status()) ? 0 : 1);
            System.exit(exitCode);
        }
    }
}
