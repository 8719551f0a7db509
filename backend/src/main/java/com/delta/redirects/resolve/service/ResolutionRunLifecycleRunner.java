package com.delta.redirects.resolve.service;

import com.delta.redirects.config.ResolverProperties;
import com.delta.redirects.resolve.model.ResolutionRunMeta;
import com.delta.redirects.resolve.persistence.RedirectJdbcRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Closes out RUNNING runs left behind by a previous process.
 */
@Component
@Order(0)
public class ResolutionRunLifecycleRunner implements ApplicationRunner {
    private static final Logger log = LoggerFactory.getLogger(ResolutionRunLifecycleRunner.class);

    private final RedirectJdbcRepository repository;
    private final ResolverProperties properties;

    public ResolutionRunLifecycleRunner(RedirectJdbcRepository repository, ResolverProperties properties) {
        this.repository = repository;
        this.properties = properties;
    }

    @Override
    public void run(ApplicationArguments args) {
        abortStaleRuns(Instant.now());
    }

    public int abortStaleRuns(Instant now) {
        boolean dbConnected;
        try {
            dbConnected = repository.isDbReachable();
        } catch (Exception e) {
            dbConnected = false;
        }
        if (!dbConnected) {
            log.warn("Skipping resolution run cleanup because database is unreachable");
            return 0;
        }

        Instant cutoff = now.minus(Duration.ofMinutes(properties.getStaleRunMinutes()));
        List<ResolutionRunMeta> running = repository.findRunningRuns();
        int aborted = 0;
        for (ResolutionRunMeta run : running) {
            if (run.startedAt().isAfter(cutoff)) {
                continue;
            }
            repository.completeRun(
                run.runId(),
                now,
                "ABORTED",
                "aborted_on_startup_stale",
                run.processed(),
                run.productMatches(),
                run.catalogMatches(),
                run.redirectedTo404(),
                run.skipped(),
                run.probeFailures()
            );
            aborted++;
            log.info("Aborted stale resolution run {} startedAt={}", run.runId(), run.startedAt());
        }
        return aborted;
    }
}
