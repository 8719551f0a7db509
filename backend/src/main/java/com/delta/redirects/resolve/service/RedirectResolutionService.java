package com.delta.redirects.resolve.service;

import com.delta.redirects.config.ResolverProperties;
import com.delta.redirects.resolve.match.BestMatchSelector;
import com.delta.redirects.resolve.model.ErrorRecord;
import com.delta.redirects.resolve.model.ProbeResult;
import com.delta.redirects.resolve.model.RedirectCandidate;
import com.delta.redirects.resolve.model.RedirectRecord;
import com.delta.redirects.resolve.model.ResolutionSummary;
import com.delta.redirects.resolve.model.UrlCategory;
import com.delta.redirects.resolve.model.UrlClassification;
import com.delta.redirects.resolve.persistence.RedirectJdbcRepository;
import com.delta.redirects.resolve.util.UrlClassifier;
import com.delta.redirects.resolve.util.UrlUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Matches every stored error URL against the reference code of its category and
 * produces redirect records. URLs that redirected elsewhere are re-probed once and
 * matched on the redirect target, while the record still points from the original URL.
 */
@Service
public class RedirectResolutionService {
    private static final Logger log = LoggerFactory.getLogger(RedirectResolutionService.class);

    public static final int ERROR_STATUS_THRESHOLD = 400;
    private static final int NOT_FOUND = 404;
    private static final int PROGRESS_LOG_EVERY = 1000;

    private final RedirectJdbcRepository repository;
    private final StatusProber statusProber;
    private final ResolverProperties properties;

    public RedirectResolutionService(
        RedirectJdbcRepository repository,
        StatusProber statusProber,
        ResolverProperties properties
    ) {
        this.repository = repository;
        this.statusProber = statusProber;
        this.properties = properties;
    }

    public ResolutionSummary resolve(Long runId) {
        List<ErrorRecord> errors = repository.findByMinStatus(ERROR_STATUS_THRESHOLD);
        Map<UrlCategory, BestMatchSelector> selectors = new EnumMap<>(UrlCategory.class);
        for (UrlCategory category : UrlCategory.values()) {
            selectors.put(category, BestMatchSelector.of(repository.findAllCodes(category)));
        }
        log.info(
            "Resolution sweep started: errors={} productCodes={} catalogCodes={}",
            errors.size(),
            selectors.get(UrlCategory.PRODUCT).size(),
            selectors.get(UrlCategory.CATALOG).size()
        );

        List<RedirectRecord> redirects = new ArrayList<>();
        int processed = 0;
        int productMatches = 0;
        int catalogMatches = 0;
        int redirectedTo404 = 0;
        int skippedUnclassified = 0;
        int skippedDecodeFailure = 0;
        int skippedNoMatch = 0;
        int skippedHealthyRedirect = 0;
        int visited = 0;

        for (ErrorRecord error : errors) {
            visited++;
            if (visited % PROGRESS_LOG_EVERY == 0) {
                log.info("Resolution progress: {}/{} redirects={}", visited, errors.size(), redirects.size());
            }

            String matchUrl = error.url();
            if (error.finalUrl() != null) {
                ProbeResult reprobe = statusProber.probe(error.finalUrl());
                if (reprobe.hasStatus() && reprobe.status() == NOT_FOUND) {
                    repository.updateStatus(error.finalUrl(), reprobe.status(), reprobe.finalUrl());
                    redirectedTo404++;
                } else if (reprobe.hasStatus() && reprobe.status() < ERROR_STATUS_THRESHOLD) {
                    log.debug("Skipping {}: redirect target {} answers {}", error.url(), error.finalUrl(), reprobe.status());
                    skippedHealthyRedirect++;
                    continue;
                }
                matchUrl = error.finalUrl();
            }

            UrlClassification classification = UrlClassifier.classify(matchUrl);
            if (classification.decodeFailed()) {
                log.debug("Skipping {}: malformed percent-encoding", matchUrl);
                skippedDecodeFailure++;
                continue;
            }
            if (!classification.isResolvable()) {
                log.debug("Skipping {}: no category or code", matchUrl);
                skippedUnclassified++;
                continue;
            }
            String baseUrl = targetBaseUrl(error.url());
            if (baseUrl == null) {
                log.debug("Skipping {}: no base URL for the redirect target", error.url());
                skippedUnclassified++;
                continue;
            }

            processed++;
            UrlCategory category = classification.category();
            RedirectCandidate candidate = selectors.get(category).bestMatch(classification.code());
            if (candidate == null) {
                log.debug("Skipping {}: no {} code resembles {}", error.url(), category.pathSegment(), classification.code());
                skippedNoMatch++;
                continue;
            }
            redirects.add(new RedirectRecord(
                error.url(),
                UrlUtils.targetUrl(baseUrl, category.pathSegment(), candidate.code()),
                candidate.percent()
            ));
            if (category == UrlCategory.PRODUCT) {
                productMatches++;
            } else {
                catalogMatches++;
            }
        }

        repository.insertRedirects(runId, redirects);

        int skipped = skippedUnclassified + skippedDecodeFailure + skippedNoMatch + skippedHealthyRedirect;
        ResolutionSummary summary = new ResolutionSummary(
            errors.size(),
            processed,
            productMatches,
            catalogMatches,
            redirectedTo404,
            skipped,
            skippedUnclassified,
            skippedDecodeFailure,
            skippedNoMatch,
            skippedHealthyRedirect,
            List.copyOf(redirects)
        );
        log.info(
            "Resolution sweep finished: processed={} productMatches={} catalogMatches={} redirectedTo404={} skipped={}",
            summary.processed(),
            summary.productMatches(),
            summary.catalogMatches(),
            summary.redirectedTo404(),
            summary.skipped()
        );
        return summary;
    }

    private String targetBaseUrl(String originalUrl) {
        String configured = properties.getTargetBaseUrl();
        if (configured != null && !configured.isBlank()) {
            return configured.trim();
        }
        return UrlUtils.origin(originalUrl);
    }
}
