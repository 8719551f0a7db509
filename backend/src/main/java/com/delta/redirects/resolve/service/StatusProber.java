package com.delta.redirects.resolve.service;

import com.delta.redirects.resolve.http.ProbeHttpClient;
import com.delta.redirects.resolve.model.HttpFetchResult;
import com.delta.redirects.resolve.model.ProbeResult;
import com.delta.redirects.resolve.util.UrlUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Turns one HTTP probe into a {@link ProbeResult}: the last status received, plus the
 * effective URL when redirects led somewhere other than the input.
 */
@Service
public class StatusProber {
    private static final Logger log = LoggerFactory.getLogger(StatusProber.class);

    private final ProbeHttpClient httpClient;

    public StatusProber(ProbeHttpClient httpClient) {
        this.httpClient = httpClient;
    }

    public ProbeResult probe(String url) {
        HttpFetchResult fetch = httpClient.probe(url);
        if (!fetch.hasResponse()) {
            log.warn("Probe failed for {}: {} {}", url, fetch.errorCode(), fetch.errorMessage());
            return ProbeResult.failed();
        }
        if (fetch.errorCode() != null) {
            log.debug("Partial response for {}: status={} error={}", url, fetch.statusCode(), fetch.errorCode());
        }
        String finalUrl = null;
        if (fetch.redirectsFollowed() > 0 && fetch.finalUri() != null) {
            String effective = fetch.finalUri().toString();
            if (!UrlUtils.sameIgnoringTrailingSlash(url, effective)) {
                finalUrl = effective;
            }
        }
        return new ProbeResult(fetch.statusCode(), finalUrl);
    }
}
