package com.delta.redirects.resolve.model;

import java.util.List;

public record ResolutionSummary(
    int errorRecords,
    int processed,
    int productMatches,
    int catalogMatches,
    int redirectedTo404,
    int skipped,
    int skippedUnclassified,
    int skippedDecodeFailure,
    int skippedNoMatch,
    int skippedHealthyRedirect,
    List<RedirectRecord> redirects) {

    public int redirectCount() {
        return redirects == null ? 0 : redirects.size();
    }
}
