package com.delta.redirects.resolve.model;

import java.time.Instant;

public record ResolutionRunMeta(
    long runId,
    Instant startedAt,
    Instant finishedAt,
    String status,
    String notes,
    int processed,
    int productMatches,
    int catalogMatches,
    int redirectedTo404,
    int skipped,
    int probeFailures) {}
