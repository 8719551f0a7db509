package com.delta.redirects.resolve.model;

import java.time.Instant;

public record ResolutionRunSummary(
    long runId,
    Instant startedAt,
    Instant finishedAt,
    String status,
    String notes,
    int errorsLoaded,
    int productCodesLoaded,
    int catalogCodesLoaded,
    StatusSweepSummary statusSweep,
    ResolutionSummary resolution) {}
