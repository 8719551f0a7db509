package com.delta.redirects.resolve.model;

public record StatusSweepSummary(
    int total,
    int batches,
    int succeeded,
    int failed,
    int redirected) {}
