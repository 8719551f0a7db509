package com.delta.redirects.resolve.model;

import java.util.Map;

public record ExportSummary(
    double minPercent,
    int exportedCount,
    String resultFile,
    Map<String, Integer> percentDistribution) {}
