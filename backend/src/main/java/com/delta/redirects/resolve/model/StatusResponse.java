package com.delta.redirects.resolve.model;

import java.util.Map;

public record StatusResponse(
    boolean dbConnectivity, Map<String, Long> counts, ResolutionRunMeta mostRecentRun) {}
