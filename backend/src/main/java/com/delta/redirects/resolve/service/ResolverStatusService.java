package com.delta.redirects.resolve.service;

import com.delta.redirects.resolve.model.StatusResponse;
import com.delta.redirects.resolve.persistence.RedirectJdbcRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.Map;

@Service
public class ResolverStatusService {
    private static final Logger log = LoggerFactory.getLogger(ResolverStatusService.class);

    private final RedirectJdbcRepository repository;

    public ResolverStatusService(RedirectJdbcRepository repository) {
        this.repository = repository;
    }

    public StatusResponse getStatus() {
        boolean dbConnected;
        try {
            dbConnected = repository.isDbReachable();
        } catch (Exception e) {
            log.warn("Database connectivity check failed", e);
            dbConnected = false;
        }
        if (!dbConnected) {
            return new StatusResponse(false, Map.of(), null);
        }
        return new StatusResponse(true, repository.tableCounts(), repository.findMostRecentRun());
    }
}
