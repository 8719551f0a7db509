package com.delta.redirects.resolve.service;

import com.delta.redirects.config.ResolverProperties;
import com.delta.redirects.resolve.http.ProbeHttpClient;
import com.delta.redirects.resolve.model.DeliveryItem;
import com.delta.redirects.resolve.model.DeliverySummary;
import com.delta.redirects.resolve.model.HttpFetchResult;
import com.delta.redirects.resolve.model.RedirectRecord;
import com.delta.redirects.resolve.persistence.RedirectJdbcRepository;
import com.delta.redirects.resolve.util.UrlUtils;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Pushes stored redirects to the remote redirect API as site-relative paths.
 */
@Service
public class RedirectDeliveryService {
    private static final Logger log = LoggerFactory.getLogger(RedirectDeliveryService.class);

    private final RedirectJdbcRepository repository;
    private final ProbeHttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final ResolverProperties properties;

    public RedirectDeliveryService(
        RedirectJdbcRepository repository,
        ProbeHttpClient httpClient,
        ObjectMapper objectMapper,
        ResolverProperties properties
    ) {
        this.repository = repository;
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
        this.properties = properties;
    }

    public DeliverySummary deliver(Double minPercent) {
        ResolverProperties.Delivery delivery = properties.getDelivery();
        if (isBlank(delivery.getApiUrl()) || isBlank(delivery.getApiKey())) {
            log.warn("Delivery skipped: API url or key not configured");
            return DeliverySummary.notSent("delivery_not_configured");
        }
        double threshold = minPercent == null ? properties.getExport().getDefaultMinPercent() : minPercent;
        RedirectExportService.validatePercent(threshold);

        List<DeliveryItem> items = toItems(repository.findRedirectsByMinPercent(threshold));
        if (items.isEmpty()) {
            log.info("Delivery skipped: no redirects with percent >= {}", threshold);
            return DeliverySummary.notSent("no_redirects");
        }
        String body;
        try {
            body = objectMapper.writeValueAsString(items);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize delivery payload", e);
        }

        log.info("Delivering {} redirects to {}", items.size(), delivery.getApiUrl());
        HttpFetchResult result = httpClient.postJson(
            delivery.getApiUrl(),
            body,
            delivery.getApiKey(),
            delivery.getRequestTimeoutSeconds()
        );
        if (!result.hasResponse()) {
            log.warn("Delivery failed: {} {}", result.errorCode(), result.errorMessage());
            return new DeliverySummary(false, items.size(), 0, 0, 0, null, result.errorCode());
        }
        if (!result.isSuccessful()) {
            log.warn("Delivery rejected with HTTP {}", result.statusCode());
            return new DeliverySummary(false, items.size(), 0, 0, 0, result.statusCode(), "http_" + result.statusCode());
        }

        int created = 0;
        int updated = 0;
        int total = 0;
        try {
            JsonNode response = objectMapper.readTree(result.body() == null ? "" : result.body());
            if (response != null) {
                created = response.path("created").asInt(0);
                updated = response.path("updated").asInt(0);
                total = response.path("total").asInt(0);
            }
        } catch (JsonProcessingException e) {
            log.warn("Delivery response was not JSON: {}", e.getOriginalMessage());
        }
        log.info("Delivery finished: created={} updated={} total={}", created, updated, total);
        return new DeliverySummary(true, items.size(), created, updated, total, result.statusCode(), null);
    }

    static List<DeliveryItem> toItems(List<RedirectRecord> redirects) {
        List<DeliveryItem> items = new ArrayList<>(redirects.size());
        for (RedirectRecord redirect : redirects) {
            items.add(new DeliveryItem(
                UrlUtils.toPath(redirect.from()),
                UrlUtils.toPath(redirect.to()),
                redirect.percent()
            ));
        }
        return items;
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
