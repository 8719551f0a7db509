package com.delta.redirects.resolve.service;

import com.delta.redirects.config.ResolverProperties;
import com.delta.redirects.resolve.model.ExportSummary;
import com.delta.redirects.resolve.model.RedirectRecord;
import com.delta.redirects.resolve.persistence.RedirectJdbcRepository;
import com.delta.redirects.resolve.util.PathUtils;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

@Service
public class RedirectExportService {
    private static final Logger log = LoggerFactory.getLogger(RedirectExportService.class);

    private final RedirectJdbcRepository repository;
    private final ObjectMapper objectMapper;
    private final ResolverProperties properties;

    public RedirectExportService(
        RedirectJdbcRepository repository,
        ObjectMapper objectMapper,
        ResolverProperties properties
    ) {
        this.repository = repository;
        this.objectMapper = objectMapper;
        this.properties = properties;
    }

    public ExportSummary export(Double minPercent) {
        return export(minPercent, properties.getExport().getResultFile());
    }

    /**
     * Writes redirects scoring at least {@code minPercent} as a pretty-printed
     * {@code {"from": "to"}} JSON object, best scores first. A later record with the same
     * {@code from} replaces the earlier one.
     */
    public ExportSummary export(Double minPercent, String resultFile) {
        double threshold = minPercent == null ? properties.getExport().getDefaultMinPercent() : minPercent;
        validatePercent(threshold);
        List<RedirectRecord> redirects = repository.findRedirectsByMinPercent(threshold);

        Map<String, String> mapping = new LinkedHashMap<>();
        for (RedirectRecord redirect : redirects) {
            mapping.put(redirect.from(), redirect.to());
        }
        Path path = PathUtils.resolvePath(resultFile);
        try {
            Path parent = path.getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            objectMapper.writerWithDefaultPrettyPrinter().writeValue(path.toFile(), mapping);
        } catch (IOException e) {
            throw new SourceFileException("Failed to write export file " + path, e);
        }

        Map<String, Integer> distribution = percentDistribution(redirects);
        log.info("Exported {} redirects with percent >= {} to {}", mapping.size(), threshold, path);
        distribution.forEach((bucket, count) -> log.info("  {}: {}", bucket, count));
        return new ExportSummary(threshold, mapping.size(), path.toString(), distribution);
    }

    public static void validatePercent(double percent) {
        if (Double.isNaN(percent) || percent < 0.0 || percent > 100.0) {
            throw new IllegalArgumentException("minPercent must be between 0 and 100, got " + percent);
        }
    }

    static Map<String, Integer> percentDistribution(List<RedirectRecord> redirects) {
        TreeMap<Integer, Integer> buckets = new TreeMap<>();
        for (RedirectRecord redirect : redirects) {
            int bucket = (int) Math.floor(redirect.percent() / 10.0) * 10;
            buckets.merge(bucket, 1, Integer::sum);
        }
        Map<String, Integer> labelled = new LinkedHashMap<>();
        for (Map.Entry<Integer, Integer> entry : buckets.descendingMap().entrySet()) {
            labelled.put(entry.getKey() + "-" + (entry.getKey() + 9) + "%", entry.getValue());
        }
        return labelled;
    }
}
