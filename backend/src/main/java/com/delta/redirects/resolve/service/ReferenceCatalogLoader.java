package com.delta.redirects.resolve.service;

import com.delta.redirects.resolve.model.UrlCategory;
import com.delta.redirects.resolve.persistence.RedirectJdbcRepository;
import com.delta.redirects.resolve.util.PathUtils;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

@Service
public class ReferenceCatalogLoader {
    private static final Logger log = LoggerFactory.getLogger(ReferenceCatalogLoader.class);

    private final ObjectMapper objectMapper;
    private final RedirectJdbcRepository repository;

    public ReferenceCatalogLoader(ObjectMapper objectMapper, RedirectJdbcRepository repository) {
        this.objectMapper = objectMapper;
        this.repository = repository;
    }

    /**
     * Reads the codes of one category and stores the ones not yet known.
     *
     * @return number of distinct codes read from the file
     */
    public int load(UrlCategory category, String configuredPath) {
        List<String> codes = readCodes(configuredPath);
        int inserted = repository.insertCodes(category, codes);
        log.info("Loaded {} {} codes ({} new)", codes.size(), category.pathSegment(), inserted);
        return codes.size();
    }

    public List<String> readCodes(String configuredPath) {
        if (configuredPath == null || configuredPath.isBlank()) {
            throw new SourceFileException("Reference source path is not configured");
        }
        Path path = PathUtils.resolvePath(configuredPath);
        if (!Files.isRegularFile(path)) {
            throw new SourceFileException("Reference source file not found: " + path);
        }
        JsonNode root;
        try {
            root = objectMapper.readTree(path.toFile());
        } catch (IOException e) {
            throw new SourceFileException("Unreadable reference source " + path, e);
        }
        if (root == null || !root.isArray()) {
            throw new SourceFileException("Reference source " + path + " is not a JSON array");
        }
        Set<String> codes = new LinkedHashSet<>();
        for (JsonNode row : root) {
            JsonNode code = row.path("code");
            if (code.isTextual() && !code.asText().isEmpty()) {
                codes.add(code.asText());
            }
        }
        return new ArrayList<>(codes);
    }
}
