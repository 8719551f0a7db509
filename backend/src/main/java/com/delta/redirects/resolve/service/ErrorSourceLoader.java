package com.delta.redirects.resolve.service;

import com.delta.redirects.resolve.util.PathUtils;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Reads the list of failing URLs, either a JSON array of {@code {"url": ...}} objects or a
 * CSV file with a {@code url} header. Order is kept and blank entries are dropped.
 */
@Service
public class ErrorSourceLoader {
    private static final Logger log = LoggerFactory.getLogger(ErrorSourceLoader.class);

    private final ObjectMapper objectMapper;

    public ErrorSourceLoader(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public List<String> load(String configuredPath) {
        if (configuredPath == null || configuredPath.isBlank()) {
            throw new SourceFileException("Error source path is not configured");
        }
        Path path = PathUtils.resolvePath(configuredPath);
        if (!Files.isRegularFile(path)) {
            throw new SourceFileException("Error source file not found: " + path);
        }
        List<String> urls = path.getFileName().toString().toLowerCase(Locale.ROOT).endsWith(".csv")
            ? readCsv(path)
            : readJson(path);
        log.info("Loaded {} error urls from {}", urls.size(), path);
        return urls;
    }

    private List<String> readJson(Path path) {
        JsonNode root;
        try {
            root = objectMapper.readTree(path.toFile());
        } catch (IOException e) {
            throw new SourceFileException("Unreadable error source " + path, e);
        }
        if (root == null || !root.isArray()) {
            throw new SourceFileException("Error source " + path + " is not a JSON array");
        }
        List<String> urls = new ArrayList<>();
        int skipped = 0;
        for (JsonNode row : root) {
            JsonNode url = row.path("url");
            if (url.isTextual() && !url.asText().isBlank()) {
                urls.add(url.asText().trim());
            } else {
                skipped++;
            }
        }
        if (skipped > 0) {
            log.debug("Skipped {} error source rows without a url in {}", skipped, path);
        }
        return urls;
    }

    private List<String> readCsv(Path path) {
        List<String> urls = new ArrayList<>();
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8);
             CSVParser parser = csvParser(reader)) {
            if (parser.getHeaderMap().keySet().stream().noneMatch(h -> h != null && h.trim().equalsIgnoreCase("url"))) {
                throw new SourceFileException("Error source " + path + " has no url column");
            }
            for (CSVRecord record : parser) {
                String url = getColumn(record, "url");
                if (url != null) {
                    urls.add(url);
                }
            }
        } catch (IOException e) {
            throw new SourceFileException("Unreadable error source " + path, e);
        }
        return urls;
    }

    private CSVParser csvParser(Reader reader) throws IOException {
        CSVFormat format = CSVFormat.DEFAULT.builder()
            .setHeader()
            .setSkipHeaderRecord(true)
            .setIgnoreSurroundingSpaces(true)
            .build();
        return format.parse(reader);
    }

    private String getColumn(CSVRecord record, String name) {
        for (String header : record.toMap().keySet()) {
            if (header != null && header.trim().equalsIgnoreCase(name)) {
                String value = record.get(header);
                if (value == null) {
                    return null;
                }
                value = value.trim();
                return value.isEmpty() ? null : value;
            }
        }
        return null;
    }
}
