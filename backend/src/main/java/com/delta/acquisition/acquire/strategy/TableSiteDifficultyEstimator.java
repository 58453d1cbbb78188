package com.delta.acquisition.acquire.strategy;

import com.delta.acquisition.acquire.jobs.PostingFields;
import com.delta.acquisition.acquire.model.OutcomeKind;
import com.delta.acquisition.config.AcquisitionProperties;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStreamReader;
import java.io.Reader;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Difficulty from a curated CSV table ({@code domain,difficulty}), overridden by configured sites, and adjusted
 * by observed outcomes with an exponential moving average.
 */
@Component
public class TableSiteDifficultyEstimator implements SiteDifficultyEstimator {
    private static final Logger log = LoggerFactory.getLogger(TableSiteDifficultyEstimator.class);

    private final Map<String, Double> table = new ConcurrentHashMap<>();
    private final Map<String, Double> learned = new ConcurrentHashMap<>();
    private final double defaultDifficulty;
    private final double learningRate;

    public TableSiteDifficultyEstimator(AcquisitionProperties properties, ResourceLoader resourceLoader) {
        this.defaultDifficulty = properties.getStrategy().getDefaultDifficulty();
        this.learningRate = properties.getStrategy().getLearningRate();
        loadTable(properties.getStrategy().getDifficultyTable(), resourceLoader);
        for (AcquisitionProperties.Site site : properties.getSites().values()) {
            String host = hostOf(site.getUrl());
            if (host != null && site.getDifficulty() != null) {
                table.put(host, site.getDifficulty());
            }
        }
    }

    @Override
    public double estimate(String host) {
        String normalized = normalizeHost(host);
        if (normalized == null) {
            return defaultDifficulty;
        }
        Double learnedValue = learned.get(normalized);
        if (learnedValue != null) {
            return learnedValue;
        }
        return lookup(normalized);
    }

    @Override
    public void observe(String host, OutcomeKind outcome) {
        String normalized = normalizeHost(host);
        if (normalized == null || outcome == null) {
            return;
        }
        double target;
        if (outcome == OutcomeKind.BLOCKED) {
            target = 1.0;
        } else if (outcome == OutcomeKind.SUCCESS) {
            target = 0.0;
        } else {
            return;
        }
        learned.compute(normalized, (key, current) -> {
            double base = current == null ? lookup(key) : current;
            double next = base + learningRate * (target - base);
            return Math.max(0.0, Math.min(1.0, next));
        });
    }

    private double lookup(String host) {
        String candidate = host;
        while (candidate != null) {
            Double value = table.get(candidate);
            if (value != null) {
                return value;
            }
            int dot = candidate.indexOf('.');
            if (dot < 0 || candidate.indexOf('.', dot + 1) < 0) {
                break;
            }
            candidate = candidate.substring(dot + 1);
        }
        return defaultDifficulty;
    }

    private void loadTable(String location, ResourceLoader resourceLoader) {
        if (location == null || location.isBlank()) {
            return;
        }
        Resource resource = resourceLoader.getResource(location);
        if (!resource.exists()) {
            log.warn("Site difficulty table {} not found, using default {}", location, defaultDifficulty);
            return;
        }
        CSVFormat format = CSVFormat.DEFAULT.builder()
            .setHeader()
            .setSkipHeaderRecord(true)
            .setIgnoreSurroundingSpaces(true)
            .setCommentMarker('#')
            .build();
        try (Reader reader = new InputStreamReader(resource.getInputStream(), StandardCharsets.UTF_8);
             CSVParser parser = format.parse(reader)) {
            for (CSVRecord record : parser) {
                String host = normalizeHost(record.get("domain"));
                Double difficulty = parseDifficulty(record.get("difficulty"));
                if (host != null && difficulty != null) {
                    table.put(host, difficulty);
                }
            }
            log.info("Loaded {} site difficulty entries from {}", table.size(), location);
        } catch (IOException | IllegalArgumentException e) {
            log.warn("Failed to load site difficulty table {}", location, e);
        }
    }

    private static Double parseDifficulty(String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        try {
            double value = Double.parseDouble(raw.trim());
            if (Double.isNaN(value)) {
                return null;
            }
            return Math.max(0.0, Math.min(1.0, value));
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private static String hostOf(String url) {
        URI uri = PostingFields.safeUri(url);
        return uri == null ? null : normalizeHost(uri.getHost());
    }

    static String normalizeHost(String host) {
        if (host == null || host.isBlank()) {
            return null;
        }
        String normalized = host.trim().toLowerCase(Locale.ROOT);
        if (normalized.startsWith("www.")) {
            normalized = normalized.substring(4);
        }
        return normalized.isEmpty() ? null : normalized;
    }
}
