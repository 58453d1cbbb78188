package com.delta.acquisition.acquire.jobs;

import com.delta.acquisition.acquire.model.NormalizedJobPosting;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

import static com.delta.acquisition.acquire.jobs.PostingFields.firstNonBlank;
import static com.delta.acquisition.acquire.jobs.PostingFields.text;

/**
 * Pulls schema.org {@code JobPosting} objects out of JSON-LD script blocks.
 */
@Component
public class JobPostingExtractor {
    public static final String METHOD = "json_ld";

    private static final Logger log = LoggerFactory.getLogger(JobPostingExtractor.class);

    private final ObjectMapper objectMapper;
    private final PostingNormalizer normalizer;

    public JobPostingExtractor(ObjectMapper objectMapper, PostingNormalizer normalizer) {
        this.objectMapper = objectMapper;
        this.normalizer = normalizer;
    }

    public List<NormalizedJobPosting> extract(String html, String sourceUrl) {
        if (html == null || html.isBlank()) {
            return List.of();
        }

        Document document = Jsoup.parse(html);
        List<JsonNode> jobPostingNodes = new ArrayList<>();
        for (Element script : document.select("script[type=application/ld+json]")) {
            String payload = script.data();
            if (payload == null || payload.isBlank()) {
                payload = script.html();
            }
            if (payload == null || payload.isBlank()) {
                continue;
            }
            try {
                JsonNode root = objectMapper.readTree(payload);
                collectJobPostingNodes(root, jobPostingNodes);
            } catch (JsonProcessingException e) {
                log.debug("Skipping malformed JSON-LD block on {}: {}", sourceUrl, e.getOriginalMessage());
            }
        }

        List<NormalizedJobPosting> postings = new ArrayList<>();
        for (JsonNode node : jobPostingNodes) {
            NormalizedJobPosting posting = normalize(node, sourceUrl);
            if (posting != null) {
                postings.add(posting);
            }
        }
        return postings;
    }

    /**
     * A posting is complete when it names both the role and the hiring organization.
     */
    public static boolean isComplete(NormalizedJobPosting posting) {
        return posting != null
            && posting.title() != null && !posting.title().isBlank()
            && posting.orgName() != null && !posting.orgName().isBlank();
    }

    private void collectJobPostingNodes(JsonNode node, List<JsonNode> out) {
        if (node == null || node.isNull()) {
            return;
        }
        if (node.isObject()) {
            if (isJobPostingType(node.get("@type"))) {
                out.add(node);
            }
            node.fields().forEachRemaining(entry -> {
                JsonNode value = entry.getValue();
                if (value.isArray() || value.isObject()) {
                    collectJobPostingNodes(value, out);
                }
            });
            return;
        }
        if (node.isArray()) {
            for (JsonNode child : node) {
                collectJobPostingNodes(child, out);
            }
        }
    }

    private boolean isJobPostingType(JsonNode typeNode) {
        if (typeNode == null || typeNode.isNull()) {
            return false;
        }
        if (typeNode.isTextual()) {
            return "jobposting".equalsIgnoreCase(typeNode.asText());
        }
        if (typeNode.isArray()) {
            for (JsonNode child : typeNode) {
                if (child.isTextual() && "jobposting".equalsIgnoreCase(child.asText())) {
                    return true;
                }
            }
        }
        return false;
    }

    private NormalizedJobPosting normalize(JsonNode node, String sourceUrl) {
        String title = firstNonBlank(text(node, "title"), text(node, "name"));
        String orgName = text(node.path("hiringOrganization"), "name");
        String description = PostingFields.htmlToText(text(node, "description"));
        return normalizer.build(
            sourceUrl,
            firstNonBlank(text(node, "url"), sourceUrl),
            title,
            orgName,
            extractLocation(node.get("jobLocation")),
            extractEmploymentType(node.get("employmentType")),
            PostingFields.parseIsoDate(text(node, "datePosted")),
            description,
            extractSalary(node.get("baseSalary")),
            extractIdentifier(node.get("identifier")),
            METHOD,
            1.0
        );
    }

    private String extractIdentifier(JsonNode identifierNode) {
        if (identifierNode == null || identifierNode.isNull()) {
            return null;
        }
        if (identifierNode.isTextual() || identifierNode.isNumber()) {
            return identifierNode.asText();
        }
        if (identifierNode.isObject()) {
            return firstNonBlank(
                text(identifierNode, "value"),
                text(identifierNode, "name"),
                text(identifierNode, "propertyID")
            );
        }
        return identifierNode.toString();
    }

    private String extractSalary(JsonNode salaryNode) {
        if (salaryNode == null || salaryNode.isNull() || !salaryNode.isObject()) {
            return null;
        }
        String currency = text(salaryNode, "currency");
        JsonNode value = salaryNode.path("value");
        String min;
        String max;
        String unit;
        if (value.isObject()) {
            min = firstNonBlank(text(value, "minValue"), text(value, "value"));
            max = text(value, "maxValue");
            unit = text(value, "unitText");
        } else {
            min = text(salaryNode, "value");
            max = null;
            unit = null;
        }
        if (min == null && max == null) {
            return null;
        }
        StringBuilder out = new StringBuilder();
        out.append(min == null ? max : min);
        if (min != null && max != null && !max.equals(min)) {
            out.append(" - ").append(max);
        }
        if (currency != null) {
            out.append(' ').append(currency);
        }
        if (unit != null) {
            out.append(" / ").append(unit.toLowerCase(Locale.ROOT));
        }
        return out.toString();
    }

    private String extractLocation(JsonNode jobLocation) {
        if (jobLocation == null || jobLocation.isNull()) {
            return null;
        }
        LinkedHashSet<String> locations = new LinkedHashSet<>();
        collectLocationStrings(jobLocation, locations);
        if (locations.isEmpty()) {
            return null;
        }
        return String.join(" | ", locations);
    }

    private void collectLocationStrings(JsonNode node, LinkedHashSet<String> out) {
        if (node == null || node.isNull()) {
            return;
        }
        if (node.isArray()) {
            for (JsonNode item : node) {
                collectLocationStrings(item, out);
            }
            return;
        }
        if (!node.isObject()) {
            if (node.isTextual()) {
                String val = node.asText().trim();
                if (!val.isEmpty()) {
                    out.add(val);
                }
            }
            return;
        }

        JsonNode address = node.has("address") ? node.get("address") : node;
        List<String> parts = new ArrayList<>();
        addIfPresent(parts, text(address, "addressLocality"));
        addIfPresent(parts, text(address, "addressRegion"));
        addIfPresent(parts, text(address, "addressCountry"));

        if (!parts.isEmpty()) {
            out.add(String.join(", ", parts));
            return;
        }

        String fallback = firstNonBlank(text(node, "name"), text(address, "name"));
        if (fallback != null) {
            out.add(fallback);
        }
    }

    private String extractEmploymentType(JsonNode node) {
        if (node == null || node.isNull()) {
            return null;
        }
        if (node.isTextual()) {
            return node.asText();
        }
        if (node.isArray()) {
            List<String> values = new ArrayList<>();
            for (JsonNode item : node) {
                if (item.isTextual()) {
                    values.add(item.asText());
                }
            }
            if (!values.isEmpty()) {
                return values.stream().distinct().collect(Collectors.joining(", "));
            }
        }
        return node.toString();
    }

    private void addIfPresent(List<String> list, String value) {
        if (value != null && !value.isBlank()) {
            list.add(value.trim());
        }
    }
}
