package com.delta.acquisition.acquire.vision;

import com.delta.acquisition.acquire.model.ActionableElement;
import com.delta.acquisition.acquire.model.BoundingBox;
import com.delta.acquisition.acquire.model.CandidateField;
import com.delta.acquisition.acquire.model.JobListingCandidate;
import com.delta.acquisition.acquire.model.SalaryRange;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import static com.delta.acquisition.acquire.jobs.PostingFields.firstNonBlank;
import static com.delta.acquisition.acquire.jobs.PostingFields.text;

/**
 * Reads the JSON a vision model returns, either bare or inside a fenced code block.
 */
@Component
public class VisionResponseParser {
    private static final Pattern FENCED_JSON = Pattern.compile("```(?:json)?\\s*(.*?)\\s*```", Pattern.DOTALL);

    private final ObjectMapper objectMapper;

    public VisionResponseParser(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public record Parsed(
        List<JobListingCandidate> candidates,
        ActionableElement actionableElement,
        double confidence
    ) {
    }

    /**
     * Candidates missing per-field confidence get {@code defaultConfidence}. The overall confidence is the mean
     * over every populated field, or {@code defaultConfidence} when nothing was found.
     */
    public Parsed parse(String modelText, double defaultConfidence) {
        JsonNode root = readJson(modelText);
        List<JobListingCandidate> candidates = new ArrayList<>();
        JsonNode jobs = root.has("jobs") ? root.get("jobs") : root.get("job_listings");
        if (jobs != null && jobs.isArray()) {
            for (JsonNode job : jobs) {
                JobListingCandidate candidate = toCandidate(job, defaultConfidence);
                if (candidate != null) {
                    candidates.add(candidate);
                }
            }
        } else if (root.isObject() && (root.hasNonNull("title") || root.hasNonNull("job_title"))) {
            JobListingCandidate candidate = toCandidate(root, defaultConfidence);
            if (candidate != null) {
                candidates.add(candidate);
            }
        }
        ActionableElement action = toAction(root.get("action"), defaultConfidence);
        return new Parsed(candidates, action, meanConfidence(candidates, defaultConfidence));
    }

    static double meanConfidence(List<JobListingCandidate> candidates, double fallback) {
        double sum = 0.0;
        int fields = 0;
        for (JobListingCandidate candidate : candidates) {
            for (CandidateField field : CandidateField.values()) {
                if (candidate.valueOf(field) != null) {
                    sum += candidate.confidenceOf(field);
                    fields++;
                }
            }
        }
        return fields == 0 ? fallback : sum / fields;
    }

    private JsonNode readJson(String modelText) {
        if (modelText == null || modelText.isBlank()) {
            throw new AnalysisException("empty model response");
        }
        String payload = modelText.trim();
        Matcher fenced = FENCED_JSON.matcher(payload);
        if (fenced.find()) {
            payload = fenced.group(1);
        } else if (!payload.startsWith("{")) {
            int start = payload.indexOf('{');
            int end = payload.lastIndexOf('}');
            if (start < 0 || end <= start) {
                throw new AnalysisException("model response contains no JSON object");
            }
            payload = payload.substring(start, end + 1);
        }
        try {
            JsonNode node = objectMapper.readTree(payload);
            if (node == null || !node.isObject()) {
                throw new AnalysisException("model response is not a JSON object");
            }
            return node;
        } catch (JsonProcessingException e) {
            throw new AnalysisException("model response is not valid JSON: " + e.getOriginalMessage(), e);
        }
    }

    private JobListingCandidate toCandidate(JsonNode job, double defaultConfidence) {
        if (job == null || !job.isObject()) {
            return null;
        }
        String title = firstNonBlank(text(job, "title"), text(job, "job_title"));
        String company = firstNonBlank(text(job, "company"), text(job, "company_name"));
        String location = text(job, "location");
        SalaryRange salary = toSalary(job.has("salary") ? job.get("salary") : job.get("salary_range"));
        if (title == null && company == null) {
            return null;
        }
        BoundingBox box = toBox(job.has("bbox") ? job.get("bbox") : job.get("bounding_box"));
        return new JobListingCandidate(title, company, location, salary, box,
            toFieldConfidence(job.get("confidence"), defaultConfidence));
    }

    private Map<CandidateField, Double> toFieldConfidence(JsonNode node, double defaultConfidence) {
        Map<CandidateField, Double> confidence = new EnumMap<>(CandidateField.class);
        for (CandidateField field : CandidateField.values()) {
            confidence.put(field, defaultConfidence);
        }
        if (node == null || node.isNull()) {
            return confidence;
        }
        if (node.isNumber()) {
            for (CandidateField field : CandidateField.values()) {
                confidence.put(field, node.asDouble());
            }
            return confidence;
        }
        if (node.isObject()) {
            for (CandidateField field : CandidateField.values()) {
                JsonNode value = node.get(field.name().toLowerCase(Locale.ROOT));
                if (value != null && value.isNumber()) {
                    confidence.put(field, value.asDouble());
                }
            }
        }
        return confidence;
    }

    private SalaryRange toSalary(JsonNode node) {
        if (node == null || node.isNull()) {
            return null;
        }
        if (node.isTextual()) {
            String value = node.asText().trim();
            return value.isEmpty() ? null : new SalaryRange(null, null, value);
        }
        if (!node.isObject()) {
            return null;
        }
        Double min = number(node.get("min"));
        Double max = number(node.get("max"));
        if (min == null && max == null) {
            return null;
        }
        return new SalaryRange(min, max, text(node, "currency"));
    }

    private BoundingBox toBox(JsonNode node) {
        if (node == null || node.isNull()) {
            return null;
        }
        if (node.isArray() && node.size() == 4) {
            return new BoundingBox(node.get(0).asDouble(), node.get(1).asDouble(),
                node.get(2).asDouble(), node.get(3).asDouble());
        }
        if (node.isObject()) {
            Double x = number(node.get("x"));
            Double y = number(node.get("y"));
            Double width = number(node.get("width"));
            Double height = number(node.get("height"));
            if (x == null || y == null || width == null || height == null) {
                return null;
            }
            return new BoundingBox(x, y, width, height);
        }
        return null;
    }

    private ActionableElement toAction(JsonNode node, double defaultConfidence) {
        if (node == null || !node.isObject()) {
            return null;
        }
        BoundingBox box = toBox(node.has("bbox") ? node.get("bbox") : node.get("bounding_box"));
        if (box == null) {
            return null;
        }
        Double confidence = number(node.get("confidence"));
        return new ActionableElement(text(node, "label"), box, confidence == null ? defaultConfidence : confidence);
    }

    private static Double number(JsonNode node) {
        if (node == null || node.isNull()) {
            return null;
        }
        if (node.isNumber()) {
            return node.asDouble();
        }
        if (node.isTextual()) {
            try {
                return Double.parseDouble(node.asText().replace(",", "").trim());
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }
}
