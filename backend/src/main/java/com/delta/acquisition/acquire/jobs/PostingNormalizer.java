package com.delta.acquisition.acquire.jobs;

import com.delta.acquisition.acquire.model.NormalizedJobPosting;
import com.delta.acquisition.acquire.util.HashUtils;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.util.Map;
import java.util.TreeMap;

/**
 * Builds {@link NormalizedJobPosting}s with a content hash over their stable fields, whatever path produced them.
 */
@Component
public class PostingNormalizer {
    private final ObjectMapper objectMapper;

    public PostingNormalizer(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * @return null when the posting has no title
     */
    public NormalizedJobPosting build(
        String sourceUrl,
        String canonicalUrl,
        String title,
        String orgName,
        String locationText,
        String employmentType,
        LocalDate datePosted,
        String descriptionText,
        String salaryText,
        String identifier,
        String extractionMethod,
        Double confidence
    ) {
        if (title == null || title.isBlank()) {
            return null;
        }
        String canonical = canonicalUrl == null || canonicalUrl.isBlank() ? sourceUrl : canonicalUrl.trim();

        Map<String, String> stableFields = new TreeMap<>();
        stableFields.put("title", blankToEmpty(title));
        stableFields.put("org_name", blankToEmpty(orgName));
        stableFields.put("location_text", blankToEmpty(locationText));
        stableFields.put("employment_type", blankToEmpty(employmentType));
        stableFields.put("date_posted", datePosted == null ? "" : datePosted.toString());
        stableFields.put("description", blankToEmpty(descriptionText));
        stableFields.put("salary", blankToEmpty(salaryText));
        stableFields.put("canonical_url", blankToEmpty(canonical));
        stableFields.put("identifier", blankToEmpty(identifier));

        String hashPayload;
        try {
            hashPayload = objectMapper.writeValueAsString(stableFields);
        } catch (JsonProcessingException e) {
            hashPayload = stableFields.toString();
        }

        return new NormalizedJobPosting(
            sourceUrl,
            canonical,
            title.trim(),
            trimToNull(orgName),
            trimToNull(locationText),
            trimToNull(employmentType),
            datePosted,
            trimToNull(descriptionText),
            trimToNull(salaryText),
            trimToNull(identifier),
            extractionMethod,
            confidence,
            HashUtils.sha256Hex(hashPayload)
        );
    }

    private static String blankToEmpty(String value) {
        return value == null ? "" : value.trim();
    }

    private static String trimToNull(String value) {
        return value == null || value.isBlank() ? null : value.trim();
    }
}
