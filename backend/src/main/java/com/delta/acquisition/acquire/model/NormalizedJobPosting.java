package com.delta.acquisition.acquire.model;

import java.time.LocalDate;

public record NormalizedJobPosting(
    String sourceUrl,
    String canonicalUrl,
    String title,
    String orgName,
    String locationText,
    String employmentType,
    LocalDate datePosted,
    String descriptionText,
    String salaryText,
    String externalIdentifier,
    String extractionMethod,
    Double confidence,
    String contentHash
) {
}
