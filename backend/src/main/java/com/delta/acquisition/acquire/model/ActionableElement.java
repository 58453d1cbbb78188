package com.delta.acquisition.acquire.model;

/**
 * An element the vision model believes leads to richer content, e.g. an apply or details button.
 */
public record ActionableElement(
    String label,
    BoundingBox box,
    double confidence
) {
}
