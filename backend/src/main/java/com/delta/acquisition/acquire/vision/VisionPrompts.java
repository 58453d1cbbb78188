package com.delta.acquisition.acquire.vision;

import org.jsoup.Jsoup;

final class VisionPrompts {
    static final String EXTRACTION = """
        You are looking at a screenshot of a job search or job detail page.
        Extract every job listing that is visible and answer with JSON only, in this shape:
        {
          "jobs": [
            {
              "title": "job title",
              "company": "company name",
              "location": "city, region or Remote",
              "salary": {"min": 0, "max": 0, "currency": "USD"},
              "bbox": {"x": 0, "y": 0, "width": 0, "height": 0},
              "confidence": {"title": 0.0, "company": 0.0, "location": 0.0, "salary": 0.0}
            }
          ],
          "action": {"label": "button text", "bbox": {"x": 0, "y": 0, "width": 0, "height": 0}, "confidence": 0.0}
        }
        Use null for anything that is not visible. Coordinates are page pixels.
        Only include "action" when a single button or link (for example "Show more jobs" or "View details")
        would reveal more listing content.
        """;

    private VisionPrompts() {
    }

    /**
     * Prompt for models that only see page text.
     */
    static String forDom(String html, int maxChars) {
        String text = Jsoup.parse(html).text();
        if (text.length() > maxChars) {
            text = text.substring(0, maxChars);
        }
        return EXTRACTION + "\nThe screenshot is not available. This is the visible page text:\n" + text;
    }
}
