package com.delta.acquisition.acquire.jobs;

import com.delta.acquisition.acquire.model.NormalizedJobPosting;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class JobPostingExtractorTest {
    private final ObjectMapper objectMapper = new ObjectMapper();
    private final JobPostingExtractor extractor = new JobPostingExtractor(objectMapper, new PostingNormalizer(objectMapper));

    @Test
    void extractsJobPostingFromJsonLd() {
        String html =
            """
                <html>
                <head>
                  <script type="application/ld+json">
                    {
                      "@context":"https://schema.org",
                      "@type":"JobPosting",
                      "title":"Senior Engineer",
                      "hiringOrganization":{"@type":"Organization","name":"Example Corp"},
                      "jobLocation":{"@type":"Place","address":{"addressLocality":"Austin","addressRegion":"TX","addressCountry":"US"}},
                      "employmentType":"FULL_TIME",
                      "datePosted":"2026-01-05",
                      "description":"<p>Build services</p>",
                      "baseSalary":{"@type":"MonetaryAmount","currency":"USD","value":{"minValue":150000,"maxValue":180000,"unitText":"YEAR"}},
                      "identifier":{"@type":"PropertyValue","value":"REQ-123"},
                      "url":"https://example.com/jobs/req-123"
                    }
                  </script>
                </head>
                <body></body>
                </html>
                """;

        List<NormalizedJobPosting> jobs = extractor.extract(html, "https://example.com/careers");
        assertEquals(1, jobs.size());
        NormalizedJobPosting posting = jobs.get(0);
        assertEquals("Senior Engineer", posting.title());
        assertEquals("Example Corp", posting.orgName());
        assertEquals("Austin, TX, US", posting.locationText());
        assertEquals("FULL_TIME", posting.employmentType());
        assertEquals(LocalDate.of(2026, 1, 5), posting.datePosted());
        assertEquals("Build services", posting.descriptionText());
        assertEquals("150000 - 180000 USD / year", posting.salaryText());
        assertEquals("REQ-123", posting.externalIdentifier());
        assertEquals("https://example.com/jobs/req-123", posting.canonicalUrl());
        assertEquals("https://example.com/careers", posting.sourceUrl());
        assertFalse(posting.contentHash().isBlank());
        assertTrue(JobPostingExtractor.isComplete(posting));
    }

    @Test
    void findsPostingsInsideGraphsAndSkipsMalformedBlocks() {
        String html = """
            <html><head>
            <script type="application/ld+json">{ not json</script>
            <script type="application/ld+json">
            {"@context":"https://schema.org","@graph":[
              {"@type":"Organization","name":"Acme"},
              {"@type":["JobPosting"],"name":"Welder","jobLocation":[{"address":{"addressLocality":"Tulsa"}},{"name":"Remote"}]}
            ]}
            </script>
            </head><body></body></html>
            """;

        List<NormalizedJobPosting> jobs = extractor.extract(html, "https://acme.example/jobs");

        assertEquals(1, jobs.size());
        NormalizedJobPosting welder = jobs.get(0);
        assertEquals("Welder", welder.title());
        assertEquals("Tulsa | Remote", welder.locationText());
        assertFalse(JobPostingExtractor.isComplete(welder));
    }

    @Test
    void contentHashTracksStableFields() {
        String template = """
            <script type="application/ld+json">
            {"@type":"JobPosting","title":"%s","hiringOrganization":{"name":"Acme"}}
            </script>
            """;
        NormalizedJobPosting first = extractor.extract(template.formatted("Baker"), "https://a.example/1").get(0);
        NormalizedJobPosting same = extractor.extract(template.formatted("Baker"), "https://a.example/1").get(0);
        NormalizedJobPosting other = extractor.extract(template.formatted("Butcher"), "https://a.example/1").get(0);

        assertEquals(first.contentHash(), same.contentHash());
        assertNotEquals(first.contentHash(), other.contentHash());
    }

    @Test
    void pagesWithoutStructuredDataYieldNothing() {
        assertTrue(extractor.extract("<html><body><h1>Jobs</h1></body></html>", "https://x.example").isEmpty());
        assertTrue(extractor.extract("", "https://x.example").isEmpty());
    }
}
