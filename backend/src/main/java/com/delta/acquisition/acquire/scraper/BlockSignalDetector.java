package com.delta.acquisition.acquire.scraper;

import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Recognizes anti-automation responses: blocking status codes and CAPTCHA or challenge pages.
 */
@Component
public class BlockSignalDetector {
    private static final List<String> CHALLENGE_SELECTORS = List.of(
        "iframe[src*=recaptcha]",
        "iframe[src*=hcaptcha]",
        "iframe[src*=challenges.cloudflare.com]",
        ".g-recaptcha",
        ".h-captcha",
        ".cf-turnstile",
        "#cf-challenge-running",
        "#challenge-form",
        "#px-captcha",
        "[data-sitekey]"
    );

    private static final List<String> CHALLENGE_TITLES = List.of(
        "just a moment",
        "attention required",
        "access denied",
        "are you a robot",
        "security check"
    );

    private static final List<String> CHALLENGE_PHRASES = List.of(
        "verify you are human",
        "unusual traffic from your computer",
        "please complete the security check",
        "enable javascript and cookies to continue",
        "press & hold"
    );

    public boolean isBlockingStatus(int status) {
        return status == 403 || status == 429;
    }

    /**
     * The first marker found in the page, if any.
     */
    public Optional<String> detect(String html) {
        if (html == null || html.isBlank()) {
            return Optional.empty();
        }
        Document document = Jsoup.parse(html);
        for (String selector : CHALLENGE_SELECTORS) {
            if (document.selectFirst(selector) != null) {
                return Optional.of(selector);
            }
        }
        String title = document.title().toLowerCase(Locale.ROOT);
        for (String marker : CHALLENGE_TITLES) {
            if (title.contains(marker)) {
                return Optional.of("title:" + marker);
            }
        }
        String text = document.body() == null ? "" : document.body().text().toLowerCase(Locale.ROOT);
        for (String phrase : CHALLENGE_PHRASES) {
            if (text.contains(phrase)) {
                return Optional.of("text:" + phrase);
            }
        }
        return Optional.empty();
    }
}
