package com.delta.acquisition.acquire.vision;

import com.delta.acquisition.acquire.service.AcquisitionCancelledException;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.concurrent.ExecutorService;

/**
 * JSON POSTs to model endpoints. Model calls are bounded by the analysis timeout rather than the crawler's
 * per-host politeness rules.
 */
@Component
public class VisionHttpTransport {
    private static final int MAX_ERROR_BODY = 300;

    private final HttpClient client;

    public VisionHttpTransport(@Qualifier("httpExecutor") ExecutorService httpExecutor) {
        this.client = HttpClient.newBuilder()
            .connectTimeout(Duration.ofSeconds(10))
            .version(HttpClient.Version.HTTP_1_1)
            .executor(httpExecutor)
            .build();
    }

    public String postJson(String url, String body, String bearerToken, Duration timeout) {
        HttpRequest.Builder builder;
        try {
            builder = HttpRequest.newBuilder(URI.create(url));
        } catch (IllegalArgumentException e) {
            throw new AnalysisException("invalid model endpoint " + url, e);
        }
        builder.header("Content-Type", "application/json")
            .header("Accept", "application/json")
            .POST(HttpRequest.BodyPublishers.ofString(body, StandardCharsets.UTF_8));
        if (timeout != null && !timeout.isZero() && !timeout.isNegative()) {
            builder.timeout(timeout);
        }
        if (bearerToken != null && !bearerToken.isBlank()) {
            builder.header("Authorization", "Bearer " + bearerToken.trim());
        }
        try {
            HttpResponse<String> response = client.send(builder.build(), HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
            if (response.statusCode() < 200 || response.statusCode() >= 300) {
                throw new AnalysisException("model endpoint returned http_" + response.statusCode() + ": " + abbreviate(response.body()));
            }
            return response.body();
        } catch (HttpTimeoutException e) {
            throw new AnalysisException("model call timed out", e);
        } catch (IOException e) {
            throw new AnalysisException("model call failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new AcquisitionCancelledException("model call interrupted", e);
        }
    }

    private static String abbreviate(String value) {
        if (value == null) {
            return "";
        }
        return value.length() <= MAX_ERROR_BODY ? value : value.substring(0, MAX_ERROR_BODY) + "...";
    }
}
