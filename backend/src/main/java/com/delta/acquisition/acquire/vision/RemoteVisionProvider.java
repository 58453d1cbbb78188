package com.delta.acquisition.acquire.vision;

import com.delta.acquisition.acquire.model.PageSnapshot;
import com.delta.acquisition.config.AcquisitionProperties;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Base64;
import java.util.Locale;

/**
 * Paid multimodal model behind an OpenAI-compatible chat completions endpoint. Cost is computed from the
 * token usage the endpoint reports.
 */
@Component
public class RemoteVisionProvider implements VisionProvider {
    private static final Logger log = LoggerFactory.getLogger(RemoteVisionProvider.class);

    private final AcquisitionProperties properties;
    private final VisionHttpTransport transport;
    private final VisionResponseParser parser;
    private final ObjectMapper objectMapper;

    public RemoteVisionProvider(
        AcquisitionProperties properties,
        VisionHttpTransport transport,
        VisionResponseParser parser,
        ObjectMapper objectMapper
    ) {
        this.properties = properties;
        this.transport = transport;
        this.parser = parser;
        this.objectMapper = objectMapper;
    }

    @Override
    public String providerId() {
        return properties.getVision().getRemote().getProviderId();
    }

    @Override
    public ProviderResult analyze(PageSnapshot snapshot, VisionCallContext context) {
        AcquisitionProperties.Remote remote = properties.getVision().getRemote();
        String apiKey = context.hasApiToken() ? context.apiToken() : remote.getApiKey();
        if (apiKey == null || apiKey.isBlank()) {
            throw new AnalysisException("no API key available for " + providerId());
        }

        String responseBody = transport.postJson(
            remote.getBaseUrl() + "/v1/chat/completions",
            write(buildRequest(snapshot, remote)),
            apiKey,
            context.timeout()
        );

        JsonNode root = readTree(responseBody);
        JsonNode usage = root.path("usage");
        double cost = costOf(usage.path("prompt_tokens").asLong(0), usage.path("completion_tokens").asLong(0), remote);
        JsonNode content = root.path("choices").path(0).path("message").path("content");
        if (!content.isTextual()) {
            throw new AnalysisException("remote model response has no message content").withIncurredCost(providerId(), cost);
        }

        VisionResponseParser.Parsed parsed;
        try {
            parsed = parser.parse(content.asText(), remote.getDefaultConfidence());
        } catch (AnalysisException e) {
            // the call was billed even though the reply is unusable
            throw e.withIncurredCost(providerId(), cost);
        }
        log.debug(
            "Remote model found {} candidates on {} for ${}",
            parsed.candidates().size(),
            snapshot.url(),
            String.format(Locale.ROOT, "%.4f", cost)
        );
        return new ProviderResult(providerId(), parsed.candidates(), parsed.confidence(), parsed.actionableElement(), cost);
    }

    static double costOf(long promptTokens, long completionTokens, AcquisitionProperties.Remote remote) {
        return (promptTokens / 1000.0) * remote.getInputCostPer1k()
            + (completionTokens / 1000.0) * remote.getOutputCostPer1k();
    }

    private ObjectNode buildRequest(PageSnapshot snapshot, AcquisitionProperties.Remote remote) {
        ObjectNode request = objectMapper.createObjectNode();
        request.put("model", remote.getModel());
        request.put("max_tokens", remote.getMaxTokens());
        ObjectNode message = request.putArray("messages").addObject();
        message.put("role", "user");
        ArrayNode content = message.putArray("content");
        if (snapshot.hasScreenshot()) {
            content.addObject().put("type", "text").put("text", VisionPrompts.EXTRACTION);
            content.addObject()
                .put("type", "image_url")
                .putObject("image_url")
                .put("url", "data:image/png;base64," + Base64.getEncoder().encodeToString(snapshot.screenshotPng()));
        } else {
            content.addObject()
                .put("type", "text")
                .put("text", VisionPrompts.forDom(snapshot.html(), properties.getVision().getMaxDomChars()));
        }
        return request;
    }

    private String write(ObjectNode request) {
        try {
            return objectMapper.writeValueAsString(request);
        } catch (JsonProcessingException e) {
            throw new AnalysisException("failed to encode remote model request", e);
        }
    }

    private JsonNode readTree(String body) {
        try {
            JsonNode root = objectMapper.readTree(body);
            if (root == null) {
                throw new AnalysisException("remote model returned an empty body");
            }
            return root;
        } catch (JsonProcessingException e) {
            throw new AnalysisException("remote model returned invalid JSON", e);
        }
    }
}
