package com.delta.acquisition.acquire.vision;

import com.delta.acquisition.acquire.model.PageSnapshot;
import com.delta.acquisition.config.AcquisitionProperties;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Base64;

/**
 * Self-hosted multimodal model behind an Ollama-compatible {@code /api/generate} endpoint. Calls are free.
 * The endpoint comes from the leased parser instance when there is one.
 */
@Component
public class LocalModelVisionProvider implements VisionProvider {
    private static final Logger log = LoggerFactory.getLogger(LocalModelVisionProvider.class);

    private final AcquisitionProperties properties;
    private final VisionHttpTransport transport;
    private final VisionResponseParser parser;
    private final ObjectMapper objectMapper;

    public LocalModelVisionProvider(
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
        return properties.getVision().getLocal().getProviderId();
    }

    @Override
    public ProviderResult analyze(PageSnapshot snapshot, VisionCallContext context) {
        AcquisitionProperties.Local local = properties.getVision().getLocal();
        String endpoint = context.hasParserEndpoint() ? stripTrailingSlash(context.parserEndpoint()) : local.getBaseUrl();

        ObjectNode request = objectMapper.createObjectNode();
        request.put("model", local.getModel());
        request.put("stream", false);
        request.put("format", "json");
        if (snapshot.hasScreenshot()) {
            request.put("prompt", VisionPrompts.EXTRACTION);
            request.putArray("images").add(Base64.getEncoder().encodeToString(snapshot.screenshotPng()));
        } else {
            request.put("prompt", VisionPrompts.forDom(snapshot.html(), properties.getVision().getMaxDomChars()));
        }

        String responseBody = transport.postJson(endpoint + "/api/generate", write(request), null, context.timeout());
        String modelText = readField(responseBody, "response");
        VisionResponseParser.Parsed parsed = parser.parse(modelText, local.getDefaultConfidence());
        log.debug("Local model found {} candidates on {}", parsed.candidates().size(), snapshot.url());
        return new ProviderResult(providerId(), parsed.candidates(), parsed.confidence(), parsed.actionableElement(), 0.0);
    }

    private String write(ObjectNode request) {
        try {
            return objectMapper.writeValueAsString(request);
        } catch (JsonProcessingException e) {
            throw new AnalysisException("failed to encode local model request", e);
        }
    }

    private String readField(String body, String field) {
        try {
            JsonNode root = objectMapper.readTree(body);
            JsonNode value = root == null ? null : root.get(field);
            if (value == null || value.isNull()) {
                throw new AnalysisException("local model response has no " + field);
            }
            return value.isTextual() ? value.asText() : value.toString();
        } catch (JsonProcessingException e) {
            throw new AnalysisException("local model returned invalid JSON", e);
        }
    }

    private static String stripTrailingSlash(String value) {
        String trimmed = value.trim();
        return trimmed.endsWith("/") ? trimmed.substring(0, trimmed.length() - 1) : trimmed;
    }
}
