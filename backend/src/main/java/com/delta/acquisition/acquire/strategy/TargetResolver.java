package com.delta.acquisition.acquire.strategy;

import com.delta.acquisition.acquire.model.AcquisitionRequest;
import com.delta.acquisition.acquire.model.ResolvedTarget;
import com.delta.acquisition.acquire.model.SearchParameters;
import com.delta.acquisition.acquire.source.DirectSourceRegistry;
import com.delta.acquisition.config.AcquisitionProperties;
import org.springframework.stereotype.Component;

import java.net.URI;
import java.net.URISyntaxException;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.Locale;
import java.util.Optional;

/**
 * Turns a request target (a configured site id or an http(s) URL) into a concrete URL plus the structured
 * paths known for it.
 */
@Component
public class TargetResolver {
    private final AcquisitionProperties properties;
    private final DirectSourceRegistry directSources;

    public TargetResolver(AcquisitionProperties properties, DirectSourceRegistry directSources) {
        this.properties = properties;
        this.directSources = directSources;
    }

    public ResolvedTarget resolve(AcquisitionRequest request) {
        String target = request.target();
        AcquisitionProperties.Site site = properties.getSites().get(target);
        if (site != null) {
            return resolveSite(target, site, request.search());
        }
        URI uri = parseHttpUri(target);
        if (uri == null) {
            throw new IllegalArgumentException("target must be a configured site id or an http(s) URL: " + target);
        }
        Optional<DirectSourceRegistry.DirectBoard> board = directSources.detect(target);
        return new ResolvedTarget(
            null,
            uri.toString(),
            uri.getHost().toLowerCase(Locale.ROOT),
            board.map(DirectSourceRegistry.DirectBoard::type).orElse(null),
            board.map(DirectSourceRegistry.DirectBoard::board).orElse(null),
            null
        );
    }

    private ResolvedTarget resolveSite(String siteId, AcquisitionProperties.Site site, SearchParameters search) {
        String url = expandTemplate(site, search);
        URI uri = parseHttpUri(url);
        if (uri == null) {
            throw new IllegalArgumentException("site " + siteId + " has no valid url configured");
        }
        String directType = site.getDirectType();
        String directBoard = site.getDirectBoard();
        if (directType == null || directType.isBlank()) {
            Optional<DirectSourceRegistry.DirectBoard> detected = directSources.detect(site.getUrl());
            directType = detected.map(DirectSourceRegistry.DirectBoard::type).orElse(null);
            directBoard = detected.map(DirectSourceRegistry.DirectBoard::board).orElse(null);
        } else if (directSources.find(directType).isEmpty() || directBoard == null || directBoard.isBlank()) {
            directType = null;
            directBoard = null;
        }
        return new ResolvedTarget(
            siteId,
            uri.toString(),
            uri.getHost().toLowerCase(Locale.ROOT),
            directType == null ? null : directType.trim().toLowerCase(Locale.ROOT),
            directBoard,
            site.getFeedUrl()
        );
    }

    private String expandTemplate(AcquisitionProperties.Site site, SearchParameters search) {
        String template = site.getSearchUrlTemplate();
        if (template == null || template.isBlank() || search == null) {
            return site.getUrl();
        }
        return template
            .replace("{query}", encode(search.query()))
            .replace("{location}", encode(search.location()));
    }

    private static String encode(String value) {
        return value == null ? "" : URLEncoder.encode(value.trim(), StandardCharsets.UTF_8);
    }

    private static URI parseHttpUri(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            URI uri = new URI(value.trim());
            String scheme = uri.getScheme();
            if (scheme == null || uri.getHost() == null) {
                return null;
            }
            if (!"http".equalsIgnoreCase(scheme) && !"https".equalsIgnoreCase(scheme)) {
                return null;
            }
            return uri;
        } catch (URISyntaxException e) {
            return null;
        }
    }
}
