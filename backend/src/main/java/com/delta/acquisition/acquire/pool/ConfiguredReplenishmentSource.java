package com.delta.acquisition.acquire.pool;

import com.delta.acquisition.acquire.model.ResourceKind;
import com.delta.acquisition.config.AcquisitionProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Items come from configuration. Worker and session slots are synthetic names generated from capacity,
 * identities fall back to a built-in browser user-agent list and parsers to a local model endpoint.
 */
@Component
public class ConfiguredReplenishmentSource implements ReplenishmentSource {
    static final List<String> DEFAULT_USER_AGENTS = List.of(
        "Mozilla/5.0 (Windows NT 10.0; Win64; x64) AppleWebKit/537.36 (KHTML, like Gecko) Chrome/120.0.0.0 Safari/537.36",
        "Mozilla/5.0 (Windows NT 10.0; Win64; x64) AppleWebKit/537.36 (KHTML, like Gecko) Chrome/119.0.0.0 Safari/537.36",
        "Mozilla/5.0 (Windows NT 10.0; Win64; x64) AppleWebKit/537.36 (KHTML, like Gecko) Chrome/120.0.0.0 Safari/537.36 Edg/120.0.0.0",
        "Mozilla/5.0 (Macintosh; Intel Mac OS X 10_15_7) AppleWebKit/605.1.15 (KHTML, like Gecko) Version/17.1 Safari/605.1.15",
        "Mozilla/5.0 (Macintosh; Intel Mac OS X 10_15_7) AppleWebKit/537.36 (KHTML, like Gecko) Chrome/120.0.0.0 Safari/537.36"
    );
    static final String DEFAULT_PARSER_ENDPOINT = "http://localhost:11434";

    private final AcquisitionProperties properties;
    private final Map<ResourceKind, Deque<String>> reserves = new EnumMap<>(ResourceKind.class);
    private final AtomicInteger generated = new AtomicInteger();

    public ConfiguredReplenishmentSource(AcquisitionProperties properties) {
        this.properties = properties;
        for (ResourceKind kind : ResourceKind.values()) {
            reserves.put(kind, new ArrayDeque<>(properties.getPools().forKind(kind).getReserve()));
        }
    }

    @Override
    public List<String> initialItems(ResourceKind kind) {
        AcquisitionProperties.Pool pool = properties.getPools().forKind(kind);
        if (pool.getCapacity() == 0) {
            return List.of();
        }
        List<String> configured = cleaned(pool.getItems());
        if (!configured.isEmpty()) {
            return configured;
        }
        return switch (kind) {
            case IDENTITY -> DEFAULT_USER_AGENTS;
            case WORKER, SESSION -> generatedNames(kind, pool.getCapacity());
            case PARSER -> repeated(DEFAULT_PARSER_ENDPOINT, pool.getCapacity());
            case TOKEN -> {
                String apiKey = properties.getVision().getRemote().getApiKey();
                yield apiKey == null || apiKey.isBlank() ? List.of() : List.of(apiKey.trim());
            }
            case PROXY -> List.of();
        };
    }

    @Override
    public Optional<String> replacement(ResourceKind kind, String retiredValue) {
        Deque<String> reserve = reserves.get(kind);
        synchronized (reserve) {
            String next = reserve.pollFirst();
            if (next != null && !next.isBlank()) {
                return Optional.of(next.trim());
            }
        }
        return switch (kind) {
            case WORKER, SESSION -> Optional.of(nextName(kind));
            case IDENTITY, PARSER -> Optional.ofNullable(retiredValue);
            case PROXY, TOKEN -> Optional.empty();
        };
    }

    private List<String> generatedNames(ResourceKind kind, int count) {
        List<String> names = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            names.add(nextName(kind));
        }
        return names;
    }

    private String nextName(ResourceKind kind) {
        return kind.name().toLowerCase(Locale.ROOT) + "-" + generated.incrementAndGet();
    }

    private static List<String> repeated(String value, int count) {
        List<String> out = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            out.add(value);
        }
        return out;
    }

    private static List<String> cleaned(List<String> values) {
        List<String> out = new ArrayList<>();
        for (String value : values) {
            if (value != null && !value.isBlank()) {
                out.add(value.trim());
            }
        }
        return out;
    }
}
