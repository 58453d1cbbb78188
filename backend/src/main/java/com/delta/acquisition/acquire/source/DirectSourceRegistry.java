package com.delta.acquisition.acquire.source;

import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;
import java.util.Optional;

@Component
public class DirectSourceRegistry {
    private final List<DirectSource> sources;

    public DirectSourceRegistry(List<DirectSource> sources) {
        this.sources = List.copyOf(sources);
    }

    public Optional<DirectSource> find(String type) {
        if (type == null || type.isBlank()) {
            return Optional.empty();
        }
        String normalized = type.trim().toLowerCase(Locale.ROOT);
        return sources.stream().filter(source -> source.type().equals(normalized)).findFirst();
    }

    public Optional<DirectBoard> detect(String url) {
        for (DirectSource source : sources) {
            Optional<String> board = source.detectBoard(url);
            if (board.isPresent()) {
                return Optional.of(new DirectBoard(source.type(), board.get()));
            }
        }
        return Optional.empty();
    }

    public boolean requiresToken(String type) {
        return find(type).map(DirectSource::requiresToken).orElse(false);
    }

    public record DirectBoard(String type, String board) {
    }
}
