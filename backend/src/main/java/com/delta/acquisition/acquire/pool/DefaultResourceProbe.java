package com.delta.acquisition.acquire.pool;

import com.delta.acquisition.acquire.http.ProxyEndpoint;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.Socket;
import java.time.Clock;
import java.time.Duration;

/**
 * Proxies are probed with a TCP connect. Sessions and tokens pass while unexpired. Everything else passes.
 */
@Component
public class DefaultResourceProbe implements ResourceProbe {
    private static final Logger log = LoggerFactory.getLogger(DefaultResourceProbe.class);

    private final Clock clock;

    public DefaultResourceProbe(Clock clock) {
        this.clock = clock;
    }

    @Override
    public boolean probe(PoolItemView item, Duration timeout) {
        return switch (item.kind()) {
            case PROXY -> connects(item.value(), timeout);
            case SESSION, TOKEN -> !item.isExpired(clock.instant());
            case IDENTITY, WORKER, PARSER -> true;
        };
    }

    private boolean connects(String proxy, Duration timeout) {
        ProxyEndpoint endpoint = ProxyEndpoint.parse(proxy);
        if (endpoint == null) {
            return false;
        }
        try (Socket socket = new Socket()) {
            socket.connect(new InetSocketAddress(endpoint.host(), endpoint.port()), (int) timeout.toMillis());
            return true;
        } catch (IOException e) {
            log.debug("Proxy probe failed for {}: {}", endpoint.key(), e.getMessage());
            return false;
        }
    }
}
