package com.delta.acquisition.acquire.persistence;

import com.delta.acquisition.acquire.model.AcquisitionEvent;
import com.delta.acquisition.acquire.service.AcquisitionEventSink;
import com.delta.acquisition.config.AcquisitionProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Stores events in {@code acquisition_events}. Storage failures are logged and dropped.
 */
@Component
public class JdbcAcquisitionEventSink implements AcquisitionEventSink {
    private static final Logger log = LoggerFactory.getLogger(JdbcAcquisitionEventSink.class);

    private final AcquisitionEventRepository repository;
    private final boolean enabled;

    public JdbcAcquisitionEventSink(AcquisitionEventRepository repository, AcquisitionProperties properties) {
        this.repository = repository;
        this.enabled = properties.getEvents().isEnabled();
    }

    @Override
    public void emit(AcquisitionEvent event) {
        if (!enabled) {
            log.debug("Event storage disabled; dropping event for {}", event.requestId());
            return;
        }
        try {
            repository.insert(event);
        } catch (RuntimeException e) {
            log.warn("Failed to store acquisition event for {}", event.requestId(), e);
        }
    }
}
