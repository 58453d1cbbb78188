package com.delta.acquisition.acquire.service;

import com.delta.acquisition.acquire.model.AcquisitionEvent;

/**
 * Receives one event per completed acquisition. Implementations must not throw for storage problems.
 */
public interface AcquisitionEventSink {
    void emit(AcquisitionEvent event);
}
