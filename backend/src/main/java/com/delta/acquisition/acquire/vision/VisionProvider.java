package com.delta.acquisition.acquire.vision;

import com.delta.acquisition.acquire.model.PageSnapshot;

public interface VisionProvider {
    String providerId();

    /**
     * Analyzes one snapshot. Implementations throw {@link AnalysisException} on any provider or parse failure
     * and must honor thread interruption.
     */
    ProviderResult analyze(PageSnapshot snapshot, VisionCallContext context);
}
