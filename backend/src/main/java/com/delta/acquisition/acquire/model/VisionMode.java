package com.delta.acquisition.acquire.model;

public enum VisionMode {
    LOCAL_ONLY,
    CLOUD_ONLY,
    HYBRID;

    public boolean usesLocal() {
        return this != CLOUD_ONLY;
    }

    public boolean usesRemote() {
        return this != LOCAL_ONLY;
    }
}
