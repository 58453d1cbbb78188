package com.delta.acquisition.acquire.model;

public enum ResourceKind {
    IDENTITY,
    PROXY,
    TOKEN,
    SESSION,
    WORKER,
    PARSER;

    /**
     * Session and token items carry an expiry timestamp; other kinds never expire.
     */
    public boolean expires() {
        return this == TOKEN || this == SESSION;
    }
}
