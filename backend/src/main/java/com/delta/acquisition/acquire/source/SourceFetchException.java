package com.delta.acquisition.acquire.source;

import com.delta.acquisition.acquire.model.HttpFetchResult;
import com.delta.acquisition.acquire.util.ReasonCodeClassifier;

/**
 * A structured source could not deliver postings. Carries a normalized reason code.
 */
public class SourceFetchException extends RuntimeException {
    private final String reasonCode;
    private final int statusCode;

    public SourceFetchException(String reasonCode, int statusCode, String message) {
        super(message);
        this.reasonCode = reasonCode;
        this.statusCode = statusCode;
    }

    public SourceFetchException(String reasonCode, String message, Throwable cause) {
        super(message, cause);
        this.reasonCode = reasonCode;
        this.statusCode = 0;
    }

    public static SourceFetchException fromFetch(String source, HttpFetchResult fetch) {
        String reason = fetch.errorCode() != null
            ? ReasonCodeClassifier.fromErrorCode(fetch.errorCode(), fetch.errorMessage())
            : ReasonCodeClassifier.fromHttpStatus(fetch.statusCode());
        String detail = fetch.errorMessage() == null ? fetch.errorKey() : fetch.errorKey() + ": " + fetch.errorMessage();
        return new SourceFetchException(reason, fetch.statusCode(), source + " fetch failed (" + detail + ")");
    }

    public String getReasonCode() {
        return reasonCode;
    }

    public int getStatusCode() {
        return statusCode;
    }

    public boolean isRetryable() {
        return ReasonCodeClassifier.isRetryable(reasonCode);
    }
}
