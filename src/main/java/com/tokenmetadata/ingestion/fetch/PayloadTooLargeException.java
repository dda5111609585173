package com.tokenmetadata.ingestion.fetch;

/**
 * Response body exceeded the configured size cap. Raised before the excess is buffered.
 */
public class PayloadTooLargeException extends RuntimeException {

    private final long maxBytes;

    public PayloadTooLargeException(String url, long observedBytes, long maxBytes) {
        super("Response from " + url + " exceeds " + maxBytes + " bytes (at least " + observedBytes + ")");
        this.maxBytes = maxBytes;
    }

    public long getMaxBytes() {
        return maxBytes;
    }
}
