package com.tokenmetadata.ingestion.fetch;

/**
 * Non-2xx HTTP response from a gateway or metadata host.
 */
public class GatewayHttpException extends RuntimeException {

    private final int statusCode;

    public GatewayHttpException(String url, int statusCode) {
        super("HTTP " + statusCode + " from " + url);
        this.statusCode = statusCode;
    }

    public int getStatusCode() {
        return statusCode;
    }

    /**
     * 4xx other than 429: the content is not coming back by retrying.
     */
    public boolean isPermanent() {
        return statusCode >= 400 && statusCode < 500 && statusCode != 429;
    }
}
