package com.tokenmetadata.ingestion.fetch;

import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.Locale;

/**
 * RFC 2397 {@code data:} URI decoding. On-chain metadata is often stored this way, e.g.
 * {@code data:application/json;base64,eyJuYW1lIjoi...}.
 */
public final class DataUri {

    public static final String SCHEME_PREFIX = "data:";

    private DataUri() {
    }

    public static boolean isDataUri(String uri) {
        return uri != null && uri.regionMatches(true, 0, SCHEME_PREFIX, 0, SCHEME_PREFIX.length());
    }

    /**
     * @throws IllegalArgumentException if there is no comma separator or the base64 payload is invalid
     */
    public static byte[] decode(String uri) {
        if (!isDataUri(uri)) {
            throw new IllegalArgumentException("Not a data URI");
        }
        int comma = uri.indexOf(',');
        if (comma < 0) {
            throw new IllegalArgumentException("data URI without payload separator");
        }
        String header = uri.substring(SCHEME_PREFIX.length(), comma).toLowerCase(Locale.ROOT);
        String payload = uri.substring(comma + 1);
        if (header.endsWith(";base64")) {
            return Base64.getMimeDecoder().decode(payload);
        }
        return IpfsUri.decodePath(payload).getBytes(StandardCharsets.UTF_8);
    }
}
