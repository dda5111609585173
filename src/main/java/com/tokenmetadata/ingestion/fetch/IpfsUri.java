package com.tokenmetadata.ingestion.fetch;

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Parsed {@code ipfs://} URI: content identifier plus optional path inside the DAG.
 *
 * <p>Producers write the same location several ways ({@code ipfs://Qm..}, {@code ipfs://ipfs/Qm..},
 * raw spaces or pre-encoded paths). {@link #parse} accepts all of them and {@link #normalized()} renders one
 * canonical form: the path is percent-decoded, then re-encoded.
 */
public record IpfsUri(String cid, String path) {

    public static final String SCHEME_PREFIX = "ipfs://";

    private static final Pattern CID = Pattern.compile("[A-Za-z0-9]+");

    /**
     * @throws IllegalArgumentException if the URI is not ipfs:// or the CID is empty or malformed
     */
    public static IpfsUri parse(String uri) {
        if (uri == null || !uri.regionMatches(true, 0, SCHEME_PREFIX, 0, SCHEME_PREFIX.length())) {
            throw new IllegalArgumentException("Not an IPFS URI: " + uri);
        }
        String rest = uri.substring(SCHEME_PREFIX.length()).strip();
        if (rest.toLowerCase(Locale.ROOT).startsWith("ipfs/")) {
            rest = rest.substring("ipfs/".length());
        }
        while (rest.startsWith("/")) {
            rest = rest.substring(1);
        }
        int slash = rest.indexOf('/');
        String cid = slash < 0 ? rest : rest.substring(0, slash);
        String path = slash < 0 ? "" : rest.substring(slash);
        if (cid.isEmpty() || !CID.matcher(cid).matches()) {
            throw new IllegalArgumentException("Malformed IPFS CID in " + uri);
        }
        if ("/".equals(path)) {
            path = "";
        }
        return new IpfsUri(cid, encodePath(decodePath(path)));
    }

    public static boolean isIpfs(String uri) {
        return uri != null && uri.regionMatches(true, 0, SCHEME_PREFIX, 0, SCHEME_PREFIX.length());
    }

    public String normalized() {
        return SCHEME_PREFIX + cid + path;
    }

    /**
     * {@code <gateway>/ipfs/<cid><path>}.
     */
    public String gatewayUrl(String gatewayBase) {
        String base = gatewayBase;
        while (base.endsWith("/")) {
            base = base.substring(0, base.length() - 1);
        }
        return base + "/ipfs/" + cid + path;
    }

    static String decodePath(String path) {
        ByteArrayOutputStream out = new ByteArrayOutputStream(path.length());
        byte[] raw = path.getBytes(StandardCharsets.UTF_8);
        for (int i = 0; i < raw.length; i++) {
            byte b = raw[i];
            if (b == '%' && i + 2 < raw.length) {
                int hi = Character.digit(raw[i + 1], 16);
                int lo = Character.digit(raw[i + 2], 16);
                if (hi >= 0 && lo >= 0) {
                    out.write((hi << 4) | lo);
                    i += 2;
                    continue;
                }
            }
            out.write(b);
        }
        return out.toString(StandardCharsets.UTF_8);
    }

    static String encodePath(String path) {
        StringBuilder sb = new StringBuilder(path.length());
        for (byte b : path.getBytes(StandardCharsets.UTF_8)) {
            int c = b & 0xFF;
            if (isUnreserved(c) || c == '/') {
                sb.append((char) c);
            } else {
                sb.append('%').append(Character.toUpperCase(Character.forDigit(c >> 4, 16)))
                        .append(Character.toUpperCase(Character.forDigit(c & 0xF, 16)));
            }
        }
        return sb.toString();
    }

    private static boolean isUnreserved(int c) {
        return (c >= 'A' && c <= 'Z') || (c >= 'a' && c <= 'z') || (c >= '0' && c <= '9')
                || c == '-' || c == '.' || c == '_' || c == '~';
    }

    @Override
    public String toString() {
        return normalized();
    }
}
