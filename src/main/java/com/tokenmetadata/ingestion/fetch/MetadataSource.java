package com.tokenmetadata.ingestion.fetch;

import com.tokenmetadata.domain.MetadataEvent;

import java.util.Objects;

/**
 * Where an event's metadata lives: inline bytes, or a URI to resolve.
 */
public final class MetadataSource {

    private final String uri;
    private final byte[] inline;

    private MetadataSource(String uri, byte[] inline) {
        this.uri = uri;
        this.inline = inline;
    }

    public static MetadataSource uri(String uri) {
        return new MetadataSource(Objects.requireNonNull(uri, "uri"), null);
    }

    public static MetadataSource inline(byte[] bytes) {
        return new MetadataSource(null, Objects.requireNonNull(bytes, "bytes").clone());
    }

    /**
     * @throws FetchException MALFORMED_URI unless exactly one of uri / inline payload is set
     */
    public static MetadataSource fromEvent(MetadataEvent event) {
        boolean hasUri = event.getMetadataUri() != null && !event.getMetadataUri().isBlank();
        boolean hasInline = event.getInlineMetadata() != null;
        if (hasUri == hasInline) {
            throw new FetchException(FetchErrorKind.MALFORMED_URI,
                    "Event " + event.getId() + " must carry exactly one of metadataUri or inlineMetadata");
        }
        return hasInline ? inline(event.getInlineMetadata()) : uri(event.getMetadataUri().strip());
    }

    public boolean isInline() {
        return inline != null;
    }

    public String getUri() {
        return uri;
    }

    public byte[] getInline() {
        return inline != null ? inline.clone() : null;
    }

    /**
     * Normalized content address when the source is an ipfs:// URI; null otherwise (inline, data:, http).
     * Content behind such a URI is immutable, so it is a valid dedup key before fetching.
     */
    public String contentAddress() {
        if (uri == null || !IpfsUri.isIpfs(uri)) {
            return null;
        }
        try {
            return IpfsUri.parse(uri).normalized();
        } catch (IllegalArgumentException e) {
            return null;
        }
    }

    @Override
    public String toString() {
        return isInline() ? "inline(" + inline.length + " bytes)" : uri;
    }
}
