package com.tokenmetadata.ingestion.store;

/**
 * Where a write came from: the event and the location its bytes were served from.
 *
 * @param gateway gateway base URL for content-addressed fetches; null otherwise
 */
public record WriteProvenance(String eventId, String metadataUri, String gateway) {
}
