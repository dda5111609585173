package com.tokenmetadata.domain;

/**
 * Expected metadata document family. Chosen by the indexer per event; decides required fields and types.
 */
public enum SchemaFamily {
    /** Any token; only a name is required. */
    GENERIC,
    /** Fungible token: name, symbol, decimals. */
    FUNGIBLE,
    /** Plain NFT: name and artifact. */
    COLLECTIBLE,
    /** World item with a 3D or image artifact, formats and tags. */
    ITEM,
    /** World place with coordinates and build height. */
    PLACE,
    /** Contract-level metadata: name and description. */
    CONTRACT
}
