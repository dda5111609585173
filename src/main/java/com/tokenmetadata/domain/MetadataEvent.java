package com.tokenmetadata.domain;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

/**
 * Token metadata update emitted by the indexer. Written by the indexer into metadata_events; read here in
 * {@code sequence} order. May be delivered more than once.
 */
@Document(collection = "metadata_events")
@NoArgsConstructor
@Getter
@Setter
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class MetadataEvent {

    @Id
    @EqualsAndHashCode.Include
    private String id;
    /** Source position; strictly increasing across the collection. Checkpoints refer to it. */
    @Indexed(unique = true)
    private long sequence;
    private String contractAddress;
    /** Null for contract-level metadata. */
    private String tokenIndex;
    private SchemaFamily schemaFamily;
    /** Exactly one of metadataUri / inlineMetadata is set. */
    private String metadataUri;
    private byte[] inlineMetadata;
    /** Block level at which the update was observed. Orders writes per token. */
    private long observedAt;

    public TokenId tokenId() {
        return TokenId.of(contractAddress, tokenIndex);
    }

    public SchemaFamily schemaFamilyOrDefault() {
        return schemaFamily != null ? schemaFamily : SchemaFamily.GENERIC;
    }

    @Override
    public String toString() {
        return "MetadataEvent{id=" + id + ", seq=" + sequence + ", token=" + contractAddress + ":" + tokenIndex
                + ", observedAt=" + observedAt + ", uri=" + (metadataUri != null ? metadataUri : "<inline>") + "}";
    }
}
