package com.tokenmetadata.domain;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Latest normalized metadata per token. Id is {@link TokenId#key()}. Written only through the conditional
 * upsert in TokenMetadataSink so observedAt never goes backwards.
 */
@Document(collection = "token_metadata")
@CompoundIndex(name = "contract_token", def = "{'contractAddress': 1, 'tokenIndex': 1}")
@NoArgsConstructor
@Getter
@Setter
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class TokenMetadata {

    @Id
    @EqualsAndHashCode.Include
    private String id;
    private String contractAddress;
    private String tokenIndex;
    private long observedAt;
    private String eventId;
    private String metadataUri;
    private String gateway;
    @Indexed
    private String fingerprint;
    private SchemaFamily schemaFamily;
    private String schemaVersion;
    @Indexed
    private Validity validity;
    private String invalidReason;
    private List<FieldDefect> defects = new ArrayList<>();
    private Map<String, Object> fields = new LinkedHashMap<>();
    private Map<String, Object> extensions = new LinkedHashMap<>();
    private Instant updatedAt;
}
