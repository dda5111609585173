package com.tokenmetadata.domain;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;

/**
 * Raw bytes of a metadata document behind an ipfs:// URI. Id is the normalized URI; content behind it never
 * changes, so an entry is written once and read on every later resolution, across restarts.
 */
@Document(collection = "ipfs_metadata_cache")
@NoArgsConstructor
@Getter
@Setter
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class IpfsMetadataCacheEntry {

    @Id
    @EqualsAndHashCode.Include
    private String uri;
    private byte[] body;
    private String fingerprint;
    private String gateway;
    private Instant cachedAt;
}
