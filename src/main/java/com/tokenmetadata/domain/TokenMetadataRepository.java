package com.tokenmetadata.domain;

import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.List;

/**
 * Reads of token_metadata. Writes go through TokenMetadataSink.
 */
public interface TokenMetadataRepository extends MongoRepository<TokenMetadata, String> {

    List<TokenMetadata> findByFingerprint(String fingerprint);

    long countByValidity(Validity validity);
}
