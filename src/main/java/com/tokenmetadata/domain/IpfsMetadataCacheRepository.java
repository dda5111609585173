package com.tokenmetadata.domain;

import org.springframework.data.mongodb.repository.MongoRepository;

public interface IpfsMetadataCacheRepository extends MongoRepository<IpfsMetadataCacheEntry, String> {
}
