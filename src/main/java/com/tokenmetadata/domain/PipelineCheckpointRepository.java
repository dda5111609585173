package com.tokenmetadata.domain;

import org.springframework.data.mongodb.repository.MongoRepository;

public interface PipelineCheckpointRepository extends MongoRepository<PipelineCheckpoint, String> {
}
