package com.tokenmetadata.domain;

import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.List;

public interface QuarantinedEventRepository extends MongoRepository<QuarantinedEvent, String> {

    List<QuarantinedEvent> findByTokenKey(String tokenKey);
}
