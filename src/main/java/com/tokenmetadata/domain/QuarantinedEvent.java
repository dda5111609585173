package com.tokenmetadata.domain;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;

/**
 * Terminal failure record for an event, kept for operator review. Id is the event id, so a redelivered
 * event that fails again overwrites its previous entry.
 */
@Document(collection = "quarantined_events")
@NoArgsConstructor
@Getter
@Setter
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class QuarantinedEvent {

    @Id
    @EqualsAndHashCode.Include
    private String id;
    private long sequence;
    @Indexed
    private String tokenKey;
    private String metadataUri;
    private long observedAt;
    private SchemaFamily schemaFamily;
    private QuarantineReason reason;
    private int attempts;
    private String lastErrorKind;
    private String lastErrorMessage;
    private Instant firstAttemptAt;
    private Instant quarantinedAt;
}
