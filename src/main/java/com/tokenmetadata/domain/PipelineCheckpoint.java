package com.tokenmetadata.domain;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;

/**
 * Resume position for an event source: every event with sequence &lt;= {@code sequence} reached a terminal
 * outcome.
 */
@Document(collection = "pipeline_checkpoints")
@NoArgsConstructor
@Getter
@Setter
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class PipelineCheckpoint {

    @Id
    @EqualsAndHashCode.Include
    private String id;
    private long sequence;
    private Instant updatedAt;
}
