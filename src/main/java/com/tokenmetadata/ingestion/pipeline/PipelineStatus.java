package com.tokenmetadata.ingestion.pipeline;

public enum PipelineStatus {
    RUNNING,
    DRAINING,
    STOPPED
}
