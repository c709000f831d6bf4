package com.postintel.parser.model;

import lombok.Builder;
import lombok.Data;

import java.time.LocalDateTime;

/**
 * Tracks each batch run for observability. Written into the stats side-car.
 */
@Data
@Builder
public class BatchRun {

    private String runId;           // UUID
    private String inputFile;
    private LocalDateTime startedAt;
    private LocalDateTime completedAt;
    private String status;          // RUNNING | SUCCESS | FAILED
    private int recordsRead;
    private int recordsWritten;
    private int recordsSkipped;
    private String errorMessage;    // null on success
}
