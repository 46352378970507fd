package com.di.modelnova.lifecycle.backend;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;

/**
 * Reference to the data a training run consumes. {@code recordCount} and {@code columns} are null when the
 * location is remote and could not be inspected.
 */
@Value
@Builder
public class DatasetHandle {
    String datasetId;
    String modelFamily;
    String location;
    Long recordCount;
    List<String> columns;
    Instant acquiredAt;

    public boolean isInspected() {
        return recordCount != null;
    }
}
