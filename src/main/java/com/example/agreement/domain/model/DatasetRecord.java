package com.example.agreement.domain.model;

import java.util.List;

/**
 * Everything the metadata service knows about a dataset that is relevant for its agreement.
 */
public record DatasetRecord(
        String datasetId,
        DatasetMetadata metadata,
        String depositorId,
        List<FileEntry> files
) {

    public DatasetRecord {
        files = files == null ? List.of() : List.copyOf(files);
    }
}
