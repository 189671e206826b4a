package com.example.agreement.interfaces.api.dto;

import com.example.agreement.application.exception.UseCaseValidationException;
import com.example.agreement.domain.model.DatasetRecord;
import com.example.agreement.domain.model.Depositor;
import com.example.agreement.domain.model.FileAccessRight;
import com.example.agreement.domain.model.FileEntry;

import java.time.LocalDate;
import java.util.List;
import java.util.Map;

/**
 * API-layer DTO carrying a complete dataset description for which placeholders are requested.
 */
public record PlaceholderRequest(
        String datasetId,
        boolean sample,
        Metadata metadata,
        Depositor depositor,
        List<File> files
) {

    /**
     * Descriptive metadata of the dataset.
     *
     * @param terms values per metadata term name
     */
    public record Metadata(
            String doi,
            String title,
            List<LocalDate> dateSubmitted,
            List<LocalDate> available,
            String accessCategory,
            Map<String, List<String>> terms
    ) {
    }

    /**
     * File of the dataset with the name of its access right.
     */
    public record File(String path, String accessRight) {
    }

    /**
     * Converts the request into the record the metadata service would have returned.
     *
     * @return dataset record or {@code null} when the request carries no metadata
     * @throws UseCaseValidationException when the file list contains a {@code null} entry
     */
    public DatasetRecord toDatasetRecord() {
        if (metadata == null) {
            return null;
        }
        List<FileEntry> entries = files == null
                ? List.of()
                : files.stream()
                        .map(PlaceholderRequest::toFileEntry)
                        .toList();
        return new DatasetRecord(datasetId, new RequestDatasetMetadata(metadata), datasetId, entries);
    }

    private static FileEntry toFileEntry(File file) {
        if (file == null) {
            throw new UseCaseValidationException("File entries must not be null.");
        }
        return new FileEntry(file.path(), FileAccessRight.fromName(file.accessRight()));
    }
}
