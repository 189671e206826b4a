package com.example.agreement.application.model;

import com.example.agreement.application.port.DatasetMetadataService;
import com.example.agreement.application.port.DepositorService;

import java.nio.file.Path;

/**
 * Request-scoped settings for generating the placeholders of one agreement.
 * Created per request and discarded afterwards.
 *
 * @param templateResourceDir directory holding the staged template resources (footer text, labels)
 * @param datasetId           dataset the agreement is generated for
 * @param sample              whether a sample agreement without persistent identifier is requested
 * @param metadataService     handle on the dataset metadata repository
 * @param depositorService    handle on the identity service
 */
public record AgreementSettings(
        Path templateResourceDir,
        String datasetId,
        boolean sample,
        DatasetMetadataService metadataService,
        DepositorService depositorService
) {
}
