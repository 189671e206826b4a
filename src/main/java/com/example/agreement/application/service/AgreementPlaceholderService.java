package com.example.agreement.application.service;

import com.example.agreement.application.exception.PlaceholderCollisionException;
import com.example.agreement.application.exception.UseCaseValidationException;
import com.example.agreement.application.model.AgreementSettings;
import com.example.agreement.domain.exception.DatasetNotFoundException;
import com.example.agreement.domain.exception.DepositorNotFoundException;
import com.example.agreement.domain.model.DatasetMetadata;
import com.example.agreement.domain.model.DatasetRecord;
import com.example.agreement.domain.model.Depositor;
import com.example.agreement.domain.model.Placeholder;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Application-layer service that assembles the complete placeholder set of one agreement.
 * It resolves the dataset and its depositor through the request's service handles, delegates the
 * derivation of every placeholder group to {@link PlaceholderMapper} and merges the results.
 */
@Service
public class AgreementPlaceholderService {

    static final String FOOTER_TEXT_FILE = "FooterText.txt";

    private static final Logger log = LoggerFactory.getLogger(AgreementPlaceholderService.class);

    private final PlaceholderMapper placeholderMapper;

    /**
     * @param placeholderMapper mapper deriving the individual placeholder groups
     */
    public AgreementPlaceholderService(PlaceholderMapper placeholderMapper) {
        this.placeholderMapper = placeholderMapper;
    }

    /**
     * Derives every placeholder of the agreement for the dataset named in {@code settings}.
     *
     * @param settings request-scoped settings
     * @return substitution context keyed by template key
     * @throws UseCaseValidationException    when no dataset identifier was given
     * @throws DatasetNotFoundException      when the metadata service does not know the dataset
     * @throws DepositorNotFoundException    when the identity service does not know the depositor
     * @throws PlaceholderCollisionException when two placeholder groups define the same key
     */
    public Map<String, Object> createPlaceholders(AgreementSettings settings) {
        if (settings.datasetId() == null || settings.datasetId().isBlank()) {
            throw new UseCaseValidationException("A dataset identifier is required.");
        }

        DatasetRecord dataset = settings.metadataService().fetchDataset(settings.datasetId());
        if (dataset == null) {
            throw new DatasetNotFoundException(settings.datasetId());
        }
        Depositor depositor = settings.depositorService().fetchDepositor(dataset.depositorId());
        if (depositor == null) {
            throw new DepositorNotFoundException(dataset.depositorId());
        }
        log.debug("Creating {} placeholders for dataset {}", settings.sample() ? "sample" : "agreement", settings.datasetId());

        DatasetMetadata metadata = dataset.metadata();
        Path footerTextFile = settings.templateResourceDir().resolve(FOOTER_TEXT_FILE);

        return merge(List.of(
                settings.sample()
                        ? placeholderMapper.sampleHeader(metadata)
                        : placeholderMapper.header(metadata, settings),
                placeholderMapper.depositor(depositor),
                placeholderMapper.embargo(metadata),
                placeholderMapper.accessRights(metadata),
                placeholderMapper.metadataTable(metadata),
                placeholderMapper.fileTable(dataset.files()),
                placeholderMapper.currentDateAndTime(),
                placeholderMapper.footer(footerTextFile)
        ));
    }

    /**
     * Merges partial placeholder maps into one substitution context.
     *
     * @param partials placeholder groups to combine
     * @return merged map keyed by template key
     * @throws PlaceholderCollisionException when a key occurs in more than one group
     */
    Map<String, Object> merge(List<Map<Placeholder, Object>> partials) {
        Map<String, Object> merged = new LinkedHashMap<>();
        for (Map<Placeholder, Object> partial : partials) {
            for (Map.Entry<Placeholder, Object> entry : partial.entrySet()) {
                String key = entry.getKey().key();
                if (merged.containsKey(key)) {
                    throw new PlaceholderCollisionException(key);
                }
                merged.put(key, entry.getValue());
            }
        }
        return merged;
    }
}
