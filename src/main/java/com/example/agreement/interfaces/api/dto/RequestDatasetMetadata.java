package com.example.agreement.interfaces.api.dto;

import com.example.agreement.application.exception.UseCaseValidationException;
import com.example.agreement.domain.model.AccessCategory;
import com.example.agreement.domain.model.DatasetDates;
import com.example.agreement.domain.model.DatasetMetadata;
import com.example.agreement.domain.model.MetadataItem;
import com.example.agreement.domain.model.MetadataTerm;
import com.example.agreement.domain.model.TextMetadataItem;

import java.time.LocalDate;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Adapts the metadata of a {@link PlaceholderRequest} to the {@link DatasetMetadata} view.
 */
class RequestDatasetMetadata implements DatasetMetadata, DatasetDates {

    private final PlaceholderRequest.Metadata metadata;
    private final AccessCategory accessCategory;
    private final Map<MetadataTerm, List<MetadataItem>> terms = new EnumMap<>(MetadataTerm.class);

    RequestDatasetMetadata(PlaceholderRequest.Metadata metadata) {
        this.metadata = metadata;
        this.accessCategory = AccessCategory.fromName(metadata.accessCategory());
        if (metadata.terms() != null) {
            metadata.terms().forEach((name, values) -> terms.put(toTerm(name), values == null
                    ? List.of()
                    : values.stream()
                            .filter(Objects::nonNull)
                            .<MetadataItem>map(TextMetadataItem::new)
                            .toList()));
        }
    }

    @Override
    public String getManagedDoi() {
        return metadata.doi();
    }

    @Override
    public String getPreferredTitle() {
        return metadata.title();
    }

    @Override
    public DatasetDates getDates() {
        return this;
    }

    @Override
    public AccessCategory getAccessCategory() {
        return accessCategory;
    }

    @Override
    public List<MetadataItem> getTerm(MetadataTerm term) {
        return terms.getOrDefault(term, List.of());
    }

    @Override
    public List<LocalDate> getDateSubmitted() {
        return metadata.dateSubmitted() == null ? List.of() : metadata.dateSubmitted();
    }

    @Override
    public List<LocalDate> getAvailable() {
        return metadata.available() == null ? List.of() : metadata.available();
    }

    private static MetadataTerm toTerm(String name) {
        try {
            return MetadataTerm.valueOf(name.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException ex) {
            throw new UseCaseValidationException("Unknown metadata term: " + name);
        }
    }
}
