package com.example.agreement.application.service;

import com.example.agreement.domain.model.AccessCategory;
import com.example.agreement.domain.model.DatasetDates;
import com.example.agreement.domain.model.DatasetMetadata;
import com.example.agreement.domain.model.MetadataItem;
import com.example.agreement.domain.model.MetadataTerm;
import com.example.agreement.domain.model.TextMetadataItem;

import java.time.LocalDate;
import java.util.Arrays;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Hand-written {@link DatasetMetadata} used across the service tests.
 */
class StubDatasetMetadata implements DatasetMetadata, DatasetDates {

    private String doi;
    private boolean doiForbidden;
    private String title = "my preferred title";
    private List<LocalDate> dateSubmitted = List.of();
    private List<LocalDate> available = List.of();
    private AccessCategory accessCategory;
    private final Map<MetadataTerm, List<MetadataItem>> terms = new EnumMap<>(MetadataTerm.class);

    StubDatasetMetadata doi(String doi) {
        this.doi = doi;
        return this;
    }

    /**
     * Makes every read of the persistent identifier fail.
     */
    StubDatasetMetadata forbidDoiAccess() {
        this.doiForbidden = true;
        return this;
    }

    StubDatasetMetadata title(String title) {
        this.title = title;
        return this;
    }

    StubDatasetMetadata dateSubmitted(LocalDate... dates) {
        this.dateSubmitted = List.of(dates);
        return this;
    }

    StubDatasetMetadata available(LocalDate... dates) {
        this.available = List.of(dates);
        return this;
    }

    StubDatasetMetadata accessCategory(AccessCategory accessCategory) {
        this.accessCategory = accessCategory;
        return this;
    }

    StubDatasetMetadata term(MetadataTerm term, String... values) {
        terms.put(term, Arrays.stream(values).<MetadataItem>map(TextMetadataItem::new).toList());
        return this;
    }

    @Override
    public String getManagedDoi() {
        if (doiForbidden) {
            throw new IllegalStateException("the persistent identifier must not be read");
        }
        return doi;
    }

    @Override
    public String getPreferredTitle() {
        return title;
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
        return dateSubmitted;
    }

    @Override
    public List<LocalDate> getAvailable() {
        return available;
    }
}
