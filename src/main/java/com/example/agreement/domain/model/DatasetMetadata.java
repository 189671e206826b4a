package com.example.agreement.domain.model;

import java.util.List;

/**
 * Read-only view on a dataset's descriptive metadata record, as delivered by the metadata service.
 * Placeholder derivation only depends on these accessors, so implementations may be thin adapters or test stubs.
 */
public interface DatasetMetadata {

    /**
     * @return managed persistent identifier (DOI) or {@code null} when none was assigned
     */
    String getManagedDoi();

    /**
     * @return preferred title of the dataset
     */
    String getPreferredTitle();

    /**
     * @return container holding the submitted and available dates
     */
    DatasetDates getDates();

    /**
     * @return dataset access category or {@code null} when unspecified
     */
    AccessCategory getAccessCategory();

    /**
     * Looks up all values recorded for an arbitrary descriptive term.
     *
     * @param term term to look up
     * @return values in record order, empty when the term is not present
     */
    List<MetadataItem> getTerm(MetadataTerm term);
}
