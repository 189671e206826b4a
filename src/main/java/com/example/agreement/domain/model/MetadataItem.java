package com.example.agreement.domain.model;

/**
 * Opaque value of a descriptive metadata term.
 */
public interface MetadataItem {

    /**
     * @return string form of the item as it appears in the metadata record
     */
    String value();
}
