package com.example.agreement.domain.model;

/**
 * Plain-text metadata value.
 */
public record TextMetadataItem(String value) implements MetadataItem {

    @Override
    public String toString() {
        return value;
    }
}
