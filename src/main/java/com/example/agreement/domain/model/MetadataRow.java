package com.example.agreement.domain.model;

/**
 * Row of the agreement's metadata table.
 */
public record MetadataRow(String label, String value) {
}
