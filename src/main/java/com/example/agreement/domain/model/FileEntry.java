package com.example.agreement.domain.model;

/**
 * File belonging to a dataset together with its access right.
 */
public record FileEntry(String path, FileAccessRight accessRight) {
}
