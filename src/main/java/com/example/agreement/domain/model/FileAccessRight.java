package com.example.agreement.domain.model;

import com.example.agreement.domain.exception.UnrecognizedCategoryException;

import java.util.Locale;

/**
 * Per-file access classification, distinct from the dataset-level {@link AccessCategory}.
 */
public enum FileAccessRight {
    ANONYMOUS,
    KNOWN,
    RESTRICTED_REQUEST,
    RESTRICTED_GROUP,
    NONE;

	/**
	 * Parses a raw file access right. Unlike {@link AccessCategory#fromName(String)} an absent value is rejected,
	 * every file carries exactly one right.
	 *
	 * @param rawValue access right name, case-insensitive
	 * @return matching access right
	 * @throws UnrecognizedCategoryException when the value is missing or names no known right
	 */
    public static FileAccessRight fromName(String rawValue) {
        if (rawValue == null) {
            throw new UnrecognizedCategoryException("file access right", null);
        }
        try {
            return FileAccessRight.valueOf(rawValue.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException ex) {
            throw new UnrecognizedCategoryException("file access right", rawValue);
        }
    }
}
