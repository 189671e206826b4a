package com.example.agreement.domain.model;

import com.example.agreement.domain.exception.UnrecognizedCategoryException;

import java.util.Locale;

/**
 * Dataset-level classification governing who may access a dataset's content.
 * A {@code null} category is treated as "unspecified" by the callers.
 */
public enum AccessCategory {
    OPEN_ACCESS,
    ANONYMOUS_ACCESS,
    FREELY_AVAILABLE,
    OPEN_ACCESS_FOR_REGISTERED_USERS,
    GROUP_ACCESS,
    REQUEST_PERMISSION,
    ACCESS_ELSEWHERE,
    NO_ACCESS;

	/**
	 * Parses a raw category name coming from a metadata record.
	 *
	 * @param rawValue category name, case-insensitive
	 * @return matching category or {@code null} when the value is absent
	 * @throws UnrecognizedCategoryException when the value names no known category
	 */
    public static AccessCategory fromName(String rawValue) {
        if (rawValue == null || rawValue.isBlank()) {
            return null;
        }
        try {
            return AccessCategory.valueOf(rawValue.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException ex) {
            throw new UnrecognizedCategoryException("access category", rawValue);
        }
    }
}
