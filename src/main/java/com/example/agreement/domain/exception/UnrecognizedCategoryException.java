package com.example.agreement.domain.exception;

/**
 * Raised when an access category or file access right does not belong to the closed set of known values.
 * Such values are data errors and are never mapped to a silent default.
 */
public class UnrecognizedCategoryException extends DomainException {

	/**
	 * Creates the exception and records the offending value.
	 *
	 * @param type  name of the enumeration that was being parsed
	 * @param value raw value that could not be matched
	 */
    public UnrecognizedCategoryException(String type, String value) {
        super("Unrecognized " + type + ": " + value);
    }
}
