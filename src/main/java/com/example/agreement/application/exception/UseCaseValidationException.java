package com.example.agreement.application.exception;

/**
 * Signals an incomplete agreement request detected before any placeholder is derived.
 */
public class UseCaseValidationException extends ApplicationException {

	/**
	 * @param message specific validation failure
	 */
    public UseCaseValidationException(String message) {
        super(message);
    }
}
