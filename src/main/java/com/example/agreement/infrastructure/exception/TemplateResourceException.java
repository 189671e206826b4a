package com.example.agreement.infrastructure.exception;

/**
 * Infrastructure-layer exception that signals a template resource (footer text, term labels) could not be read.
 */
public class TemplateResourceException extends InfrastructureException {
	/**
	 * Creates the exception with a contextual message and the underlying I/O cause.
	 *
	 * @param message description shared with the application layer
	 * @param cause   low-level I/O exception
	 */
    public TemplateResourceException(String message, Throwable cause) {
        super(message, cause);
    }
}
