package com.example.agreement.domain.exception;

/**
 * Raised when the identity service cannot resolve the depositor of a dataset.
 */
public class DepositorNotFoundException extends DomainException {

	/**
	 * Creates the exception and records the depositor reference that failed.
	 *
	 * @param depositorId identifier of the depositor account
	 */
    public DepositorNotFoundException(String depositorId) {
        super("Depositor not found: " + depositorId);
    }
}
