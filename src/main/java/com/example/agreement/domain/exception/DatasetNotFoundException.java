package com.example.agreement.domain.exception;

/**
 * Raised when the metadata service has no record for the requested dataset.
 */
public class DatasetNotFoundException extends DomainException {

	/**
	 * Creates the exception and records the missing dataset identifier.
	 *
	 * @param datasetId identifier that could not be resolved
	 */
    public DatasetNotFoundException(String datasetId) {
        super("Dataset not found: " + datasetId);
    }
}
