package com.example.agreement.application.exception;

/**
 * Thrown when two partial placeholder maps define the same key while being merged.
 */
public class PlaceholderCollisionException extends ApplicationException {

	/**
	 * @param key template key that was defined twice
	 */
    public PlaceholderCollisionException(String key) {
        super("Placeholder defined more than once: " + key);
    }
}
