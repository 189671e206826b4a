package com.example.agreement.application.port;

import com.example.agreement.domain.model.Depositor;

/**
 * Handle on the identity service holding depositor contact details.
 */
@FunctionalInterface
public interface DepositorService {

	/**
	 * @param depositorId account identifier of the depositor
	 * @return contact record or {@code null} when the account is unknown
	 */
    Depositor fetchDepositor(String depositorId);
}
