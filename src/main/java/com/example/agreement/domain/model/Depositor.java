package com.example.agreement.domain.model;

/**
 * Contact record of the account that deposited a dataset, as returned by the identity service.
 * Fields are copied into the agreement verbatim; absent values are expected as empty strings.
 */
public record Depositor(
        String name,
        String organisation,
        String address,
        String postalCode,
        String city,
        String country,
        String telephone,
        String email
) {
}
