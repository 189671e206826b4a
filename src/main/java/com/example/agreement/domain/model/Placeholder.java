package com.example.agreement.domain.model;

/**
 * Vocabulary of placeholders available to the agreement template.
 * Each constant carries the literal key the template refers to.
 */
public enum Placeholder {
    IS_SAMPLE("IsSample"),
    DANS_MANAGED_DOI("DansManagedDoi"),
    DANS_MANAGED_ENCODED_DOI("DansManagedEncodedDoi"),
    DATE_SUBMITTED("DateSubmitted"),
    TITLE("Title"),
    UNDER_EMBARGO("UnderEmbargo"),
    DATE_AVAILABLE("DateAvailable"),
    DEPOSITOR_NAME("DepositorName"),
    DEPOSITOR_ORGANISATION("DepositorOrganisation"),
    DEPOSITOR_ADDRESS("DepositorAddress"),
    DEPOSITOR_POSTAL_CODE("DepositorPostalCode"),
    DEPOSITOR_CITY("DepositorCity"),
    DEPOSITOR_COUNTRY("DepositorCountry"),
    DEPOSITOR_TELEPHONE("DepositorTelephone"),
    DEPOSITOR_EMAIL("DepositorEmail"),
    OPEN_ACCESS("OpenAccess"),
    CURRENT_DATE_AND_TIME("CurrentDateAndTime"),
    FOOTER_TEXT("FooterText"),
    METADATA_TABLE("MetadataTable"),
    FILE_TABLE("FileTable"),
    HAS_FILES("HasFiles");

    private final String key;

    Placeholder(String key) {
        this.key = key;
    }

	/**
	 * @return key under which the template engine expects this value
	 */
    public String key() {
        return key;
    }
}
