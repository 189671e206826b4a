package com.example.agreement.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.nio.file.Path;

/**
 * Externalized configuration bound from the {@code agreement.*} properties.
 *
 * @param templateResourceDir directory holding the staged template resources
 * @param metadataTermsFile   name of the metadata term labels file inside {@code templateResourceDir}
 */
@ConfigurationProperties("agreement")
public record AgreementProperties(
        Path templateResourceDir,
        @DefaultValue("MetadataTerms.properties") String metadataTermsFile
) {

    /**
     * @return location of the metadata term labels file
     */
    public Path metadataTermsPath() {
        return templateResourceDir.resolve(metadataTermsFile);
    }
}
