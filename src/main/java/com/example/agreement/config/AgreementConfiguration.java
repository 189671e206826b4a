package com.example.agreement.config;

import com.example.agreement.application.service.PlaceholderMapper;
import com.example.agreement.infrastructure.template.TemplateResourceReader;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Wires the placeholder derivation with the staged template resources.
 */
@Configuration
@EnableConfigurationProperties(AgreementProperties.class)
public class AgreementConfiguration {

    @Bean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }

    /**
     * Creates the mapper, loading the metadata term labels once at startup.
     *
     * @param properties     agreement configuration
     * @param resourceReader reader for the template resources
     * @param clock          clock used for embargo and timestamp placeholders
     * @return configured mapper
     */
    @Bean
    public PlaceholderMapper placeholderMapper(AgreementProperties properties,
                                               TemplateResourceReader resourceReader,
                                               Clock clock) {
        return new PlaceholderMapper(resourceReader.readTermLabels(properties.metadataTermsPath()), clock);
    }
}
