package com.example.agreement.infrastructure.template;

import com.example.agreement.domain.model.MetadataTerm;
import com.example.agreement.infrastructure.exception.TemplateResourceException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.EnumMap;
import java.util.Locale;
import java.util.Map;
import java.util.Properties;

/**
 * Infrastructure service that loads the staged template resources into domain values.
 * Hides the properties file format from the placeholder derivation.
 */
@Service
public class TemplateResourceReader {

    private static final Logger log = LoggerFactory.getLogger(TemplateResourceReader.class);

    /**
     * Reads the human readable labels of the metadata table.
     * Each key is the name of a {@link MetadataTerm}; keys naming no term are ignored.
     *
     * @param labelsFile properties file in the template resource directory
     * @return labels per term, only containing the terms that have a label
     * @throws TemplateResourceException when the file cannot be read
     */
    public Map<MetadataTerm, String> readTermLabels(Path labelsFile) {
        Properties properties = new Properties();
        try (Reader reader = Files.newBufferedReader(labelsFile, StandardCharsets.UTF_8)) {
            properties.load(reader);
        } catch (IOException e) {
            throw new TemplateResourceException("Unable to read metadata term labels from " + labelsFile, e);
        }

        Map<MetadataTerm, String> labels = new EnumMap<>(MetadataTerm.class);
        for (String key : properties.stringPropertyNames()) {
            MetadataTerm term = toTerm(key);
            if (term == null) {
                log.warn("Ignoring label for unknown metadata term '{}' in {}", key, labelsFile);
                continue;
            }
            labels.put(term, properties.getProperty(key).trim());
        }
        log.debug("Loaded {} metadata term labels from {}", labels.size(), labelsFile);
        return labels;
    }

    /**
     * @param key property key
     * @return term or {@code null} when the key does not name one
     */
    private MetadataTerm toTerm(String key) {
        try {
            return MetadataTerm.valueOf(key.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException ex) {
            return null;
        }
    }
}
