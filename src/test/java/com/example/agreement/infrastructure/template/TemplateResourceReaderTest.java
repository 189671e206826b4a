package com.example.agreement.infrastructure.template;

import com.example.agreement.domain.model.MetadataTerm;
import com.example.agreement.infrastructure.exception.TemplateResourceException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for loading the metadata term labels.
 */
class TemplateResourceReaderTest {

    private final TemplateResourceReader reader = new TemplateResourceReader();

    /**
     * Ensures labels are keyed by term and unknown keys are dropped.
     *
     * @throws IOException when the fixture cannot be written
     */
    @Test
    void readTermLabelsIgnoresUnknownTerms(@TempDir Path dir) throws IOException {
        Path labels = Files.writeString(dir.resolve("MetadataTerms.properties"),
                "TITLE=Title\naccessrights = Toegangsrechten \nNOT_A_TERM=Ignored\n",
                StandardCharsets.UTF_8);

        Map<MetadataTerm, String> result = reader.readTermLabels(labels);

        assertThat(result).containsExactlyInAnyOrderEntriesOf(Map.of(
                MetadataTerm.TITLE, "Title",
                MetadataTerm.ACCESSRIGHTS, "Toegangsrechten"));
    }

    @Test
    void readTermLabelsKeepsNonAsciiLabels(@TempDir Path dir) throws IOException {
        Path labels = Files.writeString(dir.resolve("MetadataTerms.properties"), "CREATOR=Maker/Créateur\n",
                StandardCharsets.UTF_8);

        assertThat(reader.readTermLabels(labels)).containsEntry(MetadataTerm.CREATOR, "Maker/Créateur");
    }

    @Test
    void readTermLabelsFailsForMissingFile(@TempDir Path dir) {
        assertThatThrownBy(() -> reader.readTermLabels(dir.resolve("absent.properties")))
                .isInstanceOf(TemplateResourceException.class)
                .hasCauseInstanceOf(IOException.class);
    }
}
