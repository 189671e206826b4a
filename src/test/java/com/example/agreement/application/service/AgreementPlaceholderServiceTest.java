package com.example.agreement.application.service;

import com.example.agreement.application.exception.PlaceholderCollisionException;
import com.example.agreement.application.exception.UseCaseValidationException;
import com.example.agreement.application.model.AgreementSettings;
import com.example.agreement.domain.exception.DatasetNotFoundException;
import com.example.agreement.domain.exception.DepositorNotFoundException;
import com.example.agreement.domain.model.DatasetRecord;
import com.example.agreement.domain.model.Depositor;
import com.example.agreement.domain.model.FileAccessRight;
import com.example.agreement.domain.model.FileEntry;
import com.example.agreement.domain.model.MetadataTerm;
import com.example.agreement.domain.model.Placeholder;
import com.example.agreement.infrastructure.exception.TemplateResourceException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

/**
 * Unit tests verifying how the application service resolves a dataset and merges the placeholder groups.
 */
class AgreementPlaceholderServiceTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2024-06-15T10:15:30Z"), ZoneOffset.UTC);
    private static final Depositor DEPOSITOR =
            new Depositor("name", "org", "addr", "postal", "city", "country", "tel", "mail");

    @TempDir
    Path templateDir;

    private PlaceholderMapper mapper;
    private AgreementPlaceholderService service;
    private StubDatasetMetadata metadata;

    @BeforeEach
    void setUp() throws IOException {
        Files.writeString(templateDir.resolve(AgreementPlaceholderService.FOOTER_TEXT_FILE), "line one\nline two\n");
        mapper = new PlaceholderMapper(Map.of(MetadataTerm.TITLE, "Title"), CLOCK);
        service = new AgreementPlaceholderService(mapper);
        metadata = new StubDatasetMetadata()
                .doi("10.5072/dans-x1")
                .dateSubmitted(LocalDate.of(2016, 7, 30))
                .available(LocalDate.of(2030, 1, 1))
                .term(MetadataTerm.TITLE, "my preferred title");
    }

    /**
     * Verifies a regular agreement receives every placeholder exactly once.
     */
    @Test
    void createPlaceholdersMergesAllGroups() {
        DatasetRecord dataset = new DatasetRecord("easy-dataset:1", metadata, "user001",
                List.of(new FileEntry("data/a.csv", FileAccessRight.ANONYMOUS)));

        Map<String, Object> placeholders = service.createPlaceholders(settings(false, dataset, DEPOSITOR));

        assertThat(placeholders.keySet()).containsExactlyInAnyOrderElementsOf(
                Arrays.stream(Placeholder.values()).map(Placeholder::key).collect(Collectors.toSet()));
        assertThat(placeholders)
                .containsEntry("IsSample", false)
                .containsEntry("DansManagedEncodedDoi", "10.5072%2Fdans-x1")
                .containsEntry("UnderEmbargo", true)
                .containsEntry("DateAvailable", "2030-01-01")
                .containsEntry("DepositorEmail", "mail")
                .containsEntry("OpenAccess", true)
                .containsEntry("HasFiles", true)
                .containsEntry("CurrentDateAndTime", "2024-06-15 10:15:30")
                .containsEntry("FooterText", "line one\nline two");
    }

    /**
     * Ensures sample agreements leave out the identifier placeholders without reading the identifier.
     */
    @Test
    void createPlaceholdersForSampleSkipsDoi() {
        DatasetRecord dataset = new DatasetRecord("easy-dataset:1", metadata.forbidDoiAccess(), "user001", null);

        Map<String, Object> placeholders = service.createPlaceholders(settings(true, dataset, DEPOSITOR));

        assertThat(placeholders)
                .containsEntry("IsSample", true)
                .containsEntry("HasFiles", false)
                .doesNotContainKeys("DansManagedDoi", "DansManagedEncodedDoi");
    }

    @Test
    void createPlaceholdersRequiresDatasetId() {
        AgreementSettings settings = new AgreementSettings(templateDir, " ", false, id -> null, id -> DEPOSITOR);

        assertThrows(UseCaseValidationException.class, () -> service.createPlaceholders(settings));
    }

    @Test
    void createPlaceholdersFailsForUnknownDataset() {
        assertThrows(DatasetNotFoundException.class,
                () -> service.createPlaceholders(settings(false, null, DEPOSITOR)));
    }

    @Test
    void createPlaceholdersFailsForUnknownDepositor() {
        DatasetRecord dataset = new DatasetRecord("easy-dataset:1", metadata, "user001", List.of());

        assertThrows(DepositorNotFoundException.class,
                () -> service.createPlaceholders(settings(false, dataset, null)));
    }

    /**
     * Ensures a missing footer file aborts the request.
     *
     * @throws IOException when the fixture cannot be removed
     */
    @Test
    void createPlaceholdersFailsWithoutFooterText() throws IOException {
        Files.delete(templateDir.resolve(AgreementPlaceholderService.FOOTER_TEXT_FILE));
        DatasetRecord dataset = new DatasetRecord("easy-dataset:1", metadata, "user001", List.of());

        assertThrows(TemplateResourceException.class,
                () -> service.createPlaceholders(settings(false, dataset, DEPOSITOR)));
    }

    /**
     * Verifies that the partial maps of the mapper never share a key.
     */
    @Test
    void placeholderGroupsAreDisjoint() {
        List<Map<Placeholder, Object>> groups = List.of(
                mapper.header(metadata, settings(false, null, null)),
                mapper.depositor(DEPOSITOR),
                mapper.embargo(metadata),
                mapper.accessRights(metadata),
                mapper.metadataTable(metadata),
                mapper.fileTable(List.of()),
                mapper.currentDateAndTime(),
                mapper.footer(templateDir.resolve(AgreementPlaceholderService.FOOTER_TEXT_FILE)));

        int total = groups.stream().mapToInt(Map::size).sum();

        assertThat(service.merge(groups)).hasSize(total);
    }

    @Test
    void mergeRejectsDuplicateKeys() {
        Map<Placeholder, Object> first = Map.of(Placeholder.TITLE, "one");
        Map<Placeholder, Object> second = Map.of(Placeholder.TITLE, "two");

        PlaceholderCollisionException ex = assertThrows(PlaceholderCollisionException.class,
                () -> service.merge(List.of(first, second)));

        assertThat(ex).hasMessageContaining("Title");
    }

    private AgreementSettings settings(boolean sample, DatasetRecord dataset, Depositor depositor) {
        return new AgreementSettings(templateDir, "easy-dataset:1", sample, id -> dataset, id -> depositor);
    }
}
