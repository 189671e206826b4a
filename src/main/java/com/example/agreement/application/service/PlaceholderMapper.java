package com.example.agreement.application.service;

import com.example.agreement.application.model.AgreementSettings;
import com.example.agreement.domain.model.AccessCategory;
import com.example.agreement.domain.model.DatasetDates;
import com.example.agreement.domain.model.DatasetMetadata;
import com.example.agreement.domain.model.Depositor;
import com.example.agreement.domain.model.FileAccessRight;
import com.example.agreement.domain.model.FileEntry;
import com.example.agreement.domain.model.FileRow;
import com.example.agreement.domain.model.MetadataItem;
import com.example.agreement.domain.model.MetadataRow;
import com.example.agreement.domain.model.MetadataTerm;
import com.example.agreement.domain.model.Placeholder;
import com.example.agreement.infrastructure.exception.TemplateResourceException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.Charset;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Derives the placeholders of a deposit agreement from a dataset's metadata and its depositor.
 * Every extraction method returns an independent partial map; the partial maps never share keys,
 * so callers can merge them into the substitution context of the template engine.
 */
public class PlaceholderMapper {

    private static final Logger log = LoggerFactory.getLogger(PlaceholderMapper.class);
    private static final DateTimeFormatter EMBARGO_DATE_FORMATTER = DateTimeFormatter.ofPattern("yyyy-MM-dd");
    private static final DateTimeFormatter DATE_TIME_FORMATTER = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");
    private static final Map<String, String> DATASET_ACCESS_LABELS = Map.of(
            "ANONYMOUS_ACCESS", "Anonymous",
            "OPEN_ACCESS", "Open Access",
            "FREELY_AVAILABLE", "Open Access",
            "OPEN_ACCESS_FOR_REGISTERED_USERS", "Open access for registered users",
            "GROUP_ACCESS", "Restricted - 'archaeology' group",
            "REQUEST_PERMISSION", "Restricted - request permission",
            "ACCESS_ELSEWHERE", "Elsewhere",
            "NO_ACCESS", "Other"
    );

    private final Map<MetadataTerm, String> termLabels;
    private final Clock clock;

    /**
     * Creates the mapper with the labels of the metadata table.
     *
     * @param termLabels labels per metadata term, as loaded from the template resource directory
     * @param clock      clock deciding what "today" is for embargo computation
     */
    public PlaceholderMapper(Map<MetadataTerm, String> termLabels, Clock clock) {
        this.termLabels = termLabels.isEmpty()
                ? new EnumMap<>(MetadataTerm.class)
                : new EnumMap<>(termLabels);
        this.clock = clock;
    }

    /**
     * Builds the header placeholders of a regular agreement.
     *
     * @param metadata dataset metadata
     * @param settings request settings providing the sample flag
     * @return IsSample, DansManagedDoi, DansManagedEncodedDoi, DateSubmitted and Title
     */
    public Map<Placeholder, Object> header(DatasetMetadata metadata, AgreementSettings settings) {
        String doi = Optional.ofNullable(metadata.getManagedDoi()).orElse("");

        Map<Placeholder, Object> header = new EnumMap<>(Placeholder.class);
        header.put(Placeholder.IS_SAMPLE, settings.sample());
        header.put(Placeholder.DANS_MANAGED_DOI, doi);
        header.put(Placeholder.DANS_MANAGED_ENCODED_DOI, encodeDoi(doi));
        header.put(Placeholder.DATE_SUBMITTED, dateSubmitted(metadata));
        header.put(Placeholder.TITLE, metadata.getPreferredTitle());
        return header;
    }

    /**
     * Builds the header placeholders of a sample agreement.
     * The persistent identifier is never read, a sample does not have one yet.
     *
     * @param metadata dataset metadata
     * @return IsSample (always {@code true}), DateSubmitted and Title
     */
    public Map<Placeholder, Object> sampleHeader(DatasetMetadata metadata) {
        Map<Placeholder, Object> header = new EnumMap<>(Placeholder.class);
        header.put(Placeholder.IS_SAMPLE, true);
        header.put(Placeholder.DATE_SUBMITTED, dateSubmitted(metadata));
        header.put(Placeholder.TITLE, metadata.getPreferredTitle());
        return header;
    }

    /**
     * Picks the first date of the sequence chosen by {@code selector}.
     *
     * @param metadata dataset metadata
     * @param selector projection from the date container to an ordered date sequence
     * @return first date or empty when the sequence is empty
     */
    public Optional<LocalDate> getDate(DatasetMetadata metadata, Function<DatasetDates, List<LocalDate>> selector) {
        List<LocalDate> dates = selector.apply(metadata.getDates());
        if (dates == null || dates.isEmpty()) {
            return Optional.empty();
        }
        return Optional.ofNullable(dates.get(0));
    }

    /**
     * Determines whether the dataset is still under embargo.
     *
     * @param metadata dataset metadata
     * @return DateAvailable and UnderEmbargo
     */
    public Map<Placeholder, Object> embargo(DatasetMetadata metadata) {
        LocalDate today = LocalDate.now(clock);
        Map<Placeholder, Object> embargo = new EnumMap<>(Placeholder.class);

        Optional<LocalDate> available = getDate(metadata, DatasetDates::getAvailable);
        if (available.isEmpty()) {
            embargo.put(Placeholder.DATE_AVAILABLE, "");
            embargo.put(Placeholder.UNDER_EMBARGO, false);
        } else if (available.get().isAfter(today)) {
            embargo.put(Placeholder.DATE_AVAILABLE, EMBARGO_DATE_FORMATTER.format(available.get()));
            embargo.put(Placeholder.UNDER_EMBARGO, true);
        } else {
            embargo.put(Placeholder.DATE_AVAILABLE, available.get().toString());
            embargo.put(Placeholder.UNDER_EMBARGO, false);
        }
        log.debug("Embargo for available date {} (today {}): {}", available.orElse(null), today, embargo);
        return embargo;
    }

    /**
     * Copies the depositor's contact details.
     *
     * @param depositor depositor record
     * @return the eight Depositor* placeholders
     */
    public Map<Placeholder, Object> depositor(Depositor depositor) {
        Map<Placeholder, Object> map = new EnumMap<>(Placeholder.class);
        map.put(Placeholder.DEPOSITOR_NAME, depositor.name());
        map.put(Placeholder.DEPOSITOR_ORGANISATION, depositor.organisation());
        map.put(Placeholder.DEPOSITOR_ADDRESS, depositor.address());
        map.put(Placeholder.DEPOSITOR_POSTAL_CODE, depositor.postalCode());
        map.put(Placeholder.DEPOSITOR_CITY, depositor.city());
        map.put(Placeholder.DEPOSITOR_COUNTRY, depositor.country());
        map.put(Placeholder.DEPOSITOR_TELEPHONE, depositor.telephone());
        map.put(Placeholder.DEPOSITOR_EMAIL, depositor.email());
        return map;
    }

    /**
     * Classifies the dataset's access category. An unspecified category counts as open access.
     *
     * @param metadata dataset metadata
     * @return {@code true} when the dataset is openly accessible
     */
    public boolean isOpenAccess(DatasetMetadata metadata) {
        AccessCategory category = metadata.getAccessCategory();
        if (category == null) {
            return true;
        }
        return switch (category) {
            case OPEN_ACCESS, ANONYMOUS_ACCESS, FREELY_AVAILABLE -> true;
            case OPEN_ACCESS_FOR_REGISTERED_USERS, GROUP_ACCESS, REQUEST_PERMISSION, ACCESS_ELSEWHERE, NO_ACCESS -> false;
        };
    }

    /**
     * @param metadata dataset metadata
     * @return OpenAccess
     */
    public Map<Placeholder, Object> accessRights(DatasetMetadata metadata) {
        Map<Placeholder, Object> map = new EnumMap<>(Placeholder.class);
        map.put(Placeholder.OPEN_ACCESS, isOpenAccess(metadata));
        return map;
    }

    /**
     * Translates an access category value of the metadata record into its agreement label.
     * Values without a label, {@code null} included, are returned as they are.
     *
     * @param item metadata value holding an access category name
     * @return human readable label
     */
    public String formatDatasetAccessRights(MetadataItem item) {
        String value = item.value();
        return value == null ? null : DATASET_ACCESS_LABELS.getOrDefault(value, value);
    }

    /**
     * @param accessRight access right of a file
     * @return human readable label
     */
    public String formatFileAccessRights(FileAccessRight accessRight) {
        return switch (accessRight) {
            case ANONYMOUS -> "Anonymous";
            case KNOWN -> "Known";
            case RESTRICTED_REQUEST -> "Restricted request";
            case RESTRICTED_GROUP -> "Restricted group";
            case NONE -> "None";
        };
    }

    /**
     * Reads the footer text, normalizing line endings to {@code \n} without a trailing line break.
     *
     * @param file footer text file, encoded in the platform charset
     * @return footer text
     * @throws TemplateResourceException when the file is missing or unreadable
     */
    public String footerText(Path file) {
        try {
            return String.join("\n", Files.readAllLines(file, Charset.defaultCharset()));
        } catch (IOException e) {
            throw new TemplateResourceException("Unable to read footer text from " + file, e);
        }
    }

    /**
     * @param file footer text file
     * @return FooterText
     */
    public Map<Placeholder, Object> footer(Path file) {
        Map<Placeholder, Object> map = new EnumMap<>(Placeholder.class);
        map.put(Placeholder.FOOTER_TEXT, footerText(file));
        return map;
    }

    /**
     * Lists the labelled descriptive terms of the dataset. Terms without a configured label
     * or without non-null values are left out; multiple values of one term are joined by a comma.
     *
     * @param metadata dataset metadata
     * @return MetadataTable holding a list of {@link MetadataRow}
     */
    public Map<Placeholder, Object> metadataTable(DatasetMetadata metadata) {
        List<MetadataRow> rows = new ArrayList<>();
        for (Map.Entry<MetadataTerm, String> label : termLabels.entrySet()) {
            List<MetadataItem> items = metadata.getTerm(label.getKey());
            if (items == null) {
                continue;
            }
            List<MetadataItem> present = items.stream()
                    .filter(item -> item != null && item.value() != null)
                    .toList();
            if (present.isEmpty()) {
                continue;
            }
            Function<MetadataItem, String> formatter = label.getKey() == MetadataTerm.ACCESSRIGHTS
                    ? this::formatDatasetAccessRights
                    : MetadataItem::value;
            String value = present.stream()
                    .map(formatter)
                    .collect(Collectors.joining(", "));
            rows.add(new MetadataRow(label.getValue(), value));
        }

        Map<Placeholder, Object> map = new EnumMap<>(Placeholder.class);
        map.put(Placeholder.METADATA_TABLE, List.copyOf(rows));
        return map;
    }

    /**
     * @param files files of the dataset
     * @return FileTable holding a list of {@link FileRow}, and HasFiles
     */
    public Map<Placeholder, Object> fileTable(List<FileEntry> files) {
        List<FileRow> rows = files.stream()
                .map(file -> new FileRow(file.path(), formatFileAccessRights(file.accessRight())))
                .toList();

        Map<Placeholder, Object> map = new EnumMap<>(Placeholder.class);
        map.put(Placeholder.FILE_TABLE, rows);
        map.put(Placeholder.HAS_FILES, !rows.isEmpty());
        return map;
    }

    /**
     * @return CurrentDateAndTime, formatted {@code yyyy-MM-dd HH:mm:ss}
     */
    public Map<Placeholder, Object> currentDateAndTime() {
        Map<Placeholder, Object> map = new EnumMap<>(Placeholder.class);
        map.put(Placeholder.CURRENT_DATE_AND_TIME, DATE_TIME_FORMATTER.format(LocalDateTime.now(clock)));
        return map;
    }

    private String dateSubmitted(DatasetMetadata metadata) {
        return getDate(metadata, DatasetDates::getDateSubmitted)
                .orElse(DatasetDates.DEFAULT_DATE)
                .toString();
    }

    // only '/' is escaped, every other character passes through
    private String encodeDoi(String doi) {
        return doi.replace("/", "%2F");
    }
}
