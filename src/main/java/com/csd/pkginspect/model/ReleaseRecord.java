package com.csd.pkginspect.model;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Value;
import org.apache.maven.artifact.versioning.ComparableVersion;

import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.Locale;

/**
 * One published release: its release date and version. Either side may be absent.
 */
@Value
public class ReleaseRecord {

    public static final DateTimeFormatter RELEASE_DATE_FORMAT = DateTimeFormatter.ofPattern("MMM d, yyyy", Locale.US);

    @JsonFormat(shape = JsonFormat.Shape.STRING, pattern = "MMM dd, yyyy", locale = "en_US")
    LocalDate date;
    String version;

    public static ReleaseRecord of(String dateText, String version) {
        LocalDate date = null;
        if (dateText != null && !dateText.isBlank()) {
            try {
                date = LocalDate.parse(dateText.trim(), RELEASE_DATE_FORMAT);
            } catch (DateTimeParseException e) {
                throw new IllegalArgumentException("Unparseable release date: " + dateText, e);
            }
        }
        return new ReleaseRecord(date, version == null || version.isBlank() ? null : version.trim());
    }

    @JsonIgnore
    public ComparableVersion getParsedVersion() {
        return version == null ? null : new ComparableVersion(version);
    }

    public boolean hasDate() {
        return date != null;
    }

    public boolean hasVersion() {
        return version != null;
    }
}
