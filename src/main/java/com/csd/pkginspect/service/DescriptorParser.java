package com.csd.pkginspect.service;

import com.csd.pkginspect.exception.NotFoundException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Parses the {@code METADATA} descriptor of a package into a flat field map ("short metadata").
 * Multi-valued fields are merged into a set under the plural key once more than one value is present.
 * Parses are memoized per descriptor path.
 */
@Slf4j
@Component
public class DescriptorParser {

    public static final String METADATA_FILE = "METADATA";

    /** Descriptor header fields kept in short metadata. */
    public static final List<String> METADATA_FIELDS = List.of(
            "Author",
            "Author-email",
            "Classifier",
            "Description-Content-Type",
            "Download-URL",
            "Home-page",
            "License",
            "Metadata-Version",
            "Name",
            "Platform",
            "Requires-Python",
            "Summary",
            "Version"
    );

    /** Files commonly found inside a descriptor directory. */
    public static final List<String> DESCRIPTOR_FILES = List.of(
            "entry_points",
            "installer",
            "license",
            "metadata",
            "record",
            "requested",
            "top_level",
            "wheel"
    );

    static final List<String> MULTI_VALUED_FIELDS = List.of("Classifier", "Platform");

    private final ComputeOnceCache<Path, Map<String, Object>> parsed = new ComputeOnceCache<>("descriptor");
    private final int fieldThreshold;

    public DescriptorParser(@Value("${pkginspect.match.threshold:95}") int fieldThreshold) {
        this.fieldThreshold = fieldThreshold;
    }

    public Map<String, Object> parse(Path metadataFile) {
        return parsed.get(metadataFile.toAbsolutePath().normalize(), this::readAndParse);
    }

    private Map<String, Object> readAndParse(Path metadataFile) {
        try {
            log.debug("Parsing descriptor {}", metadataFile);
            return Collections.unmodifiableMap(parseContents(Files.readString(metadataFile, StandardCharsets.UTF_8), fieldThreshold));
        } catch (IOException e) {
            throw new NotFoundException("Failed to read package descriptor " + metadataFile, e);
        }
    }

    public static Map<String, Object> parseContents(String contents) {
        return parseContents(contents, FuzzyMatcher.DEFAULT_THRESHOLD);
    }

    public static Map<String, Object> parseContents(String contents, int fieldThreshold) {
        Map<String, Object> fields = new LinkedHashMap<>();
        Map<String, Set<String>> multi = new LinkedHashMap<>();

        for (String line : contents.split("\\R")) {
            if (line.isEmpty()) {
                break; // headers end at the first blank line, the long description follows
            }
            if (Character.isWhitespace(line.charAt(0))) {
                continue;
            }
            int colon = line.indexOf(':');
            if (colon <= 0) {
                continue;
            }
            String key = line.substring(0, colon).trim();
            String value = line.substring(colon + 1).trim();
            if (key.isEmpty() || !Character.isUpperCase(key.charAt(0))) {
                continue;
            }
            String field = FuzzyMatcher.bestMatch(key, METADATA_FIELDS, fieldThreshold).orElse(null);
            if (field == null) {
                continue;
            }
            if (MULTI_VALUED_FIELDS.contains(field)) {
                multi.computeIfAbsent(field, k -> new LinkedHashSet<>()).add(value);
            } else {
                fields.put(key, value);
            }
        }

        multi.forEach((field, values) -> {
            if (values.size() > 1) {
                fields.put(field + "s", Collections.unmodifiableSet(values));
                fields.remove(field);
            } else {
                fields.put(field, values.iterator().next());
            }
        });
        return fields;
    }
}
