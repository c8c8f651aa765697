package com.csd.pkginspect.service;

import com.csd.pkginspect.exception.InvalidArgumentException;
import com.csd.pkginspect.exception.NotFoundException;
import com.csd.pkginspect.exception.PreconditionFailedException;
import com.csd.pkginspect.model.FieldGroup;
import com.csd.pkginspect.model.PackageDirectory;
import com.csd.pkginspect.model.PackageRecord;
import com.csd.pkginspect.model.RuntimeVersion;
import com.csd.pkginspect.model.StatisticsSnapshot;
import com.csd.pkginspect.model.VersionHistory;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.function.BiFunction;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Answers a single field query about an installed package. Queries are fuzzy-resolved against the
 * field vocabulary and dispatched through an ordered handler table; the first handler that claims
 * the field answers it.
 */
@Slf4j
@Service
public class MetadataExtractorService {

    public static final List<String> SESSION_FIELDS = List.of(
            "site_path",
            "installed_version",
            "isinstalled_version",
            "islatest_version",
            "available_updates",
            "installed_runtimes",
            "version_packages",
            "date_installed",
            "total_size"
    );

    public static final List<String> REMOTE_FIELDS = List.of(
            "initial_version",
            "latest_version",
            "total_versions",
            "version_history",
            "package_url",
            "stats_url",
            "statistics"
    );

    public static final List<String> DERIVED_FIELDS = List.of("doc", "source_file", "source_code");

    public static final String SHORT_META = "short_meta";
    public static final String SHORT_LICENSE = "short_license";

    private final EnvironmentDiscoveryService discovery;
    private final PackageResolverService resolver;
    private final DescriptorParser descriptorParser;
    private final ModuleIntrospector introspector;
    private final RemoteCatalogClient catalog;
    private final UpdateService updateService;
    private final PackageMetricsService metrics;
    private final int fieldThreshold;

    private final List<FieldHandler> handlers;
    private final SortedSet<String> vocabulary;

    public MetadataExtractorService(EnvironmentDiscoveryService discovery,
                                    PackageResolverService resolver,
                                    DescriptorParser descriptorParser,
                                    ModuleIntrospector introspector,
                                    RemoteCatalogClient catalog,
                                    UpdateService updateService,
                                    PackageMetricsService metrics,
                                    @Value("${pkginspect.match.package-threshold:85}") int fieldThreshold) {
        this.discovery = discovery;
        this.resolver = resolver;
        this.descriptorParser = descriptorParser;
        this.introspector = introspector;
        this.catalog = catalog;
        this.updateService = updateService;
        this.metrics = metrics;
        this.fieldThreshold = fieldThreshold;

        List<String> remote = new ArrayList<>(REMOTE_FIELDS);
        remote.addAll(StatisticsParser.STAT_KEYS);
        List<String> descriptor = new ArrayList<>(DescriptorParser.METADATA_FIELDS);
        descriptor.addAll(DescriptorParser.DESCRIPTOR_FILES);
        descriptor.add(SHORT_META);
        descriptor.add(SHORT_LICENSE);

        this.handlers = List.of(
                new FieldHandler(FieldGroup.SESSION, Set.copyOf(SESSION_FIELDS), this::sessionField),
                new FieldHandler(FieldGroup.REMOTE, Set.copyOf(remote),
                        (record, field) -> remoteField(record.getPackageName(), field, null)),
                new FieldHandler(FieldGroup.DERIVED, Set.copyOf(DERIVED_FIELDS), this::derivedField),
                new FieldHandler(FieldGroup.DESCRIPTOR, null, this::descriptorField)
        );

        SortedSet<String> names = new TreeSet<>(SESSION_FIELDS);
        names.addAll(remote);
        names.addAll(DERIVED_FIELDS);
        names.addAll(descriptor);
        this.vocabulary = Collections.unmodifiableSortedSet(names);
    }

    /**
     * Every recognized field name, sorted.
     */
    public SortedSet<String> fieldNames() {
        return vocabulary;
    }

    /**
     * @return the field value, the field vocabulary for an empty query, or null when nothing answers
     */
    public Object inspect(PackageRecord record, String query) {
        if (query == null) {
            throw new InvalidArgumentException("A field to inspect must be specified (use an empty field to list them).");
        }
        if (query.isBlank()) {
            log.debug("Empty query, returning {} field names", vocabulary.size());
            return fieldNames();
        }
        if (record == null) {
            throw new PreconditionFailedException("No package has been resolved yet; resolve a package and runtime first.");
        }
        String trimmed = query.trim();
        String resolved = FuzzyMatcher.bestMatch(trimmed, vocabulary, fieldThreshold).orElse(null);
        log.debug("Field '{}' resolved to '{}' for {}", trimmed, resolved, record.getPackageName());

        for (FieldHandler handler : handlers) {
            if (handler.claims(resolved)) {
                return handler.getResolver().apply(record, resolved != null ? resolved : trimmed);
            }
        }
        return null;
    }

    /**
     * Catalog-backed field lookup. Needs only a package name, so it also serves packages that are not installed.
     */
    public Object remoteField(String packageName, String field, String manager) {
        switch (field) {
            case "initial_version":
                return updateService.initial(catalog.fetchHistory(packageName)).getVersion();
            case "latest_version":
                return updateService.latest(catalog.fetchHistory(packageName)).getVersion();
            case "total_versions":
                return catalog.fetchHistory(packageName).size();
            case "version_history":
                return catalog.fetchHistory(packageName).getRecords();
            case "package_url":
                return catalog.packageUrl(packageName);
            case "stats_url":
                return catalog.statsUrl(packageName, manager);
            case "statistics":
                return catalog.fetchStatistics(packageName, manager).getValues();
            default:
                StatisticsSnapshot snapshot = catalog.fetchStatistics(packageName, manager);
                return snapshot.get(field);
        }
    }

    private Object sessionField(PackageRecord record, String field) {
        PackageDirectory dir = record.getDirectory();
        switch (field) {
            case "site_path":
                return dir.getPath().toString();
            case "installed_version":
                return record.getInstalledVersion();
            case "isinstalled_version":
                return resolver.isInstalled(record.getRuntime(), record.getPackageName());
            case "islatest_version":
                return updateService.isLatest(catalog.fetchHistory(record.getPackageName()), record.getInstalledVersion());
            case "available_updates":
                VersionHistory history = catalog.fetchHistory(record.getPackageName());
                return updateService.updatesAfter(history, record.getInstalledVersion());
            case "installed_runtimes":
                return discovery.listRuntimes().stream()
                        .filter(rt -> resolver.isInstalled(rt, record.getPackageName()))
                        .map(RuntimeVersion::getLabel)
                        .collect(Collectors.toList());
            case "version_packages":
                Map<String, String> versions = new LinkedHashMap<>();
                resolver.installedVersions(record.getRuntime()).forEach(e -> versions.put(e.getKey(), e.getValue()));
                return versions;
            case "date_installed":
                return metrics.dateInstalled(dir);
            case "total_size":
                return metrics.totalSize(dir);
            default:
                throw new IllegalStateException("Unhandled session field " + field);
        }
    }

    private Object derivedField(PackageRecord record, String field) {
        PackageDirectory dir = record.getDirectory();
        switch (field) {
            case "doc":
                return introspector.docstring(dir).orElse(null);
            case "source_file":
                return introspector.sourceFile(dir).map(Path::toString).orElse(null);
            case "source_code":
                return introspector.sourceCode(dir).orElse(null);
            default:
                throw new IllegalStateException("Unhandled derived field " + field);
        }
    }

    private Object descriptorField(PackageRecord record, String field) {
        PackageDirectory dir = record.getDirectory();
        if (!dir.isDescriptorDirectory()) {
            return null;
        }
        Optional<Path> file = descriptorFile(dir.getPath(), field);
        if (file.isPresent()) {
            return readText(file.get());
        }
        Path metadataFile = dir.getPath().resolve(DescriptorParser.METADATA_FILE);
        if (!Files.isRegularFile(metadataFile)) {
            return null;
        }
        Map<String, Object> shortMeta = descriptorParser.parse(metadataFile);
        if (SHORT_META.equals(field)) {
            return shortMeta;
        }
        if (SHORT_LICENSE.equals(field)) {
            return shortMeta.get("License");
        }
        return FuzzyMatcher.bestMatch(field, shortMeta.keySet(), fieldThreshold)
                .map(shortMeta::get)
                .orElse(null);
    }

    private static Optional<Path> descriptorFile(Path dir, String field) {
        String needle = field.toLowerCase(Locale.ROOT);
        try (Stream<Path> files = Files.walk(dir)) {
            return files.filter(Files::isRegularFile)
                    .sorted()
                    .filter(f -> f.getFileName().toString().toLowerCase(Locale.ROOT).contains(needle))
                    .findFirst();
        } catch (IOException | UncheckedIOException e) {
            throw new NotFoundException("Failed to list descriptor directory " + dir, e);
        }
    }

    private static String readText(Path file) {
        try {
            return Files.readString(file, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new NotFoundException("Failed to read descriptor file " + file, e);
        }
    }

    /**
     * One row of the dispatch table. A null field set claims every query.
     */
    @lombok.Value
    static class FieldHandler {
        FieldGroup group;
        Set<String> fields;
        BiFunction<PackageRecord, String, Object> resolver;

        boolean claims(String field) {
            return fields == null || (field != null && fields.contains(field));
        }
    }
}
