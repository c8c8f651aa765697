package com.csd.pkginspect.service;

import com.csd.pkginspect.exception.InvalidArgumentException;
import com.csd.pkginspect.exception.NotFoundException;
import com.csd.pkginspect.model.ByteSize;
import com.csd.pkginspect.model.ComparisonOperator;
import com.csd.pkginspect.model.ComparisonResult;
import com.csd.pkginspect.model.PackageRecord;
import com.csd.pkginspect.model.RuntimeVersion;
import com.csd.pkginspect.model.UpdateCheckResult;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Query surface over discovery, resolution, extraction and the update engine.
 */
@Slf4j
@Service
public class InspectionService {

    public static final String ALL_ITEMS = "all_items";

    private final EnvironmentDiscoveryService discovery;
    private final PackageResolverService resolver;
    private final MetadataExtractorService extractor;
    private final UpdateService updateService;

    public InspectionService(EnvironmentDiscoveryService discovery,
                             PackageResolverService resolver,
                             MetadataExtractorService extractor,
                             UpdateService updateService) {
        this.discovery = discovery;
        this.resolver = resolver;
        this.extractor = extractor;
        this.updateService = updateService;
    }

    public List<RuntimeVersion> listRuntimes() {
        return discovery.listRuntimes();
    }

    /**
     * Installed package name to installed version, in package name order.
     */
    public Map<String, String> listPackages(String runtime) {
        Map<String, String> packages = new LinkedHashMap<>();
        resolver.installedVersions(resolver.resolveVersion(runtime))
                .forEach(entry -> packages.put(entry.getKey(), entry.getValue()));
        return packages;
    }

    public Object inspect(String packageName, String runtime, String field) {
        if (field != null && field.isBlank()) {
            return extractor.fieldNames();
        }
        return extractor.inspect(bind(packageName, runtime), field);
    }

    public ComparisonResult compareAcrossRuntimes(String packageName, String runtimeA, String runtimeB,
                                                  String field, String operator) {
        RuntimeVersion a = resolver.resolveVersion(runtimeA);
        RuntimeVersion b = resolver.resolveVersion(runtimeB);
        if (a.equals(b)) {
            throw new InvalidArgumentException("Comparing runtime " + a + " with itself; specify two different runtime versions.");
        }
        if (StringUtils.isBlank(field)) {
            throw new InvalidArgumentException("A field to compare must be specified.");
        }
        ComparisonOperator op = StringUtils.isBlank(operator) ? null : ComparisonOperator.parse(operator);

        Object valueA = valueOrNull(packageName, a, field);
        Object valueB = valueOrNull(packageName, b, field);
        List<String> missing = new ArrayList<>();
        if (valueA == null) {
            missing.add(a.getLabel());
        }
        if (valueB == null) {
            missing.add(b.getLabel());
        }
        if (!missing.isEmpty()) {
            throw new NotFoundException("No value for '" + field + "' of " + packageName
                    + " could be found for runtime(s) " + String.join(", ", missing));
        }

        Boolean outcome = op == null ? null : op.test(compareValues(valueA, valueB));
        log.info("Compared {} '{}' between {} and {}: {} {} {} -> {}", packageName, field, a, b,
                valueA, op == null ? "?" : op.getSymbol(), valueB, outcome);
        return ComparisonResult.builder()
                .packageName(packageName)
                .field(field)
                .runtimeA(a)
                .runtimeB(b)
                .valueA(valueA)
                .valueB(valueB)
                .operator(op)
                .outcome(outcome)
                .build();
    }

    /**
     * Updates after {@code currentVersion}, or after the version installed on the newest runtime that
     * has the package when no current version is given.
     */
    public UpdateCheckResult listUpdates(String packageName, String currentVersion) {
        if (StringUtils.isBlank(packageName)) {
            throw new InvalidArgumentException("A package name must be specified.");
        }
        if (StringUtils.isNotBlank(currentVersion)) {
            return updateService.checkUpdates(packageName.trim(), currentVersion.trim());
        }
        RuntimeVersion newest = resolver.latestRuntimeWith(packageName)
                .orElseThrow(() -> new NotFoundException("The package (" + packageName
                        + ") is not installed in any runtime; specify the current version."));
        PackageRecord record = resolver.getSitePath(newest, packageName);
        log.debug("Using installed version {} of {} from runtime {}", record.getInstalledVersion(),
                record.getPackageName(), newest);
        return updateService.checkUpdates(record.getPackageName(), record.getInstalledVersion());
    }

    /**
     * Catalog fields for a package that need not be installed. {@value #ALL_ITEMS} returns every catalog field.
     */
    public Object inspectRemote(String packageName, String item, String manager) {
        if (StringUtils.isBlank(packageName)) {
            throw new InvalidArgumentException("A package name must be specified.");
        }
        List<String> items = new ArrayList<>(MetadataExtractorService.REMOTE_FIELDS);
        items.addAll(StatisticsParser.STAT_KEYS);
        if (StringUtils.isBlank(item)) {
            return items;
        }
        if (FuzzyMatcher.matches(item.trim(), ALL_ITEMS, FuzzyMatcher.LOOSE_THRESHOLD)) {
            Map<String, Object> all = new LinkedHashMap<>();
            for (String field : MetadataExtractorService.REMOTE_FIELDS) {
                all.put(field, extractor.remoteField(packageName, field, manager));
            }
            return all;
        }
        String field = FuzzyMatcher.bestMatch(item.trim(), items, FuzzyMatcher.LOOSE_THRESHOLD)
                .orElseThrow(() -> new InvalidArgumentException("The specified item '" + item
                        + "' is not a catalog field." + didYouMean(item, items)));
        return extractor.remoteField(packageName, field, manager);
    }

    static String didYouMean(String query, Collection<String> options) {
        return FuzzyMatcher.bestCandidate(query, options)
                .filter(c -> FuzzyMatcher.matches(query, c, 60))
                .map(c -> " Did you mean '" + c + "'?")
                .orElse(" Valid options: " + options);
    }

    /**
     * Orders two field values. Versions compare as versions, numbers and sizes by magnitude, other
     * mutually comparable values naturally; anything else by length.
     */
    @SuppressWarnings({"unchecked", "rawtypes"})
    static int compareValues(Object a, Object b) {
        if (a instanceof String && b instanceof String
                && VersionUtil.looksLikeVersion((String) a) && VersionUtil.looksLikeVersion((String) b)) {
            return VersionUtil.compare((String) a, (String) b);
        }
        if (a instanceof Number && b instanceof Number) {
            return Double.compare(((Number) a).doubleValue(), ((Number) b).doubleValue());
        }
        if (a instanceof ByteSize && b instanceof ByteSize) {
            return Double.compare(((ByteSize) a).getBytes(), ((ByteSize) b).getBytes());
        }
        if (a instanceof Comparable && a.getClass().equals(b.getClass())) {
            return ((Comparable) a).compareTo(b);
        }
        return Integer.compare(lengthOf(a), lengthOf(b));
    }

    private static int lengthOf(Object value) {
        if (value instanceof Collection) {
            return ((Collection<?>) value).size();
        }
        if (value instanceof Map) {
            return ((Map<?, ?>) value).size();
        }
        return String.valueOf(value).length();
    }

    private Object valueOrNull(String packageName, RuntimeVersion runtime, String field) {
        try {
            return extractor.inspect(resolver.getSitePath(runtime, packageName), field);
        } catch (NotFoundException e) {
            log.debug("No '{}' for {} under {}: {}", field, packageName, runtime, e.getMessage());
            return null;
        }
    }

    private PackageRecord bind(String packageName, String runtime) {
        return resolver.getSitePath(resolver.resolveVersion(runtime), packageName);
    }
}
