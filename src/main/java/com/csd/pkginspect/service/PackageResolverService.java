package com.csd.pkginspect.service;

import com.csd.pkginspect.exception.AmbiguousMatchException;
import com.csd.pkginspect.exception.InvalidArgumentException;
import com.csd.pkginspect.exception.NotFoundException;
import com.csd.pkginspect.model.PackageDirectory;
import com.csd.pkginspect.model.PackageRecord;
import com.csd.pkginspect.model.RuntimeVersion;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.util.AbstractMap;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Maps user input (a runtime label and a possibly misspelled package name) onto what is actually installed.
 */
@Slf4j
@Service
public class PackageResolverService {

    // below this a best candidate is too far off to be worth suggesting
    private static final int SUGGESTION_FLOOR = 60;

    private final EnvironmentDiscoveryService discovery;
    private final DescriptorParser descriptorParser;
    private final WorkerPool workerPool;
    private final int packageThreshold;
    private final ComputeOnceCache<SiteKey, PackageRecord> sitePathCache = new ComputeOnceCache<>("site-path");

    public PackageResolverService(EnvironmentDiscoveryService discovery,
                                  DescriptorParser descriptorParser,
                                  WorkerPool workerPool,
                                  @Value("${pkginspect.match.package-threshold:85}") int packageThreshold) {
        this.discovery = discovery;
        this.descriptorParser = descriptorParser;
        this.workerPool = workerPool;
        this.packageThreshold = packageThreshold;
    }

    public RuntimeVersion resolveVersion(String input) {
        if (StringUtils.isBlank(input)) {
            throw new InvalidArgumentException("A runtime version must be specified.");
        }
        if (!VersionUtil.looksLikeVersion(input) && !input.trim().matches("\\d+")) {
            throw new InvalidArgumentException("The specified runtime version '" + input + "' is not a valid version.");
        }
        RuntimeVersion requested = RuntimeVersion.of(input);
        return discovery.listRuntimes().stream()
                .filter(requested::equals)
                .findFirst()
                .orElseThrow(() -> new NotFoundException("The specified runtime version (" + input
                        + ") is either not installed or cannot be found. Installed: " + discovery.listRuntimes()));
    }

    /**
     * Canonical installed name for {@code name} under {@code runtime}, e.g. {@code reqeusts} resolves to
     * {@code requests}. Ties at the top score go to the first package in name order.
     */
    public String resolvePackage(RuntimeVersion runtime, String name) {
        if (StringUtils.isBlank(name)) {
            throw new InvalidArgumentException("A package name must be specified.");
        }
        List<String> candidates = installedPackages(runtime);
        if (candidates.isEmpty()) {
            throw new NotFoundException("No packages were found for the specified runtime version " + runtime);
        }
        String normalized = EnvironmentDiscoveryService.normalize(name);
        for (String candidate : candidates) {
            if (EnvironmentDiscoveryService.normalize(candidate).equals(normalized)) {
                return candidate;
            }
        }
        Optional<String> match = FuzzyMatcher.bestMatch(name, candidates, packageThreshold);
        if (match.isPresent()) {
            log.debug("Resolved package '{}' to '{}' for runtime {}", name, match.get(), runtime);
            return match.get();
        }
        String suggestion = FuzzyMatcher.bestCandidate(name, candidates)
                .filter(c -> FuzzyMatcher.matches(name, c, SUGGESTION_FLOOR))
                .orElse(null);
        throw new AmbiguousMatchException(name, suggestion,
                "The package (" + name + ") was not found in the specified runtime version " + runtime + ".");
    }

    /**
     * Resolves runtime and package together. Computed at most once per (package, runtime) pair; concurrent
     * callers with the same key wait for the first resolution.
     */
    public PackageRecord getSitePath(RuntimeVersion runtime, String name) {
        if (runtime == null) {
            throw new InvalidArgumentException("A runtime version must be specified.");
        }
        if (StringUtils.isBlank(name)) {
            throw new InvalidArgumentException("A package name must be specified.");
        }
        return sitePathCache.get(new SiteKey(runtime, EnvironmentDiscoveryService.normalize(name)),
                key -> resolveRecord(runtime, name));
    }

    public List<String> installedPackages(RuntimeVersion runtime) {
        return discovery.packagesFor(runtime).stream()
                .map(PackageDirectory::getPackageName)
                .collect(Collectors.toList());
    }

    public boolean isInstalled(RuntimeVersion runtime, String name) {
        try {
            resolvePackage(runtime, name);
            return true;
        } catch (NotFoundException e) {
            return false;
        }
    }

    /**
     * Installed (name, version) pairs of one runtime, resolved on the worker pool in package order.
     */
    public List<Map.Entry<String, String>> installedVersions(RuntimeVersion runtime) {
        return workerPool.map(discovery.packagesFor(runtime),
                dir -> new AbstractMap.SimpleImmutableEntry<>(dir.getPackageName(), installedVersion(dir)));
    }

    /**
     * Newest runtime that has the package installed.
     */
    public Optional<RuntimeVersion> latestRuntimeWith(String name) {
        List<RuntimeVersion> runtimes = new ArrayList<>(discovery.listRuntimes());
        Collections.reverse(runtimes);
        return runtimes.stream().filter(rt -> isInstalled(rt, name)).findFirst();
    }

    /**
     * Version encoded in the descriptor directory name, then the descriptor's {@code Version} field,
     * then {@link VersionUtil#MIN_VERSION}.
     */
    public String installedVersion(PackageDirectory dir) {
        String fileName = dir.getPath().getFileName().toString();
        String afterName = fileName.length() > dir.getPackageName().length()
                ? fileName.substring(dir.getPackageName().length())
                : "";
        if (dir.isDescriptorDirectory()) {
            Optional<String> fromName = VersionUtil.findVersion(afterName);
            if (fromName.isPresent()) {
                return fromName.get();
            }
            Path metadata = dir.getPath().resolve(DescriptorParser.METADATA_FILE);
            if (metadata.toFile().isFile()) {
                Object version = descriptorParser.parse(metadata).get("Version");
                if (version != null && VersionUtil.findVersion(version.toString()).isPresent()) {
                    return version.toString();
                }
            }
        }
        return VersionUtil.MIN_VERSION;
    }

    private PackageRecord resolveRecord(RuntimeVersion runtime, String name) {
        RuntimeVersion installed = resolveVersion(runtime.getLabel());
        String canonical = resolvePackage(installed, name);
        PackageDirectory dir = discovery.packagesFor(installed).stream()
                .filter(d -> d.getPackageName().equals(canonical))
                .findFirst()
                .orElseThrow(() -> new NotFoundException("The package (" + canonical
                        + ") has no installation directory for runtime " + installed));
        PackageRecord record = PackageRecord.builder()
                .runtime(installed)
                .directory(dir)
                .installedVersion(installedVersion(dir))
                .build();
        log.info("Resolved {} {} for runtime {} at {}", canonical, record.getInstalledVersion(), installed, dir.getPath());
        return record;
    }

    @lombok.Value
    private static class SiteKey {
        RuntimeVersion runtime;
        String normalizedName;
    }
}
