package com.csd.pkginspect.service;

import com.csd.pkginspect.exception.InvalidArgumentException;
import com.csd.pkginspect.model.PackageDirectory;
import com.csd.pkginspect.model.RuntimeVersion;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Whole-environment views, keyed by runtime label.
 */
@Slf4j
@Service
public class SnapshotService {

    public static final List<String> OPTIONS = List.of("all", "runtimes", "site_packages", "package_paths", "package_versions");

    private final EnvironmentDiscoveryService discovery;
    private final PackageResolverService resolver;

    public SnapshotService(EnvironmentDiscoveryService discovery, PackageResolverService resolver) {
        this.discovery = discovery;
        this.resolver = resolver;
    }

    public Object snapshot(String option) {
        String chosen = StringUtils.isBlank(option) ? "all" : option.trim().toLowerCase(Locale.ROOT);
        if (!OPTIONS.contains(chosen)) {
            throw new InvalidArgumentException("The specified snapshot option '" + option + "' is not valid."
                    + InspectionService.didYouMean(option.trim(), OPTIONS));
        }
        log.info("Building '{}' snapshot", chosen);
        switch (chosen) {
            case "runtimes":
                return runtimes();
            case "site_packages":
                return sitePackages();
            case "package_paths":
                return packagePaths();
            case "package_versions":
                return packageVersions();
            default:
                Map<String, Object> all = new LinkedHashMap<>();
                all.put("runtimes", runtimes());
                all.put("site_packages", sitePackages());
                all.put("package_paths", packagePaths());
                all.put("package_versions", packageVersions());
                return all;
        }
    }

    private List<String> runtimes() {
        return discovery.listRuntimes().stream().map(RuntimeVersion::getLabel).collect(Collectors.toList());
    }

    private Map<String, List<String>> sitePackages() {
        Map<String, List<String>> result = new LinkedHashMap<>();
        for (RuntimeVersion runtime : discovery.listRuntimes()) {
            result.put(runtime.getLabel(), discovery.sitePackagesFor(runtime).stream()
                    .map(Path::toString)
                    .collect(Collectors.toList()));
        }
        return result;
    }

    private Map<String, Map<String, String>> packagePaths() {
        Map<String, Map<String, String>> result = new LinkedHashMap<>();
        discovery.allPackages().forEach((runtime, packages) -> {
            Map<String, String> paths = new LinkedHashMap<>();
            for (PackageDirectory dir : packages) {
                paths.put(dir.getPackageName(), dir.getPath().toString());
            }
            result.put(runtime.getLabel(), paths);
        });
        return result;
    }

    private Map<String, Map<String, String>> packageVersions() {
        Map<String, Map<String, String>> result = new LinkedHashMap<>();
        for (RuntimeVersion runtime : discovery.listRuntimes()) {
            Map<String, String> versions = new LinkedHashMap<>();
            resolver.installedVersions(runtime).forEach(e -> versions.put(e.getKey(), e.getValue()));
            result.put(runtime.getLabel(), versions);
        }
        return result;
    }
}
